package com.techwriter.retrieval;

import java.time.Instant;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.techwriter.ingest.HashingEmbeddingService;
import com.techwriter.runtime.AppConfig;
import com.techwriter.store.ChunkRecord;
import com.techwriter.store.EdgeRecord;
import com.techwriter.store.EdgeType;
import com.techwriter.store.FileRecord;
import com.techwriter.store.KnowledgeStore;
import com.techwriter.store.SummaryLevel;
import com.techwriter.store.SummaryRecord;
import com.techwriter.store.SymbolRecord;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetrievalEngineTest {

    private KnowledgeStore store;
    private long tokenizerFile;
    private long tokenizerSymbol;
    private long normalizeSymbol;

    @BeforeEach
    void setUp() throws Exception {
        store = KnowledgeStore.ephemeral();
        tokenizerFile = store.upsertFile(file("src/tokenizer.py"));
        long utilFile = store.upsertFile(file("src/util.py"));
        long readmeFile = store.upsertFile(new FileRecord(null, "README.md", "h", "markdown", 10, Instant.now(), false));

        tokenizerSymbol = store.addSymbol(new SymbolRecord(null, tokenizerFile, "Tokenizer", "class",
                "class Tokenizer", 1, 3, "Splits text into tokens.", null));
        normalizeSymbol = store.addSymbol(new SymbolRecord(null, utilFile, "normalize", "function",
                "def normalize(text)", 1, 2, null, null));
        store.addEdge(new EdgeRecord(tokenizerSymbol, normalizeSymbol, EdgeType.CALLS));

        store.addChunk(chunk(tokenizerFile, 1, 3, "class Tokenizer:\n    def split(self, text):\n        return normalize(text).split()",
                "class", tokenizerSymbol));
        store.addChunk(chunk(utilFile, 1, 2, "def normalize(text):\n    return text.strip().lower()", "function", normalizeSymbol));
        store.addChunk(chunk(readmeFile, 1, 1, "The project ships a command line entry point.", "paragraph", null));
    }

    @AfterEach
    void tearDown() throws Exception {
        store.close();
    }

    @Test
    void shouldRankLexicalAndPathMatchesFirst() {
        RetrievalEngine engine = new RetrievalEngine(store, new AppConfig.RetrievalConfig());

        EvidenceBundle bundle = engine.retrieve("How does the tokenizer split text?", 5);

        assertFalse(bundle.isEmpty());
        ScoredChunk top = bundle.chunks().get(0);
        assertEquals("src/tokenizer.py", top.path());
        assertEquals("src/tokenizer.py:1-3", top.citation());
        assertTrue(bundle.allowedCitations().contains("src/tokenizer.py:1-3"));
        for (int i = 1; i < bundle.chunks().size(); i++) {
            assertTrue(bundle.chunks().get(i - 1).score() >= bundle.chunks().get(i).score());
        }
    }

    @Test
    void shouldExpandMatchedSymbolsAlongGraphEdges() {
        RetrievalEngine engine = new RetrievalEngine(store, new AppConfig.RetrievalConfig());

        EvidenceBundle bundle = engine.retrieve("Tokenizer", 5);

        assertTrue(bundle.symbols().stream().anyMatch(symbol -> symbol.id() == tokenizerSymbol));
        assertTrue(bundle.symbols().stream().anyMatch(symbol -> symbol.id() == normalizeSymbol));
        assertTrue(bundle.edges().contains(new EdgeRecord(tokenizerSymbol, normalizeSymbol, EdgeType.CALLS)));
        assertTrue(bundle.chunks().stream().anyMatch(chunk -> chunk.path().equals("src/util.py")));
    }

    @Test
    void shouldIncludeMatchingSummariesAndTheirCitations() {
        store.addSummary(SummaryRecord.create(SummaryLevel.FILE, tokenizerFile,
                "Tokenizer splits text after normalizing it. [src/tokenizer.py:1-3] [src/util.py:1-2]", 0.6));
        RetrievalEngine engine = new RetrievalEngine(store, new AppConfig.RetrievalConfig());

        EvidenceBundle bundle = engine.retrieve("normalizing", 3);

        assertEquals(1, bundle.summaries().size());
        assertTrue(bundle.allowedCitations().contains("src/util.py:1-2"));
        assertTrue(bundle.allowedCitations().contains("src/tokenizer.py:1-3"));
    }

    @Test
    void shouldReturnEmptyBundleWhenNothingMatches() {
        RetrievalEngine engine = new RetrievalEngine(store, new AppConfig.RetrievalConfig());

        EvidenceBundle bundle = engine.retrieve("quantum flux capacitor", 5);

        assertTrue(bundle.isEmpty());
        assertTrue(bundle.allowedCitations().isEmpty());
    }

    @Test
    void shouldWorkLexicallyWhenEmbeddingsAreMissingAndUseThemWhenPresent() {
        HashingEmbeddingService embeddings = new HashingEmbeddingService(64);
        RetrievalEngine engine = new RetrievalEngine(store, new AppConfig.RetrievalConfig(), embeddings);

        EvidenceBundle lexical = engine.retrieve("command line entry point", 5);
        assertEquals("README.md", lexical.chunks().get(0).path());

        for (ChunkRecord chunk : store.chunksForFile(tokenizerFile)) {
            store.putChunkEmbedding(chunk.id(), embeddings.embed(chunk.text()));
        }
        EvidenceBundle hybrid = engine.retrieve("command line entry point", 5);
        assertEquals("README.md", hybrid.chunks().get(0).path());
    }

    @Test
    void shouldReachChunksThroughSymbolVectors() {
        HashingEmbeddingService embeddings = new HashingEmbeddingService(256);
        long lexerFile = store.upsertFile(file("src/lexer.py"));
        long lexerSymbol = store.addSymbol(new SymbolRecord(null, lexerFile, "Lexer", "class", "class Lexer", 1, 2,
                "Emits lexemes for downstream stages.", null));
        long lexerChunk = store.addChunk(chunk(lexerFile, 1, 2, "class Lexer:\n    pass", "class", lexerSymbol));
        store.putChunkEmbedding(lexerChunk, embeddings.embed("class Lexer pass"));
        store.putSymbolEmbedding(lexerSymbol, embeddings.embed("Lexer class Lexer Emits lexemes for downstream stages."));
        RetrievalEngine engine = new RetrievalEngine(store, new AppConfig.RetrievalConfig(), embeddings);

        EvidenceBundle bundle = engine.retrieve("downstream lexemes", 5);

        assertTrue(bundle.allowedCitations().contains("src/lexer.py:1-2"));
    }

    @Test
    void shouldRespectLimit() {
        RetrievalEngine engine = new RetrievalEngine(store, new AppConfig.RetrievalConfig());

        assertEquals(1, engine.retrieve("text", 1).chunks().size());
        assertTrue(engine.retrieve("text", 0).chunks().isEmpty());
    }

    private static FileRecord file(String path) {
        return new FileRecord(null, path, "hash-" + path, "python", 100, Instant.now(), true);
    }

    private static ChunkRecord chunk(long fileId, int start, int end, String text, String kind, Long symbolId) {
        return new ChunkRecord(null, fileId, start, end, kind, text, "hash-" + start + "-" + text.length(), symbolId);
    }
}
