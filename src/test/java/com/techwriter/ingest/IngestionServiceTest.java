package com.techwriter.ingest;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.techwriter.parse.TreeSitterParserAdapter;
import com.techwriter.runtime.AppConfig;
import com.techwriter.store.ChunkRecord;
import com.techwriter.store.EdgeRecord;
import com.techwriter.store.EdgeType;
import com.techwriter.store.FileRecord;
import com.techwriter.store.KnowledgeStore;
import com.techwriter.store.SymbolRecord;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class IngestionServiceTest {

    @TempDir
    Path tempDir;

    private KnowledgeStore store;
    private TreeSitterParserAdapter parser;
    private AppConfig.IngestConfig config;

    @BeforeEach
    void setUp() throws Exception {
        store = KnowledgeStore.ephemeral();
        parser = new TreeSitterParserAdapter();
        config = new AppConfig.IngestConfig();
        config.setWorkers(2);
    }

    @AfterEach
    void tearDown() throws Exception {
        store.close();
    }

    @Test
    void shouldChunkProseByParagraphAndStoreUnparsedFilesWhole() throws Exception {
        Files.writeString(tempDir.resolve("README.md"), "# Tool\nParses input.\n\nWrites output.\n");
        Files.writeString(tempDir.resolve("settings.yaml"), "mode: fast\nlevel: 3\n");

        IngestionReport report = new IngestionService(store, parser, config).ingest(tempDir);

        assertEquals(2, report.processedFiles());
        assertEquals(0, report.skippedFiles());
        assertEquals(3, report.chunks());

        FileRecord readme = store.findFileByPath("README.md").orElseThrow();
        assertEquals("markdown", readme.lang());
        assertFalse(readme.parsed());
        List<ChunkRecord> paragraphs = store.chunksForFile(readme.id());
        assertEquals(2, paragraphs.size());
        assertEquals(1, paragraphs.get(0).startLine());
        assertEquals(2, paragraphs.get(0).endLine());
        assertEquals(4, paragraphs.get(1).startLine());

        FileRecord settings = store.findFileByPath("settings.yaml").orElseThrow();
        List<ChunkRecord> whole = store.chunksForFile(settings.id());
        assertEquals(1, whole.size());
        assertEquals("block", whole.get(0).kind());
        assertEquals(1, whole.get(0).startLine());
        assertEquals(2, whole.get(0).endLine());
    }

    @Test
    void shouldSkipUnchangedFilesAndReplaceChangedOnesInPlace() throws Exception {
        Path readme = tempDir.resolve("README.md");
        Files.writeString(readme, "First version.\n");
        IngestionService service = new IngestionService(store, parser, config);

        service.ingest(tempDir);
        long firstId = store.findFileByPath("README.md").orElseThrow().id();

        IngestionReport unchanged = service.ingest(tempDir);
        assertEquals(0, unchanged.processedFiles());
        assertEquals(1, unchanged.skippedFiles());

        Files.writeString(readme, "Second version.\n\nWith a new paragraph.\n");
        IngestionReport changed = service.ingest(tempDir);

        assertEquals(1, changed.processedFiles());
        FileRecord updated = store.findFileByPath("README.md").orElseThrow();
        assertEquals(firstId, updated.id());
        List<ChunkRecord> chunks = store.chunksForFile(firstId);
        assertEquals(2, chunks.size());
        assertEquals("Second version.", chunks.get(0).text());
        assertEquals(2, store.countChunks());
    }

    @Test
    void shouldParseSourceAndResolveImportsAcrossFiles() throws Exception {
        assumeTrue(parser.supports("python"), "python grammar not loadable on this platform");
        Files.writeString(tempDir.resolve("lib.py"), """
                class Base:
                    def run(self):
                        return 1
                """);
        Files.writeString(tempDir.resolve("app.py"), """
                from lib import Base


                class App(Base):
                    def start(self):
                        return Base()
                """);

        IngestionReport report = new IngestionService(store, parser, config, new HashingEmbeddingService(32))
                .ingest(tempDir);

        assertEquals(2, report.processedFiles());
        assertTrue(store.findFileByPath("app.py").orElseThrow().parsed());
        assertTrue(report.resolvedImports() >= 1);
        assertFalse(store.edgesOfType(EdgeType.IMPORTS_RESOLVED).isEmpty());
        assertTrue(store.listSymbols().stream()
                .anyMatch(symbol -> symbol.name().equals("start") && symbol.parentSymbolId() != null));
        assertTrue(store.hasChunkEmbeddings());
    }

    @Test
    void shouldRebuildCallEdgesWhenOnlyTheCalleeFileChanges() throws Exception {
        assumeTrue(parser.supports("python"), "python grammar not loadable on this platform");
        Path lib = tempDir.resolve("lib.py");
        Files.writeString(lib, "def helper():\n    return 1\n");
        Files.writeString(tempDir.resolve("app.py"), "def run():\n    return helper()\n");
        IngestionService service = new IngestionService(store, parser, config);

        service.ingest(tempDir);
        assertEquals(1, store.edgesOfType(EdgeType.CALLS).size());

        Files.writeString(lib, "def helper():\n    return 2\n");
        IngestionReport report = service.ingest(tempDir);

        assertEquals(1, report.processedFiles());
        assertEquals(1, report.skippedFiles());
        List<EdgeRecord> calls = store.edgesOfType(EdgeType.CALLS);
        assertEquals(1, calls.size());
        SymbolRecord callee = store.findSymbol(calls.get(0).dstSymbolId()).orElseThrow();
        assertEquals("helper", callee.name());
        assertEquals(store.findFileByPath("lib.py").orElseThrow().id(), callee.fileId());
    }

    @Test
    void shouldForgetFilesRemovedFromTheTree() throws Exception {
        Files.writeString(tempDir.resolve("keep.md"), "Stays in the tree.\n");
        Path gone = tempDir.resolve("gone.md");
        Files.writeString(gone, "Deleted before the next run.\n");
        IngestionService service = new IngestionService(store, parser, config);
        service.ingest(tempDir);
        assertEquals(2, store.countFiles());

        Files.delete(gone);
        IngestionReport report = service.ingest(tempDir);

        assertEquals(1, report.removedFiles());
        assertEquals(1, store.countFiles());
        assertTrue(store.findFileByPath("gone.md").isEmpty());
        assertEquals(1, store.countChunks());
        assertTrue(store.searchChunks("Deleted", 5).isEmpty());
    }

    @Test
    void shouldRejectMissingRoot() {
        IngestionService service = new IngestionService(store, parser, config);

        assertThrows(java.io.IOException.class, () -> service.ingest(tempDir.resolve("missing")));
    }
}
