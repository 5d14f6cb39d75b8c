package com.techwriter.ingest;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.techwriter.parse.ChunkCandidate;
import com.techwriter.parse.EdgeCandidate;
import com.techwriter.parse.ImportCandidate;
import com.techwriter.parse.ParsedSource;
import com.techwriter.parse.ParserAdapter;
import com.techwriter.parse.SymbolCandidate;
import com.techwriter.parse.SymbolNesting;
import com.techwriter.runtime.AppConfig;
import com.techwriter.store.ChunkRecord;
import com.techwriter.store.EdgeRecord;
import com.techwriter.store.EdgeType;
import com.techwriter.store.FileRecord;
import com.techwriter.store.KnowledgeStore;
import com.techwriter.store.ReferenceRecord;
import com.techwriter.store.SymbolRecord;

/**
 * Reads a source tree into the store. Files are prepared (read, hashed, parsed, chunked) on a
 * bounded pool; every write happens on the calling thread, one transaction per file, in path order.
 * Cross-file resolution runs after the last file is written.
 */
public class IngestionService {
    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final KnowledgeStore store;
    private final ParserAdapter parser;
    private final AppConfig.IngestConfig config;
    private final EmbeddingService embeddingService;
    private final ParagraphChunker paragraphChunker = new ParagraphChunker();

    public IngestionService(KnowledgeStore store, ParserAdapter parser, AppConfig.IngestConfig config) {
        this(store, parser, config, null);
    }

    /**
     * @param embeddingService null to skip embeddings
     */
    public IngestionService(KnowledgeStore store, ParserAdapter parser, AppConfig.IngestConfig config,
            EmbeddingService embeddingService) {
        this.store = store;
        this.parser = parser;
        this.config = config;
        this.embeddingService = embeddingService;
    }

    public IngestionReport ingest(Path root) throws IOException {
        Path base = root.toAbsolutePath().normalize();
        if (!Files.isDirectory(base)) {
            throw new IOException("Not a directory: " + root);
        }
        SourceFileWalker walker = new SourceFileWalker(
                config.getExclude(), config.isRespectGitignore(), config.getMaxFileBytes(), config.getMaxFiles());
        List<Path> files = walker.walk(base);

        Map<String, String> knownHashes = new HashMap<>();
        store.listFiles().forEach(file -> knownHashes.put(file.path(), file.hash()));

        int removed = removeVanished(base, files);
        int processed = 0;
        int skipped = 0;
        Counts counts = new Counts();

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(config.getWorkers(), Math.max(1, files.size())));
        try {
            List<Future<Optional<PreparedFile>>> futures = new ArrayList<>(files.size());
            for (Path file : files) {
                futures.add(pool.submit(() -> prepare(base, file, knownHashes)));
            }
            for (int i = 0; i < futures.size(); i++) {
                Optional<PreparedFile> prepared = await(futures.get(i), files.get(i));
                if (prepared.isEmpty() || prepared.get().unchanged()) {
                    skipped++;
                    continue;
                }
                PreparedFile file = prepared.get();
                store.runInTransaction(() -> write(file, counts));
                processed++;
                log.info("ingest.file path={} lang={} parsed={} chunks={} symbols={}",
                        file.path(), file.lang(), file.parsed(), file.chunks().size(), file.symbols().size());
            }
        } finally {
            pool.shutdownNow();
        }

        CrossFileResolver.Result resolution = new CrossFileResolver(store).resolve();
        IngestionReport report = new IngestionReport(processed, skipped, removed, files.size(), counts.chunks,
                counts.symbols, counts.edges, resolution.resolvedImports(), resolution.resolvedReferences());
        log.info("ingest.done processed={} skipped={} removed={} total={} chunks={} symbols={} edges={}",
                processed, skipped, removed, files.size(), counts.chunks, counts.symbols, counts.edges);
        return report;
    }

    /**
     * Drops stored files the walk no longer returns, whether deleted, excluded or past the file limit.
     */
    private int removeVanished(Path base, List<Path> files) {
        Set<String> present = new HashSet<>();
        for (Path file : files) {
            present.add(relativePath(base, file));
        }
        List<FileRecord> vanished = store.listFiles().stream()
                .filter(file -> !present.contains(file.path()))
                .toList();
        if (!vanished.isEmpty()) {
            store.runInTransaction(() -> vanished.forEach(file -> store.deleteFile(file.id())));
            vanished.forEach(file -> log.info("ingest.removed path={}", file.path()));
        }
        return vanished.size();
    }

    private static String relativePath(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    private Optional<PreparedFile> await(Future<Optional<PreparedFile>> future, Path file) throws IOException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Ingestion interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException || cause instanceof UncheckedIOException) {
                log.warn("ingest.skip path={} reason={}", file, cause.toString());
                return Optional.empty();
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IOException("Failed to prepare " + file, cause);
        }
    }

    Optional<PreparedFile> prepare(Path root, Path file, Map<String, String> knownHashes) throws IOException {
        String relative = relativePath(root, file);
        byte[] bytes = Files.readAllBytes(file);
        String hash = ContentHashing.sha256(bytes);
        if (hash.equals(knownHashes.get(relative))) {
            return Optional.of(PreparedFile.unchanged(relative, hash));
        }
        String text = new String(bytes, StandardCharsets.UTF_8);
        if (text.isEmpty()) {
            log.debug("ingest.skip path={} reason=empty", relative);
            return Optional.empty();
        }
        String lang = LanguageDetector.detect(file);
        Instant mtime = Files.getLastModifiedTime(file).toInstant();

        if (LanguageDetector.isProse(lang)) {
            List<ChunkCandidate> paragraphs = paragraphChunker.chunk(text);
            if (paragraphs.isEmpty()) {
                paragraphs = List.of(wholeFile(text));
            }
            return Optional.of(new PreparedFile(relative, hash, lang, bytes.length, mtime, false, false,
                    paragraphs, List.of(), List.of(), List.of()));
        }

        Optional<ParsedSource> parsed = parser.supports(lang) ? parser.parse(text, lang) : Optional.empty();
        if (parsed.isEmpty()) {
            if (parser.supports(lang)) {
                log.warn("ingest.degraded path={} lang={} reason=parse-failed", relative, lang);
            } else {
                log.debug("ingest.unparsed path={} lang={}", relative, lang);
            }
            return Optional.of(new PreparedFile(relative, hash, lang, bytes.length, mtime, false, false,
                    List.of(wholeFile(text)), List.of(), List.of(), List.of()));
        }

        ParsedSource tree = parsed.get();
        List<SymbolCandidate> symbols = parser.symbols(tree);
        List<ChunkCandidate> chunks = parser.chunks(tree);
        if (chunks.isEmpty()) {
            chunks = List.of(wholeFile(text));
        }
        return Optional.of(new PreparedFile(relative, hash, lang, bytes.length, mtime, true, false,
                chunks, symbols, parser.imports(tree), parser.references(tree, symbols)));
    }

    private static ChunkCandidate wholeFile(String text) {
        String[] lines = text.split("\\R", -1);
        int total = Math.max(1, text.endsWith("\n") ? lines.length - 1 : lines.length);
        return new ChunkCandidate(1, total, text, "block");
    }

    private void write(PreparedFile file, Counts counts) {
        long fileId = store.upsertFile(new FileRecord(null, file.path(), file.hash(), file.lang(), file.size(),
                file.mtime(), file.parsed()));
        store.clearFileContents(fileId);

        List<SymbolCandidate> symbols = file.symbols();
        List<Long> symbolIds = new ArrayList<>(symbols.size());
        Map<String, Long> byPosition = new HashMap<>();
        Map<String, Long> byName = new HashMap<>();
        for (SymbolCandidate symbol : symbols) {
            long id = store.addSymbol(new SymbolRecord(null, fileId, symbol.name(), symbol.kind(), symbol.signature(),
                    symbol.startLine(), symbol.endLine(), symbol.doc(), null));
            symbolIds.add(id);
            byPosition.putIfAbsent(symbol.name() + "@" + symbol.startLine(), id);
            byName.putIfAbsent(symbol.name(), id);
        }
        int[] parents = SymbolNesting.parents(symbols);
        for (int i = 0; i < parents.length; i++) {
            if (parents[i] >= 0) {
                store.updateSymbolParent(symbolIds.get(i), symbolIds.get(parents[i]));
            }
        }

        for (ImportCandidate imported : file.imports()) {
            store.addSymbol(new SymbolRecord(null, fileId, imported.moduleName(), SymbolRecord.IMPORT_KIND,
                    null, imported.line(), imported.line(), null, null));
            counts.symbols++;
        }
        counts.symbols += symbols.size();

        for (EdgeCandidate edge : file.references()) {
            Long src = byPosition.get(edge.srcName() + "@" + edge.srcStartLine());
            if (src == null) {
                continue;
            }
            Long dst = byName.get(edge.dstName());
            if (dst == null) {
                if (edge.type() != EdgeType.MEMBER_OF) {
                    store.addReference(new ReferenceRecord(src, edge.dstName(), edge.type()));
                }
                continue;
            }
            if (!dst.equals(src) && store.addEdge(new EdgeRecord(src, dst, edge.type()))) {
                counts.edges++;
            }
        }

        for (ChunkCandidate chunk : file.chunks()) {
            Long owner = bestOverlap(chunk, symbols, symbolIds);
            long chunkId = store.addChunk(new ChunkRecord(null, fileId, chunk.startLine(), chunk.endLine(), chunk.kind(),
                    chunk.text(), ContentHashing.sha256(chunk.text()), owner));
            counts.chunks++;
            if (embeddingService != null) {
                store.putChunkEmbedding(chunkId, embeddingService.embed(chunk.text()));
            }
        }
        if (embeddingService != null) {
            for (int i = 0; i < symbols.size(); i++) {
                SymbolCandidate symbol = symbols.get(i);
                String text = symbol.name() + " " + (symbol.signature() == null ? "" : symbol.signature())
                        + " " + (symbol.doc() == null ? "" : symbol.doc());
                store.putSymbolEmbedding(symbolIds.get(i), embeddingService.embed(text));
            }
        }
    }

    /**
     * Symbol sharing the most lines with the chunk. Ties go to the tighter span.
     */
    static Long bestOverlap(ChunkCandidate chunk, List<SymbolCandidate> symbols, List<Long> symbolIds) {
        Long best = null;
        int bestOverlap = 0;
        int bestSpan = Integer.MAX_VALUE;
        for (int i = 0; i < symbols.size(); i++) {
            SymbolCandidate symbol = symbols.get(i);
            int overlap = Math.min(chunk.endLine(), symbol.endLine()) - Math.max(chunk.startLine(), symbol.startLine()) + 1;
            if (overlap <= 0) {
                continue;
            }
            if (overlap > bestOverlap || (overlap == bestOverlap && symbol.span() < bestSpan)) {
                best = symbolIds.get(i);
                bestOverlap = overlap;
                bestSpan = symbol.span();
            }
        }
        return best;
    }

    private static final class Counts {
        private int chunks;
        private int symbols;
        private int edges;
    }
}
