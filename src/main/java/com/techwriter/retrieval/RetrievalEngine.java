package com.techwriter.retrieval;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.techwriter.citation.Citation;
import com.techwriter.citation.CitationResolution;
import com.techwriter.citation.CitationResolver;
import com.techwriter.citation.CitationTokens;
import com.techwriter.ingest.EmbeddingService;
import com.techwriter.runtime.AppConfig;
import com.techwriter.store.ChunkRecord;
import com.techwriter.store.EdgeRecord;
import com.techwriter.store.FileRecord;
import com.techwriter.store.KnowledgeStore;
import com.techwriter.store.SummaryLevel;
import com.techwriter.store.SummaryRecord;
import com.techwriter.store.SymbolRecord;

/**
 * Hybrid retrieval: each source adds a weighted score per chunk id, then literal token hits are
 * added and the best chunks win.
 */
public class RetrievalEngine {
    private static final Logger log = LoggerFactory.getLogger(RetrievalEngine.class);

    static final double LEXICAL_WEIGHT = 1.0;
    static final double VECTOR_WEIGHT = 0.2;
    static final double PATH_WEIGHT = 0.4;
    static final double SYMBOL_WEIGHT = 0.3;
    static final double SUMMARY_WEIGHT = 0.5;
    static final double GRAPH_WEIGHT = 0.25;
    static final double KIND_WEIGHT = 0.35;

    private static final Map<String, List<String>> KIND_HINTS = Map.of(
            "function", List.of("function", "method"),
            "functions", List.of("function", "method"),
            "method", List.of("method", "function"),
            "methods", List.of("method", "function"),
            "class", List.of("class", "interface", "enum", "record"),
            "classes", List.of("class", "interface", "enum", "record"));

    private final KnowledgeStore store;
    private final AppConfig.RetrievalConfig config;
    private final EmbeddingService embeddingService;
    private final CitationResolver resolver;

    public RetrievalEngine(KnowledgeStore store, AppConfig.RetrievalConfig config) {
        this(store, config, null);
    }

    public RetrievalEngine(KnowledgeStore store, AppConfig.RetrievalConfig config, EmbeddingService embeddingService) {
        this.store = store;
        this.config = config;
        this.embeddingService = embeddingService;
        this.resolver = new CitationResolver(store);
    }

    public EvidenceBundle retrieve(String topic) {
        return retrieve(topic, config.getLimit());
    }

    public EvidenceBundle retrieve(String topic, int limit) {
        List<String> tokens = TopicTokens.of(topic);
        int wide = Math.max(limit, config.getFtsLimit());
        Map<Long, Double> scores = new LinkedHashMap<>();
        Map<Long, ChunkRecord> chunks = new HashMap<>();

        for (ChunkRecord chunk : store.searchChunks(tokens, wide)) {
            add(scores, chunks, chunk, LEXICAL_WEIGHT);
        }
        addVectorHits(topic, wide, scores, chunks);
        addPathHits(tokens, scores, chunks);

        List<SymbolRecord> matchedSymbols = store.findSymbolsByName(tokens, wide);
        for (SymbolRecord symbol : matchedSymbols) {
            chunksOf(symbol).forEach(chunk -> add(scores, chunks, chunk, SYMBOL_WEIGHT));
        }

        List<SummaryRecord> matchedSummaries = store.searchSummaries(tokens, wide);
        for (ChunkRecord chunk : representativeChunks(matchedSummaries)) {
            add(scores, chunks, chunk, SUMMARY_WEIGHT);
        }

        for (SymbolRecord neighbor : neighbors(matchedSymbols, 1, new ArrayList<>())) {
            chunksOf(neighbor).forEach(chunk -> add(scores, chunks, chunk, GRAPH_WEIGHT));
        }

        addKindHits(tokens, wide, scores, chunks);

        for (Map.Entry<Long, Double> entry : scores.entrySet()) {
            entry.setValue(entry.getValue() + TopicTokens.literalHits(tokens, chunks.get(entry.getKey()).text()));
        }

        Map<Long, String> paths = new HashMap<>();
        List<ScoredChunk> ranked = scores.entrySet().stream()
                .sorted(Comparator.<Map.Entry<Long, Double>>comparingDouble(Map.Entry::getValue).reversed()
                        .thenComparing(Map.Entry::getKey))
                .limit(Math.max(0, limit))
                .map(entry -> scored(chunks.get(entry.getKey()), entry.getValue(), paths))
                .toList();

        List<SymbolRecord> bundleSymbols = store.findSymbolsByName(tokens, Math.max(1, limit));
        List<EdgeRecord> bundleEdges = new ArrayList<>();
        Set<Long> symbolIds = new LinkedHashSet<>();
        List<SymbolRecord> allSymbols = new ArrayList<>();
        for (SymbolRecord symbol : bundleSymbols) {
            if (symbolIds.add(symbol.id())) {
                allSymbols.add(symbol);
            }
        }
        for (SymbolRecord neighbor : neighbors(bundleSymbols, config.getNeighborRadius(), bundleEdges)) {
            if (symbolIds.add(neighbor.id())) {
                allSymbols.add(neighbor);
            }
        }

        EvidenceBundle bundle = new EvidenceBundle(topic, ranked, bundleSummaries(matchedSummaries, ranked, limit),
                allSymbols, bundleEdges);
        log.debug("retrieval.done topic=\"{}\" tokens={} candidates={} chunks={} symbols={} edges={}",
                topic, tokens.size(), scores.size(), ranked.size(), allSymbols.size(), bundleEdges.size());
        return bundle;
    }

    /**
     * Chunk vectors score their own chunk; symbol vectors score the chunks the symbol owns.
     */
    private void addVectorHits(String topic, int wide, Map<Long, Double> scores, Map<Long, ChunkRecord> chunks) {
        if (embeddingService == null || !store.hasChunkEmbeddings()) {
            return;
        }
        float[] query = embeddingService.embed(topic);
        for (Map.Entry<Long, Double> entry : nearest(query, store.chunkEmbeddings(), wide)) {
            store.findChunk(entry.getKey())
                    .ifPresent(chunk -> add(scores, chunks, chunk, VECTOR_WEIGHT * entry.getValue()));
        }
        for (Map.Entry<Long, Double> entry : nearest(query, store.symbolEmbeddings(), wide)) {
            store.findSymbol(entry.getKey()).ifPresent(symbol -> chunksOf(symbol)
                    .forEach(chunk -> add(scores, chunks, chunk, VECTOR_WEIGHT * entry.getValue())));
        }
    }

    private static List<Map.Entry<Long, Double>> nearest(float[] query, Map<Long, float[]> vectors, int limit) {
        Map<Long, Double> similarities = new HashMap<>();
        vectors.forEach((id, vector) -> {
            if (vector.length == query.length) {
                double similarity = EmbeddingService.cosine(query, vector);
                if (similarity > 0) {
                    similarities.put(id, similarity);
                }
            }
        });
        return similarities.entrySet().stream()
                .sorted(Map.Entry.<Long, Double>comparingByValue().reversed().thenComparing(Map.Entry::getKey))
                .limit(limit)
                .toList();
    }

    private void addPathHits(List<String> tokens, Map<Long, Double> scores, Map<Long, ChunkRecord> chunks) {
        if (tokens.isEmpty()) {
            return;
        }
        Set<String> wanted = new HashSet<>(tokens);
        for (FileRecord file : store.listFiles()) {
            boolean overlaps = TopicTokens.ofPath(file.path()).stream().anyMatch(wanted::contains);
            if (overlaps) {
                store.chunksForFile(file.id()).forEach(chunk -> add(scores, chunks, chunk, PATH_WEIGHT));
            }
        }
    }

    private void addKindHits(List<String> tokens, int wide, Map<Long, Double> scores, Map<Long, ChunkRecord> chunks) {
        Set<String> kinds = new LinkedHashSet<>();
        tokens.forEach(token -> kinds.addAll(KIND_HINTS.getOrDefault(token, List.of())));
        if (kinds.isEmpty()) {
            return;
        }
        for (ChunkRecord chunk : chunks.values().stream().filter(c -> kinds.contains(c.kind())).toList()) {
            scores.merge(chunk.id(), KIND_WEIGHT, Double::sum);
        }
        for (ChunkRecord chunk : store.chunksByKind(kinds, wide)) {
            if (!scores.containsKey(chunk.id())) {
                add(scores, chunks, chunk, KIND_WEIGHT);
            }
        }
    }

    private List<ChunkRecord> chunksOf(SymbolRecord symbol) {
        List<ChunkRecord> owned = store.chunksForSymbol(symbol.id());
        if (!owned.isEmpty()) {
            return owned;
        }
        return store.findChunkCovering(symbol.fileId(), symbol.startLine(), symbol.endLine())
                .map(List::of)
                .orElse(List.of());
    }

    /**
     * One chunk per file a summary points at: the chunks its citations resolve to, else its target.
     */
    private List<ChunkRecord> representativeChunks(List<SummaryRecord> summaries) {
        Map<Long, ChunkRecord> byFile = new LinkedHashMap<>();
        for (SummaryRecord summary : summaries) {
            List<Citation> citations = CitationTokens.citations(summary.text());
            for (Citation citation : citations) {
                CitationResolution resolution = resolver.resolve(citation);
                resolution.resolvedChunk().ifPresent(chunk -> byFile.putIfAbsent(chunk.fileId(), chunk));
            }
            if (citations.isEmpty()) {
                targetChunk(summary).ifPresent(chunk -> byFile.putIfAbsent(chunk.fileId(), chunk));
            }
        }
        return new ArrayList<>(byFile.values());
    }

    private Optional<ChunkRecord> targetChunk(SummaryRecord summary) {
        if (summary.level() == SummaryLevel.CHUNK) {
            return store.findChunk(summary.targetId());
        }
        if (summary.level() == SummaryLevel.FILE) {
            List<ChunkRecord> fileChunks = store.chunksForFile(summary.targetId());
            return fileChunks.isEmpty() ? Optional.empty() : Optional.of(fileChunks.get(0));
        }
        return Optional.empty();
    }

    /**
     * Breadth-first expansion over edges in both directions, up to {@code radius} hops.
     */
    private List<SymbolRecord> neighbors(List<SymbolRecord> seeds, int radius, List<EdgeRecord> edgesOut) {
        Set<Long> visited = new HashSet<>();
        seeds.forEach(seed -> visited.add(seed.id()));
        Set<EdgeRecord> seenEdges = new LinkedHashSet<>();
        Deque<long[]> frontier = new ArrayDeque<>();
        seeds.forEach(seed -> frontier.add(new long[] { seed.id(), 0 }));
        List<SymbolRecord> found = new ArrayList<>();
        while (!frontier.isEmpty()) {
            long[] current = frontier.poll();
            if (current[1] >= radius) {
                continue;
            }
            for (EdgeRecord edge : store.edgesForSymbol(current[0])) {
                seenEdges.add(edge);
                long other = edge.otherEnd(current[0]);
                if (visited.add(other)) {
                    store.findSymbol(other).ifPresent(found::add);
                    frontier.add(new long[] { other, current[1] + 1 });
                }
            }
        }
        edgesOut.addAll(seenEdges);
        return found;
    }

    private List<SummaryRecord> bundleSummaries(List<SummaryRecord> matched, List<ScoredChunk> ranked, int limit) {
        Map<Long, SummaryRecord> out = new LinkedHashMap<>();
        matched.stream().limit(Math.max(1, limit)).forEach(summary -> out.putIfAbsent(summary.id(), summary));
        Set<Long> files = new LinkedHashSet<>();
        ranked.forEach(chunk -> files.add(chunk.chunk().fileId()));
        for (Long fileId : files) {
            store.summariesFor(SummaryLevel.FILE, fileId).forEach(summary -> out.putIfAbsent(summary.id(), summary));
        }
        return new ArrayList<>(out.values());
    }

    private ScoredChunk scored(ChunkRecord chunk, double score, Map<Long, String> paths) {
        String path = paths.computeIfAbsent(chunk.fileId(), fileId -> store.findFile(fileId)
                .map(FileRecord::path)
                .orElseThrow(() -> new IllegalStateException("Chunk " + chunk.id() + " has no file")));
        return new ScoredChunk(chunk, path, Citation.format(path, chunk.startLine(), chunk.endLine()), score);
    }

    private static void add(Map<Long, Double> scores, Map<Long, ChunkRecord> chunks, ChunkRecord chunk, double weight) {
        scores.merge(chunk.id(), weight, Double::sum);
        chunks.putIfAbsent(chunk.id(), chunk);
    }
}
