package com.techwriter.pipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.techwriter.citation.Citation;
import com.techwriter.citation.CitationResolution;
import com.techwriter.citation.CitationResolver;
import com.techwriter.citation.CitationTokens;
import com.techwriter.citation.UnverifiableCitationException;
import com.techwriter.llm.Summarizer;
import com.techwriter.llm.SummaryDraft;
import com.techwriter.store.ChunkRecord;
import com.techwriter.store.FileRecord;
import com.techwriter.store.KnowledgeStore;
import com.techwriter.store.SummaryLevel;
import com.techwriter.store.SummaryRecord;

/**
 * Builds the summary hierarchy: chunks and files, then the ingested root as one module inside one
 * package. Every summary is stored with citations to the chunks it describes and is rejected unless
 * all of them resolve.
 */
public class SummaryService {
    private static final Logger log = LoggerFactory.getLogger(SummaryService.class);

    static final String FILE_INSTRUCTIONS = "Summarize this source file in two or three sentences: its purpose and its main declarations.";
    static final String CHUNK_INSTRUCTIONS = "Summarize what this code does in one sentence.";
    static final String MODULE_INSTRUCTIONS = "Combine these file summaries into a short overview of the module.";
    static final String PACKAGE_INSTRUCTIONS = "Combine these module summaries into a short overview of the package.";
    static final int MAX_CHILD_CITATIONS = 3;

    private final KnowledgeStore store;
    private final Summarizer summarizer;
    private final CitationResolver resolver;

    public SummaryService(KnowledgeStore store, Summarizer summarizer) {
        this.store = store;
        this.summarizer = summarizer;
        this.resolver = new CitationResolver(store);
    }

    public record Hierarchy(
            List<SummaryRecord> chunkSummaries,
            List<SummaryRecord> fileSummaries,
            SummaryRecord moduleSummary,
            SummaryRecord packageSummary) {

        public int size() {
            return chunkSummaries.size() + fileSummaries.size() + (moduleSummary == null ? 0 : 1)
                    + (packageSummary == null ? 0 : 1);
        }
    }

    public Hierarchy summarizeProject(Path root, boolean includeChunks) {
        String rootPath = root.toAbsolutePath().normalize().toString();
        Path fileName = root.toAbsolutePath().normalize().getFileName();
        String name = fileName == null ? rootPath : fileName.toString();

        List<SummaryRecord> chunkSummaries = new ArrayList<>();
        List<SummaryRecord> fileSummaries = new ArrayList<>();
        for (FileRecord file : store.listFiles()) {
            if (!file.parsed()) {
                continue;
            }
            if (includeChunks) {
                chunkSummaries.addAll(summarizeChunks(file));
            }
            summarizeFile(file).ifPresent(fileSummaries::add);
        }
        if (fileSummaries.isEmpty()) {
            log.info("summary.done files=0 chunks={}", chunkSummaries.size());
            return new Hierarchy(chunkSummaries, fileSummaries, null, null);
        }

        long packageId = store.findPackageId(rootPath).orElseGet(() -> store.addPackage(rootPath, name));
        long moduleId = store.findModuleId(rootPath).orElseGet(() -> store.addModule(packageId, rootPath, name));
        Set<Long> linked = new LinkedHashSet<>(store.moduleFileIds(moduleId));
        for (SummaryRecord summary : fileSummaries) {
            if (linked.add(summary.targetId())) {
                store.linkModuleFile(moduleId, summary.targetId());
            }
        }

        SummaryRecord moduleSummary = aggregate(SummaryLevel.MODULE, moduleId, fileSummaries, MODULE_INSTRUCTIONS)
                .orElse(null);
        SummaryRecord packageSummary = moduleSummary == null ? null
                : aggregate(SummaryLevel.PACKAGE, packageId, List.of(moduleSummary), PACKAGE_INSTRUCTIONS).orElse(null);
        log.info("summary.done files={} chunks={} module={} package={}",
                fileSummaries.size(), chunkSummaries.size(), moduleSummary != null, packageSummary != null);
        return new Hierarchy(chunkSummaries, fileSummaries, moduleSummary, packageSummary);
    }

    /**
     * Reuses an existing file summary so re-runs over an unchanged store do not duplicate it.
     */
    public Optional<SummaryRecord> summarizeFile(FileRecord file) {
        List<SummaryRecord> existing = store.summariesFor(SummaryLevel.FILE, file.id());
        if (!existing.isEmpty()) {
            return Optional.of(existing.get(0));
        }
        List<ChunkRecord> chunks = store.chunksForFile(file.id());
        if (chunks.isEmpty()) {
            return Optional.empty();
        }
        StringBuilder content = new StringBuilder("File: ").append(file.path());
        chunks.forEach(chunk -> content.append('\n').append(chunk.text()));
        String citation = Citation.format(file.path(), chunks.get(0).startLine(), chunks.get(0).endLine());
        return store(SummaryLevel.FILE, file.id(), content.toString(), FILE_INSTRUCTIONS, List.of(citation));
    }

    public List<SummaryRecord> summarizeChunks(FileRecord file) {
        List<SummaryRecord> out = new ArrayList<>();
        for (ChunkRecord chunk : store.chunksForFile(file.id())) {
            if (!store.summariesFor(SummaryLevel.CHUNK, chunk.id()).isEmpty()) {
                continue;
            }
            String citation = Citation.format(file.path(), chunk.startLine(), chunk.endLine());
            store(SummaryLevel.CHUNK, chunk.id(), chunk.text(), CHUNK_INSTRUCTIONS, List.of(citation)).ifPresent(out::add);
        }
        return out;
    }

    private Optional<SummaryRecord> aggregate(SummaryLevel level, long targetId, List<SummaryRecord> children,
            String instructions) {
        StringBuilder content = new StringBuilder();
        Set<String> citations = new LinkedHashSet<>();
        for (SummaryRecord child : children) {
            content.append(CitationTokens.stripBracketed(child.text())).append('\n');
            for (Citation citation : CitationTokens.citations(child.text())) {
                if (citations.size() < MAX_CHILD_CITATIONS) {
                    citations.add(citation.format());
                }
            }
        }
        return store(level, targetId, content.toString(), instructions, new ArrayList<>(citations));
    }

    private Optional<SummaryRecord> store(SummaryLevel level, long targetId, String content, String instructions,
            List<String> citations) {
        SummaryDraft draft;
        try {
            draft = summarizer.summarize(content, instructions);
        } catch (IOException e) {
            log.warn("summary.failed level={} target={} reason={}", level.value(), targetId, e.toString());
            return Optional.empty();
        }
        Set<String> all = new LinkedHashSet<>(citations);
        draft.citations().stream().filter(Citation::isValid).forEach(all::add);
        String text = CitationEnforcer.withCitations(String.join(" ", CitationTokens.stripBracketed(draft.text()).split("\\s+")), all);
        try {
            validate(text);
        } catch (IllegalArgumentException | UnverifiableCitationException e) {
            log.warn("summary.rejected level={} target={} reason={}", level.value(), targetId, e.getMessage());
            return Optional.empty();
        }
        SummaryRecord summary = SummaryRecord.create(level, targetId, text, draft.confidence());
        return Optional.of(summary.withId(store.addSummary(summary)));
    }

    /**
     * @throws IllegalArgumentException when the text is empty or carries no citation
     * @throws UnverifiableCitationException when a citation does not resolve
     */
    void validate(String text) {
        if (CitationTokens.stripBracketed(text).isBlank()) {
            throw new IllegalArgumentException("Summary text is empty");
        }
        List<String> tokens = CitationTokens.bracketed(text);
        if (tokens.isEmpty()) {
            throw new IllegalArgumentException("Summary missing citations");
        }
        for (String token : tokens) {
            if (!Citation.isValid(token)) {
                throw new IllegalArgumentException("Summary citation does not parse: " + token);
            }
            CitationResolution resolution = resolver.resolve(token);
            if (!resolution.isResolved()) {
                throw new UnverifiableCitationException(token, resolution.failure());
            }
        }
    }
}
