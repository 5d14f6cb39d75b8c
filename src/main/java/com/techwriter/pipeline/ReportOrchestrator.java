package com.techwriter.pipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.techwriter.citation.CitationTokens;
import com.techwriter.claims.ClaimExtractor;
import com.techwriter.claims.ClaimVerifier;
import com.techwriter.gate.Coverage;
import com.techwriter.gate.CoverageGate;
import com.techwriter.gate.IssuePlanner;
import com.techwriter.gate.IterationMetrics;
import com.techwriter.ingest.IngestionReport;
import com.techwriter.ingest.IngestionService;
import com.techwriter.llm.Drafter;
import com.techwriter.llm.EvidenceBlock;
import com.techwriter.llm.Grader;
import com.techwriter.retrieval.EvidenceBundle;
import com.techwriter.retrieval.RetrievalEngine;
import com.techwriter.retrieval.ScoredChunk;
import com.techwriter.runtime.AppConfig;
import com.techwriter.store.ClaimRecord;
import com.techwriter.store.IterationStatusRecord;
import com.techwriter.store.Issue;
import com.techwriter.store.KnowledgeStore;
import com.techwriter.store.ReportVersionRecord;
import com.techwriter.store.SummaryRecord;
import com.techwriter.store.SymbolRecord;

/**
 * Runs ingest, then draft, enforce, verify and score until the gate passes or the iteration cap is hit.
 * One report version is created per run and updated in place on every iteration.
 */
public class ReportOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(ReportOrchestrator.class);

    private final KnowledgeStore store;
    private final IngestionService ingestion;
    private final RetrievalEngine retrieval;
    private final Drafter drafter;
    private final SummaryService summaries;
    private final CoverageGate gate;
    private final AppConfig.PipelineConfig config;
    private final CitationEnforcer enforcer;
    private final ReportValidator validator;
    private final CitationRepairer repairer;
    private final ClaimExtractor extractor = new ClaimExtractor();
    private final ClaimVerifier verifier;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<PipelineState> states = new ArrayList<>();

    /**
     * @param summaries null to skip the summary hierarchy
     */
    public ReportOrchestrator(
            KnowledgeStore store,
            IngestionService ingestion,
            RetrievalEngine retrieval,
            Drafter drafter,
            Grader grader,
            SummaryService summaries,
            CoverageGate gate,
            AppConfig.PipelineConfig config) {
        this.store = store;
        this.ingestion = ingestion;
        this.retrieval = retrieval;
        this.drafter = drafter;
        this.summaries = summaries;
        this.gate = gate;
        this.config = config;
        this.enforcer = new CitationEnforcer(store, retrieval);
        this.validator = new ReportValidator(store);
        this.repairer = new CitationRepairer(retrieval);
        this.verifier = new ClaimVerifier(store, retrieval, grader);
    }

    /**
     * Stops the run before its next drafting step.
     */
    public void cancel() {
        cancelled.set(true);
    }

    public PipelineResult run(Path root, String prompt) throws IOException {
        states.clear();
        transition(PipelineState.INGESTING, 0);
        IngestionReport ingested = ingestion.ingest(root);
        if (summaries != null && config.isSummarize()) {
            summaries.summarizeProject(root, config.isSummarizeChunks());
        }
        return iterate(prompt, ingested);
    }

    /**
     * Drafts against whatever the store already holds.
     */
    public PipelineResult draft(String prompt) throws IOException {
        states.clear();
        return iterate(prompt, null);
    }

    private PipelineResult iterate(String prompt, IngestionReport ingested) throws IOException {
        int expected = config.getExpectedItems() > 0 ? config.getExpectedItems() : store.countFiles();
        ReportVersionRecord version = null;
        List<Issue> issues = List.of();
        IterationMetrics metrics = null;

        for (int iteration = 1; iteration <= config.getMaxIters(); iteration++) {
            if (cancelled.get()) {
                throw new CancellationException("Run cancelled before iteration " + iteration);
            }
            transition(PipelineState.DRAFTING, iteration);
            EvidenceBundle bundle = retrieval.retrieve(prompt);
            if (bundle.isEmpty()) {
                throw new EvidenceStarvationException(prompt);
            }
            Set<String> allowed = bundle.allowedCitations();
            String draftPrompt = iteration == 1 ? prompt : revisionPrompt(prompt, issues);
            String draft = drafter.draft(draftPrompt, evidenceBlocks(bundle));

            transition(PipelineState.ENFORCING_CITATIONS, iteration);
            String report = enforcer.enforce(draft == null ? "" : draft, allowed);
            validator.validate(report);

            if (version == null) {
                version = store.addReportVersion(report);
            } else {
                version = version.withContent(report);
            }
            long versionId = version.id();
            logRetrieval(versionId, iteration, draftPrompt, bundle);

            transition(PipelineState.VERIFYING, iteration);
            List<ClaimRecord> claims = verifier.verifyAll(extractor.extract(versionId, report), Set.of());
            if (CitationRepairer.needsRepair(claims)) {
                CitationRepairer.Result repaired = repairer.repair(report, claims, allowed);
                if (repaired.changed()) {
                    report = repaired.report();
                    validator.validate(report);
                    version = version.withContent(report);
                    claims = verifier.verifyAll(extractor.extract(versionId, report), Set.of());
                }
            }
            claims = store.replaceClaims(versionId, claims);

            transition(PipelineState.SCORING, iteration);
            Coverage coverage = Coverage.of(claims, expected);
            issues = IssuePlanner.plan(coverage, claims);
            metrics = IterationMetrics.compute(iteration, coverage, claims, issues);
            version = version.withScores(metrics.coverage(), metrics.citationRate(),
                    metrics.issuesHigh(), metrics.issuesMed(), metrics.issuesLow());
            store.updateReportVersion(version);
            store.logIterationStatus(new IterationStatusRecord(null, versionId, iteration, metrics.coverage(),
                    metrics.supportRate(), metrics.citationRate(), metrics.issuesHigh(), metrics.issuesMed(),
                    metrics.issuesLow(), metrics.missingCitations(), Instant.now()));
            store.logIterationIssues(versionId, iteration, issues);
            log.info("pipeline.score version={} {}", versionId, metrics);

            if (!gate.shouldContinue(metrics)) {
                transition(PipelineState.GATE_PASS, iteration);
                transition(PipelineState.DONE, iteration);
                return new PipelineResult(versionId, report, claims, metrics, ingested, states);
            }
            if (iteration < config.getMaxIters()) {
                transition(PipelineState.REVISING, iteration);
            }
        }
        throw new GateExhaustedException(config.getMaxIters(), metrics);
    }

    public List<PipelineState> states() {
        return List.copyOf(states);
    }

    static String revisionPrompt(String prompt, List<Issue> issues) {
        StringBuilder out = new StringBuilder(prompt)
                .append("\n\nRevise the report to resolve these issues. Cite only the evidence provided.");
        for (Issue issue : issues) {
            out.append("\n- [").append(issue.severity().value()).append("] ").append(issue.description());
            if (issue.fixHint() != null && !issue.fixHint().isBlank()) {
                out.append(" (").append(issue.fixHint()).append(')');
            }
        }
        return out.toString();
    }

    static List<EvidenceBlock> evidenceBlocks(EvidenceBundle bundle) {
        List<EvidenceBlock> blocks = new ArrayList<>();
        for (ScoredChunk chunk : bundle.chunks()) {
            blocks.add(new EvidenceBlock(chunk.citation(), chunk.chunk().text()));
        }
        for (SummaryRecord summary : bundle.summaries()) {
            CitationTokens.citations(summary.text()).stream().findFirst().ifPresent(citation ->
                    blocks.add(new EvidenceBlock(citation.format(), CitationTokens.stripBracketed(summary.text()))));
        }
        return blocks;
    }

    private void logRetrieval(long versionId, int iteration, String prompt, EvidenceBundle bundle) {
        List<Map<String, Object>> chunks = new ArrayList<>();
        for (ScoredChunk chunk : bundle.chunks()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("chunkId", chunk.chunk().id());
            entry.put("citation", chunk.citation());
            entry.put("score", chunk.score());
            chunks.add(entry);
        }
        store.logRetrievalEvent(versionId, iteration, prompt, chunks,
                bundle.summaries().stream().map(SummaryRecord::id).toList(),
                bundle.symbols().stream().map(SymbolRecord::name).toList(),
                bundle.edges());
    }

    private void transition(PipelineState state, int iteration) {
        states.add(state);
        log.info("pipeline.state state={} iteration={}", state, iteration);
    }
}
