package com.techwriter.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.techwriter.gate.CoverageGate;
import com.techwriter.ingest.IngestionService;
import com.techwriter.llm.Drafter;
import com.techwriter.llm.EvidenceBlock;
import com.techwriter.llm.Grade;
import com.techwriter.llm.Grader;
import com.techwriter.parse.TreeSitterParserAdapter;
import com.techwriter.retrieval.RetrievalEngine;
import com.techwriter.runtime.AppConfig;
import com.techwriter.store.ClaimStatus;
import com.techwriter.store.Issue;
import com.techwriter.store.KnowledgeStore;
import com.techwriter.store.Severity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReportOrchestratorTest {

    private static final String PROMPT = "Describe the parser and the writer report";
    private static final String GROUNDED_DRAFT = """
            # Report

            - The parser splits raw input into tokens [parser.md:1-1]
            - The writer renders the report as markdown [writer.md:1-1]
            """;

    @TempDir
    Path tempDir;

    private KnowledgeStore store;
    private IngestionService ingestion;
    private RetrievalEngine retrieval;
    private AppConfig.PipelineConfig config;

    @BeforeEach
    void setUp() throws Exception {
        Files.writeString(tempDir.resolve("parser.md"), "The parser splits raw input into tokens.\n\nTokens are grouped into statements.\n");
        Files.writeString(tempDir.resolve("writer.md"), "The writer renders the report as markdown.\n");
        store = KnowledgeStore.ephemeral();
        ingestion = new IngestionService(store, new TreeSitterParserAdapter(), new AppConfig.IngestConfig());
        retrieval = new RetrievalEngine(store, new AppConfig.RetrievalConfig());
        config = new AppConfig.PipelineConfig();
        config.setMaxIters(2);
    }

    @AfterEach
    void tearDown() throws Exception {
        store.close();
    }

    @Test
    void shouldPassGateOnGroundedDraft() throws Exception {
        ReportOrchestrator orchestrator = orchestrator((prompt, evidence) -> GROUNDED_DRAFT, supported());

        PipelineResult result = orchestrator.run(tempDir, PROMPT);

        assertEquals(1, result.iterations());
        assertEquals(2, result.ingestion().processedFiles());
        assertEquals(List.of(PipelineState.INGESTING, PipelineState.DRAFTING, PipelineState.ENFORCING_CITATIONS,
                PipelineState.VERIFYING, PipelineState.SCORING, PipelineState.GATE_PASS, PipelineState.DONE),
                result.states());
        assertEquals(2, result.claims().size());
        assertTrue(result.claims().stream().allMatch(claim -> claim.status() == ClaimStatus.SUPPORTED));
        assertEquals(1.0, result.metrics().coverage());
        assertEquals(result.report(), store.findReportVersion(result.reportVersionId()).orElseThrow().content());
        assertEquals(1, store.listRetrievalEvents(result.reportVersionId()).size());
        assertEquals(1, store.listIterationStatus(result.reportVersionId()).size());
        assertEquals(2, store.claimsFor(result.reportVersionId()).size());
    }

    @Test
    void shouldReplaceUnresolvableCitationsBeforeValidation() throws Exception {
        String draft = """
                - The writer renders the report as markdown [nowhere.md:1-2]
                - Statements group the tokens together
                - Parser splits raw input [not a citation]
                """;
        ReportOrchestrator orchestrator = orchestrator((prompt, evidence) -> draft, supported());

        PipelineResult result = orchestrator.run(tempDir, PROMPT);

        List<String> lines = result.report().lines().toList();
        assertEquals("- The writer renders the report as markdown [writer.md:1-1]", lines.get(0));
        assertTrue(lines.get(1).startsWith("- Statements group the tokens together [parser.md:"));
        assertTrue(lines.get(2).startsWith("- Parser splits raw input [parser.md:"));
        assertFalse(result.report().contains("nowhere.md"));
        assertEquals(3, new ReportValidator(store).validate(result.report()).size());
    }

    @Test
    void shouldReviseUntilIterationCapThenFailWithLastMetrics() throws Exception {
        List<String> prompts = new ArrayList<>();
        Drafter drafter = (prompt, evidence) -> {
            prompts.add(prompt);
            return GROUNDED_DRAFT;
        };
        ReportOrchestrator orchestrator = orchestrator(drafter, (text, evidence) -> Grade.uncertain("unclear"));

        GateExhaustedException failure = assertThrows(GateExhaustedException.class, () -> orchestrator.run(tempDir, PROMPT));

        assertEquals(2, prompts.size());
        assertEquals(PROMPT, prompts.get(0));
        assertTrue(prompts.get(1).startsWith(PROMPT));
        assertTrue(prompts.get(1).contains("[medium] Claim unresolved: - The parser splits raw input into tokens"));
        assertEquals(2, failure.lastMetrics().iteration());
        assertEquals(0.0, failure.lastMetrics().supportRate());
        assertTrue(orchestrator.states().contains(PipelineState.REVISING));
        assertEquals(1, store.listReportVersions().size());
        assertEquals(2, store.listIterationStatus(null).size());
        assertFalse(store.listIterationIssues(null).isEmpty());
    }

    @Test
    void shouldFailWhenRetrievalFindsNoEvidence() throws Exception {
        List<String> prompts = new ArrayList<>();
        ReportOrchestrator orchestrator = orchestrator((prompt, evidence) -> {
            prompts.add(prompt);
            return GROUNDED_DRAFT;
        }, supported());

        EvidenceStarvationException failure = assertThrows(EvidenceStarvationException.class,
                () -> orchestrator.run(tempDir, "quantum flux capacitor"));

        assertEquals("quantum flux capacitor", failure.prompt());
        assertTrue(prompts.isEmpty());
        assertTrue(store.listReportVersions().isEmpty());
    }

    @Test
    void shouldStopWhenCancelled() throws Exception {
        ingestion.ingest(tempDir);
        ReportOrchestrator orchestrator = orchestrator((prompt, evidence) -> GROUNDED_DRAFT, supported());
        orchestrator.cancel();

        assertThrows(CancellationException.class, () -> orchestrator.draft(PROMPT));
        assertTrue(store.listReportVersions().isEmpty());
    }

    @Test
    void shouldPropagateDrafterFailure() throws Exception {
        IOException offline = new IOException("model offline");
        ReportOrchestrator orchestrator = orchestrator((prompt, evidence) -> {
            throw offline;
        }, supported());

        IOException failure = assertThrows(IOException.class, () -> orchestrator.run(tempDir, PROMPT));

        assertSame(offline, failure);
    }

    @Test
    void shouldHandDrafterCitableEvidence() throws Exception {
        List<EvidenceBlock> seen = new ArrayList<>();
        ReportOrchestrator orchestrator = orchestrator((prompt, evidence) -> {
            seen.addAll(evidence);
            return GROUNDED_DRAFT;
        }, supported());

        orchestrator.run(tempDir, PROMPT);

        assertTrue(seen.stream().anyMatch(block -> block.citation().equals("writer.md:1-1")
                && block.text().contains("renders the report")));
    }

    @Test
    void shouldListIssuesInRevisionPrompt() {
        String prompt = ReportOrchestrator.revisionPrompt("Explain it", List.of(
                new Issue(Severity.HIGH, "Claim unresolved: - X", "Find supporting evidence or revise claim."),
                new Issue(Severity.MEDIUM, "Missing coverage: 0 of 2 expected items supported", null)));

        assertTrue(prompt.startsWith("Explain it\n\nRevise the report"));
        assertTrue(prompt.contains("\n- [high] Claim unresolved: - X (Find supporting evidence or revise claim.)"));
        assertTrue(prompt.endsWith("\n- [medium] Missing coverage: 0 of 2 expected items supported"));
    }

    private ReportOrchestrator orchestrator(Drafter drafter, Grader grader) {
        return new ReportOrchestrator(store, ingestion, retrieval, drafter, grader, null, CoverageGate.defaults(), config);
    }

    private static Grader supported() {
        return (text, evidence) -> Grade.supported("matches");
    }
}
