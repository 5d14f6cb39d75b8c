package com.techwriter.pipeline;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.techwriter.store.ClaimRecord;
import com.techwriter.store.ClaimStatus;
import com.techwriter.store.KnowledgeStore;

import static org.junit.jupiter.api.Assertions.assertEquals;

class MetricsEvaluatorTest {

    @Test
    void shouldRecomputeRatesFromPersistedClaims() throws Exception {
        try (KnowledgeStore store = KnowledgeStore.ephemeral()) {
            long versionId = store.addReportVersion("- a\n- b\n- c\n- d").id();
            store.replaceClaims(versionId, List.of(
                    claim(versionId, "- a", List.of("x.py:1-2"), ClaimStatus.SUPPORTED),
                    claim(versionId, "- b", List.of("x.py:1-2"), ClaimStatus.SUPPORTED),
                    claim(versionId, "- c", List.of("x.py:3-4"), ClaimStatus.CONTRADICTED),
                    claim(versionId, "- d", List.of(), ClaimStatus.MISSING)));

            MetricsEvaluator.Evaluation evaluation = MetricsEvaluator.evaluate(store, versionId, 4);

            assertEquals(4, evaluation.claims());
            assertEquals(0.5, evaluation.supportRate());
            assertEquals(0.75, evaluation.citationRate());
            assertEquals(0.5, evaluation.coverage());
        }
    }

    @Test
    void shouldReportZeroRatesForReportWithoutClaims() throws Exception {
        try (KnowledgeStore store = KnowledgeStore.ephemeral()) {
            long versionId = store.addReportVersion("# Empty").id();

            MetricsEvaluator.Evaluation evaluation = MetricsEvaluator.evaluate(store, versionId, 0);

            assertEquals(0, evaluation.claims());
            assertEquals(0.0, evaluation.supportRate());
            assertEquals(1.0, evaluation.coverage());
        }
    }

    private static ClaimRecord claim(long versionId, String text, List<String> citations, ClaimStatus status) {
        return ClaimRecord.unchecked(versionId, text, citations).withVerdict(citations, status, "");
    }
}
