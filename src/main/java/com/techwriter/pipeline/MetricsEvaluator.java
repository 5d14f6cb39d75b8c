package com.techwriter.pipeline;

import java.util.List;

import com.techwriter.gate.Coverage;
import com.techwriter.store.ClaimRecord;
import com.techwriter.store.KnowledgeStore;

/**
 * Recomputes the headline rates of a report version from its persisted claims.
 */
public final class MetricsEvaluator {

    private MetricsEvaluator() {
    }

    public record Evaluation(double supportRate, double citationRate, double coverage, int claims) {
    }

    public static Evaluation evaluate(KnowledgeStore store, long reportVersionId, int expectedItems) {
        List<ClaimRecord> claims = store.claimsFor(reportVersionId);
        int total = claims.size();
        long supported = claims.stream().filter(ClaimRecord::isSupported).count();
        long cited = claims.stream().filter(ClaimRecord::hasCitations).count();
        int denominator = Math.max(1, total);
        return new Evaluation(
                (double) supported / denominator,
                (double) cited / denominator,
                Coverage.of(claims, expectedItems).score(),
                total);
    }
}
