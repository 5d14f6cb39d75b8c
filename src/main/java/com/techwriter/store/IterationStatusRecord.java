package com.techwriter.store;

import java.time.Instant;

public record IterationStatusRecord(
        Long id,
        long reportVersionId,
        int iteration,
        double coverage,
        double supportRate,
        double citationRate,
        int issuesHigh,
        int issuesMed,
        int issuesLow,
        int missingCitations,
        Instant createdAt) {
}
