package com.techwriter.store;

import java.time.Instant;

public record IterationIssueRecord(
        Long id,
        long reportVersionId,
        int iteration,
        Severity severity,
        String description,
        String fixHint,
        Instant createdAt) {
}
