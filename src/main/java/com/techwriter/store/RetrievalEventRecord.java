package com.techwriter.store;

import java.time.Instant;

public record RetrievalEventRecord(
        Long id,
        long reportVersionId,
        int iteration,
        String prompt,
        String chunksJson,
        String summariesJson,
        String symbolsJson,
        String edgesJson,
        Instant createdAt) {
}
