package com.techwriter.store;

import java.time.Instant;
import java.util.Objects;

public record SummaryRecord(Long id, SummaryLevel level, long targetId, String text, double confidence, Instant createdAt) {
    public SummaryRecord {
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(createdAt, "createdAt");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1], got " + confidence);
        }
    }

    public static SummaryRecord create(SummaryLevel level, long targetId, String text, double confidence) {
        return new SummaryRecord(null, level, targetId, text, confidence, Instant.now());
    }

    public SummaryRecord withId(long newId) {
        return new SummaryRecord(newId, level, targetId, text, confidence, createdAt);
    }
}
