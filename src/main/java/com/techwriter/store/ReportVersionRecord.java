package com.techwriter.store;

import java.time.Instant;
import java.util.Objects;

public record ReportVersionRecord(
        Long id,
        String content,
        Instant createdAt,
        double coverageScore,
        double citationScore,
        int issuesHigh,
        int issuesMed,
        int issuesLow) {
    public ReportVersionRecord {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(createdAt, "createdAt");
    }

    public static ReportVersionRecord draft(String content) {
        return new ReportVersionRecord(null, content, Instant.now(), 0.0, 0.0, 0, 0, 0);
    }

    public ReportVersionRecord withId(long newId) {
        return new ReportVersionRecord(newId, content, createdAt, coverageScore, citationScore, issuesHigh, issuesMed, issuesLow);
    }

    public ReportVersionRecord withContent(String newContent) {
        return new ReportVersionRecord(id, newContent, createdAt, coverageScore, citationScore, issuesHigh, issuesMed, issuesLow);
    }

    public ReportVersionRecord withScores(double coverage, double citation, int high, int medium, int low) {
        return new ReportVersionRecord(id, content, createdAt, coverage, citation, high, medium, low);
    }
}
