package com.techwriter.gate;

import java.util.List;

import com.techwriter.store.ClaimRecord;
import com.techwriter.store.Issue;
import com.techwriter.store.Severity;

public record IterationMetrics(
        int iteration,
        int claims,
        double coverage,
        double supportRate,
        double citationRate,
        int issuesHigh,
        int issuesMed,
        int issuesLow,
        int missingCitations) {

    public static IterationMetrics compute(int iteration, Coverage coverage, List<ClaimRecord> claims, List<Issue> issues) {
        int total = claims.size();
        long supported = claims.stream().filter(ClaimRecord::isSupported).count();
        long cited = claims.stream().filter(ClaimRecord::hasCitations).count();
        int denominator = Math.max(1, total);
        double supportRate = (double) supported / denominator;
        double citationRate = (double) cited / denominator;
        return new IterationMetrics(
                iteration,
                total,
                coverage.score(),
                supportRate,
                citationRate,
                count(issues, Severity.HIGH),
                count(issues, Severity.MEDIUM),
                count(issues, Severity.LOW),
                (int) (total - cited));
    }

    private static int count(List<Issue> issues, Severity severity) {
        return (int) issues.stream().filter(issue -> issue.severity() == severity).count();
    }

    @Override
    public String toString() {
        return String.format("iteration=%d claims=%d coverage=%.2f support=%.2f citations=%.2f high=%d medium=%d low=%d",
                iteration, claims, coverage, supportRate, citationRate, issuesHigh, issuesMed, issuesLow);
    }
}
