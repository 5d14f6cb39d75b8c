package com.techwriter.gate;

import java.util.List;

import com.techwriter.runtime.AppConfig;
import com.techwriter.store.ClaimRecord;
import com.techwriter.store.Issue;

/**
 * Thresholds a report must meet before iteration stops.
 */
public record CoverageGate(
        double minSupportRate,
        double minCoverage,
        double minCitationRate,
        int maxHighIssues,
        int maxMediumIssues) {

    public static CoverageGate defaults() {
        return from(new AppConfig.GateConfig());
    }

    public static CoverageGate from(AppConfig.GateConfig config) {
        return new CoverageGate(config.getMinSupportRate(), config.getMinCoverage(), config.getMinCitationRate(),
                config.getMaxHighIssues(), config.getMaxMediumIssues());
    }

    /**
     * @return true to keep iterating, false once every threshold holds
     */
    public boolean shouldContinue(Coverage coverage, List<ClaimRecord> claims) {
        List<Issue> issues = IssuePlanner.plan(coverage, claims);
        return shouldContinue(IterationMetrics.compute(0, coverage, claims, issues));
    }

    public boolean shouldContinue(IterationMetrics metrics) {
        boolean passes = metrics.supportRate() >= minSupportRate
                && metrics.coverage() >= minCoverage
                && metrics.citationRate() >= minCitationRate
                && metrics.issuesHigh() <= maxHighIssues
                && metrics.issuesMed() <= maxMediumIssues;
        return !passes;
    }
}
