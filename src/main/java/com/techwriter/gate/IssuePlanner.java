package com.techwriter.gate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.techwriter.store.ClaimRecord;
import com.techwriter.store.Issue;
import com.techwriter.store.Severity;

public final class IssuePlanner {
    static final String CLAIM_FIX_HINT = "Find supporting evidence or revise claim.";
    static final String COVERAGE_FIX_HINT = "Add claims with citations that cover the missing targets.";

    private IssuePlanner() {
    }

    /**
     * One issue per claim that is not supported, plus one for incomplete coverage. High severity first.
     */
    public static List<Issue> plan(Coverage coverage, List<ClaimRecord> claims) {
        List<Issue> issues = new ArrayList<>();
        for (ClaimRecord claim : claims) {
            if (claim.isSupported()) {
                continue;
            }
            Severity severity = claim.severity() == Severity.HIGH ? Severity.HIGH : Severity.MEDIUM;
            issues.add(new Issue(severity, "Claim unresolved: " + claim.text(), CLAIM_FIX_HINT));
        }
        if (coverage.score() < 1.0) {
            issues.add(new Issue(Severity.MEDIUM,
                    String.format("Missing coverage: %d of %d expected items supported", coverage.supported(), coverage.expected()),
                    COVERAGE_FIX_HINT));
        }
        issues.sort(Comparator.comparing(Issue::severity));
        return issues;
    }
}
