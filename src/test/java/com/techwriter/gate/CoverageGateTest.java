package com.techwriter.gate;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.techwriter.runtime.AppConfig;
import com.techwriter.store.ClaimRecord;
import com.techwriter.store.ClaimStatus;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CoverageGateTest {

    private final CoverageGate lenient = new CoverageGate(0.5, 0.5, 0.5, 0, 1);

    @Test
    void shouldStopWhenSingleCitedClaimIsSupportedAndCoverageIsFull() {
        List<ClaimRecord> claims = List.of(claim("- Parses input [src/a.py:1-3]", List.of("src/a.py:1-3"), ClaimStatus.SUPPORTED));

        assertFalse(lenient.shouldContinue(new Coverage(1, 1), claims));
    }

    @Test
    void shouldContinueWhileHighIssuesRemain() {
        List<ClaimRecord> claims = List.of(
                claim("- Parses input [src/a.py:1-3]", List.of("src/a.py:1-3"), ClaimStatus.SUPPORTED),
                claim("- Writes output", List.of(), ClaimStatus.MISSING));

        assertTrue(lenient.shouldContinue(Coverage.of(claims, 1), claims));
    }

    @Test
    void shouldContinueWhenCitationRateIsBelowThreshold() {
        IterationMetrics metrics = new IterationMetrics(1, 4, 1.0, 1.0, 0.25, 0, 0, 0, 3);

        assertTrue(lenient.shouldContinue(metrics));
        assertFalse(new CoverageGate(0.5, 0.5, 0.2, 0, 1).shouldContinue(metrics));
    }

    @Test
    void shouldContinueOnEmptyReport() {
        assertTrue(CoverageGate.defaults().shouldContinue(new Coverage(0, 3), List.of()));
    }

    @Test
    void shouldReadThresholdsFromConfig() {
        AppConfig.GateConfig config = new AppConfig.GateConfig();
        config.setMinCoverage(0.9);

        CoverageGate gate = CoverageGate.from(config);

        assertEquals(0.9, gate.minCoverage());
        assertEquals(config.getMaxMediumIssues(), gate.maxMediumIssues());
    }

    static ClaimRecord claim(String text, List<String> citations, ClaimStatus status) {
        return ClaimRecord.unchecked(1, text, citations).withVerdict(citations, status, "");
    }
}
