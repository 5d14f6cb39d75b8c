package com.techwriter.gate;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.techwriter.store.ClaimStatus;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CoverageTest {

    @Test
    void shouldStayWithinUnitInterval() {
        assertEquals(1.0, new Coverage(0, 0).score());
        assertEquals(0.5, new Coverage(1, 2).score());
        assertEquals(1.0, new Coverage(5, 2).score());
        assertEquals(0.0, new Coverage(0, 4).score());
    }

    @Test
    void shouldCountOnlySupportedClaims() {
        Coverage coverage = Coverage.of(List.of(
                CoverageGateTest.claim("- a b", List.of(), ClaimStatus.SUPPORTED),
                CoverageGateTest.claim("- c d", List.of(), ClaimStatus.UNCERTAIN),
                CoverageGateTest.claim("- e f", List.of(), ClaimStatus.CONTRADICTED)), 4);

        assertEquals(1, coverage.supported());
        assertEquals(0.25, coverage.score());
    }

    @Test
    void shouldRejectNegativeCounts() {
        assertThrows(IllegalArgumentException.class, () -> new Coverage(-1, 2));
    }
}
