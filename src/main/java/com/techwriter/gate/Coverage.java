package com.techwriter.gate;

import java.util.List;

import com.techwriter.store.ClaimRecord;

/**
 * Supported claims against the number of items a report is expected to cover.
 */
public record Coverage(int supported, int expected) {
    public Coverage {
        if (supported < 0 || expected < 0) {
            throw new IllegalArgumentException("counts must be non-negative");
        }
    }

    public static Coverage of(List<ClaimRecord> claims, int expected) {
        int supported = (int) claims.stream().filter(ClaimRecord::isSupported).count();
        return new Coverage(supported, expected);
    }

    /**
     * Always within [0, 1]; nothing expected counts as fully covered.
     */
    public double score() {
        if (expected == 0) {
            return 1.0;
        }
        return Math.min(1.0, (double) supported / expected);
    }
}
