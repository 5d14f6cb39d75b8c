package com.techwriter.pipeline;

import com.techwriter.gate.IterationMetrics;

public class GateExhaustedException extends RuntimeException {
    private final IterationMetrics lastMetrics;

    public GateExhaustedException(int attempts, IterationMetrics lastMetrics) {
        super("Gating failed after " + attempts + " attempts: " + lastMetrics);
        this.lastMetrics = lastMetrics;
    }

    public IterationMetrics lastMetrics() {
        return lastMetrics;
    }
}
