package com.techwriter.pipeline;

public enum PipelineState {
    INGESTING,
    DRAFTING,
    ENFORCING_CITATIONS,
    VERIFYING,
    SCORING,
    GATE_PASS,
    REVISING,
    DONE
}
