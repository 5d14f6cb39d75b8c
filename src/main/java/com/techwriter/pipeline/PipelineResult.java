package com.techwriter.pipeline;

import java.util.List;

import com.techwriter.gate.IterationMetrics;
import com.techwriter.ingest.IngestionReport;
import com.techwriter.store.ClaimRecord;

/**
 * @param ingestion null when the run drafted against an already populated store
 */
public record PipelineResult(
        long reportVersionId,
        String report,
        List<ClaimRecord> claims,
        IterationMetrics metrics,
        IngestionReport ingestion,
        List<PipelineState> states) {

    public PipelineResult {
        claims = List.copyOf(claims);
        states = List.copyOf(states);
    }

    public int iterations() {
        return metrics.iteration();
    }
}
