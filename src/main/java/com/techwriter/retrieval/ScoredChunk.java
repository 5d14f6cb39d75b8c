package com.techwriter.retrieval;

import com.techwriter.store.ChunkRecord;

public record ScoredChunk(ChunkRecord chunk, String path, String citation, double score) {
}
