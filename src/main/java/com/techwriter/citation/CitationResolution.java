package com.techwriter.citation;

import java.util.Optional;

import com.techwriter.store.ChunkRecord;
import com.techwriter.store.FileRecord;

/**
 * Outcome of resolving a citation against the store. Exactly one of {@code chunk} or {@code failure} is set.
 */
public record CitationResolution(Citation citation, FileRecord file, ChunkRecord chunk, Failure failure) {

    public enum Failure {
        UNKNOWN_FILE,
        UNKNOWN_RANGE
    }

    static CitationResolution resolved(Citation citation, FileRecord file, ChunkRecord chunk) {
        return new CitationResolution(citation, file, chunk, null);
    }

    static CitationResolution failed(Citation citation, FileRecord file, Failure failure) {
        return new CitationResolution(citation, file, null, failure);
    }

    public boolean isResolved() {
        return chunk != null;
    }

    public Optional<ChunkRecord> resolvedChunk() {
        return Optional.ofNullable(chunk);
    }
}
