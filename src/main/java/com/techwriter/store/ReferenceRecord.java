package com.techwriter.store;

import java.util.Objects;

/**
 * A reference from a declared symbol to a name declared in another file. Kept so cross-file edges can be
 * rebuilt when only the target's file is re-ingested.
 */
public record ReferenceRecord(long srcSymbolId, String dstName, EdgeType type) {
    public ReferenceRecord {
        Objects.requireNonNull(dstName, "dstName");
        Objects.requireNonNull(type, "type");
    }
}
