package com.techwriter.store;

import java.util.Objects;

public record EdgeRecord(long srcSymbolId, long dstSymbolId, EdgeType type) {
    public EdgeRecord {
        Objects.requireNonNull(type, "type");
    }

    public long otherEnd(long symbolId) {
        return srcSymbolId == symbolId ? dstSymbolId : srcSymbolId;
    }
}
