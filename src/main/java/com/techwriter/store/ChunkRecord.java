package com.techwriter.store;

import java.util.Objects;

public record ChunkRecord(
        Long id,
        long fileId,
        int startLine,
        int endLine,
        String kind,
        String text,
        String hash,
        Long symbolId) {
    public ChunkRecord {
        if (startLine < 1) {
            throw new IllegalArgumentException("start_line must be >= 1, got " + startLine);
        }
        if (endLine < startLine) {
            throw new IllegalArgumentException("end_line " + endLine + " is before start_line " + startLine);
        }
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(hash, "hash");
    }

    public int lineCount() {
        return endLine - startLine + 1;
    }

    public int overlap(int otherStart, int otherEnd) {
        return Math.max(0, Math.min(endLine, otherEnd) - Math.max(startLine, otherStart) + 1);
    }

    public ChunkRecord withSymbolId(Long newSymbolId) {
        return new ChunkRecord(id, fileId, startLine, endLine, kind, text, hash, newSymbolId);
    }
}
