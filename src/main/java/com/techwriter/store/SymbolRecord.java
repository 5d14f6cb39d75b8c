package com.techwriter.store;

import java.util.Objects;

public record SymbolRecord(
        Long id,
        long fileId,
        String name,
        String kind,
        String signature,
        int startLine,
        int endLine,
        String doc,
        Long parentSymbolId) {
    public static final String IMPORT_KIND = "import";

    public SymbolRecord {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        if (startLine < 1 || endLine < startLine) {
            throw new IllegalArgumentException("invalid symbol span " + startLine + "-" + endLine + " for " + name);
        }
    }

    public boolean isImport() {
        return IMPORT_KIND.equals(kind);
    }

    public boolean encloses(SymbolRecord other) {
        return startLine <= other.startLine && endLine >= other.endLine;
    }

    public int span() {
        return endLine - startLine;
    }
}
