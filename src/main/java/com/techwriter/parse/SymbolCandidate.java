package com.techwriter.parse;

public record SymbolCandidate(String name, String kind, String signature, int startLine, int endLine, String doc) {

    public boolean encloses(SymbolCandidate other) {
        return startLine <= other.startLine && endLine >= other.endLine;
    }

    public int span() {
        return endLine - startLine;
    }

    public boolean isClassLike() {
        return "class".equals(kind) || "interface".equals(kind) || "enum".equals(kind) || "record".equals(kind);
    }
}
