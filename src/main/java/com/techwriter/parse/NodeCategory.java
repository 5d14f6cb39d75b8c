package com.techwriter.parse;

import java.util.Optional;

import com.techwriter.store.EdgeType;

/**
 * Language-neutral categories a grammar maps its native node types onto.
 */
public enum NodeCategory {
    FUNCTION,
    CLASS,
    IMPORT,
    CALL,
    INHERIT,
    MEMBER,
    IMPLEMENTS,
    EXPORT;

    public boolean declaresSymbol() {
        return this == FUNCTION || this == CLASS || this == MEMBER;
    }

    public boolean isChunked() {
        return this == FUNCTION || this == CLASS;
    }

    /**
     * The edge a reference node of this category produces, if any.
     */
    public Optional<EdgeType> referenceEdge() {
        return switch (this) {
            case CALL -> Optional.of(EdgeType.CALLS);
            case INHERIT -> Optional.of(EdgeType.INHERITS);
            case IMPLEMENTS -> Optional.of(EdgeType.IMPLEMENTS);
            case EXPORT -> Optional.of(EdgeType.EXPORTS);
            case FUNCTION, CLASS, IMPORT, MEMBER -> Optional.empty();
        };
    }
}
