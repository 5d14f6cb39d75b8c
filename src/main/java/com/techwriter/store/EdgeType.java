package com.techwriter.store;

import java.util.Arrays;

public enum EdgeType {
    IMPORTS("imports"),
    IMPORTS_RESOLVED("imports-resolved"),
    CALLS("calls"),
    INHERITS("inherits"),
    MEMBER_OF("member-of"),
    IMPLEMENTS("implements"),
    EXPORTS("exports");

    private final String value;

    EdgeType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static EdgeType fromValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown edge type: " + value));
    }
}
