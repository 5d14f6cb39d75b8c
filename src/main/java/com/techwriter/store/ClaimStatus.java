package com.techwriter.store;

import java.util.Arrays;
import java.util.Locale;

public enum ClaimStatus {
    SUPPORTED,
    CONTRADICTED,
    UNCERTAIN,
    MISSING;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public Severity severity() {
        return switch (this) {
            case SUPPORTED -> Severity.LOW;
            case UNCERTAIN -> Severity.MEDIUM;
            case CONTRADICTED, MISSING -> Severity.HIGH;
        };
    }

    public static ClaimStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value().equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown claim status: " + value));
    }
}
