package com.techwriter.store;

import java.util.Arrays;
import java.util.Locale;

/**
 * Issue and claim severity. Declaration order is the report order: high first.
 */
public enum Severity {
    HIGH,
    MEDIUM,
    LOW;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Severity fromValue(String value) {
        return Arrays.stream(values())
                .filter(severity -> severity.value().equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown severity: " + value));
    }
}
