package com.techwriter.store;

import java.util.Arrays;
import java.util.Locale;

public enum SummaryLevel {
    CHUNK,
    FILE,
    MODULE,
    PACKAGE;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SummaryLevel fromValue(String value) {
        return Arrays.stream(values())
                .filter(level -> level.value().equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown summary level: " + value));
    }
}
