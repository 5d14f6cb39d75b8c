package com.techwriter.store;

import java.util.Objects;

public record Issue(Severity severity, String description, String fixHint) {
    public Issue {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(description, "description");
    }
}
