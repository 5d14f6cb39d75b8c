package com.techwriter.store;

import java.util.List;
import java.util.Objects;

public record ClaimRecord(
        Long id,
        long reportVersionId,
        String text,
        List<String> citationRefs,
        ClaimStatus status,
        Severity severity,
        String rationale) {
    public ClaimRecord {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(severity, "severity");
        citationRefs = citationRefs == null ? List.of() : List.copyOf(citationRefs);
        rationale = rationale == null ? "" : rationale;
    }

    public static ClaimRecord unchecked(long reportVersionId, String text, List<String> citationRefs) {
        return new ClaimRecord(null, reportVersionId, text, citationRefs, ClaimStatus.MISSING, Severity.MEDIUM, "Not checked");
    }

    public boolean hasCitations() {
        return !citationRefs.isEmpty();
    }

    public boolean isSupported() {
        return status == ClaimStatus.SUPPORTED;
    }

    public ClaimRecord withVerdict(List<String> newCitations, ClaimStatus newStatus, String newRationale) {
        return new ClaimRecord(id, reportVersionId, text, newCitations, newStatus, newStatus.severity(), newRationale);
    }

    public ClaimRecord withId(long newId) {
        return new ClaimRecord(newId, reportVersionId, text, citationRefs, status, severity, rationale);
    }
}
