package com.techwriter.llm;

import java.util.Objects;

import com.techwriter.store.ClaimStatus;

public record Grade(ClaimStatus status, String rationale) {
    public Grade {
        Objects.requireNonNull(status, "status");
        if (status == ClaimStatus.MISSING) {
            throw new IllegalArgumentException("a grade is supported, contradicted or uncertain");
        }
        rationale = rationale == null ? "" : rationale;
    }

    public static Grade supported(String rationale) {
        return new Grade(ClaimStatus.SUPPORTED, rationale);
    }

    public static Grade contradicted(String rationale) {
        return new Grade(ClaimStatus.CONTRADICTED, rationale);
    }

    public static Grade uncertain(String rationale) {
        return new Grade(ClaimStatus.UNCERTAIN, rationale);
    }

    public boolean isDecisive() {
        return status != ClaimStatus.UNCERTAIN;
    }
}
