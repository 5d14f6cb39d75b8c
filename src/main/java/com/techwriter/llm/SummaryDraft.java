package com.techwriter.llm;

import java.util.List;

public record SummaryDraft(String text, double confidence, List<String> citations) {
    public SummaryDraft {
        text = text == null ? "" : text.strip();
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        citations = citations == null ? List.of() : List.copyOf(citations);
    }
}
