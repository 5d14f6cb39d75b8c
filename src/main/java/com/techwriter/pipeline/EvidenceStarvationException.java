package com.techwriter.pipeline;

/**
 * Retrieval found nothing to draft from.
 */
public class EvidenceStarvationException extends RuntimeException {
    private final String prompt;

    public EvidenceStarvationException(String prompt) {
        super("No evidence retrieved for prompt: " + prompt);
        this.prompt = prompt;
    }

    public String prompt() {
        return prompt;
    }
}
