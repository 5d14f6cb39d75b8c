package com.techwriter.citation;

public class CitationFormatException extends IllegalArgumentException {
    private final String citation;

    public CitationFormatException(String citation, String reason) {
        super("Invalid citation '" + citation + "': " + reason);
        this.citation = citation;
    }

    public String citation() {
        return citation;
    }
}
