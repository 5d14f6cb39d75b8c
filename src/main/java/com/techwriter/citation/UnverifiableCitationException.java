package com.techwriter.citation;

/**
 * A citation in a finished report that does not resolve to a stored chunk.
 */
public class UnverifiableCitationException extends RuntimeException {
    private final String token;
    private final CitationResolution.Failure failure;

    public UnverifiableCitationException(String token, CitationResolution.Failure failure) {
        super("Citation [" + token + "] cannot be verified: " + describe(failure));
        this.token = token;
        this.failure = failure;
    }

    public UnverifiableCitationException(String token, CitationFormatException cause) {
        super("Citation [" + token + "] cannot be verified: " + cause.getMessage(), cause);
        this.token = token;
        this.failure = null;
    }

    public String token() {
        return token;
    }

    /**
     * @return the resolution failure, or null when the token did not parse
     */
    public CitationResolution.Failure failure() {
        return failure;
    }

    private static String describe(CitationResolution.Failure failure) {
        return failure == CitationResolution.Failure.UNKNOWN_FILE ? "unknown file" : "no chunk covers the range";
    }
}
