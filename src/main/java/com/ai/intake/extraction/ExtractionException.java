package com.ai.intake.extraction;

/**
 * Raised by an extractor that could not produce a usable answer. Always recovered
 * by {@link ExtractionGateway}; never reaches the patient.
 */
public class ExtractionException extends RuntimeException {

    public enum Kind {
        /** The provider did not answer within the configured bound. */
        TIMEOUT,
        /** The provider answered with something that is not the expected JSON. */
        MALFORMED,
        /** The provider could not be reached or is not configured. */
        UNAVAILABLE
    }

    private final Kind kind;

    public ExtractionException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ExtractionException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
