package com.ai.intake.extraction;

/**
 * A value proposed by an extractor together with how sure it is (0..1).
 */
public record ExtractedValue(String value, double confidence) {

    public ExtractedValue {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0,1]: " + confidence);
        }
    }
}
