package com.ai.intake.extraction;

import java.util.Map;

/**
 * Observability hook for recovered extraction failures.
 */
public interface ExtractionFailureReporter {

    void report(String conversationId, ExtractionException failure);

    Map<ExtractionException.Kind, Long> failureCounts();
}
