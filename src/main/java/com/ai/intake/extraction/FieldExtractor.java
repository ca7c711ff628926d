package com.ai.intake.extraction;

import com.ai.intake.conversation.IntakeField;

import java.util.Set;

/**
 * Proposes slot values from one patient utterance. Implementations may be slow or
 * wrong; they must leave out anything they cannot determine rather than guess.
 */
public interface FieldExtractor {

    /**
     * @param text          raw patient utterance
     * @param missingFields fields the intake still lacks, as a hint to the extractor
     * @throws ExtractionException when no usable result could be produced
     */
    ExtractedFields extract(String text, Set<IntakeField> missingFields);

    /** Short name used in logs and on the health endpoint. */
    String name();
}
