package com.ai.intake.conversation;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of an intake handed to downstream collaborators.
 */
public record IntakeSnapshot(
        String conversationId,
        IntakeStatus status,
        String name,
        Integer age,
        String gender,
        String email,
        String symptom,
        String symptomWording,
        boolean symptomMatched,
        List<AnsweredQuestion> answers,
        Instant createdAt,
        Instant completedAt,
        String abandonReason
) {

    public IntakeSnapshot {
        answers = answers == null ? List.of() : List.copyOf(answers);
    }
}
