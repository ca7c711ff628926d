package com.ai.intake.notification;

import com.ai.intake.conversation.AnsweredQuestion;
import com.ai.intake.conversation.IntakeSnapshot;
import com.ai.intake.conversation.IntakeStatus;
import com.ai.intake.conversation.QuestionCategory;

import java.time.Instant;
import java.util.List;

final class SnapshotFixtures {

    private SnapshotFixtures() {
    }

    static IntakeSnapshot completed(String conversationId) {
        return new IntakeSnapshot(conversationId, IntakeStatus.COMPLETE,
                "Ann Lee", 52, "Female", "ann@example.com",
                "chest pain", "my chest hurts", true,
                List.of(new AnsweredQuestion("chest_pain.detail.onset", "When did the pain start?",
                                QuestionCategory.DETAIL, "this morning"),
                        new AnsweredQuestion("chest_pain.redflag.radiation", "Does the pain spread to your arm?",
                                QuestionCategory.RED_FLAG, "no")),
                Instant.parse("2024-05-01T10:00:00Z"), Instant.parse("2024-05-01T10:06:30Z"), null);
    }
}
