package com.ai.intake.catalog;

import com.ai.intake.conversation.QuestionCategory;

public record FollowUpQuestion(String id, String text, QuestionCategory category) {
}
