package com.ai.intake.dto;

import com.ai.intake.conversation.IntakeSnapshot;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Rendered engine action. {@code type} is {@code question}, {@code complete} or {@code abandoned}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IntakeReply(String conversationId, String type, String message, String reason, IntakeSnapshot intake) {

    public static final String QUESTION = "question";
    public static final String COMPLETE = "complete";
    public static final String ABANDONED = "abandoned";

    public static IntakeReply question(String conversationId, String text) {
        return new IntakeReply(conversationId, QUESTION, text, null, null);
    }

    public static IntakeReply complete(String conversationId, String text, IntakeSnapshot snapshot) {
        return new IntakeReply(conversationId, COMPLETE, text, null, snapshot);
    }

    public static IntakeReply abandoned(String conversationId, String text, String reason) {
        return new IntakeReply(conversationId, ABANDONED, text, reason, null);
    }

    public boolean isTerminal() {
        return !QUESTION.equals(type);
    }
}
