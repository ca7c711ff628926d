package com.ai.intake.exception;

/**
 * Caller handed the engine a conversation id it has no record for. Never shown to the patient.
 */
public class UnknownConversationException extends RuntimeException {

    private final String conversationId;

    public UnknownConversationException(String conversationId) {
        super("No intake conversation for id '" + conversationId + "'");
        this.conversationId = conversationId;
    }

    public String getConversationId() {
        return conversationId;
    }
}
