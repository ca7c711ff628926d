package com.ai.intake.service;

import com.ai.intake.conversation.EngineAction;
import com.ai.intake.dto.IntakeReply;
import org.springframework.stereotype.Component;

/**
 * Turns engine actions into what the REST and WebSocket adapters send back.
 */
@Component
public class ReplyRenderer {

    private final ResponsePhrases phrases;

    public ReplyRenderer(ResponsePhrases phrases) {
        this.phrases = phrases;
    }

    public IntakeReply render(String conversationId, EngineAction action) {
        switch (action.getType()) {
            case ASK:
                return IntakeReply.question(conversationId, action.getQuestionText());
            case COMPLETE:
                return IntakeReply.complete(conversationId, phrases.completed(action.getSnapshot()), action.getSnapshot());
            default:
                return IntakeReply.abandoned(conversationId, phrases.abandoned(action.getReason()), action.getReason());
        }
    }
}
