package com.ai.intake.conversation;

import java.util.Objects;

/**
 * What the engine wants the transport to do after a turn. No rendering here
 * beyond the question text itself.
 */
public final class EngineAction {

    public enum Type {
        ASK,
        COMPLETE,
        ABANDONED
    }

    private final Type type;
    private final String questionText;
    private final IntakeSnapshot snapshot;
    private final String reason;

    private EngineAction(Type type, String questionText, IntakeSnapshot snapshot, String reason) {
        this.type = type;
        this.questionText = questionText;
        this.snapshot = snapshot;
        this.reason = reason;
    }

    public static EngineAction ask(String questionText) {
        return new EngineAction(Type.ASK, Objects.requireNonNull(questionText, "questionText"), null, null);
    }

    public static EngineAction complete(IntakeSnapshot snapshot) {
        return new EngineAction(Type.COMPLETE, null, Objects.requireNonNull(snapshot, "snapshot"), null);
    }

    public static EngineAction abandoned(String reason) {
        return new EngineAction(Type.ABANDONED, null, null, reason);
    }

    public Type getType() {
        return type;
    }

    public boolean isAsk() {
        return type == Type.ASK;
    }

    public boolean isTerminal() {
        return type != Type.ASK;
    }

    public String getQuestionText() {
        return questionText;
    }

    public IntakeSnapshot getSnapshot() {
        return snapshot;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        switch (type) {
            case ASK:
                return "Ask(" + questionText + ")";
            case COMPLETE:
                return "Complete(" + snapshot.conversationId() + ")";
            default:
                return "Abandoned(" + reason + ")";
        }
    }
}
