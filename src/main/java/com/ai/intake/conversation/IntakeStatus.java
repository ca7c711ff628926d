package com.ai.intake.conversation;

/**
 * Lifecycle of one intake conversation. Transitions only move forward;
 * ABANDONED is reachable from every non-terminal state.
 */
public enum IntakeStatus {
    COLLECTING_DEMOGRAPHICS,
    COLLECTING_SYMPTOM,
    COLLECTING_FOLLOWUPS,
    COMPLETE,
    ABANDONED;

    public boolean isTerminal() {
        return this == COMPLETE || this == ABANDONED;
    }

    public boolean canTransitionTo(IntakeStatus next) {
        if (next == null || isTerminal()) return false;
        if (next == ABANDONED) return true;
        return next.ordinal() > ordinal();
    }
}
