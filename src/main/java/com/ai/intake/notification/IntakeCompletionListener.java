package com.ai.intake.notification;

import com.ai.intake.conversation.IntakeSnapshot;

/**
 * Downstream consumer of a finished intake. Called once per conversation, after the
 * completed record has been saved.
 */
public interface IntakeCompletionListener {

    void onIntakeCompleted(IntakeSnapshot snapshot);
}
