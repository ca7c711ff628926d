package com.ai.intake.notification;

import com.ai.intake.conversation.IntakeSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fans a completed intake out to every listener. A failing listener is logged and
 * skipped; it never changes what the engine returns.
 */
@Component
public class CompletionNotifier {

    private static final Logger log = LoggerFactory.getLogger(CompletionNotifier.class);

    private final List<IntakeCompletionListener> listeners;

    public CompletionNotifier(List<IntakeCompletionListener> listeners) {
        this.listeners = List.copyOf(listeners);
        log.info("Completion listeners: {}", this.listeners.size());
    }

    /** Returns how many listeners handled the snapshot without error. */
    public int notifyCompleted(IntakeSnapshot snapshot) {
        int delivered = 0;
        for (IntakeCompletionListener listener : listeners) {
            try {
                listener.onIntakeCompleted(snapshot);
                delivered++;
            } catch (RuntimeException e) {
                log.warn("[{}] Completion listener {} failed", snapshot.conversationId(),
                        listener.getClass().getSimpleName(), e);
            }
        }
        return delivered;
    }
}
