package com.ai.intake.notification;

import com.ai.intake.conversation.IntakeSnapshot;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CompletionNotifierTest {

    @Test
    void failingListenerDoesNotStopTheOthers() {
        List<String> seen = new ArrayList<>();
        IntakeCompletionListener failing = s -> {
            throw new IllegalStateException("down");
        };
        IntakeCompletionListener recording = s -> seen.add(s.conversationId());
        CompletionNotifier notifier = new CompletionNotifier(List.of(failing, recording));

        int delivered = notifier.notifyCompleted(SnapshotFixtures.completed("c1"));

        assertEquals(1, delivered);
        assertEquals(List.of("c1"), seen);
    }

    @Test
    void noListenersIsFine() {
        IntakeSnapshot snapshot = SnapshotFixtures.completed("c1");
        assertEquals(0, new CompletionNotifier(List.of()).notifyCompleted(snapshot));
    }
}
