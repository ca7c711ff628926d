package com.ai.intake.conversation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

class IntakeRecordTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
    private static final Instant T1 = Instant.parse("2024-05-01T10:05:00Z");

    @ParameterizedTest
    @CsvSource({
        "COLLECTING_DEMOGRAPHICS, COLLECTING_SYMPTOM,      true",
        "COLLECTING_SYMPTOM,      COLLECTING_FOLLOWUPS,    true",
        "COLLECTING_FOLLOWUPS,    COMPLETE,                true",
        "COLLECTING_DEMOGRAPHICS, ABANDONED,               true",
        "COLLECTING_FOLLOWUPS,    ABANDONED,               true",
        "COLLECTING_FOLLOWUPS,    COLLECTING_SYMPTOM,      false",
        "COMPLETE,                ABANDONED,               false",
        "ABANDONED,               COMPLETE,                false",
        "COMPLETE,                COMPLETE,                false",
    })
    void statusOnlyMovesForward(IntakeStatus from, IntakeStatus to, boolean allowed) {
        assertEquals(allowed, from.canTransitionTo(to));
    }

    @Test
    void illegalTransitionThrows() {
        IntakeRecord r = IntakeRecord.start("c1", T0);
        r.transitionTo(IntakeStatus.COLLECTING_SYMPTOM, T0);

        assertThrows(IllegalStateException.class, () -> r.transitionTo(IntakeStatus.COLLECTING_DEMOGRAPHICS, T1));
    }

    @Test
    void completionTimestampIsSetOnce() {
        IntakeRecord r = IntakeRecord.start("c1", T0);
        r.transitionTo(IntakeStatus.COLLECTING_SYMPTOM, T0);
        r.transitionTo(IntakeStatus.COLLECTING_FOLLOWUPS, T0);
        r.transitionTo(IntakeStatus.COMPLETE, T1);

        assertEquals(T1, r.getCompletedAt());
        assertTrue(r.isTerminal());
        assertThrows(IllegalStateException.class, () -> r.abandon("late", T1));
    }

    @Test
    void symptomCannotBeReplaced() {
        IntakeRecord r = IntakeRecord.start("c1", T0);
        r.setPrimarySymptom("chest pain", "my chest hurts", true);

        assertThrows(IllegalStateException.class, () -> r.setPrimarySymptom("fatigue", "tired", true));
        assertEquals("chest pain", r.getPrimarySymptom());
    }

    @Test
    void questionIdsAreNeverAddedTwice() {
        IntakeRecord r = IntakeRecord.start("c1", T0);

        assertTrue(r.markAsked("q1", "First?", QuestionCategory.DETAIL));
        r.recordAnswer("yes");
        assertFalse(r.markAsked("q1", "First?", QuestionCategory.DETAIL));

        assertEquals(1, r.getAskedQuestionIds().size());
        assertEquals(1, r.categoryTurns(QuestionCategory.DETAIL));
        assertFalse(r.hasPendingQuestion());
    }

    @Test
    void answerNeedsPendingQuestion() {
        IntakeRecord r = IntakeRecord.start("c1", T0);
        assertThrows(IllegalStateException.class, () -> r.recordAnswer("hello"));
    }

    @Test
    void copyIsIndependent() {
        IntakeRecord r = IntakeRecord.start("c1", T0);
        r.fill(IntakeField.EMAIL, "a@example.com");
        r.recordFieldQuestion(EnumSet.of(IntakeField.NAME));
        IntakeRecord copy = r.copy();

        copy.markAsked("q1", "First?", QuestionCategory.DETAIL);
        copy.fill(IntakeField.NAME, "Ann");
        copy.recordMiss(IntakeField.NAME);

        assertTrue(r.getAskedQuestionIds().isEmpty());
        assertNull(r.getName());
        assertEquals(0, r.misses(IntakeField.NAME));
        assertTrue(r.wasLastAskedAbout(IntakeField.NAME));
        assertEquals("a@example.com", copy.getEmail());
    }

    @Test
    void missingFieldsTrackSlots() {
        IntakeRecord r = IntakeRecord.start("c1", T0);
        r.fill(IntakeField.AGE, "40");
        r.setPrimarySymptom("fatigue", "tired", true);

        assertEquals(EnumSet.of(IntakeField.NAME, IntakeField.GENDER, IntakeField.EMAIL), r.missingFields());
        assertEquals("40", r.value(IntakeField.AGE));
        assertThrows(IllegalArgumentException.class, () -> r.fill(IntakeField.SYMPTOM, "x"));
    }
}
