package com.ai.intake.store;

import com.ai.intake.conversation.IntakeField;
import com.ai.intake.conversation.IntakeRecord;
import com.ai.intake.conversation.IntakeStatus;
import com.ai.intake.conversation.QuestionCategory;
import com.ai.intake.entity.IntakeSessionEntity;
import com.ai.intake.repository.IntakeSessionRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class JpaSessionStoreTest {

    @Configuration
    @EntityScan(basePackageClasses = IntakeSessionEntity.class)
    @EnableJpaRepositories(basePackageClasses = IntakeSessionRepository.class)
    static class JpaConfig {
    }

    @Autowired
    private IntakeSessionRepository repository;

    private JpaSessionStore store;

    @BeforeEach
    void setUp() {
        store = new JpaSessionStore(repository, new ObjectMapper().findAndRegisterModules());
    }

    @Test
    void roundTripsTheWholeRecord() {
        IntakeRecord record = IntakeRecord.start("c1", Instant.parse("2024-05-01T10:00:00Z"));
        record.fill(IntakeField.NAME, "Ann");
        record.fill(IntakeField.AGE, "52");
        record.fill(IntakeField.EMAIL, "ann@example.com");
        record.recordMiss(IntakeField.NAME);
        record.recordFieldQuestion(EnumSet.of(IntakeField.EMAIL));
        record.transitionTo(IntakeStatus.COLLECTING_SYMPTOM, Instant.parse("2024-05-01T10:01:00Z"));
        record.setPrimarySymptom("fatigue", "so tired", true);
        record.transitionTo(IntakeStatus.COLLECTING_FOLLOWUPS, Instant.parse("2024-05-01T10:02:00Z"));
        record.markAsked("fatigue.detail.duration", "How long?", QuestionCategory.DETAIL);
        record.recordAnswer("two weeks");
        record.markAsked("fatigue.detail.activity", "Worse with activity?", QuestionCategory.DETAIL);

        store.save("c1", record);
        IntakeRecord loaded = store.load("c1").orElseThrow();

        assertEquals(record.toSnapshot(), loaded.toSnapshot());
        assertEquals(List.of("fatigue.detail.duration", "fatigue.detail.activity"), List.copyOf(loaded.getAskedQuestionIds()));
        assertEquals(2, loaded.categoryTurns(QuestionCategory.DETAIL));
        assertEquals("fatigue.detail.activity", loaded.getPendingQuestionId());
        assertEquals(1, loaded.misses(IntakeField.NAME));
        assertTrue(loaded.getLastAskedFields().isEmpty());
        assertEquals(IntakeStatus.COLLECTING_FOLLOWUPS,
                repository.findByConversationId("c1").orElseThrow().getStatus());
        assertNotNull(loaded.getRevision());
    }

    @Test
    void staleWriteIsRejected() {
        store.save("c1", IntakeRecord.start("c1", Instant.now()));
        IntakeRecord first = store.load("c1").orElseThrow();
        IntakeRecord second = store.load("c1").orElseThrow();

        first.fill(IntakeField.NAME, "First");
        store.save("c1", first);
        second.fill(IntakeField.NAME, "Second");

        assertThrows(ObjectOptimisticLockingFailureException.class, () -> store.save("c1", second));
        assertEquals("First", store.load("c1").orElseThrow().getName());
    }

    @Test
    void removeDeletesRow() {
        store.save("c1", IntakeRecord.start("c1", Instant.now()));

        assertTrue(store.remove("c1"));
        assertTrue(store.load("c1").isEmpty());
        assertFalse(store.remove("c1"));
    }
}
