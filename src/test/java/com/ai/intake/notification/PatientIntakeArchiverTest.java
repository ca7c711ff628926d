package com.ai.intake.notification;

import com.ai.intake.entity.PatientIntake;
import com.ai.intake.repository.PatientIntakeRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class PatientIntakeArchiverTest {

    @Configuration
    @EntityScan(basePackageClasses = PatientIntake.class)
    @EnableJpaRepositories(basePackageClasses = PatientIntakeRepository.class)
    static class JpaConfig {
    }

    @Autowired
    private PatientIntakeRepository repository;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private PatientIntakeArchiver archiver;

    @BeforeEach
    void setUp() {
        archiver = new PatientIntakeArchiver(repository, objectMapper);
    }

    @Test
    void storesCompletedIntake() throws Exception {
        archiver.onIntakeCompleted(SnapshotFixtures.completed("c1"));

        PatientIntake row = repository.findByConversationId("c1").orElseThrow();
        assertEquals("Ann Lee", row.getName());
        assertEquals(52, row.getAge());
        assertEquals("chest pain", row.getSymptom());
        assertTrue(row.isSymptomMatched());
        assertEquals("completed", row.getStatus());

        JsonNode answers = objectMapper.readTree(row.getResponsesJson());
        assertEquals(2, answers.size());
        assertEquals("chest_pain.detail.onset", answers.get(0).path("questionId").asText());
        assertEquals("RED_FLAG", answers.get(1).path("category").asText());
    }

    @Test
    void secondDeliveryIsIgnored() {
        archiver.onIntakeCompleted(SnapshotFixtures.completed("c1"));
        archiver.onIntakeCompleted(SnapshotFixtures.completed("c1"));

        assertEquals(1, repository.count());
    }

    @Test
    void countsBySymptom() {
        archiver.onIntakeCompleted(SnapshotFixtures.completed("c1"));
        archiver.onIntakeCompleted(SnapshotFixtures.completed("c2"));

        List<Object[]> stats = repository.countBySymptom();
        assertEquals(1, stats.size());
        assertEquals("chest pain", stats.get(0)[0]);
        assertEquals(2L, ((Number) stats.get(0)[1]).longValue());
    }
}
