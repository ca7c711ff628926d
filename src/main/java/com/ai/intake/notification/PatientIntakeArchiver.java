package com.ai.intake.notification;

import com.ai.intake.conversation.AnsweredQuestion;
import com.ai.intake.conversation.IntakeSnapshot;
import com.ai.intake.entity.PatientIntake;
import com.ai.intake.repository.PatientIntakeRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stores every completed intake in {@code patient_intake}.
 */
@Component
public class PatientIntakeArchiver implements IntakeCompletionListener {

    private static final Logger log = LoggerFactory.getLogger(PatientIntakeArchiver.class);

    private final PatientIntakeRepository repository;
    private final ObjectMapper objectMapper;

    public PatientIntakeArchiver(PatientIntakeRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional
    public void onIntakeCompleted(IntakeSnapshot snapshot) {
        if (repository.existsByConversationId(snapshot.conversationId())) {
            log.info("[{}] Intake already archived", snapshot.conversationId());
            return;
        }
        PatientIntake row = PatientIntake.builder()
                .conversationId(snapshot.conversationId())
                .name(snapshot.name())
                .email(snapshot.email())
                .age(snapshot.age())
                .gender(snapshot.gender())
                .symptom(snapshot.symptom())
                .symptomMatched(snapshot.symptomMatched())
                .responsesJson(responsesJson(snapshot.answers()))
                .completedAt(snapshot.completedAt())
                .build();
        repository.save(row);
        log.info("[{}] Intake archived: symptom={} answers={}", snapshot.conversationId(),
                snapshot.symptom(), snapshot.answers().size());
    }

    private String responsesJson(List<AnsweredQuestion> answers) {
        List<Map<String, String>> rows = new ArrayList<>();
        for (AnsweredQuestion a : answers) {
            Map<String, String> row = new LinkedHashMap<>();
            row.put("questionId", a.questionId());
            row.put("question", a.question());
            row.put("category", a.category().name());
            row.put("answer", a.answer());
            rows.add(row);
        }
        try {
            return objectMapper.writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize intake answers", e);
        }
    }
}
