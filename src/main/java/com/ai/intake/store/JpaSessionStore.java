package com.ai.intake.store;

import com.ai.intake.conversation.IntakeRecord;
import com.ai.intake.entity.IntakeSessionEntity;
import com.ai.intake.repository.IntakeSessionRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Objects;
import java.util.Optional;

/**
 * Keeps each live record as JSON in {@code intake_session}. A save carrying a stale
 * revision fails with an optimistic-locking exception instead of overwriting.
 */
@Component
@ConditionalOnProperty(name = "intake.session-store", havingValue = "jpa")
public class JpaSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(JpaSessionStore.class);

    private final IntakeSessionRepository repository;
    private final ObjectMapper objectMapper;

    public JpaSessionStore(IntakeSessionRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<IntakeRecord> load(String conversationId) {
        return repository.findByConversationId(conversationId).map(this::toRecord);
    }

    @Override
    @Transactional
    public void save(String conversationId, IntakeRecord record) {
        IntakeSessionEntity entity = repository.findByConversationId(conversationId).orElse(null);
        if (entity == null) {
            entity = IntakeSessionEntity.builder().conversationId(conversationId).build();
        } else if (!Objects.equals(entity.getVersion(), record.getRevision())) {
            log.warn("[{}] stale write rejected (stored={}, loaded={})",
                    conversationId, entity.getVersion(), record.getRevision());
            throw new ObjectOptimisticLockingFailureException(IntakeSessionEntity.class, entity.getId());
        }
        entity.setStatus(record.getStatus());
        entity.setStateJson(toJson(record));
        IntakeSessionEntity saved = repository.saveAndFlush(entity);
        record.setRevision(saved.getVersion());
        log.debug("[{}] saved ({}, version {})", conversationId, record.getStatus(), saved.getVersion());
    }

    @Override
    @Transactional
    public boolean remove(String conversationId) {
        return repository.deleteByConversationId(conversationId) > 0;
    }

    private IntakeRecord toRecord(IntakeSessionEntity entity) {
        try {
            IntakeRecord record = objectMapper.readValue(entity.getStateJson(), IntakeRecord.class);
            record.setRevision(entity.getVersion());
            return record;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt intake state for conversation " + entity.getConversationId(), e);
        }
    }

    private String toJson(IntakeRecord record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize intake state for conversation "
                    + record.getConversationId(), e);
        }
    }
}
