package com.ai.intake.repository;

import com.ai.intake.entity.IntakeSessionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface IntakeSessionRepository extends JpaRepository<IntakeSessionEntity, Long> {

    Optional<IntakeSessionEntity> findByConversationId(String conversationId);

    long deleteByConversationId(String conversationId);
}
