package com.ai.intake.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Archived copy of a completed intake, one row per conversation.
 */
@Entity
@Table(name = "patient_intake", indexes = {
    @Index(name = "idx_patient_intake_conversation_id", columnList = "conversation_id", unique = true)
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PatientIntake {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "conversation_id", nullable = false, length = 128)
    private String conversationId;

    private String name;

    private String email;

    private Integer age;

    private String gender;

    @Column(nullable = false)
    private String symptom;

    private boolean symptomMatched;

    /** Question/answer pairs as JSON, in ask order. */
    @Lob
    private String responsesJson;

    @Column(nullable = false, length = 32)
    @Builder.Default
    private String status = "completed";

    private Instant completedAt;

    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
