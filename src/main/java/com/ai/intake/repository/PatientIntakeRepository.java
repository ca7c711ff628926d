package com.ai.intake.repository;

import com.ai.intake.entity.PatientIntake;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PatientIntakeRepository extends JpaRepository<PatientIntake, Long> {

    Optional<PatientIntake> findByConversationId(String conversationId);

    boolean existsByConversationId(String conversationId);

    @Query("select p.symptom, count(p) from PatientIntake p group by p.symptom order by count(p) desc")
    List<Object[]> countBySymptom();
}
