package com.pumpd.backend.repositories.sequence;

import com.pumpd.backend.models.sequence.SequenceStep;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface SequenceStepRepository extends JpaRepository<SequenceStep, Long> {

    Optional<SequenceStep> findBySequenceTemplateIdAndStepOrder(Long sequenceTemplateId, Integer stepOrder);
}
