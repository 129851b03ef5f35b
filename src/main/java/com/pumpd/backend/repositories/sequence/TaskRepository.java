package com.pumpd.backend.repositories.sequence;

import com.pumpd.backend.enums.TaskStatus;
import com.pumpd.backend.models.sequence.Task;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface TaskRepository extends JpaRepository<Task, Long> {

    Optional<Task> findByIdAndOrganisationId(Long id, Long organisationId);

    List<Task> findBySequenceInstanceIdOrderBySequenceStepOrderAsc(Long sequenceInstanceId);

    List<Task> findBySequenceInstanceIdInOrderBySequenceStepOrderAsc(Collection<Long> sequenceInstanceIds);

    Optional<Task> findFirstBySequenceInstanceIdAndStatusAndSequenceStepOrderGreaterThanOrderBySequenceStepOrderAsc(
            Long sequenceInstanceId, TaskStatus status, Integer sequenceStepOrder);

    long countBySequenceInstanceIdAndSequenceStepOrderLessThanAndStatusIn(
            Long sequenceInstanceId, Integer sequenceStepOrder, Collection<TaskStatus> statuses);

    List<Task> findBySequenceInstanceIdAndStatus(Long sequenceInstanceId, TaskStatus status);

    boolean existsBySequenceInstanceIdAndStatus(Long sequenceInstanceId, TaskStatus status);
}
