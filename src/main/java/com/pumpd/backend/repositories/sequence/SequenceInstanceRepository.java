package com.pumpd.backend.repositories.sequence;

import com.pumpd.backend.models.sequence.SequenceInstance;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface SequenceInstanceRepository extends JpaRepository<SequenceInstance, Long> {

    Optional<SequenceInstance> findByIdAndOrganisationId(Long id, Long organisationId);

    /**
     * Row-locked read for state changes. Concurrent transitions of the same instance queue here
     * and the later one sees the state the earlier one committed.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM SequenceInstance i WHERE i.id = :id AND i.organisationId = :organisationId")
    Optional<SequenceInstance> findForUpdate(@Param("id") Long id, @Param("organisationId") Long organisationId);

    List<SequenceInstance> findByOrganisationIdOrderByCreatedAtDesc(Long organisationId);

    List<SequenceInstance> findByOrganisationIdAndRestaurantIdInOrderByCreatedAtDesc(Long organisationId,
                                                                                     Collection<Long> restaurantIds);
}
