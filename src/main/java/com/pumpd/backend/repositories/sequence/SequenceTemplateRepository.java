package com.pumpd.backend.repositories.sequence;

import com.pumpd.backend.models.sequence.SequenceTemplate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Repository
public interface SequenceTemplateRepository extends JpaRepository<SequenceTemplate, Long> {

    @Query("SELECT DISTINCT t FROM SequenceTemplate t LEFT JOIN FETCH t.steps " +
            "WHERE t.id = :id AND t.organisationId = :organisationId")
    Optional<SequenceTemplate> findWithStepsByIdAndOrganisationId(@Param("id") Long id,
                                                                  @Param("organisationId") Long organisationId);

    @Query("SELECT DISTINCT t FROM SequenceTemplate t LEFT JOIN FETCH t.steps " +
            "WHERE t.organisationId = :organisationId ORDER BY t.createdAt DESC")
    List<SequenceTemplate> findAllWithStepsByOrganisationId(@Param("organisationId") Long organisationId);

    /**
     * Atomic increment, safe against concurrent starts of the same template.
     */
    @Modifying
    @Transactional
    @Query("UPDATE SequenceTemplate t SET t.usageCount = t.usageCount + :delta WHERE t.id = :id")
    int incrementUsageCount(@Param("id") Long id, @Param("delta") int delta);
}
