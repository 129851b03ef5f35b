package com.pumpd.backend.repositories.sequence;

import com.pumpd.backend.models.sequence.MessageTemplate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface MessageTemplateRepository extends JpaRepository<MessageTemplate, Long> {

    List<MessageTemplate> findByOrganisationIdAndIdIn(Long organisationId, Collection<Long> ids);
}
