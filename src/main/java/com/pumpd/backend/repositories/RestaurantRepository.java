package com.pumpd.backend.repositories;

import com.pumpd.backend.models.Restaurant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface RestaurantRepository extends JpaRepository<Restaurant, Long> {

    Optional<Restaurant> findByIdAndOrganisationId(Long id, Long organisationId);

    // One round trip for a whole bulk start
    List<Restaurant> findByOrganisationIdAndIdIn(Long organisationId, Collection<Long> ids);
}
