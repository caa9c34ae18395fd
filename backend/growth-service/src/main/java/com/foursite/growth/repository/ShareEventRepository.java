package com.foursite.growth.repository;

import com.foursite.growth.entity.ShareEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ShareEventRepository extends JpaRepository<ShareEvent, UUID> {

    Optional<ShareEvent> findByIdempotencyKey(String idempotencyKey);

    long countBySiteId(String siteId);

    @Query("SELECT new com.foursite.growth.repository.ShareSample(e.siteId, e.platform, e.occurredAt, e.idempotencyKey)"
            + " FROM ShareEvent e WHERE e.siteId IN :siteIds AND e.occurredAt > :since AND e.occurredAt <= :until")
    List<ShareSample> findSamples(Collection<String> siteIds, Instant since, Instant until);
}
