package com.foursite.growth.repository;

import com.foursite.growth.entity.Site;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface SiteRepository extends JpaRepository<Site, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Site s WHERE s.id = :id")
    Optional<Site> findByIdForUpdate(String id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Site s WHERE s.ownerId = :ownerId ORDER BY s.id")
    List<Site> findByOwnerIdForUpdate(String ownerId);

    List<Site> findByShowcaseEligibleTrue();

    @Modifying(clearAutomatically = true)
    @Query("UPDATE Site s SET s.pageviews = s.pageviews + :count, s.version = s.version + 1, s.updatedAt = :now"
            + " WHERE s.id = :id AND s.retired = false")
    int incrementPageviews(String id, long count, Instant now);

    /**
     * Sites whose share count passed a featuring multiple that never fired
     */
    @Query("SELECT s.id FROM Site s WHERE s.retired = false AND s.totalShares >= s.lastTriggeredMultiple + :threshold")
    List<String> findIdsWithUntriggeredCrossing(long threshold);
}
