package com.foursite.growth.repository;

import com.foursite.growth.entity.ReferralEdge;
import com.foursite.growth.entity.ReferralStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ReferralEdgeRepository extends JpaRepository<ReferralEdge, UUID> {

    boolean existsByActivePairKey(String activePairKey);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM ReferralEdge r WHERE r.id = :id")
    Optional<ReferralEdge> findByIdForUpdate(UUID id);

    long countByReferrerIdAndStatus(String referrerId, ReferralStatus status);

    List<ReferralEdge> findByReferrerIdOrderByConvertedAtAsc(String referrerId);

    @Query("SELECT r.referrerId FROM ReferralEdge r WHERE r.status = :status"
            + " GROUP BY r.referrerId HAVING COUNT(r) >= :minimum")
    List<String> findReferrersWithAtLeast(ReferralStatus status, long minimum);
}
