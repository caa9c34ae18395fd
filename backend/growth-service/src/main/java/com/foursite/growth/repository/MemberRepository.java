package com.foursite.growth.repository;

import com.foursite.growth.entity.Member;
import com.foursite.growth.entity.SubscriptionTier;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface MemberRepository extends JpaRepository<Member, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT m FROM Member m WHERE m.id = :id")
    Optional<Member> findByIdForUpdate(String id);

    @Query("SELECT m.id FROM Member m WHERE m.paidPro = false AND m.tier = :tier"
            + " AND (m.proExpiresAt IS NULL OR m.proExpiresAt <= :now)")
    List<String> findIdsWithExpiredGrant(SubscriptionTier tier, Instant now);
}
