package com.foursite.growth.repository;

import com.foursite.growth.entity.CommissionLedgerEntry;
import com.foursite.growth.entity.LedgerEntryType;
import com.foursite.growth.entity.SettlementStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CommissionLedgerEntryRepository extends JpaRepository<CommissionLedgerEntry, UUID> {

    boolean existsByReferralEdgeIdAndPeriodAndEntryType(UUID referralEdgeId, String period, LedgerEntryType entryType);

    boolean existsByReversedEntryId(UUID reversedEntryId);

    List<CommissionLedgerEntry> findByReferrerIdOrderByCreatedAtDesc(String referrerId);

    List<CommissionLedgerEntry> findByPayoutId(UUID payoutId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM CommissionLedgerEntry e WHERE e.referrerId = :referrerId"
            + " AND e.settlementStatus = :status ORDER BY e.period, e.createdAt")
    List<CommissionLedgerEntry> findByReferrerIdAndStatusForUpdate(String referrerId, SettlementStatus status);

    /** Null when the referrer has no entries of the type */
    @Query("SELECT SUM(e.payableAmount) FROM CommissionLedgerEntry e"
            + " WHERE e.referrerId = :referrerId AND e.entryType = :entryType")
    BigDecimal sumByReferrerIdAndType(String referrerId, LedgerEntryType entryType);

    @Query("SELECT SUM(e.payableAmount) FROM CommissionLedgerEntry e"
            + " WHERE e.referrerId = :referrerId AND e.entryType = :entryType AND e.settlementStatus = :status")
    BigDecimal sumByReferrerIdAndTypeAndStatus(String referrerId, LedgerEntryType entryType, SettlementStatus status);

    @Query("SELECT MIN(e.period) FROM CommissionLedgerEntry e"
            + " WHERE e.referrerId = :referrerId AND e.settlementStatus = :status")
    Optional<String> findEarliestPeriod(String referrerId, SettlementStatus status);
}
