package com.foursite.growth.integration;

import com.foursite.growth.dto.CommissionSummaryDto;
import com.foursite.growth.dto.LedgerEntryDto;
import com.foursite.growth.dto.PayoutDto;
import com.foursite.growth.dto.RecordConversionRequest;
import com.foursite.growth.dto.ReferralDto;
import com.foursite.growth.entity.LedgerEntryType;
import com.foursite.growth.entity.PayoutStatus;
import com.foursite.growth.entity.SettlementStatus;
import com.foursite.growth.exception.ConflictException;
import com.foursite.growth.exception.DuplicatePeriodException;
import com.foursite.growth.service.CommissionService;
import com.foursite.growth.service.PayoutService;
import com.foursite.growth.service.ReferralService;
import com.foursite.growth.support.BaseIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommissionIntegrationTest extends BaseIntegrationTest {

    private static final BigDecimal HUNDRED = new BigDecimal("100.00");

    @Autowired
    private ReferralService referralService;

    @Autowired
    private CommissionService commissionService;

    @Autowired
    private PayoutService payoutService;

    private UUID edgeId;

    @BeforeEach
    void convert() {
        ReferralDto referral = referralService.recordConversion(new RecordConversionRequest("rita", "sam",
                Instant.parse("2025-10-15T00:00:00Z")));
        edgeId = referral.getId();
    }

    @Test
    @DisplayName("First-year period pays twenty percent")
    void firstYearRate() {
        LedgerEntryDto entry = commissionService.settlePeriod(edgeId, "2026-05", HUNDRED);

        assertThat(entry.getEntryType()).isEqualTo(LedgerEntryType.ACCRUAL);
        assertThat(entry.getRateApplied()).isEqualByComparingTo("0.20");
        assertThat(entry.getPayableAmount()).isEqualByComparingTo("20.00");
        assertThat(entry.getSettlementStatus()).isEqualTo(SettlementStatus.PENDING);
    }

    @Test
    @DisplayName("A period settles once")
    void duplicatePeriod() {
        commissionService.settlePeriod(edgeId, "2026-05", HUNDRED);

        assertThatThrownBy(() -> commissionService.settlePeriod(edgeId, "2026-05", HUNDRED))
                .isInstanceOf(DuplicatePeriodException.class);
        assertThat(commissionService.getEntries("rita")).hasSize(1);
    }

    @Test
    @DisplayName("Future and malformed periods are rejected")
    void invalidPeriods() {
        assertThatThrownBy(() -> commissionService.settlePeriod(edgeId, "2026-07", HUNDRED))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> commissionService.settlePeriod(edgeId, "May 2026", HUNDRED))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> commissionService.settlePeriod(edgeId, "2026-05", new BigDecimal("-1")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Anniversary month blends both rates by time")
    void anniversaryMonthBlends() {
        clock.setInstant(Instant.parse("2026-11-02T00:00:00Z"));

        LedgerEntryDto entry = commissionService.settlePeriod(edgeId, "2026-10", HUNDRED);

        assertThat(entry.getPayableAmount()).isEqualByComparingTo("22.74");
        assertThat(commissionService.getSummary("rita").getCurrentRate()).isEqualByComparingTo("0.25");
    }

    @Test
    @DisplayName("Churned referral earns nothing more")
    void churnedReferral() {
        commissionService.settlePeriod(edgeId, "2026-04", HUNDRED);
        referralService.churn(edgeId);

        assertThatThrownBy(() -> commissionService.settlePeriod(edgeId, "2026-05", HUNDRED))
                .isInstanceOf(ConflictException.class);
        assertThat(commissionService.getSummary("rita").getPendingAmount()).isEqualByComparingTo("20.00");
    }

    @Test
    @DisplayName("Reversal offsets the accrual and can happen once")
    void reversal() {
        LedgerEntryDto accrual = commissionService.settlePeriod(edgeId, "2026-05", HUNDRED);

        LedgerEntryDto reversal = commissionService.reverseEntry(accrual.getId(), "refund");

        assertThat(reversal.getEntryType()).isEqualTo(LedgerEntryType.REVERSAL);
        assertThat(reversal.getReversedEntryId()).isEqualTo(accrual.getId());
        CommissionSummaryDto summary = commissionService.getSummary("rita");
        assertThat(summary.getTotalEarned()).isEqualByComparingTo("0");
        assertThat(summary.getPendingAmount()).isEqualByComparingTo("0");

        assertThatThrownBy(() -> commissionService.reverseEntry(accrual.getId(), "again"))
                .isInstanceOf(ConflictException.class);
        assertThatThrownBy(() -> commissionService.reverseEntry(reversal.getId(), "nested"))
                .isInstanceOf(ConflictException.class);
        assertThatThrownBy(() -> payoutService.requestPayout("rita")).isInstanceOf(ConflictException.class);
    }

    @Test
    @DisplayName("Payout claims pending commission and a failed payout releases it")
    void payoutLifecycle() {
        commissionService.settlePeriod(edgeId, "2026-04", HUNDRED);
        commissionService.settlePeriod(edgeId, "2026-05", HUNDRED);

        PayoutDto payout = payoutService.requestPayout("rita");
        assertThat(payout.getAmount()).isEqualByComparingTo("40.00");
        assertThat(payout.getEntryCount()).isEqualTo(2);
        CommissionSummaryDto claimed = commissionService.getSummary("rita");
        assertThat(claimed.getPendingAmount()).isEqualByComparingTo("0");
        assertThat(claimed.getTotalPaid()).isEqualByComparingTo("40.00");
        assertThat(claimed.getPendingPeriod()).isNull();
        assertThatThrownBy(() -> payoutService.requestPayout("rita")).isInstanceOf(ConflictException.class);

        payoutService.markProcessing(payout.getId());
        PayoutDto failed = payoutService.failPayout(payout.getId(), "bank rejected");
        assertThat(failed.getStatus()).isEqualTo(PayoutStatus.FAILED);
        CommissionSummaryDto released = commissionService.getSummary("rita");
        assertThat(released.getPendingAmount()).isEqualByComparingTo("40.00");
        assertThat(released.getPendingPeriod()).isEqualTo("2026-04");

        PayoutDto retry = payoutService.requestPayout("rita");
        PayoutDto completed = payoutService.completePayout(retry.getId(), "tx-123");
        assertThat(completed.getStatus()).isEqualTo(PayoutStatus.COMPLETED);
        assertThat(completed.getExternalReference()).isEqualTo("tx-123");
        assertThatThrownBy(() -> payoutService.failPayout(retry.getId(), "late"))
                .isInstanceOf(ConflictException.class);
        assertThat(payoutService.getPayouts("rita")).hasSize(2);
    }

    @Test
    @DisplayName("Summary reports the rate of the oldest live referral")
    void summary() {
        commissionService.settlePeriod(edgeId, "2026-05", new BigDecimal("49.99"));

        CommissionSummaryDto summary = commissionService.getSummary("rita");

        assertThat(summary.getTotalEarned()).isEqualByComparingTo("10.00");
        assertThat(summary.getCurrentRate()).isEqualByComparingTo("0.20");
        assertThat(summary.getActiveReferrals()).isEqualTo(1);
        assertThat(summary.getPendingPeriod()).isEqualTo("2026-05");
    }
}
