package com.foursite.growth.integration;

import com.foursite.growth.dto.MemberDto;
import com.foursite.growth.dto.MilestoneProgressDto;
import com.foursite.growth.dto.RecordConversionRequest;
import com.foursite.growth.dto.ReferralDto;
import com.foursite.growth.entity.ReferralStatus;
import com.foursite.growth.entity.SubscriptionTier;
import com.foursite.growth.exception.DuplicateConversionException;
import com.foursite.growth.service.MemberService;
import com.foursite.growth.service.MilestoneService;
import com.foursite.growth.service.ReferralService;
import com.foursite.growth.support.BaseIntegrationTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MilestoneIntegrationTest extends BaseIntegrationTest {

    private static final Instant GRANT_END = Instant.parse("2027-06-15T12:00:00Z");

    @Autowired
    private ReferralService referralService;

    @Autowired
    private MemberService memberService;

    @Autowired
    private MilestoneService milestoneService;

    @Test
    @DisplayName("Tenth active referral grants twelve months of pro exactly once")
    void tenthReferralGrantsPro() {
        registerSite("alice-site", "alice", SubscriptionTier.FREE);
        for (int i = 1; i <= 9; i++) {
            convert("alice", "friend-" + i);
        }
        assertThat(milestoneRecordRepository.count()).isZero();
        assertThat(milestoneService.getProgress("alice")).singleElement()
                .extracting(MilestoneProgressDto::getReferralsRemaining).isEqualTo(1L);

        convert("alice", "friend-10");
        convert("alice", "friend-11");

        assertThat(milestoneService.getMilestoneStatus("alice")).singleElement()
                .satisfies(record -> {
                    assertThat(record.getMilestoneType()).isEqualTo("10-referrals-free-pro");
                    assertThat(record.getQualifyingCount()).isEqualTo(10);
                    assertThat(record.getFiredAt()).isEqualTo(START);
                });
        MemberDto alice = memberService.getMember("alice");
        assertThat(alice.getTier()).isEqualTo(SubscriptionTier.PRO);
        assertThat(alice.getProExpiresAt()).isEqualTo(GRANT_END);
        assertThat(siteService.getSiteStats("alice-site").isShowcaseEligible()).isTrue();
    }

    @Test
    @DisplayName("Dropping below and climbing back does not grant again")
    void suspendAndReinstateDoesNotRegrant() {
        List<ReferralDto> referrals = new ArrayList<>();
        for (int i = 1; i <= 10; i++) {
            referrals.add(convert("bob", "friend-" + i));
        }
        assertThat(milestoneRecordRepository.count()).isEqualTo(1);

        referralService.suspend(referrals.get(0).getId());
        assertThat(referralEdgeRepository.countByReferrerIdAndStatus("bob", ReferralStatus.ACTIVE)).isEqualTo(9);
        referralService.reinstate(referrals.get(0).getId());

        assertThat(milestoneRecordRepository.count()).isEqualTo(1);
        assertThat(memberService.getMember("bob").getProExpiresAt()).isEqualTo(GRANT_END);
    }

    @Test
    @DisplayName("Reinstating the tenth referral reaches the milestone")
    void reinstateCanReachMilestone() {
        List<ReferralDto> referrals = new ArrayList<>();
        for (int i = 1; i <= 9; i++) {
            referrals.add(convert("carol", "friend-" + i));
        }
        referralService.suspend(referrals.get(3).getId());
        convert("carol", "friend-10");
        assertThat(milestoneRecordRepository.count()).isZero();

        referralService.reinstate(referrals.get(3).getId());

        assertThat(milestoneService.getMilestoneStatus("carol")).hasSize(1);
    }

    @Test
    @DisplayName("Concurrent conversions crossing the threshold grant one reward")
    void concurrentConversions() throws Exception {
        int threads = 10;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<ReferralDto>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                String referee = "racer-" + i;
                futures.add(executor.submit(() -> {
                    start.await();
                    return convert("dave", referee);
                }));
            }
            start.countDown();
            for (Future<ReferralDto> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(referralEdgeRepository.countByReferrerIdAndStatus("dave", ReferralStatus.ACTIVE)).isEqualTo(threads);
        assertThat(milestoneRecordRepository.count()).isEqualTo(1);
        assertThat(memberService.getMember("dave").getTier()).isEqualTo(SubscriptionTier.PRO);
    }

    @Test
    @DisplayName("A pair converts once until the referral churns")
    void duplicateConversion() {
        ReferralDto first = convert("erin", "frank");

        assertThatThrownBy(() -> convert("erin", "frank")).isInstanceOf(DuplicateConversionException.class);

        referralService.churn(first.getId());
        ReferralDto second = convert("erin", "frank");

        assertThat(second.getId()).isNotEqualTo(first.getId());
        assertThat(referralService.getReferrals("erin")).extracting(ReferralDto::getStatus)
                .containsExactlyInAnyOrder(ReferralStatus.CHURNED, ReferralStatus.ACTIVE);
    }

    @Test
    @DisplayName("Self-referral is rejected")
    void selfReferral() {
        assertThatThrownBy(() -> convert("gina", "gina")).isInstanceOf(IllegalArgumentException.class);
        assertThat(memberRepository.count()).isZero();
    }

    private ReferralDto convert(String referrerId, String refereeId) {
        return referralService.recordConversion(new RecordConversionRequest(referrerId, refereeId, null));
    }
}
