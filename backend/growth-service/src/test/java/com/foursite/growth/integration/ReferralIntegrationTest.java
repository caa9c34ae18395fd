package com.foursite.growth.integration;

import com.foursite.growth.dto.RecordConversionRequest;
import com.foursite.growth.dto.ReferralDto;
import com.foursite.growth.entity.Member;
import com.foursite.growth.entity.ReferralEdge;
import com.foursite.growth.entity.ReferralStatus;
import com.foursite.growth.entity.SubscriptionTier;
import com.foursite.growth.exception.DuplicateConversionException;
import com.foursite.growth.service.ReferralService;
import com.foursite.growth.support.BaseIntegrationTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReferralIntegrationTest extends BaseIntegrationTest {

    @Autowired
    private ReferralService referralService;

    @Test
    @DisplayName("Ids containing the separator are distinct pairs")
    void separatorInIdsDoesNotCollide() {
        ReferralDto first = convert("org:alice", "bob");
        ReferralDto second = convert("org", "alice:bob");

        assertThat(first.getId()).isNotEqualTo(second.getId());
        assertThat(referralEdgeRepository.count()).isEqualTo(2);
        assertThatThrownBy(() -> convert("org:alice", "bob"))
                .isInstanceOf(DuplicateConversionException.class);
        assertThatThrownBy(() -> convert("org", "alice:bob"))
                .isInstanceOf(DuplicateConversionException.class);
    }

    @Test
    @DisplayName("Created and updated timestamps come from the engine clock")
    void timestampsFollowEngineClock() {
        ReferralDto referral = convert("alice", "bob");
        ReferralEdge created = referralEdgeRepository.findById(referral.getId()).orElseThrow();
        assertThat(created.getCreatedAt()).isEqualTo(START);

        clock.advance(Duration.ofDays(3));
        referralService.suspend(referral.getId());

        ReferralEdge suspended = referralEdgeRepository.findById(referral.getId()).orElseThrow();
        assertThat(suspended.getStatus()).isEqualTo(ReferralStatus.PENDING);
        assertThat(suspended.getCreatedAt()).isEqualTo(START);
        assertThat(suspended.getUpdatedAt()).isEqualTo(START.plus(Duration.ofDays(3)));

        Member referee = memberRepository.findById("bob").orElseThrow();
        assertThat(referee.getCreatedAt()).isEqualTo(START);
    }

    @Test
    @DisplayName("Site registration is stamped with the engine clock")
    void siteTimestampsFollowEngineClock() {
        Instant registeredAt = START.plus(Duration.ofHours(5));
        clock.setInstant(registeredAt);

        registerSite("alice-site", "alice", SubscriptionTier.FREE);

        assertThat(siteRepository.findById("alice-site").orElseThrow().getCreatedAt()).isEqualTo(registeredAt);
    }

    private ReferralDto convert(String referrerId, String refereeId) {
        return referralService.recordConversion(new RecordConversionRequest(referrerId, refereeId, null));
    }
}
