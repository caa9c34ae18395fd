package com.foursite.growth.entity;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class MemberTest {

    private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

    @Test
    void grantMakesMemberProUntilItExpires() {
        Member member = Member.builder().id("u").build();
        member.extendProGrant(NOW.plusSeconds(3600));

        assertThat(member.refreshTier(NOW)).isTrue();
        assertThat(member.getTier()).isEqualTo(SubscriptionTier.PRO);
        assertThat(member.refreshTier(NOW.plusSeconds(3600))).isTrue();
        assertThat(member.getTier()).isEqualTo(SubscriptionTier.FREE);
    }

    @Test
    void grantNeverShortens() {
        Member member = Member.builder().id("u").build();
        member.extendProGrant(NOW.plusSeconds(7200));
        member.extendProGrant(NOW.plusSeconds(60));

        assertThat(member.getProExpiresAt()).isEqualTo(NOW.plusSeconds(7200));
    }

    @Test
    void paidProOutlivesAnExpiredGrant() {
        Member member = Member.builder().id("u").paidPro(true).proExpiresAt(NOW.minusSeconds(1)).build();

        assertThat(member.effectiveTier(NOW)).isEqualTo(SubscriptionTier.PRO);
    }
}
