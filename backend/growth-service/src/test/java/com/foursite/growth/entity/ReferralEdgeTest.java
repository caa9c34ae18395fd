package com.foursite.growth.entity;

import com.foursite.growth.exception.ConflictException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReferralEdgeTest {

    @Test
    void suspendAndReinstate() {
        ReferralEdge edge = edge();

        edge.suspend();
        assertThat(edge.getStatus()).isEqualTo(ReferralStatus.PENDING);
        assertThatThrownBy(edge::suspend).isInstanceOf(ConflictException.class);

        edge.reinstate();
        assertThat(edge.getStatus()).isEqualTo(ReferralStatus.ACTIVE);
        assertThatThrownBy(edge::reinstate).isInstanceOf(ConflictException.class);
    }

    @Test
    void churnIsTerminalAndFreesThePair() {
        ReferralEdge edge = edge();

        edge.churn();

        assertThat(edge.getStatus()).isEqualTo(ReferralStatus.CHURNED);
        assertThat(edge.getActivePairKey()).isNull();
        assertThat(edge.isLive()).isFalse();
        assertThatThrownBy(edge::churn).isInstanceOf(ConflictException.class);
        assertThatThrownBy(edge::reinstate).isInstanceOf(ConflictException.class);
    }

    @Test
    void pairKeyKeepsIdsWithSeparatorApart() {
        assertThat(ReferralEdge.pairKey("org:alice", "bob")).isNotEqualTo(ReferralEdge.pairKey("org", "alice:bob"));
        assertThat(ReferralEdge.pairKey("a:", "b")).isNotEqualTo(ReferralEdge.pairKey("a", ":b"));
        assertThat(ReferralEdge.pairKey("a", "b")).isNotEqualTo(ReferralEdge.pairKey("b", "a"));
    }

    private static ReferralEdge edge() {
        return ReferralEdge.builder()
                .referrerId("a")
                .refereeId("b")
                .activePairKey(ReferralEdge.pairKey("a", "b"))
                .build();
    }
}
