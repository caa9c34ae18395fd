package com.foursite.growth.entity;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ViralBoostLevelTest {

    @Test
    void levelFollowsShareCount() {
        assertThat(ViralBoostLevel.fromShareCount(0)).isEqualTo(ViralBoostLevel.NONE);
        assertThat(ViralBoostLevel.fromShareCount(1)).isEqualTo(ViralBoostLevel.BRONZE);
        assertThat(ViralBoostLevel.fromShareCount(5)).isEqualTo(ViralBoostLevel.BRONZE);
        assertThat(ViralBoostLevel.fromShareCount(6)).isEqualTo(ViralBoostLevel.SILVER);
        assertThat(ViralBoostLevel.fromShareCount(16)).isEqualTo(ViralBoostLevel.GOLD);
        assertThat(ViralBoostLevel.fromShareCount(100)).isEqualTo(ViralBoostLevel.PLATINUM);
        assertThat(ViralBoostLevel.fromShareCount(101)).isEqualTo(ViralBoostLevel.VIRAL);
    }

    @Test
    void sharesToNextLevel() {
        assertThat(ViralBoostLevel.BRONZE.getSharesToNextLevel(3)).isEqualTo(3);
        assertThat(ViralBoostLevel.VIRAL.getSharesToNextLevel(500)).isZero();
        assertThat(ViralBoostLevel.VIRAL.next()).isNull();
    }
}
