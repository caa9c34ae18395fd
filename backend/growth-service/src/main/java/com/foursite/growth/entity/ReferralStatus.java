package com.foursite.growth.entity;

/**
 * Referral edge status. CHURNED is terminal.
 */
public enum ReferralStatus {
    PENDING,
    ACTIVE,
    CHURNED
}
