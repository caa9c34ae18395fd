package com.foursite.growth.entity;

/**
 * Payout status enum
 */
public enum PayoutStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
}
