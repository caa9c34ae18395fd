package com.foursite.growth.entity;

/**
 * Settlement status of a commission ledger entry
 */
public enum SettlementStatus {
    PENDING,
    PAID
}
