package com.foursite.growth.entity;

public enum LedgerEntryType {
    ACCRUAL,
    REVERSAL
}
