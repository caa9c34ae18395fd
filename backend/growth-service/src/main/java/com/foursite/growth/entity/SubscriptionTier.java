package com.foursite.growth.entity;

/**
 * Subscription tier of a member, mirrored onto each of the member's sites
 */
public enum SubscriptionTier {
    FREE,
    PRO
}
