package com.foursite.growth.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Published after a referral edge becomes active, on conversion or reinstatement
 */
public record ReferralConvertedEvent(UUID referralEdgeId, String referrerId, String refereeId, Instant convertedAt) {
}
