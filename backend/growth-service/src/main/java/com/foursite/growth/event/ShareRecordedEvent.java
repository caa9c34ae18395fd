package com.foursite.growth.event;

import com.foursite.growth.entity.SharePlatform;

import java.time.Instant;

/**
 * Published after a share commits.
 *
 * @param crossedMultiple the featuring multiple this share reached, or null
 */
public record ShareRecordedEvent(String siteId, SharePlatform platform, long newTotal, Long crossedMultiple,
                                 Instant occurredAt) {
}
