package com.foursite.growth.repository;

import com.foursite.growth.entity.SharePlatform;

import java.time.Instant;

/**
 * Projection of a share event with the fields scoring needs
 */
public record ShareSample(String siteId, SharePlatform platform, Instant occurredAt, String idempotencyKey) {
}
