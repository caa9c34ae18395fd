package com.foursite.growth.entity;

/**
 * External platforms a site can be shared to
 */
public enum SharePlatform {
    TWITTER,
    LINKEDIN,
    FACEBOOK,
    REDDIT,
    HACKERNEWS,
    EMAIL,
    DISCORD,
    SLACK,
    COPY_LINK
}
