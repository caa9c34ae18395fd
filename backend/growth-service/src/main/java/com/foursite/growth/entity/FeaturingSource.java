package com.foursite.growth.entity;

/**
 * What caused an auto-featuring window to be granted
 */
public enum FeaturingSource {
    NOTIFICATION,
    RECONCILIATION
}
