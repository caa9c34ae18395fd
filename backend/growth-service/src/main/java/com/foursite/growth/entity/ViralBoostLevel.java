package com.foursite.growth.entity;

/**
 * Boost levels reached by a site's cumulative external shares
 */
public enum ViralBoostLevel {
    NONE(0),
    BRONZE(1),
    SILVER(6),
    GOLD(16),
    PLATINUM(51),
    VIRAL(101);

    private final long minShares;

    ViralBoostLevel(long minShares) {
        this.minShares = minShares;
    }

    public long getMinShares() {
        return minShares;
    }

    /**
     * Determine level based on total external shares
     */
    public static ViralBoostLevel fromShareCount(long shares) {
        if (shares >= VIRAL.minShares)
            return VIRAL;
        if (shares >= PLATINUM.minShares)
            return PLATINUM;
        if (shares >= GOLD.minShares)
            return GOLD;
        if (shares >= SILVER.minShares)
            return SILVER;
        if (shares >= BRONZE.minShares)
            return BRONZE;
        return NONE;
    }

    /**
     * Next level up, or null at the top
     */
    public ViralBoostLevel next() {
        return switch (this) {
            case NONE -> BRONZE;
            case BRONZE -> SILVER;
            case SILVER -> GOLD;
            case GOLD -> PLATINUM;
            case PLATINUM -> VIRAL;
            case VIRAL -> null;
        };
    }

    /**
     * Get shares needed to reach next level
     */
    public long getSharesToNextLevel(long currentShares) {
        ViralBoostLevel nextLevel = next();
        if (nextLevel == null)
            return 0;
        return Math.max(0, nextLevel.minShares - currentShares);
    }
}
