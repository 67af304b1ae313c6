package com.wagerdesk.common.edge;

/**
 * Discrete recommendation derived from expected value per unit stake.
 */
public enum RecommendationTier {
    NO_BET,
    LEAN,
    BET,
    STRONG_BET;

    public boolean isPositive() {
        return this != NO_BET;
    }
}
