package com.z254.horizon.domain.model;

/**
 * Kind of challenge an adaptation responds to.
 */
public enum ChallengeType {
    HEALTH,
    EFFICIENCY,
    INNOVATION,
    MARKET_SHIFT,
    TECHNOLOGY_DISRUPTION,
    COMPETITIVE_THREAT,
    VARIETY_EXPLOSION
}
