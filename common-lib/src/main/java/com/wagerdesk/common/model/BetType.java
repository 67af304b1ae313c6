package com.wagerdesk.common.model;

/**
 * Market a wager is placed on.
 */
public enum BetType {
    SPREAD,
    TOTAL,
    PLAYER_PROP,
    MONEYLINE
}
