package com.wagerdesk.common.debate;

public enum ArgumentCategory {
    STATISTICAL,
    SITUATIONAL,
    MARKET_EFFICIENCY,
    METHODOLOGY,
    VARIANCE
}
