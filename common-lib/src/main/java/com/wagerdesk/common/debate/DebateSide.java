package com.wagerdesk.common.debate;

public enum DebateSide {
    SUPPORTING,
    OPPOSING
}
