package com.wagerdesk.common.debate;

public enum DebateWinner {
    SUPPORTING,
    OPPOSING,
    NEUTRAL
}
