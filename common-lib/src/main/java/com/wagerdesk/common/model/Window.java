package com.wagerdesk.common.model;

/**
 * Trailing performance windows served by the warehouse.
 */
public enum Window {
    SEASON(82),
    L15(15),
    L10(10),
    L5(5);

    private final int games;

    Window(int games) {
        this.games = games;
    }

    /** Nominal game count of the window; {@link #SEASON} uses a full regular season. */
    public int games() {
        return games;
    }
}
