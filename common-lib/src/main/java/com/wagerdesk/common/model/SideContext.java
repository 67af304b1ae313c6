package com.wagerdesk.common.model;

import java.util.Map;

/**
 * Everything known about one side (team or player) of a request.
 * Nullable components are lookups that returned "not found".
 */
public record SideContext(
    String entityId,
    String name,
    boolean home,
    Map<Window, WindowAggregate> windows,
    RestProfile rest,
    VenueSplit venue,
    OpponentStrength strength,
    OverUnderRecord overUnder
) {
    public SideContext {
        windows = windows == null ? Map.of() : Map.copyOf(windows);
    }

    public boolean hasWindows() {
        return !windows.isEmpty();
    }

    /** Games in the largest window available, 0 when none. */
    public int sampleGames() {
        for (Window w : Window.values()) {
            WindowAggregate agg = windows.get(w);
            if (agg != null) return agg.games();
        }
        return 0;
    }
}
