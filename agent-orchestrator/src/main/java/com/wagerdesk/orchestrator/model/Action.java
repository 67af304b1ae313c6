package com.wagerdesk.orchestrator.model;

/**
 * Final recommendation tag of an evaluation.
 */
public enum Action {
    BET,
    LEAN_BET,
    /** Negative edge on the requested selection; the other side may be worth a look. */
    FADE,
    NO_BET,
    /** No line was supplied or quoted, so no edge could be computed. */
    NEED_LINE,
    /** Context could not be assembled; nothing to recommend. */
    NO_RECOMMENDATION;

    public boolean isActionable() {
        return this == BET || this == LEAN_BET;
    }
}
