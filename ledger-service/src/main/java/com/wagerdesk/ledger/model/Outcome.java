package com.wagerdesk.ledger.model;

/**
 * Realized result of a wager against its line.
 */
public enum Outcome {
    WIN,
    LOSS,
    PUSH;

    public int winCount() {
        return this == WIN ? 1 : 0;
    }

    public int lossCount() {
        return this == LOSS ? 1 : 0;
    }

    public int pushCount() {
        return this == PUSH ? 1 : 0;
    }
}
