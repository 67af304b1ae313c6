package com.wagerdesk.common.model;

/**
 * Selection taken within a market.
 *
 * <p>{@link #OVER}/{@link #UNDER} apply to totals and player props. {@link #SIDE_A} and
 * {@link #SIDE_B} apply to spread and moneyline markets and refer to the first and second
 * side of the evaluation request.
 */
public enum Direction {
    OVER,
    UNDER,
    SIDE_A,
    SIDE_B;

    public boolean isTotalSide() {
        return this == OVER || this == UNDER;
    }

    public Direction opposite() {
        return switch (this) {
            case OVER   -> UNDER;
            case UNDER  -> OVER;
            case SIDE_A -> SIDE_B;
            case SIDE_B -> SIDE_A;
        };
    }
}
