package com.wagerdesk.common.debate;

/**
 * One claim made for or against the selection.
 *
 * @param rule      name of the catalog rule that produced it
 * @param strength  in [0, 1]
 */
public record Argument(
    String rule,
    DebateSide side,
    ArgumentCategory category,
    double strength,
    String claim,
    String rationale
) {
    public Argument {
        if (Double.isNaN(strength)) {
            throw new IllegalArgumentException("strength is NaN for rule " + rule);
        }
        strength = Math.max(0.0, Math.min(1.0, strength));
    }
}
