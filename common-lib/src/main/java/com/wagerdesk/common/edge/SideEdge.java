package com.wagerdesk.common.edge;

import com.wagerdesk.common.model.Direction;

/**
 * Edge metrics for one side of a market.
 *
 * @param kellyFull   unscaled Kelly fraction, 0 when EV is not positive
 * @param kellyStake  stake after multiplier, cap and penalty
 * @param penalty     multiplier applied to edge and stake for historically weak selections (1.0 = none)
 */
public record SideEdge(
    Direction direction,
    double odds,
    double modelProbability,
    double impliedProbability,
    double edge,
    double expectedValue,
    double kellyFull,
    double kellyStake,
    double penalty,
    RecommendationTier tier
) {
    public double adjustedEdge() {
        return edge * penalty;
    }
}
