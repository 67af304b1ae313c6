package com.wagerdesk.common.edge;

import com.wagerdesk.common.model.Direction;

/**
 * Expected value and fractional-Kelly sizing from model probabilities and decimal prices.
 *
 * <pre>
 *   implied  = 1 / odds
 *   edge     = p − implied
 *   EV       = p·(odds − 1) − (1 − p)
 *   kelly    = (b·p − q) / b     b = odds − 1, q = 1 − p; 0 when EV ≤ 0
 *   stake    = min(kelly · multiplier, cap) · penalty
 *
 *   tier:  EV > strong → STRONG_BET
 *          EV > bet    → BET
 *          EV > 0      → LEAN
 *          otherwise   → NO_BET
 * </pre>
 *
 * <p>All numbers stay on the result next to the tier so the thresholds can be checked.
 */
public final class EdgeCalculator {

    private EdgeCalculator() {}

    /**
     * Evaluates both sides of a two-way market.
     *
     * @param first        OVER or SIDE_A
     * @param pFirst       model probability that {@code first} wins
     * @param pSecond      model probability that the opposite side wins
     */
    public static EdgeResult evaluate(Direction first, double pFirst, double oddsFirst,
                                      double pSecond, double oddsSecond, EdgeParameters params) {
        SideEdge a = side(first, pFirst, oddsFirst, params);
        SideEdge b = side(first.opposite(), pSecond, oddsSecond, params);

        SideEdge best = a.expectedValue() >= b.expectedValue() ? a : b;
        if (best.expectedValue() <= 0) {
            return new EdgeResult(a, b, null, RecommendationTier.NO_BET);
        }
        return new EdgeResult(a, b, best.direction(), best.tier());
    }

    public static SideEdge side(Direction direction, double p, double odds, EdgeParameters params) {
        double implied = OddsConverter.impliedProbability(odds);
        double ev = expectedValue(p, odds);
        double kelly = ev > 0 ? kellyFraction(p, odds) : 0.0;
        double penalty = direction == Direction.OVER ? params.overPenalty() : 1.0;
        double stake = Math.min(kelly * params.kellyMultiplier(), params.kellyCap()) * penalty;
        return new SideEdge(direction, odds, p, implied, p - implied, ev, kelly, stake, penalty,
                            tier(ev, params));
    }

    public static double expectedValue(double p, double odds) {
        return p * (odds - 1.0) - (1.0 - p);
    }

    /** Full Kelly fraction, floored at zero. */
    public static double kellyFraction(double p, double odds) {
        double b = odds - 1.0;
        if (b <= 0) return 0.0;
        return Math.max(0.0, (b * p - (1.0 - p)) / b);
    }

    public static RecommendationTier tier(double ev, EdgeParameters params) {
        if (ev > params.strongThreshold()) return RecommendationTier.STRONG_BET;
        if (ev > params.betThreshold())    return RecommendationTier.BET;
        if (ev > 0)                        return RecommendationTier.LEAN;
        return RecommendationTier.NO_BET;
    }
}
