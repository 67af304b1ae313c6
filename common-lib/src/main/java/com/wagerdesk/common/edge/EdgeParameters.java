package com.wagerdesk.common.edge;

/**
 * Sizing and tiering constants for {@link EdgeCalculator}.
 *
 * @param kellyMultiplier   fraction of full Kelly actually staked
 * @param kellyCap          absolute cap on the stake, as a share of bankroll
 * @param betThreshold      EV above which the tier is at least BET
 * @param strongThreshold   EV above which the tier is STRONG_BET
 * @param overPenalty       multiplier on edge and stake of OVER selections
 * @param defaultOdds       price assumed for totals, spreads and moneylines when none is quoted
 * @param defaultPropOdds   price assumed for player props when none is quoted
 */
public record EdgeParameters(
    double kellyMultiplier,
    double kellyCap,
    double betThreshold,
    double strongThreshold,
    double overPenalty,
    double defaultOdds,
    double defaultPropOdds
) {
    public EdgeParameters {
        if (kellyMultiplier <= 0 || kellyMultiplier > 1) {
            throw new IllegalArgumentException("kellyMultiplier must be in (0, 1]: " + kellyMultiplier);
        }
        if (strongThreshold < betThreshold) {
            throw new IllegalArgumentException("strongThreshold below betThreshold");
        }
    }

    public static EdgeParameters defaults() {
        return new EdgeParameters(0.25, 0.05, 0.03, 0.06, 0.5, 1.91, 1.87);
    }
}
