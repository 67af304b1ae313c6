package com.wagerdesk.common.model;

import java.util.List;

/**
 * Point estimate for the market of a request, decomposed into named adjustments.
 *
 * <p>For totals {@code pointEstimate} is the projected combined score and {@code meanA}/{@code meanB}
 * the per-side expected scores fed to the simulator. For spreads it is side A's projected margin.
 * For player props it is the projected stat value and {@code prop} carries the simulator inputs.
 *
 * @param line                line the projection is compared to; {@code null} when none was provided
 * @param insufficientSample  true when either side had fewer games than the sample threshold
 */
public record Projection(
    BetType betType,
    double pointEstimate,
    double meanA,
    double meanB,
    double stdA,
    double stdB,
    Double line,
    List<Adjustment> adjustments,
    List<String> inputsUsed,
    PropDistribution prop,
    boolean insufficientSample
) {
    public Projection {
        adjustments = adjustments == null ? List.of() : List.copyOf(adjustments);
        inputsUsed  = inputsUsed == null ? List.of() : List.copyOf(inputsUsed);
    }

    public boolean hasLine() {
        return line != null;
    }

    /**
     * Signed distance from the line in favour of OVER (totals, props) or side A covering
     * (spreads, where the line is side A's handicap). 0 when no line is set.
     */
    public double marginFromLine() {
        if (line == null) return 0.0;
        return betType == BetType.SPREAD ? pointEstimate + line : pointEstimate - line;
    }

    public double adjustmentTotal() {
        return adjustments.stream().mapToDouble(Adjustment::value).sum();
    }
}
