package com.wagerdesk.ledger.analysis;

/**
 * Versioned thresholds for rule induction. A new version gets a new table; rules record the
 * version that produced them so a threshold change never rewrites existing rules.
 *
 * @param highEdge            wagers with predicted edge above {@code parameter} losing more than {@code limit}
 * @param supportingWinner    wagers where the supporting side won the debate losing more than {@code limit}
 * @param overconfidentBucket buckets at or above {@code parameter} percent with calibration error above {@code limit}
 */
public record ThresholdTable(
    String version,
    Threshold highEdge,
    Threshold supportingWinner,
    Threshold overconfidentBucket
) {

    /**
     * @param pattern    stable name stored on the rules this threshold produces
     * @param minSamples decided wagers (or bucket bets) required before the threshold is tested
     * @param adjustment confidence adjustment of the produced rule
     */
    public record Threshold(String pattern, double parameter, int minSamples, double limit, double adjustment) {}

    public static ThresholdTable v1() {
        return new ThresholdTable("v1",
            new Threshold("HIGH_EDGE", 0.05, 5, 0.55, -0.02),
            new Threshold("SUPPORTING_WINNER", 0.0, 5, 0.50, -0.03),
            new Threshold("OVERCONFIDENT_BUCKET", 70, 10, 0.15, -0.05));
    }
}
