package com.wagerdesk.common.simulation;

/**
 * Tunable constants of the scoring simulation.
 *
 * <p>The correlation and skewness defaults come from observed home/away score pairs; the naive
 * 0.5 correlation overstates how often both sides run hot together and makes probabilities
 * overconfident.
 *
 * @param draws               number of paired samples
 * @param correlation         correlation between the two sides' scores, in [-1, 1]
 * @param skewMode            draw from a skew-normal instead of a bivariate normal
 * @param skewness            skew-normal shape; only read when {@code skewMode} is set
 * @param overtimeProbability chance of an overtime period per game
 * @param overtimeMean        mean extra combined points when overtime happens
 * @param overtimeStd         standard deviation of the extra points
 * @param sideFloor           minimum score of one side
 * @param minStdDev           floor applied to each side's standard deviation
 * @param seed                fixed seed for reproducible runs; {@code null} draws a fresh seed
 */
public record SimulationParameters(
    int draws,
    double correlation,
    boolean skewMode,
    double skewness,
    double overtimeProbability,
    double overtimeMean,
    double overtimeStd,
    double sideFloor,
    double minStdDev,
    Long seed
) {
    public static final int    DEFAULT_DRAWS          = 10_000;
    public static final double EMPIRICAL_CORRELATION  = 0.19;
    public static final double EMPIRICAL_SKEWNESS     = 0.19;

    public SimulationParameters {
        if (draws <= 0) {
            throw new IllegalArgumentException("draws must be positive: " + draws);
        }
        if (correlation < -1.0 || correlation > 1.0) {
            throw new IllegalArgumentException("correlation out of range: " + correlation);
        }
        if (overtimeProbability < 0.0 || overtimeProbability > 1.0) {
            throw new IllegalArgumentException("overtimeProbability out of range: " + overtimeProbability);
        }
    }

    public static SimulationParameters defaults() {
        return new SimulationParameters(DEFAULT_DRAWS, EMPIRICAL_CORRELATION, false, EMPIRICAL_SKEWNESS,
                                        0.06, 12.0, 3.0, 70.0, 5.0, null);
    }

    public SimulationParameters withSeed(Long newSeed) {
        return new SimulationParameters(draws, correlation, skewMode, skewness, overtimeProbability,
                                        overtimeMean, overtimeStd, sideFloor, minStdDev, newSeed);
    }

    public SimulationParameters withDraws(int newDraws) {
        return new SimulationParameters(newDraws, correlation, skewMode, skewness, overtimeProbability,
                                        overtimeMean, overtimeStd, sideFloor, minStdDev, seed);
    }

    public SimulationParameters withCorrelation(double newCorrelation) {
        return new SimulationParameters(draws, newCorrelation, skewMode, skewness, overtimeProbability,
                                        overtimeMean, overtimeStd, sideFloor, minStdDev, seed);
    }

    public SimulationParameters withSkewMode(boolean enabled) {
        return new SimulationParameters(draws, correlation, enabled, skewness, overtimeProbability,
                                        overtimeMean, overtimeStd, sideFloor, minStdDev, seed);
    }

    public SimulationParameters withOvertimeProbability(double probability) {
        return new SimulationParameters(draws, correlation, skewMode, skewness, probability,
                                        overtimeMean, overtimeStd, sideFloor, minStdDev, seed);
    }
}
