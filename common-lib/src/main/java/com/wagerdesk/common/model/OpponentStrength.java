package com.wagerdesk.common.model;

/**
 * Strength of the opposition a side has faced, used to normalize its raw scoring.
 *
 * @param rawPointsFor          average points scored in the sample
 * @param rawPointsAgainst      average points allowed in the sample
 * @param opponentDefRating     average defensive rating of the opponents faced
 * @param opponentOffRating     average offensive rating of the opponents faced
 * @param leagueDefRating       league-average defensive rating
 * @param leagueOffRating       league-average offensive rating
 */
public record OpponentStrength(
    double rawPointsFor,
    double rawPointsAgainst,
    double opponentDefRating,
    double opponentOffRating,
    double leagueDefRating,
    double leagueOffRating
) {

    /** Points scored rescaled to a league-average defense. */
    public double adjustedPointsFor() {
        return opponentDefRating > 0 ? rawPointsFor * leagueDefRating / opponentDefRating : rawPointsFor;
    }

    /** Points allowed rescaled to a league-average offense. */
    public double adjustedPointsAgainst() {
        return opponentOffRating > 0 ? rawPointsAgainst * leagueOffRating / opponentOffRating : rawPointsAgainst;
    }
}
