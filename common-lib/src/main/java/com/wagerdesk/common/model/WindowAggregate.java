package com.wagerdesk.common.model;

/**
 * Team efficiency aggregate over one trailing window.
 *
 * @param offensiveRating points scored per 100 possessions
 * @param defensiveRating points allowed per 100 possessions
 * @param pace            possessions per 48 minutes
 * @param stdDev          standard deviation of the side's points over the window; 0 when unknown
 */
public record WindowAggregate(
    Window window,
    int games,
    double offensiveRating,
    double defensiveRating,
    double pace,
    double pointsFor,
    double pointsAgainst,
    double stdDev
) {}
