package com.wagerdesk.ledger.settlement;

import com.wagerdesk.ledger.model.Outcome;

/**
 * Resolved result of one wager.
 *
 * @param actualValue     realized metric: combined score, side A margin, or stat value
 * @param distanceFromLine absolute distance between the realized metric and the line, in points
 * @param profit          per unit staked: {@code odds − 1} on a win, {@code −1} on a loss, 0 on a push
 */
public record Settlement(Outcome outcome, double actualValue, double distanceFromLine, double profit) {}
