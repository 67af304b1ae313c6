package com.wagerdesk.ledger.dto;

/**
 * Realized values supplied by an operator when the warehouse has no usable result.
 *
 * @param entityScore   final score of the wager's entity (side A); totals use both scores
 * @param opponentScore final score of the opponent
 * @param statValue     realized stat for player props; ignored otherwise
 */
public record ManualSettlementRequest(Double entityScore, Double opponentScore, Double statValue) {}
