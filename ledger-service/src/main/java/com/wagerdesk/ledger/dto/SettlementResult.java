package com.wagerdesk.ledger.dto;

import com.wagerdesk.ledger.settlement.SettlementStatus;

/**
 * Outcome of a manual settlement. {@code outcome}, {@code actualValue} and {@code profit} are the
 * stored values, also when the wager had already been settled.
 */
public record SettlementResult(long wagerId, SettlementStatus status, String outcome, Double actualValue,
                               Double profit) {}
