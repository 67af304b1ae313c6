package com.wagerdesk.ledger.dto;

/**
 * Settled record of every wager whose selection contains a pattern.
 *
 * @param winRate wins over decided wagers; {@code null} when none are decided
 * @param roi     profit per settled wager at unit stake
 */
public record PerformanceSummary(String pattern, int settled, int wins, int losses, int pushes,
                                 Double winRate, double profit, double roi) {}
