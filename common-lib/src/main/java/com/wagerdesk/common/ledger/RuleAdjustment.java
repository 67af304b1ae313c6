package com.wagerdesk.common.ledger;

/**
 * An active learning rule as served by the ledger.
 *
 * @param conditionType  what the condition is evaluated over, e.g. {@code EDGE_ABOVE}, {@code DEBATE_WINNER}
 * @param adjustment     signed confidence adjustment
 */
public record RuleAdjustment(Long ruleId, String condition, String conditionType, String betType, double adjustment) {}
