package com.wagerdesk.ledger.analysis;

/**
 * A rule the analysis pass found support for, before the duplicate check.
 *
 * @param winRateBefore win rate of the matching wagers when the rule was induced
 */
public record RuleCandidate(
    String pattern,
    String conditionType,
    String condition,
    double adjustment,
    String evidence,
    int sampleSize,
    double winRateBefore
) {}
