package com.wagerdesk.orchestrator.judge;

import com.wagerdesk.orchestrator.model.Action;

import java.util.List;

/**
 * Outcome of decision synthesis.
 *
 * @param appliedRules  ids of learning rules whose condition matched
 */
public record Verdict(Action action, double confidence, String reasoning, List<Long> appliedRules) {

    public Verdict {
        appliedRules = appliedRules == null ? List.of() : List.copyOf(appliedRules);
    }
}
