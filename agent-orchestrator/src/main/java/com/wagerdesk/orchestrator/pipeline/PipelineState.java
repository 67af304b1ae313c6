package com.wagerdesk.orchestrator.pipeline;

/**
 * States of one evaluation run.
 *
 * <pre>
 *   AWAITING_CONTEXT → CONTEXT_FETCHED → PROJECTED → SIMULATED → DEBATED → DONE
 *          ↑                 │
 *          └──── RETRY ◄─────┘   (bounded; DATA_UNAVAILABLE once the budget is spent)
 * </pre>
 */
public enum PipelineState {
    AWAITING_CONTEXT,
    CONTEXT_FETCHED,
    PROJECTED,
    SIMULATED,
    DEBATED,
    RETRY,
    DONE,
    DATA_UNAVAILABLE;

    public boolean isTerminal() {
        return this == DONE || this == DATA_UNAVAILABLE;
    }
}
