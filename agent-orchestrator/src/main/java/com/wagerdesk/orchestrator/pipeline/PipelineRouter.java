package com.wagerdesk.orchestrator.pipeline;

/**
 * Picks the next state of a run from the artifacts it holds.
 *
 * <p>The earliest missing artifact among context, projection, simulation and debate decides the
 * stage to run; the returned state names the last artifact in place. A run without usable
 * context is sent back through {@link PipelineState#RETRY} until {@code maxRetries} refetches
 * have been spent, then ends as {@link PipelineState#DATA_UNAVAILABLE}. Routing reads nothing
 * but the run itself.
 */
public class PipelineRouter {

    private final int maxRetries;

    public PipelineRouter(int maxRetries) {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0: " + maxRetries);
        this.maxRetries = maxRetries;
    }

    public PipelineState route(PipelineRun run) {
        if (run.state().isTerminal()) return run.state();
        if (run.aborted()) return PipelineState.DONE;
        if (run.context() == null) {
            if (run.contextAttempts() == 0) return PipelineState.AWAITING_CONTEXT;
            return run.retries() < maxRetries ? PipelineState.RETRY : PipelineState.DATA_UNAVAILABLE;
        }
        if (run.projection() == null) return PipelineState.CONTEXT_FETCHED;
        if (run.simulation() == null) return PipelineState.PROJECTED;
        if (run.debate() == null) return PipelineState.SIMULATED;
        return PipelineState.DONE;
    }

    public int maxRetries() {
        return maxRetries;
    }
}
