package com.reliability.fta.api;

/**
 * Observability interface for monitoring recalculation passes.
 *
 * Listeners are registered with the analysis and receive callbacks from the
 * evaluating thread while a pass runs. Nothing reported here changes the
 * computed values: dangling links and cycle fallbacks have already degraded to
 * their defined results by the time the callback fires.
 *
 * Callbacks run inside the pass, so implementations must stay cheap and must
 * not mutate the tree.
 */
public interface EvaluationListener {

    /**
     * Called before the first node of a pass is evaluated.
     *
     * @param pass The incrementing pass number of the analysis.
     * @param mode The propagation semantics of this pass.
     */
    void onPassStart(long pass, AnalysisMode mode);

    /**
     * Called once per node when its calculated probability has been stored.
     */
    void onNodeEvaluated(long pass, String nodeId, double calculatedProbability);

    /**
     * Called when a link's target id does not resolve. The link is skipped.
     *
     * @param sourceId The node declaring the link.
     * @param targetId The unresolved target id.
     */
    void onDanglingLink(long pass, String sourceId, String targetId);

    /**
     * Called when evaluation re-enters a node already on the active recursion
     * path and falls back to its base probability for that occurrence.
     */
    void onCycleFallback(long pass, String nodeId, double fallbackProbability);

    /**
     * Called when the pass is complete.
     *
     * @param nodesEvaluated Number of nodes that received a calculated value.
     */
    void onPassEnd(long pass, int nodesEvaluated);
}
