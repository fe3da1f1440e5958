package com.reliability.fta.api;

import com.reliability.fta.engine.EvaluationContext;
import com.reliability.fta.engine.NodeStore;

/**
 * One propagation semantics over a {@link NodeStore}.
 *
 * A call recomputes the calculated probability of every node from scratch.
 * Implementations must complete for any tree that passed boundary validation:
 * dangling links, cycles and empty gates all degrade to defined fallbacks, so
 * no exception escapes for tree content.
 */
public interface ProbabilityEvaluator {

    /** The mode this evaluator implements. */
    AnalysisMode mode();

    /**
     * Runs one full pass.
     *
     * @param store   The tree to evaluate. Not mutated structurally.
     * @param context Pass-scoped state. Must be fresh for every pass.
     * @return The number of nodes that received a calculated probability.
     */
    int recalculate(NodeStore store, EvaluationContext context);
}
