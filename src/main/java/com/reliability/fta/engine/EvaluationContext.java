package com.reliability.fta.engine;

import com.reliability.fta.api.AnalysisMode;
import com.reliability.fta.api.EvaluationListener;
import com.reliability.fta.node.EventNode;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * State owned by a single recalculation pass.
 *
 * Holds the memo of resolved values (node id to calculated probability) and
 * the set of nodes on the active recursion path. Both live exactly as long as
 * the pass: a new context is created for every pass and never shared, which
 * keeps the evaluators themselves stateless and reentrant.
 */
public final class EvaluationContext {
    private final long pass;
    private final EvaluationListener listener;

    private final Map<String, Double> resolved = new HashMap<>();
    private final Set<String> visiting = new HashSet<>();

    private int evaluatedCount;
    private int danglingLinks;
    private int cycleFallbacks;

    /**
     * @param pass     The pass number reported to the listener.
     * @param listener Optional observer, may be null.
     */
    public EvaluationContext(long pass, EvaluationListener listener) {
        this.pass = pass;
        this.listener = listener;
    }

    void begin(AnalysisMode mode) {
        if (listener != null)
            listener.onPassStart(pass, mode);
    }

    int finish() {
        if (listener != null)
            listener.onPassEnd(pass, evaluatedCount);
        return evaluatedCount;
    }

    /** The value resolved earlier in this pass, or null. */
    Double memoized(String nodeId) {
        return resolved.get(nodeId);
    }

    boolean isVisiting(String nodeId) {
        return visiting.contains(nodeId);
    }

    void enter(String nodeId) {
        visiting.add(nodeId);
    }

    void leave(String nodeId) {
        visiting.remove(nodeId);
    }

    /** Stores the node's output and memoizes it for the rest of the pass. */
    void resolve(EventNode node, double value) {
        resolved.put(node.getId(), value);
        node.assignCalculatedProbability(value);
        evaluatedCount++;
        if (listener != null)
            listener.onNodeEvaluated(pass, node.getId(), value);
    }

    void danglingLink(String sourceId, String targetId) {
        danglingLinks++;
        if (listener != null)
            listener.onDanglingLink(pass, sourceId, targetId);
    }

    void cycleFallback(String nodeId, double fallback) {
        cycleFallbacks++;
        if (listener != null)
            listener.onCycleFallback(pass, nodeId, fallback);
    }

    public int evaluatedCount() {
        return evaluatedCount;
    }

    public int danglingLinks() {
        return danglingLinks;
    }

    public int cycleFallbacks() {
        return cycleFallbacks;
    }
}
