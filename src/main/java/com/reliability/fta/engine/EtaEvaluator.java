package com.reliability.fta.engine;

import com.reliability.fta.api.AnalysisMode;
import com.reliability.fta.api.ProbabilityEvaluator;
import com.reliability.fta.node.EventNode;
import com.reliability.fta.util.ProbabilityMath;

/**
 * Top-down Event Tree Analysis.
 *
 * The root keeps its own probability; every other node is its parent's
 * calculated probability times its own, rounded to 6 digits. Gates and links
 * play no part. The descent follows ownership edges only, which are acyclic,
 * so no cycle guard is needed.
 */
public final class EtaEvaluator implements ProbabilityEvaluator {

    @Override
    public AnalysisMode mode() {
        return AnalysisMode.ETA;
    }

    @Override
    public int recalculate(NodeStore store, EvaluationContext context) {
        context.begin(AnalysisMode.ETA);
        descend(store.root(), 1.0, context);
        return context.finish();
    }

    private void descend(EventNode node, double parentProbability, EvaluationContext ctx) {
        double value = ProbabilityMath.round(parentProbability * node.getProbability());
        ctx.resolve(node, value);
        for (EventNode child : node.getChildren())
            descend(child, value, ctx);
    }
}
