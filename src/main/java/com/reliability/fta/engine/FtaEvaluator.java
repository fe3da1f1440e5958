package com.reliability.fta.engine;

import com.reliability.fta.api.AnalysisMode;
import com.reliability.fta.api.LogicGate;
import com.reliability.fta.api.ProbabilityEvaluator;
import com.reliability.fta.node.EventLink;
import com.reliability.fta.node.EventNode;
import com.reliability.fta.util.ProbabilityMath;

import java.util.List;

/**
 * Bottom-up Fault Tree Analysis.
 *
 * Algorithm, per node N (memoized for the pass, cycle-guarded):
 *
 * 1. Base: a leaf uses its own probability. A node with children ignores its
 * own probability and combines the children through its gate:
 * AND = prod(p), OR = 1 - prod(1 - p).
 *
 * 2. Links: each target is resolved by id through the NodeStore and evaluated
 * through the same procedure. Dangling targets are skipped.
 *
 * 3. Link folding, in two fixed phases regardless of declaration order: all
 * AND links first (base *= prod(and)), then the union of the updated base with
 * every OR link value.
 *
 * 4. Every intermediate and final value is rounded to 6 decimal digits.
 *
 * Cycles: if N is reached again while it is still on the recursion path
 * (through a link back to itself or to an ancestor), that occurrence uses N's
 * own base probability instead of recursing. This is an approximation, not a
 * fixed-point solve, and it guarantees termination within one traversal.
 */
public final class FtaEvaluator implements ProbabilityEvaluator {

    @Override
    public AnalysisMode mode() {
        return AnalysisMode.FTA;
    }

    @Override
    public int recalculate(NodeStore store, EvaluationContext context) {
        context.begin(AnalysisMode.FTA);
        evaluate(store, store.root(), context);
        return context.finish();
    }

    private double evaluate(NodeStore store, EventNode node, EvaluationContext ctx) {
        final String id = node.getId();

        Double memo = ctx.memoized(id);
        if (memo != null)
            return memo;

        if (ctx.isVisiting(id)) {
            double fallback = node.getProbability();
            ctx.cycleFallback(id, fallback);
            return fallback;
        }

        ctx.enter(id);

        double base;
        List<EventNode> children = node.getChildren();
        if (children.isEmpty()) {
            base = node.getProbability();
        } else {
            double[] values = new double[children.size()];
            for (int i = 0; i < values.length; i++)
                values[i] = evaluate(store, children.get(i), ctx);
            base = node.getLogicGate() == LogicGate.AND
                    ? ProbabilityMath.round(ProbabilityMath.product(values, values.length))
                    : ProbabilityMath.round(ProbabilityMath.union(values, values.length));
        }

        List<EventLink> links = node.getLinks();
        if (!links.isEmpty()) {
            double[] andValues = new double[links.size()];
            double[] orValues = new double[links.size()];
            int andCount = 0, orCount = 0;

            for (EventLink link : links) {
                if (!link.hasTarget())
                    continue;
                EventNode target = store.find(link.targetId());
                if (target == null) {
                    ctx.danglingLink(id, link.targetId());
                    continue;
                }
                double v = evaluate(store, target, ctx);
                if (link.relation() == LogicGate.AND)
                    andValues[andCount++] = v;
                else
                    orValues[orCount++] = v;
            }

            if (andCount > 0)
                base = ProbabilityMath.round(base * ProbabilityMath.product(andValues, andCount));
            if (orCount > 0)
                base = ProbabilityMath.round(ProbabilityMath.union(base, orValues, orCount));
        }

        base = ProbabilityMath.round(base);
        ctx.leave(id);
        ctx.resolve(node, base);
        return base;
    }
}
