package com.reliability.fta.util;

import com.reliability.fta.api.AnalysisMode;
import com.reliability.fta.api.EvaluationListener;

import java.util.Arrays;

/**
 * Fans out callbacks to several {@link EvaluationListener} instances in
 * registration order.
 */
public class CompositeEvaluationListener implements EvaluationListener {
    private EvaluationListener[] listeners = new EvaluationListener[0];

    public void add(EvaluationListener listener) {
        EvaluationListener[] old = listeners;
        EvaluationListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public boolean isEmpty() {
        return listeners.length == 0;
    }

    @Override
    public void onPassStart(long pass, AnalysisMode mode) {
        for (EvaluationListener l : listeners)
            l.onPassStart(pass, mode);
    }

    @Override
    public void onNodeEvaluated(long pass, String nodeId, double calculatedProbability) {
        for (EvaluationListener l : listeners)
            l.onNodeEvaluated(pass, nodeId, calculatedProbability);
    }

    @Override
    public void onDanglingLink(long pass, String sourceId, String targetId) {
        for (EvaluationListener l : listeners)
            l.onDanglingLink(pass, sourceId, targetId);
    }

    @Override
    public void onCycleFallback(long pass, String nodeId, double fallbackProbability) {
        for (EvaluationListener l : listeners)
            l.onCycleFallback(pass, nodeId, fallbackProbability);
    }

    @Override
    public void onPassEnd(long pass, int nodesEvaluated) {
        for (EvaluationListener l : listeners)
            l.onPassEnd(pass, nodesEvaluated);
    }
}
