package com.reliability.fta.util;

import com.reliability.fta.api.AnalysisMode;
import com.reliability.fta.api.EvaluationListener;

import lombok.extern.log4j.Log4j2;

/**
 * Opt-in warning channel for anomalies that the evaluators otherwise absorb
 * silently: dangling links and cycle fallbacks. Warnings are throttled.
 */
@Log4j2
public final class LoggingEvaluationListener implements EvaluationListener {
    private final WarningRateLimiter limiter;

    public LoggingEvaluationListener() {
        this(1000);
    }

    public LoggingEvaluationListener(long minIntervalMillis) {
        this.limiter = new WarningRateLimiter(log, minIntervalMillis);
    }

    @Override
    public void onPassStart(long pass, AnalysisMode mode) {
        log.debug("Pass {} started ({})", pass, mode);
    }

    @Override
    public void onNodeEvaluated(long pass, String nodeId, double calculatedProbability) {
        log.trace("Pass {}: {} = {}", pass, nodeId, calculatedProbability);
    }

    @Override
    public void onDanglingLink(long pass, String sourceId, String targetId) {
        limiter.warn(String.format("Pass %d: link from '%s' to missing node '%s' skipped", pass, sourceId, targetId));
    }

    @Override
    public void onCycleFallback(long pass, String nodeId, double fallbackProbability) {
        limiter.warn(String.format("Pass %d: cycle through '%s', base probability %s used", pass, nodeId,
                fallbackProbability));
    }

    @Override
    public void onPassEnd(long pass, int nodesEvaluated) {
        log.debug("Pass {} finished, {} nodes evaluated", pass, nodesEvaluated);
    }
}
