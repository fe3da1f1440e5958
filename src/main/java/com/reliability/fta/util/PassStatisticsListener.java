package com.reliability.fta.util;

import com.reliability.fta.api.AnalysisMode;
import com.reliability.fta.api.EvaluationListener;

/**
 * Tracks timing and anomaly counts of recalculation passes.
 *
 * <p>
 * Captures:
 * <ul>
 * <li><b>Latency:</b> last, min, max and average pass duration.</li>
 * <li><b>Workload:</b> nodes evaluated in the last pass.</li>
 * <li><b>Anomalies:</b> dangling links and cycle fallbacks in the last pass
 * and in total.</li>
 * </ul>
 */
public final class PassStatisticsListener implements EvaluationListener {
    private long passStartNanos, lastLatencyNanos;
    private long totalPasses, totalLatencyNanos;
    private long minLatencyNanos = Long.MAX_VALUE, maxLatencyNanos = Long.MIN_VALUE;
    private int lastNodesEvaluated, lastDanglingLinks, lastCycleFallbacks;
    private long totalDanglingLinks, totalCycleFallbacks;
    private AnalysisMode lastMode;

    @Override
    public void onPassStart(long pass, AnalysisMode mode) {
        passStartNanos = System.nanoTime();
        lastMode = mode;
        lastDanglingLinks = 0;
        lastCycleFallbacks = 0;
    }

    @Override
    public void onNodeEvaluated(long pass, String nodeId, double calculatedProbability) {
        // Per-node timing is not tracked
    }

    @Override
    public void onDanglingLink(long pass, String sourceId, String targetId) {
        lastDanglingLinks++;
        totalDanglingLinks++;
    }

    @Override
    public void onCycleFallback(long pass, String nodeId, double fallbackProbability) {
        lastCycleFallbacks++;
        totalCycleFallbacks++;
    }

    @Override
    public void onPassEnd(long pass, int nodesEvaluated) {
        lastLatencyNanos = System.nanoTime() - passStartNanos;
        lastNodesEvaluated = nodesEvaluated;
        totalPasses++;
        totalLatencyNanos += lastLatencyNanos;
        if (lastLatencyNanos < minLatencyNanos)
            minLatencyNanos = lastLatencyNanos;
        if (lastLatencyNanos > maxLatencyNanos)
            maxLatencyNanos = lastLatencyNanos;
    }

    public long totalPasses() {
        return totalPasses;
    }

    public AnalysisMode lastMode() {
        return lastMode;
    }

    public int lastNodesEvaluated() {
        return lastNodesEvaluated;
    }

    public int lastDanglingLinks() {
        return lastDanglingLinks;
    }

    public int lastCycleFallbacks() {
        return lastCycleFallbacks;
    }

    public long totalDanglingLinks() {
        return totalDanglingLinks;
    }

    public long totalCycleFallbacks() {
        return totalCycleFallbacks;
    }

    public double lastLatencyMicros() {
        return lastLatencyNanos / 1000.0;
    }

    public double avgLatencyMicros() {
        return totalPasses > 0 ? totalLatencyNanos / (double) totalPasses / 1000.0 : 0;
    }

    public long minLatencyNanos() {
        return minLatencyNanos == Long.MAX_VALUE ? 0 : minLatencyNanos;
    }

    public long maxLatencyNanos() {
        return maxLatencyNanos == Long.MIN_VALUE ? 0 : maxLatencyNanos;
    }

    /** Snapshot suitable for JSON serialization. */
    public Snapshot snapshot() {
        return new Snapshot(totalPasses, lastMode == null ? null : lastMode.name(), lastNodesEvaluated,
                lastDanglingLinks, lastCycleFallbacks, totalDanglingLinks, totalCycleFallbacks,
                lastLatencyMicros(), avgLatencyMicros());
    }

    public record Snapshot(long totalPasses, String lastMode, int lastNodesEvaluated, int lastDanglingLinks,
            int lastCycleFallbacks, long totalDanglingLinks, long totalCycleFallbacks,
            double lastLatencyMicros, double avgLatencyMicros) {
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-20s | %10s | %10s | %10s | %10s%n", "Metric", "Value", "Avg (us)", "Min (us)",
                "Max (us)"));
        sb.append("------------------------------------------------------------------------------\n");
        sb.append(String.format("%-20s | %10d | %10.2f | %10.2f | %10.2f%n",
                "Total Passes",
                totalPasses,
                avgLatencyMicros(),
                minLatencyNanos() / 1000.0,
                maxLatencyNanos() / 1000.0));
        sb.append(String.format("%-20s | %10d%n", "Dangling Links", totalDanglingLinks));
        sb.append(String.format("%-20s | %10d%n", "Cycle Fallbacks", totalCycleFallbacks));
        return sb.toString();
    }
}
