package com.spreadsheet.fgraph.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.spreadsheet.fgraph.address.Address;
import com.spreadsheet.fgraph.api.EvaluationListener;
import com.spreadsheet.fgraph.engine.ConvergenceWarning;

/** Aggregates evaluation counts and timings per node to find hot spots. */
public class EvaluationProfileListener implements EvaluationListener {

    public static class NodeStats {
        public final Address address;
        public long count;
        public long changedCount;
        public long errorCount;
        public long totalDurationNanos;
        public long minDurationNanos = Long.MAX_VALUE;
        public long maxDurationNanos = Long.MIN_VALUE;

        public NodeStats(Address address) {
            this.address = address;
        }

        void update(boolean changed, long duration) {
            count++;
            if (changed)
                changedCount++;
            totalDurationNanos += duration;
            if (duration < minDurationNanos)
                minDurationNanos = duration;
            if (duration > maxDurationNanos)
                maxDurationNanos = duration;
        }

        public double avgMicros() {
            return count == 0 ? 0 : totalDurationNanos / (double) count / 1000.0;
        }
    }

    private final Map<Address, NodeStats> stats = new LinkedHashMap<>();
    private long resolves;
    private long cycleIterations;
    private long convergenceFailures;

    @Override
    public void onResolveStart(Address target) {
        resolves++;
    }

    @Override
    public void onNodeEvaluated(Address address, boolean changed, long durationNanos) {
        stats.computeIfAbsent(address, NodeStats::new).update(changed, durationNanos);
    }

    @Override
    public void onNodeError(Address address, Throwable error) {
        stats.computeIfAbsent(address, NodeStats::new).errorCount++;
    }

    @Override
    public void onCycleIteration(Address head, int iteration, double maxDelta) {
        cycleIterations++;
    }

    @Override
    public void onConvergenceFailure(ConvergenceWarning warning) {
        convergenceFailures++;
    }

    @Override
    public void onResolveEnd(Address target, int nodesEvaluated) {
        // No-op
    }

    /** Number of evaluations of the node at {@code address}, 0 if never evaluated. */
    public long evaluations(Address address) {
        NodeStats s = stats.get(address);
        return s == null ? 0 : s.count;
    }

    public long totalEvaluations() {
        long total = 0;
        for (NodeStats s : stats.values())
            total += s.count;
        return total;
    }

    public long resolves() {
        return resolves;
    }

    public long cycleIterations() {
        return cycleIterations;
    }

    public long convergenceFailures() {
        return convergenceFailures;
    }

    public Collection<NodeStats> stats() {
        return Collections.unmodifiableCollection(stats.values());
    }

    /** Resets all collected statistics. */
    public void reset() {
        stats.clear();
        resolves = 0;
        cycleIterations = 0;
        convergenceFailures = 0;
    }

    /** Returns a formatted table of node statistics, most expensive first. */
    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-30s | %10s | %10s | %10s | %10s | %10s%n", "Node", "Count", "Changed", "Errors",
                "Avg (us)", "Max (us)"));
        sb.append(
                "------------------------------------------------------------------------------------------------------\n");

        List<NodeStats> sorted = new ArrayList<>(stats.values());
        sorted.sort((s1, s2) -> Long.compare(s2.totalDurationNanos, s1.totalDurationNanos));

        for (NodeStats s : sorted) {
            sb.append(String.format("%-30s | %10d | %10d | %10d | %10.2f | %10.2f%n",
                    truncate(s.address.address(), 30),
                    s.count,
                    s.changedCount,
                    s.errorCount,
                    s.avgMicros(),
                    s.count == 0 ? 0.0 : s.maxDurationNanos / 1000.0));
        }
        return sb.toString();
    }

    private String truncate(String s, int len) {
        if (s.length() <= len)
            return s;
        return s.substring(0, len - 3) + "...";
    }
}
