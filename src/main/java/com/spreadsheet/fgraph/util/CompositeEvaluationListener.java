package com.spreadsheet.fgraph.util;

import java.util.Arrays;

import com.spreadsheet.fgraph.address.Address;
import com.spreadsheet.fgraph.api.EvaluationListener;
import com.spreadsheet.fgraph.engine.ConvergenceWarning;

/**
 * Fans evaluator callbacks out to several {@link EvaluationListener}s.
 */
public class CompositeEvaluationListener implements EvaluationListener {
    private EvaluationListener[] listeners = new EvaluationListener[0];

    public void add(EvaluationListener listener) {
        EvaluationListener[] old = listeners;
        EvaluationListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public boolean remove(EvaluationListener listener) {
        for (int i = 0; i < listeners.length; i++) {
            if (listeners[i] == listener) {
                EvaluationListener[] next = new EvaluationListener[listeners.length - 1];
                System.arraycopy(listeners, 0, next, 0, i);
                System.arraycopy(listeners, i + 1, next, i, listeners.length - i - 1);
                listeners = next;
                return true;
            }
        }
        return false;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onResolveStart(Address target) {
        for (EvaluationListener l : listeners)
            l.onResolveStart(target);
    }

    @Override
    public void onNodeEvaluated(Address address, boolean changed, long durationNanos) {
        for (EvaluationListener l : listeners)
            l.onNodeEvaluated(address, changed, durationNanos);
    }

    @Override
    public void onNodeError(Address address, Throwable error) {
        for (EvaluationListener l : listeners)
            l.onNodeError(address, error);
    }

    @Override
    public void onCycleIteration(Address head, int iteration, double maxDelta) {
        for (EvaluationListener l : listeners)
            l.onCycleIteration(head, iteration, maxDelta);
    }

    @Override
    public void onConvergenceFailure(ConvergenceWarning warning) {
        for (EvaluationListener l : listeners)
            l.onConvergenceFailure(warning);
    }

    @Override
    public void onResolveEnd(Address target, int nodesEvaluated) {
        for (EvaluationListener l : listeners)
            l.onResolveEnd(target, nodesEvaluated);
    }
}
