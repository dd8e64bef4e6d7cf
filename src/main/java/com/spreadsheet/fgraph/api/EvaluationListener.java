package com.spreadsheet.fgraph.api;

import com.spreadsheet.fgraph.address.Address;
import com.spreadsheet.fgraph.engine.ConvergenceWarning;

/**
 * Observability hook for the evaluator.
 *
 * Callbacks run synchronously inside resolution. Implementations should be
 * cheap; anything slow here slows every resolve.
 */
public interface EvaluationListener {

    /**
     * Called before a top-level resolve of {@code target} begins.
     */
    void onResolveStart(Address target);

    /**
     * Called after a node has been evaluated.
     *
     * @param address       the node's address
     * @param changed       true if its cached value changed
     * @param durationNanos time spent in the node's own evaluation
     */
    void onNodeEvaluated(Address address, boolean changed, long durationNanos);

    /**
     * Called when a node's evaluation produced an error value from an
     * unexpected exception or a syntax error.
     */
    void onNodeError(Address address, Throwable error);

    /**
     * Called after each Gauss-Seidel sweep of a cycle.
     *
     * @param head      the address at which the cycle was entered
     * @param iteration sweep number, the first pass counting as 1
     * @param maxDelta  largest absolute change of any member in this sweep
     */
    void onCycleIteration(Address head, int iteration, double maxDelta);

    /** Called when a cycle stops without meeting the tolerance. */
    void onConvergenceFailure(ConvergenceWarning warning);

    /**
     * Called when the top-level resolve completes, normally or not.
     *
     * @param nodesEvaluated number of node evaluations performed
     */
    void onResolveEnd(Address target, int nodesEvaluated);
}
