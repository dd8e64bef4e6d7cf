package com.spreadsheet.fgraph.api;

import java.util.Set;

import com.spreadsheet.fgraph.address.Address;

/**
 * A vertex of the dependency graph, keyed by its address.
 *
 * <p>
 * A node caches the last value it computed. {@link #evaluate} is only called by
 * the evaluator once every precedent holds a valid value, so implementations
 * read precedent values through the {@link EvaluationContext} and never trigger
 * resolution themselves.
 */
public interface Node {

    Address address();

    NodeKind kind();

    /** The cached value; meaningful only while {@link #isDirty()} is false. */
    Object value();

    /** Addresses this node reads, in first-reference order. Empty for constants. */
    Set<Address> precedents();

    /** True when the cached value must be recomputed before use. */
    boolean isDirty();

    /** Marks the cached value stale. No-op for constants. */
    void markDirty();

    /** Formula text including the leading {@code =}, or null. */
    String formula();

    /**
     * Recomputes the value from precedent values and clears the dirty flag.
     *
     * @return true if the value differs from the previously cached one.
     */
    boolean evaluate(EvaluationContext context);
}
