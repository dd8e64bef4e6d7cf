package com.spreadsheet.fgraph.node;

import java.util.Objects;

import com.spreadsheet.fgraph.address.Address;
import com.spreadsheet.fgraph.api.EvaluationContext;
import com.spreadsheet.fgraph.api.Node;

/**
 * Base class for nodes whose value is computed from precedents and cached.
 *
 * Design:
 * - Template Method: {@link #evaluate} is final and handles the cache and the
 * dirty flag. Subclasses only implement {@link #compute}.
 * - Nodes start dirty; {@link #markDirty()} is the only way back.
 */
public abstract class CachedNode implements Node {
    private final Address address;

    private Object value;
    private boolean dirty = true;

    protected CachedNode(Address address) {
        this.address = address;
    }

    @Override
    public final Address address() {
        return address;
    }

    /**
     * Computes the new value from precedent values.
     *
     * @return The new value; errors are returned, not thrown.
     */
    protected abstract Object compute(EvaluationContext context);

    @Override
    public final boolean evaluate(EvaluationContext context) {
        Object previous = value;
        value = compute(context);
        dirty = false;
        return !Objects.equals(previous, value);
    }

    @Override
    public final Object value() {
        return value;
    }

    @Override
    public final boolean isDirty() {
        return dirty;
    }

    @Override
    public final void markDirty() {
        dirty = true;
    }

    /**
     * Installs a previously computed value and marks the node clean, as when
     * reloading a saved graph.
     */
    public final void restore(Object cachedValue) {
        this.value = cachedValue;
        this.dirty = false;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + address.address() + (dirty ? ", dirty" : " = " + value) + "]";
    }
}
