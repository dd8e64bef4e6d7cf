package com.spreadsheet.fgraph.node;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;

import com.spreadsheet.fgraph.address.Address;
import com.spreadsheet.fgraph.api.EvaluationContext;
import com.spreadsheet.fgraph.api.Node;
import com.spreadsheet.fgraph.api.NodeKind;
import com.spreadsheet.fgraph.api.Values;

/**
 * A literal cell value, or a formula/range result frozen by focusing. Never
 * dirty and never recomputed; only {@link #update(Object)} changes it.
 */
public final class ConstantNode implements Node {
    private final Address address;
    private Object value;

    public ConstantNode(Address address, Object value) {
        this.address = address;
        this.value = Values.normalize(value);
    }

    /**
     * Replaces the value.
     *
     * @return true if the value actually changed.
     */
    public boolean update(Object newValue) {
        Object normalized = Values.normalize(newValue);
        if (Objects.equals(value, normalized))
            return false;
        value = normalized;
        return true;
    }

    @Override
    public Address address() {
        return address;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CONSTANT;
    }

    @Override
    public Object value() {
        return value;
    }

    @Override
    public Set<Address> precedents() {
        return Collections.emptySet();
    }

    @Override
    public boolean isDirty() {
        return false;
    }

    @Override
    public void markDirty() {
        // constants are always valid
    }

    @Override
    public String formula() {
        return null;
    }

    @Override
    public boolean evaluate(EvaluationContext context) {
        return false;
    }

    @Override
    public String toString() {
        return "ConstantNode[" + address.address() + " = " + Values.display(value) + "]";
    }
}
