package com.spreadsheet.fgraph.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

import com.spreadsheet.fgraph.address.Address;
import com.spreadsheet.fgraph.api.Node;
import com.spreadsheet.fgraph.engine.NodeStore;

/**
 * Depth-first listing of a node and its precedents with their current cached
 * values, for explaining how an output was computed.
 *
 * <p>
 * Entries are produced lazily from an explicit stack, so very deep chains do
 * not exhaust the Java call stack. The tree is restartable: every call to
 * {@link #iterator()} starts a fresh walk over the store as it is then.
 */
public final class ValueTree implements Iterable<ValueTreeEntry> {
    private final NodeStore store;
    private final Address root;

    public ValueTree(NodeStore store, Address root) {
        this.store = store;
        this.root = root;
    }

    @Override
    public Iterator<ValueTreeEntry> iterator() {
        return new Walk();
    }

    /** Renders every entry with {@link ValueTreeEntry#line()}. */
    public List<String> lines() {
        List<String> out = new ArrayList<>();
        for (ValueTreeEntry e : this)
            out.add(e.line());
        return out;
    }

    @Override
    public String toString() {
        return String.join("\n", lines());
    }

    private final class Walk implements Iterator<ValueTreeEntry> {
        private final Deque<Frame> stack = new ArrayDeque<>();
        private final Set<Address> path = new HashSet<>();
        private ValueTreeEntry next;

        Walk() {
            next = enter(root, 0);
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public ValueTreeEntry next() {
            if (next == null)
                throw new NoSuchElementException();
            ValueTreeEntry current = next;
            next = advance();
            return current;
        }

        private ValueTreeEntry advance() {
            while (!stack.isEmpty()) {
                Frame top = stack.peek();
                if (!top.children.hasNext()) {
                    stack.pop();
                    path.remove(top.address);
                    continue;
                }
                Address child = top.children.next();
                if (path.contains(child))
                    return new ValueTreeEntry(child, valueOf(child), top.depth + 1, true);
                return enter(child, top.depth + 1);
            }
            return null;
        }

        private ValueTreeEntry enter(Address address, int depth) {
            stack.push(new Frame(address, depth, store.precedents(address).iterator()));
            path.add(address);
            return new ValueTreeEntry(address, valueOf(address), depth, false);
        }

        private Object valueOf(Address address) {
            Node n = store.get(address);
            return n == null ? null : n.value();
        }
    }

    private record Frame(Address address, int depth, Iterator<Address> children) {
    }
}
