package com.spreadsheet.fgraph.engine;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import com.spreadsheet.fgraph.address.Address;
import com.spreadsheet.fgraph.api.Node;

/**
 * Arena of graph nodes keyed by address.
 *
 * Data layout:
 * - nodes: address to node, in creation order. Each node owns its precedent
 * set (the edges it reads).
 * - successors: reverse index, address to the addresses that read it. It is
 * kept in step with precedents on every add, replace and remove, so
 * invalidation can walk dependents without scanning the arena.
 *
 * Successor entries may exist for addresses that have no node yet: a formula
 * can reference a cell before that cell is first resolved.
 */
public final class NodeStore {
    private final Map<Address, Node> nodes = new LinkedHashMap<>();
    private final Map<Address, Set<Address>> successors = new HashMap<>();
    private int edgeCount;

    /** @throws IllegalArgumentException if a node already exists at the address */
    public void add(Node node) {
        Address address = node.address();
        if (nodes.containsKey(address))
            throw new IllegalArgumentException("Duplicate node: " + address);
        nodes.put(address, node);
        link(node);
    }

    /**
     * Replaces the node at the same address. The old node's precedent edges are
     * dropped and the new node's added; dependents are unaffected.
     *
     * @return the previous node, or null
     */
    public Node replace(Node node) {
        Node old = nodes.put(node.address(), node);
        if (old != null)
            unlink(old);
        link(node);
        return old;
    }

    /**
     * Removes a node and its precedent edges.
     *
     * @return the removed node, or null
     */
    public Node remove(Address address) {
        Node old = nodes.remove(address);
        if (old != null) {
            unlink(old);
            Set<Address> deps = successors.get(address);
            if (deps != null && deps.isEmpty())
                successors.remove(address);
        }
        return old;
    }

    public Node get(Address address) {
        return nodes.get(address);
    }

    public boolean contains(Address address) {
        return nodes.containsKey(address);
    }

    /** Addresses whose nodes read {@code address}. */
    public Set<Address> successors(Address address) {
        Set<Address> s = successors.get(address);
        return s == null ? Collections.emptySet() : Collections.unmodifiableSet(s);
    }

    /** Addresses read by the node at {@code address}; empty if there is none. */
    public Set<Address> precedents(Address address) {
        Node n = nodes.get(address);
        return n == null ? Collections.emptySet() : n.precedents();
    }

    /** All nodes in creation order. */
    public Collection<Node> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public Set<Address> addresses() {
        return Collections.unmodifiableSet(nodes.keySet());
    }

    public int size() {
        return nodes.size();
    }

    /** Number of precedent edges held by the nodes in the store. */
    public int edgeCount() {
        return edgeCount;
    }

    private void link(Node node) {
        for (Address p : node.precedents()) {
            if (successors.computeIfAbsent(p, k -> new LinkedHashSet<>()).add(node.address()))
                edgeCount++;
        }
    }

    private void unlink(Node node) {
        for (Address p : node.precedents()) {
            Set<Address> deps = successors.get(p);
            if (deps != null && deps.remove(node.address())) {
                edgeCount--;
                if (deps.isEmpty())
                    successors.remove(p);
            }
        }
    }
}
