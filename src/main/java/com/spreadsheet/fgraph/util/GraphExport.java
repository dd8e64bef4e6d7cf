package com.spreadsheet.fgraph.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.spreadsheet.fgraph.address.Address;
import com.spreadsheet.fgraph.api.Node;
import com.spreadsheet.fgraph.api.NodeKind;
import com.spreadsheet.fgraph.api.Values;
import com.spreadsheet.fgraph.engine.NodeStore;

/**
 * Diagnostic views of the node store: vertex and edge lists, a text dump, and
 * Mermaid and Graphviz DOT renderings.
 *
 * <p>
 * Do <b>not</b> use on the hot path (allocates strings, iterates the whole
 * store).
 */
public final class GraphExport {
    private final NodeStore store;

    /** A node as exported: formula is null for constants and ranges. */
    public record Vertex(Address address, NodeKind kind, Object value, String formula, boolean dirty) {
    }

    /** A dependency edge: {@code to} reads {@code from}. */
    public record Edge(Address from, Address to) {
    }

    public GraphExport(NodeStore store) {
        this.store = store;
    }

    /** All nodes in creation order. */
    public List<Vertex> vertices() {
        List<Vertex> out = new ArrayList<>(store.size());
        for (Node n : store.nodes())
            out.add(new Vertex(n.address(), n.kind(), n.value(), n.formula(), n.isDirty()));
        return out;
    }

    /** Precedent to dependent edges, grouped by dependent. */
    public List<Edge> edges() {
        List<Edge> out = new ArrayList<>(store.edgeCount());
        for (Node n : store.nodes())
            for (Address p : n.precedents())
                out.add(new Edge(p, n.address()));
        return out;
    }

    /**
     * Dumps detailed state of a single node.
     */
    public String explainNode(Address address) {
        Node node = store.get(address);
        if (node == null)
            return "Node: " + address + " (not in graph)\n";
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(address.address()).append('\n')
                .append("  Kind: ").append(node.kind()).append('\n');
        if (node.formula() != null)
            sb.append("  Formula: ").append(node.formula()).append('\n');
        sb.append("  Value: ").append(node.isDirty() ? "<dirty>" : Values.display(node.value())).append('\n');
        appendList(sb, "  Precedents", node.precedents());
        appendList(sb, "  Dependents", store.successors(address));
        return sb.toString();
    }

    private static void appendList(StringBuilder sb, String label, Collection<Address> items) {
        sb.append(label).append(" (").append(items.size()).append("): ");
        int i = 0;
        for (Address a : items) {
            if (i++ > 0)
                sb.append(", ");
            sb.append(a.address());
        }
        sb.append('\n');
    }

    /**
     * Dumps the whole graph, one node per line with the nodes that read it.
     */
    public String dumpTopology() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph (").append(store.size()).append(" nodes, ").append(store.edgeCount()).append(" edges):\n");
        for (Node n : store.nodes()) {
            sb.append("  ").append(n.address().address()).append(" [").append(n.kind()).append(']');
            var deps = store.successors(n.address());
            if (!deps.isEmpty()) {
                sb.append(" -> ");
                int i = 0;
                for (Address d : deps) {
                    if (i++ > 0)
                        sb.append(", ");
                    sb.append(d.address());
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid flowchart. Constants are drawn as rounded boxes,
     * ranges as subroutine boxes. Addresses that sanitize to the same id get a
     * numeric suffix.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");
        MermaidIds ids = new MermaidIds();
        for (Vertex v : vertices()) {
            String label = escape(v.address().address()) + "<br/>" + escape(label(v));
            sb.append("  ").append(ids.of(v.address()));
            switch (v.kind()) {
                case CONSTANT -> sb.append("(\"").append(label).append("\")");
                case RANGE -> sb.append("[[\"").append(label).append("\"]]");
                default -> sb.append("[\"").append(label).append("\"]");
            }
            sb.append(";\n");
        }
        for (Edge e : edges())
            sb.append("  ").append(ids.of(e.from())).append(" --> ").append(ids.of(e.to()))
                    .append(";\n");
        return sb.toString();
    }

    /** Generates a Graphviz DOT digraph. */
    public String toDot() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("digraph formulas {\n  rankdir=LR;\n");
        for (Vertex v : vertices()) {
            sb.append("  \"").append(dotEscape(v.address().address())).append("\" [label=\"")
                    .append(dotEscape(v.address().address() + "\\n" + label(v))).append("\", shape=")
                    .append(v.kind() == NodeKind.CONSTANT ? "ellipse" : v.kind() == NodeKind.RANGE ? "box3d" : "box")
                    .append("];\n");
        }
        for (Edge e : edges())
            sb.append("  \"").append(dotEscape(e.from().address())).append("\" -> \"")
                    .append(dotEscape(e.to().address())).append("\";\n");
        return sb.append("}\n").toString();
    }

    private static String label(Vertex v) {
        String value = v.dirty() ? "?" : Values.display(v.value());
        return v.formula() != null ? v.formula() + " = " + value : value;
    }

    /** Unique Mermaid node ids for one export. */
    private static final class MermaidIds {
        private final Map<Address, String> ids = new HashMap<>();
        private final Set<String> used = new HashSet<>();

        String of(Address address) {
            String id = ids.get(address);
            if (id != null)
                return id;
            String base = address.address().replaceAll("[^a-zA-Z0-9_]", "_");
            id = base;
            for (int n = 2; !used.add(id); n++)
                id = base + "_" + n;
            ids.put(address, id);
            return id;
        }
    }

    private static String escape(String text) {
        return text.replace("\"", "#quot;");
    }

    private static String dotEscape(String text) {
        return text.replace("\"", "\\\"");
    }
}
