package com.spreadsheet.fgraph.engine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.spreadsheet.fgraph.address.Address;
import com.spreadsheet.fgraph.address.AddressCell;
import com.spreadsheet.fgraph.address.AddressRange;
import com.spreadsheet.fgraph.address.Addresses;
import com.spreadsheet.fgraph.api.EvaluationContext;
import com.spreadsheet.fgraph.api.EvaluationListener;
import com.spreadsheet.fgraph.api.Node;
import com.spreadsheet.fgraph.api.NodeKind;
import com.spreadsheet.fgraph.api.RangeValue;
import com.spreadsheet.fgraph.api.Values;
import com.spreadsheet.fgraph.fn.FunctionRegistry;
import com.spreadsheet.fgraph.node.ConstantNode;
import com.spreadsheet.fgraph.node.FormulaNode;
import com.spreadsheet.fgraph.node.RangeNode;

/**
 * Lazy, memoized, cycle-aware resolution of graph nodes.
 *
 * Algorithm Details:
 * Resolution is a pull-based depth-first walk driven by an explicit stack of
 * frames, so the depth of a dependency chain never touches the Java call stack.
 *
 * 1. Memoize: a frame whose node is clean is popped without work.
 *
 * 2. Expand: a dirty node is put on the current path and each of its dirty
 * precedents is pushed (nodes are created on first reference). A precedent
 * that is already on the path closes a cycle: an error by default, otherwise
 * the back edge reads the precedent's seed (its prior numeric value, else 0)
 * and the precedent is marked as a cycle head.
 *
 * 3. Evaluate: once every pushed precedent has been popped the node computes
 * its value, becomes clean and leaves the path.
 *
 * 4. Solve: when a cycle head completes, its strongly connected set (nodes of
 * this pass that both reach and are reached from the head) is re-evaluated in
 * dependency order, Gauss-Seidel style, until no member moves by the tolerance
 * or the iteration limit is hit. If that set still contains a node on the path,
 * solving is handed to that outer node instead.
 *
 * Invalidation is eager but shallow: {@link #setValue} marks transitive
 * dependents dirty with a work-list and recomputes nothing.
 *
 * Not thread-safe.
 */
public final class Evaluator {
    private static final Logger log = LogManager.getLogger(Evaluator.class);

    private final NodeStore store;
    private final NodeFactory factory;
    private final FunctionRegistry functions;
    private EvaluationConfig config;
    private EvaluationListener listener;

    public Evaluator(NodeStore store, NodeFactory factory, FunctionRegistry functions, EvaluationConfig config) {
        this.store = store;
        this.factory = factory;
        this.functions = functions;
        this.config = config;
    }

    public void setListener(EvaluationListener listener) {
        this.listener = listener;
    }

    public EvaluationListener listener() {
        return listener;
    }

    public EvaluationConfig config() {
        return config;
    }

    public void setConfig(EvaluationConfig config) {
        this.config = config;
    }

    /**
     * Resolves an address with the session configuration.
     *
     * @throws CircularReferenceException if a cycle is met and iterative solving
     *                                    is disabled
     */
    public Object resolve(Address address) {
        return resolveDetailed(address, config).value();
    }

    /** Resolves with iterative solving enabled for this call only. */
    public Object resolve(Address address, int maxIterations, double tolerance) {
        return resolveDetailed(address, EvaluationConfig.cycles(maxIterations, tolerance)).value();
    }

    public Resolution resolveDetailed(Address address) {
        return resolveDetailed(address, config);
    }

    public Resolution resolveDetailed(Address address, EvaluationConfig cfg) {
        Address key = Addresses.normalize(address);
        final EvaluationListener l = this.listener;
        if (l != null)
            l.onResolveStart(key);
        Pass pass = new Pass(cfg);
        try {
            Node root = factory.ensure(key);
            if (root.isDirty())
                pass.run(key);
            return new Resolution(root.value(), pass.warnings);
        } finally {
            if (l != null)
                l.onResolveEnd(key, pass.evaluations);
        }
    }

    /**
     * Overwrites a cell or range with a value. A formula cell becomes a
     * constant. Every transitive dependent is marked dirty; nothing is
     * recomputed until it is next resolved.
     *
     * <p>
     * For a range, a scalar is written to every cell, while a
     * {@link RangeValue} or {@code Object[][]} must match the range's shape.
     *
     * @throws IllegalArgumentException on a shape mismatch or an unsupported
     *                                  value type
     */
    public void setValue(Address address, Object value) {
        Address key = Addresses.normalize(address);
        Object v = Values.normalize(value);
        if (key instanceof AddressCell cell) {
            setCell(cell, v);
            return;
        }
        AddressRange range = (AddressRange) key;
        List<AddressCell> cells = factory.cells(range);
        if (v instanceof RangeValue rv) {
            int[] shape = factory.shape(range);
            if (rv.rows() != shape[0] || rv.columns() != shape[1])
                throw new IllegalArgumentException("Value of shape " + rv.rows() + "x" + rv.columns()
                        + " does not fit " + range + " of shape " + shape[0] + "x" + shape[1]);
            for (int i = 0; i < cells.size(); i++)
                setCell(cells.get(i), rv.get(i));
        } else {
            for (AddressCell cell : cells)
                setCell(cell, v);
        }
    }

    private void setCell(AddressCell cell, Object value) {
        Node node = factory.ensure(cell);
        if (node instanceof ConstantNode constant) {
            if (!constant.update(value))
                return;
        } else {
            store.replace(new ConstantNode(cell, value));
            log.debug("Replaced {} node {} with a constant", node.kind(), cell);
        }
        invalidateDependents(cell);
        if (value != null) {
            factory.extend(cell);
            widenRanges(cell);
        }
    }

    /**
     * Rebuilds open ranges that cover the cell but were clipped short of it when
     * built, so their dependents read the new cell.
     */
    private void widenRanges(AddressCell cell) {
        List<AddressRange> stale = new ArrayList<>();
        for (Node n : store.nodes())
            if (n instanceof RangeNode r && r.range().contains(cell) && !r.precedents().contains(cell))
                stale.add(r.range());
        for (AddressRange range : stale) {
            store.replace(factory.rebuild(range));
            invalidateDependents(range);
            log.debug("Widened {} to cover {}", range, cell);
        }
    }

    /** Marks the node at the address and all its transitive dependents dirty. */
    public int invalidate(Address address) {
        Address key = Addresses.normalize(address);
        Node node = store.get(key);
        if (node != null)
            node.markDirty();
        return invalidateDependents(key) + (node != null ? 1 : 0);
    }

    /**
     * Marks every transitive dependent of the address dirty.
     *
     * @return number of nodes visited
     */
    public int invalidateDependents(Address address) {
        Deque<Address> work = new ArrayDeque<>(store.successors(address));
        Set<Address> seen = new HashSet<>();
        while (!work.isEmpty()) {
            Address a = work.pop();
            if (!seen.add(a))
                continue;
            Node n = store.get(a);
            if (n == null)
                continue;
            n.markDirty();
            work.addAll(store.successors(a));
        }
        return seen.size();
    }

    /**
     * Marks every formula and range node dirty and resolves them all again.
     *
     * @return warnings from cycles that did not converge
     */
    public List<ConvergenceWarning> recalculate() {
        List<Address> targets = new ArrayList<>();
        for (Node n : store.nodes()) {
            if (n.kind() != NodeKind.CONSTANT) {
                n.markDirty();
                targets.add(n.address());
            }
        }
        List<ConvergenceWarning> warnings = new ArrayList<>();
        for (Address a : targets) {
            if (store.contains(a))
                warnings.addAll(resolveDetailed(a).warnings());
        }
        log.debug("Recalculated {} nodes", targets.size());
        return warnings;
    }

    private static final class Frame {
        final Address address;
        boolean expanded;

        Frame(Address address) {
            this.address = address;
        }
    }

    /** State of one top-level resolve. */
    private final class Pass implements EvaluationContext {
        private final EvaluationConfig cfg;
        private final Deque<Frame> stack = new ArrayDeque<>();
        // Expanded frames not yet popped, in push order: the current path.
        private final LinkedHashSet<Address> path = new LinkedHashSet<>();
        private final Set<Address> visited = new HashSet<>();
        private final List<Address> postOrder = new ArrayList<>();
        private final Set<Address> cycleHeads = new HashSet<>();
        private final List<ConvergenceWarning> warnings = new ArrayList<>();
        private AddressCell current;
        private int evaluations;

        Pass(EvaluationConfig cfg) {
            this.cfg = cfg;
        }

        void run(Address root) {
            stack.push(new Frame(root));
            while (!stack.isEmpty()) {
                Frame f = stack.peek();
                Node node = store.get(f.address);
                if (!f.expanded) {
                    if (node == null || !node.isDirty()) {
                        stack.pop();
                        continue;
                    }
                    expand(f, node);
                    continue;
                }
                stack.pop();
                evaluate(node);
                postOrder.add(f.address);
                path.remove(f.address);
                if (cycleHeads.remove(f.address))
                    solveCycle(f.address);
            }
        }

        private void expand(Frame f, Node node) {
            f.expanded = true;
            path.add(f.address);
            visited.add(f.address);
            for (Address p : node.precedents()) {
                Node pn = factory.ensure(p);
                if (!pn.isDirty())
                    continue;
                if (path.contains(p)) {
                    if (!cfg.iterative())
                        throw new CircularReferenceException(pathFrom(p));
                    cycleHeads.add(p);
                    continue;
                }
                stack.push(new Frame(p));
            }
        }

        private List<Address> pathFrom(Address start) {
            List<Address> members = new ArrayList<>();
            boolean on = false;
            for (Address a : path) {
                if (a.equals(start))
                    on = true;
                if (on)
                    members.add(a);
            }
            return members;
        }

        private boolean evaluate(Node node) {
            final EvaluationListener l = listener;
            current = node.address() instanceof AddressCell c ? c : null;
            long start = l != null ? System.nanoTime() : 0;
            boolean changed = node.evaluate(this);
            evaluations++;
            if (l != null) {
                l.onNodeEvaluated(node.address(), changed, System.nanoTime() - start);
                if (node instanceof FormulaNode fn && fn.failure() != null)
                    l.onNodeError(node.address(), fn.failure());
            }
            return changed;
        }

        private void solveCycle(Address head) {
            Set<Address> members = stronglyConnected(head);
            for (Address a : path) {
                if (members.contains(a)) {
                    // an enclosing cycle is still open; solve it as a whole later
                    cycleHeads.add(a);
                    return;
                }
            }
            List<Address> order = new ArrayList<>(members.size());
            for (Address a : postOrder)
                if (members.contains(a) && !order.contains(a))
                    order.add(a);

            final EvaluationListener l = listener;
            int iteration = 1;
            double delta = Double.NaN;
            boolean converged = false;
            while (iteration < cfg.maxIterations()) {
                iteration++;
                delta = 0.0;
                for (Address a : order) {
                    Node n = store.get(a);
                    Object before = n.value();
                    evaluate(n);
                    delta = Math.max(delta, difference(before, n.value()));
                }
                if (l != null)
                    l.onCycleIteration(head, iteration, delta);
                if (delta < cfg.tolerance()) {
                    converged = true;
                    break;
                }
            }
            if (converged) {
                log.debug("Cycle at {} ({} members) converged after {} iterations", head, order.size(), iteration);
                return;
            }
            ConvergenceWarning warning = new ConvergenceWarning(head, order, iteration, delta);
            warnings.add(warning);
            log.warn(warning.toString());
            if (l != null)
                l.onConvergenceFailure(warning);
        }

        /** Nodes of this pass reachable from the head both ways, head included. */
        private Set<Address> stronglyConnected(Address head) {
            Set<Address> down = new HashSet<>();
            Deque<Address> work = new ArrayDeque<>();
            work.push(head);
            while (!work.isEmpty()) {
                Address a = work.pop();
                for (Address p : store.precedents(a))
                    if (visited.contains(p) && down.add(p))
                        work.push(p);
            }
            Set<Address> members = new LinkedHashSet<>();
            Set<Address> up = new HashSet<>();
            work.push(head);
            while (!work.isEmpty()) {
                Address a = work.pop();
                for (Address s : store.successors(a))
                    if (visited.contains(s) && up.add(s))
                        work.push(s);
            }
            for (Address a : up)
                if (down.contains(a))
                    members.add(a);
            members.add(head);
            return members;
        }

        private double difference(Object before, Object after) {
            if (before instanceof Double x && after instanceof Double y)
                return Math.abs(x - y);
            if (Objects.equals(before, after))
                return 0.0;
            return Double.POSITIVE_INFINITY;
        }

        @Override
        public Object valueOf(Address address) {
            Node n = store.get(address);
            if (n == null)
                n = factory.ensure(address);
            if (n.isDirty()) {
                // back edge inside a cycle: read the seed
                Object v = n.value();
                return v instanceof Double ? v : 0.0;
            }
            return n.value();
        }

        @Override
        public FunctionRegistry functions() {
            return functions;
        }

        @Override
        public AddressCell currentCell() {
            return current;
        }
    }
}
