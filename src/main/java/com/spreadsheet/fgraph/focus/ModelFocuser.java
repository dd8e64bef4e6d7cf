package com.spreadsheet.fgraph.focus;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

import com.spreadsheet.fgraph.address.Address;
import com.spreadsheet.fgraph.address.AddressRange;
import com.spreadsheet.fgraph.address.Addresses;
import com.spreadsheet.fgraph.api.Node;
import com.spreadsheet.fgraph.api.NodeKind;
import com.spreadsheet.fgraph.engine.Evaluator;
import com.spreadsheet.fgraph.engine.NodeFactory;
import com.spreadsheet.fgraph.engine.NodeStore;
import com.spreadsheet.fgraph.node.ConstantNode;

/**
 * Reduces the graph to what is needed to recompute a set of outputs from a set
 * of inputs.
 *
 * Steps:
 * 1. Build: every output is resolved, which creates its whole precedent
 * closure.
 * 2. Needed: walk precedents back from the outputs, stopping at declared input
 * cells. Inputs outside that set are unused.
 * 3. Sever: an input that holds a formula (a buried input) becomes a constant
 * with its last value, dropping its precedent edges.
 * 4. Reachable: walk dependents forward from the inputs, within the needed set.
 * 5. Prune: drop every node that is neither needed nor an input, then freeze
 * needed formula and range nodes that no input reaches. Freezing cuts edges,
 * so the needed set is recomputed and leftovers dropped.
 *
 * Afterwards changing an input and resolving an output gives the same answer
 * as on the full model.
 */
@Log4j2
public final class ModelFocuser {
    private final NodeStore store;
    private final NodeFactory factory;
    private final Evaluator evaluator;

    public ModelFocuser(NodeStore store, NodeFactory factory, Evaluator evaluator) {
        this.store = store;
        this.factory = factory;
        this.evaluator = evaluator;
    }

    /**
     * Focuses the graph on the given outputs.
     *
     * @param inputs  cells or ranges that callers will change afterwards; ranges
     *                stand for all their cells
     * @param outputs cells or ranges that callers will resolve afterwards
     * @throws DisconnectedOutputException if an output cannot be built
     * @throws UnreachableInputException   if an input cannot be located, or with
     *                                     {@link FocusOptions#strictInputs()} if
     *                                     no output depends on it
     */
    public FocusResult focus(Collection<? extends Address> inputs, Collection<? extends Address> outputs,
            FocusOptions options) {
        if (outputs.isEmpty())
            throw new IllegalArgumentException("At least one output is required");

        Set<Address> outs = new LinkedHashSet<>();
        for (Address o : outputs) {
            Address key = Addresses.normalize(o);
            if (!store.contains(key) && !factory.source().canBuild(key))
                throw new DisconnectedOutputException(key);
            outs.add(key);
        }
        for (Address o : outs)
            evaluator.resolve(o);

        Set<Address> inputCells = new LinkedHashSet<>();
        Set<Address> inputRanges = new LinkedHashSet<>();
        List<Address> missing = new ArrayList<>();
        for (Address in : inputs) {
            Address key = Addresses.normalize(in);
            if (!store.contains(key) && !factory.source().canBuild(key)) {
                missing.add(key);
                continue;
            }
            if (key instanceof AddressRange range) {
                if (store.contains(range))
                    inputRanges.add(range);
                inputCells.addAll(factory.cells(range));
            } else {
                inputCells.add(key);
            }
        }
        if (!missing.isEmpty())
            throw new UnreachableInputException("Inputs not found in the graph", missing);
        for (Address cell : inputCells)
            factory.ensure(cell);

        int before = store.size();
        Set<Address> needed = needed(outs, inputCells);
        Set<Address> unused = new LinkedHashSet<>();
        for (Address cell : inputCells)
            if (!needed.contains(cell))
                unused.add(cell);
        if (!unused.isEmpty() && options.strictInputs())
            throw new UnreachableInputException("No output depends on inputs", new ArrayList<>(unused));

        Set<Address> buried = new LinkedHashSet<>();
        for (Address cell : inputCells) {
            Node n = store.get(cell);
            if (n.kind() == NodeKind.FORMULA) {
                Object value = evaluator.resolve(cell);
                store.replace(new ConstantNode(cell, value));
                buried.add(cell);
            }
        }

        Set<Address> reachable = reachable(inputCells, needed);

        Set<Address> removed = new LinkedHashSet<>();
        removeAllExcept(needed, inputCells, inputRanges, removed);

        Set<Address> frozen = new LinkedHashSet<>();
        for (Address a : needed) {
            Node n = store.get(a);
            if (n == null || n.kind() == NodeKind.CONSTANT || reachable.contains(a))
                continue;
            Object value = n.isDirty() ? evaluator.resolve(a) : n.value();
            store.replace(new ConstantNode(a, value));
            frozen.add(a);
        }
        if (!frozen.isEmpty())
            removeAllExcept(needed(outs, inputCells), inputCells, inputRanges, removed);

        FocusResult result = new FocusResult(before, store.size(), new LinkedHashSet<>(store.addresses()), removed,
                frozen, buried, unused);
        for (Address cell : unused)
            log.warn("Input {} has no path to any output; kept as an unused constant", cell);
        log.info(result.summary());
        return result;
    }

    /** Outputs plus their precedent closure, not walking past input cells. */
    private Set<Address> needed(Set<Address> outputs, Set<Address> inputCells) {
        Set<Address> needed = new LinkedHashSet<>(outputs);
        Deque<Address> work = new ArrayDeque<>(outputs);
        while (!work.isEmpty()) {
            Address a = work.pop();
            if (inputCells.contains(a))
                continue;
            for (Address p : store.precedents(a))
                if (needed.add(p))
                    work.push(p);
        }
        return needed;
    }

    /** Dependents of the inputs, within {@code needed}, inputs included. */
    private Set<Address> reachable(Set<Address> inputCells, Set<Address> needed) {
        Set<Address> reachable = new LinkedHashSet<>();
        Deque<Address> work = new ArrayDeque<>();
        for (Address cell : inputCells) {
            if (needed.contains(cell) && reachable.add(cell))
                work.push(cell);
        }
        while (!work.isEmpty()) {
            Address a = work.pop();
            for (Address s : store.successors(a))
                if (needed.contains(s) && reachable.add(s))
                    work.push(s);
        }
        return reachable;
    }

    private void removeAllExcept(Set<Address> needed, Set<Address> inputCells, Set<Address> inputRanges,
            Set<Address> removed) {
        for (Address a : new ArrayList<>(store.addresses())) {
            if (needed.contains(a) || inputCells.contains(a) || inputRanges.contains(a))
                continue;
            store.remove(a);
            removed.add(a);
            log.debug("Removed {}", a);
        }
    }
}
