package com.spreadsheet.fgraph.focus;

import java.util.Set;

import com.spreadsheet.fgraph.address.Address;

/**
 * What focusing did to the graph.
 *
 * @param nodesBefore  node count before focusing (after outputs were built)
 * @param nodesAfter   node count after focusing
 * @param retained     addresses still in the store
 * @param removed      addresses dropped from the store
 * @param frozen       formula and range nodes turned into constants
 * @param buriedInputs inputs that held formulas and were cut loose
 * @param unusedInputs inputs no output depends on
 */
public record FocusResult(int nodesBefore, int nodesAfter, Set<Address> retained, Set<Address> removed,
        Set<Address> frozen, Set<Address> buriedInputs, Set<Address> unusedInputs) {

    public FocusResult {
        retained = Set.copyOf(retained);
        removed = Set.copyOf(removed);
        frozen = Set.copyOf(frozen);
        buriedInputs = Set.copyOf(buriedInputs);
        unusedInputs = Set.copyOf(unusedInputs);
    }

    public String summary() {
        return "Focused graph: " + nodesBefore + " -> " + nodesAfter + " nodes (" + removed.size() + " removed, "
                + frozen.size() + " frozen, " + buriedInputs.size() + " buried inputs, " + unusedInputs.size()
                + " unused inputs)";
    }
}
