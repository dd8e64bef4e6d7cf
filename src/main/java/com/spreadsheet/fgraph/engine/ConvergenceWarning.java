package com.spreadsheet.fgraph.engine;

import java.util.List;

import com.spreadsheet.fgraph.address.Address;

/**
 * Iterative solving of a cycle stopped at the iteration limit before every
 * member changed by less than the tolerance. The members keep the values of the
 * last sweep.
 *
 * @param head       address at which the cycle was entered
 * @param members    cycle members in evaluation order
 * @param iterations sweeps performed, the first pass included
 * @param lastDelta  largest absolute change in the last sweep
 */
public record ConvergenceWarning(Address head, List<Address> members, int iterations, double lastDelta) {

    public ConvergenceWarning {
        members = List.copyOf(members);
    }

    @Override
    public String toString() {
        return "Cycle at " + head.address() + " (" + members.size() + " members) did not converge after "
                + iterations + " iterations, last delta " + lastDelta;
    }
}
