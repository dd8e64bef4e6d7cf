package com.spreadsheet.fgraph.engine;

import java.util.List;
import java.util.stream.Collectors;

import com.spreadsheet.fgraph.address.Address;
import com.spreadsheet.fgraph.api.FormulaGraphException;

/**
 * Thrown when resolution re-enters an address that is already on the current
 * resolution path and iterative solving is disabled.
 */
public class CircularReferenceException extends FormulaGraphException {
    private final List<Address> members;

    /**
     * @param members the cycle in path order, starting at the re-entered address
     */
    public CircularReferenceException(List<Address> members) {
        super("Circular reference: " + members.stream().map(Address::address).collect(Collectors.joining(" -> "))
                + " -> " + members.get(0).address());
        this.members = List.copyOf(members);
    }

    public List<Address> members() {
        return members;
    }
}
