package com.spreadsheet.fgraph.focus;

import java.util.List;
import java.util.stream.Collectors;

import com.spreadsheet.fgraph.address.Address;
import com.spreadsheet.fgraph.api.FormulaGraphException;

/**
 * A declared input cannot be located in the graph, or (with strict inputs) no
 * requested output depends on it.
 */
public class UnreachableInputException extends FormulaGraphException {
    private final List<Address> inputs;

    public UnreachableInputException(String reason, List<Address> inputs) {
        super(reason + ": " + inputs.stream().map(Address::address).collect(Collectors.joining(", ")));
        this.inputs = List.copyOf(inputs);
    }

    public List<Address> inputs() {
        return inputs;
    }
}
