package com.spreadsheet.fgraph.focus;

import com.spreadsheet.fgraph.address.Address;
import com.spreadsheet.fgraph.api.FormulaGraphException;

/**
 * A requested output has no node and none can be built for it.
 */
public class DisconnectedOutputException extends FormulaGraphException {
    private final Address output;

    public DisconnectedOutputException(Address output) {
        super("Output " + output.address() + " is not part of the graph");
        this.output = output;
    }

    public Address output() {
        return output;
    }
}
