package com.spreadsheet.fgraph.util;

import com.spreadsheet.fgraph.address.Address;
import com.spreadsheet.fgraph.api.Values;

/**
 * One line of a {@link ValueTree}.
 *
 * @param cycle true when the address is already on the path from the root;
 *              its precedents are not walked again
 */
public record ValueTreeEntry(Address address, Object value, int depth, boolean cycle) {

    /** {@code depth} spaces, then {@code address = value}. */
    public String line() {
        return " ".repeat(depth) + address.address() + " = " + Values.display(value) + (cycle ? " <- cycle" : "");
    }
}
