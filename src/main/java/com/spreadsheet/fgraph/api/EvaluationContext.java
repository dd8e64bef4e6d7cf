package com.spreadsheet.fgraph.api;

import com.spreadsheet.fgraph.address.Address;
import com.spreadsheet.fgraph.address.AddressCell;
import com.spreadsheet.fgraph.fn.FunctionRegistry;

/**
 * What a node sees while it evaluates.
 */
public interface EvaluationContext {

    /** Current value of an already-resolved precedent. */
    Object valueOf(Address address);

    FunctionRegistry functions();

    /** The cell being evaluated, for functions such as ROW(). */
    AddressCell currentCell();
}
