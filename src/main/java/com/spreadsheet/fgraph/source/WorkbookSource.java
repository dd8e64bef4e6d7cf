package com.spreadsheet.fgraph.source;

import java.util.Collection;

import com.spreadsheet.fgraph.address.Address;
import com.spreadsheet.fgraph.address.AddressCell;
import com.spreadsheet.fgraph.address.DefinedName;
import com.spreadsheet.fgraph.address.NameResolver;
import com.spreadsheet.fgraph.address.TableDefinition;

/**
 * Read access to a spreadsheet: cell contents, sheet extents, defined names
 * and tables. The graph pulls cells from here the first time they are
 * referenced.
 */
public interface WorkbookSource extends NameResolver {

    /** Workbook name used in logs and snapshots. */
    String name();

    /** Contents of a cell, or null if the cell is empty. */
    CellContent cell(AddressCell address);

    /** Sheet names in workbook order. */
    Collection<String> sheetNames();

    /** Non-empty cells of a sheet in row-major order. */
    Collection<AddressCell> populatedCells(String sheet);

    /** Largest populated row of the sheet, 0 if the sheet is empty. */
    int maxRow(String sheet);

    /** Largest populated column of the sheet, 0 if the sheet is empty. */
    int maxColumn(String sheet);

    Collection<DefinedName> definedNames();

    Collection<TableDefinition> tables();

    default boolean hasSheet(String sheet) {
        return sheetNames().contains(sheet);
    }

    /**
     * True when a node for the address could be built from this source: its
     * sheet exists in the workbook.
     */
    default boolean canBuild(Address address) {
        return hasSheet(address.sheet());
    }
}
