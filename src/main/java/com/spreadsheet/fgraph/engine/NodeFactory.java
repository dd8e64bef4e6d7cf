package com.spreadsheet.fgraph.engine;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

import com.spreadsheet.fgraph.address.Address;
import com.spreadsheet.fgraph.address.AddressCell;
import com.spreadsheet.fgraph.address.AddressRange;
import com.spreadsheet.fgraph.address.Addresses;
import com.spreadsheet.fgraph.api.Node;
import com.spreadsheet.fgraph.formula.CompiledFormula;
import com.spreadsheet.fgraph.formula.FormulaParser;
import com.spreadsheet.fgraph.node.ConstantNode;
import com.spreadsheet.fgraph.node.FormulaNode;
import com.spreadsheet.fgraph.node.RangeNode;
import com.spreadsheet.fgraph.source.CellContent;
import com.spreadsheet.fgraph.source.WorkbookSource;

/**
 * Builds nodes on first reference from the workbook source.
 *
 * - Empty or literal cell: {@link ConstantNode}.
 * - Formula cell: {@link FormulaNode}, compiled once here.
 * - Range: {@link RangeNode} over its cells, open bounds clipped to the sheet's
 * populated extent. Cells assigned after loading widen that extent.
 */
@Log4j2
public final class NodeFactory {
    private final NodeStore store;
    private final WorkbookSource source;
    // sheet -> {maxRow, maxColumn} of cells assigned through the evaluator
    private final Map<String, int[]> assigned = new HashMap<>();

    public NodeFactory(NodeStore store, WorkbookSource source) {
        this.store = store;
        this.source = source;
    }

    /** Returns the node at the (normalized) address, creating it if needed. */
    public Node ensure(Address address) {
        Address key = Addresses.normalize(address);
        Node node = store.get(key);
        if (node != null)
            return node;
        node = build(key);
        store.add(node);
        log.debug("Created {} node {}", node.kind(), key);
        return node;
    }

    /**
     * Expands a range to its cells with the same clipping the range node uses.
     */
    public List<AddressCell> cells(AddressRange range) {
        return range.cells(rowLimit(range), columnLimit(range));
    }

    /** Shape {@code {rows, columns}} of {@link #cells(AddressRange)}. */
    public int[] shape(AddressRange range) {
        return range.shape(rowLimit(range), columnLimit(range));
    }

    /** Builds a fresh range node with the current extent of its sheet. */
    public RangeNode rebuild(AddressRange range) {
        int[] shape = shape(range);
        return new RangeNode(range, cells(range), shape[0], shape[1]);
    }

    /** Records an assigned cell so later range expansion reaches it. */
    public void extend(AddressCell cell) {
        int[] extent = assigned.computeIfAbsent(cell.sheet(), k -> new int[2]);
        extent[0] = Math.max(extent[0], cell.row());
        extent[1] = Math.max(extent[1], cell.column());
    }

    public WorkbookSource source() {
        return source;
    }

    private Node build(Address address) {
        if (address instanceof AddressCell cell) {
            CellContent content = source.cell(cell);
            if (content == null)
                return new ConstantNode(cell, null);
            if (content.isFormula()) {
                CompiledFormula compiled = FormulaParser.compile(content.formula(), cell, source);
                return new FormulaNode(cell, compiled);
            }
            return new ConstantNode(cell, content.value());
        }
        return rebuild((AddressRange) address);
    }

    private int rowLimit(AddressRange range) {
        int[] extent = assigned.get(range.sheet());
        return Math.max(Math.max(source.maxRow(range.sheet()), extent == null ? 0 : extent[0]), 1);
    }

    private int columnLimit(AddressRange range) {
        int[] extent = assigned.get(range.sheet());
        return Math.max(Math.max(source.maxColumn(range.sheet()), extent == null ? 0 : extent[1]), 1);
    }
}
