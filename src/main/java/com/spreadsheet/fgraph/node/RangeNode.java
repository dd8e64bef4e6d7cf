package com.spreadsheet.fgraph.node;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.spreadsheet.fgraph.address.Address;
import com.spreadsheet.fgraph.address.AddressCell;
import com.spreadsheet.fgraph.address.AddressRange;
import com.spreadsheet.fgraph.api.EvaluationContext;
import com.spreadsheet.fgraph.api.NodeKind;
import com.spreadsheet.fgraph.api.RangeValue;

/**
 * Aggregates the cells of a range into one {@link RangeValue}. Its precedents
 * are exactly its constituent cells, in row-major order.
 */
public final class RangeNode extends CachedNode {
    private final List<AddressCell> cells;
    private final Set<Address> precedents;
    private final int rows;
    private final int columns;

    /**
     * @param range   the range address
     * @param cells   constituent cells, already clipped to the sheet extent
     * @param rows    row count of the resulting value
     * @param columns column count of the resulting value
     */
    public RangeNode(AddressRange range, List<AddressCell> cells, int rows, int columns) {
        super(range);
        if (rows * columns != cells.size())
            throw new IllegalArgumentException(
                    "Range " + range + " shape " + rows + "x" + columns + " does not match " + cells.size() + " cells");
        this.cells = List.copyOf(cells);
        this.precedents = Collections.unmodifiableSet(new LinkedHashSet<>(cells));
        this.rows = rows;
        this.columns = columns;
    }

    public AddressRange range() {
        return (AddressRange) address();
    }

    public List<AddressCell> cells() {
        return cells;
    }

    public int rows() {
        return rows;
    }

    public int columns() {
        return columns;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.RANGE;
    }

    @Override
    public Set<Address> precedents() {
        return precedents;
    }

    @Override
    public String formula() {
        return null;
    }

    @Override
    protected Object compute(EvaluationContext context) {
        Object[] values = new Object[cells.size()];
        for (int i = 0; i < values.length; i++)
            values[i] = context.valueOf(cells.get(i));
        return new RangeValue(rows, columns, values);
    }
}
