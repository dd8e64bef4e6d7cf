package com.spreadsheet.fgraph.util;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

import com.spreadsheet.fgraph.address.Address;
import com.spreadsheet.fgraph.address.AddressCell;
import com.spreadsheet.fgraph.address.Addresses;
import com.spreadsheet.fgraph.api.FormulaGraphException;
import com.spreadsheet.fgraph.api.Node;
import com.spreadsheet.fgraph.api.NodeKind;
import com.spreadsheet.fgraph.engine.Evaluator;
import com.spreadsheet.fgraph.engine.NodeFactory;
import com.spreadsheet.fgraph.engine.NodeStore;
import com.spreadsheet.fgraph.fn.FunctionNotImplementedException;
import com.spreadsheet.fgraph.node.FormulaNode;
import com.spreadsheet.fgraph.source.CellContent;
import com.spreadsheet.fgraph.source.WorkbookSource;

/**
 * Recomputes formula cells and compares them with the values the spreadsheet
 * application cached in the workbook.
 *
 * <p>
 * Numbers agree when {@code |actual - expected| <= tolerance * (1 + |expected|)};
 * other values must be equal (error values compare by code). Cells are checked
 * against the graph's current state, so inputs changed with
 * {@link Evaluator#setValue} show up as mismatches.
 */
@Log4j2
public final class CalcValidator {
    public static final double DEFAULT_TOLERANCE = 1e-4;

    private final NodeStore store;
    private final NodeFactory factory;
    private final Evaluator evaluator;

    public CalcValidator(NodeStore store, NodeFactory factory, Evaluator evaluator) {
        this.store = store;
        this.factory = factory;
        this.evaluator = evaluator;
    }

    /**
     * Validates the formula cells feeding the given outputs, or every formula
     * cell of the workbook when {@code outputs} is empty.
     */
    public ValidationReport validate(Collection<? extends Address> outputs, double tolerance) {
        ValidationReport report = new ValidationReport();
        for (AddressCell cell : targets(outputs, report))
            check(cell, tolerance, report);
        if (report.isClean())
            log.info(report.summary());
        else
            log.warn(report.summary());
        return report;
    }

    private Set<AddressCell> targets(Collection<? extends Address> outputs, ValidationReport report) {
        Set<AddressCell> targets = new LinkedHashSet<>();
        WorkbookSource source = factory.source();
        if (outputs.isEmpty()) {
            for (String sheet : source.sheetNames())
                for (AddressCell cell : source.populatedCells(sheet)) {
                    CellContent content = source.cell(cell);
                    if (content != null && content.isFormula())
                        targets.add(cell);
                }
            return targets;
        }
        Deque<Address> work = new ArrayDeque<>();
        Set<Address> seen = new LinkedHashSet<>();
        for (Address o : outputs) {
            Address key = Addresses.normalize(o);
            try {
                evaluator.resolve(key);
            } catch (FormulaGraphException e) {
                report.add(new Discrepancy(key, Discrepancy.Category.EXCEPTIONS, null, null, e.getMessage()));
                continue;
            }
            if (seen.add(key))
                work.push(key);
        }
        while (!work.isEmpty()) {
            Address a = work.pop();
            Node n = store.get(a);
            if (n == null)
                continue;
            if (n.kind() == NodeKind.FORMULA)
                targets.add((AddressCell) a);
            for (Address p : n.precedents())
                if (seen.add(p))
                    work.push(p);
        }
        return targets;
    }

    private void check(AddressCell cell, double tolerance, ValidationReport report) {
        CellContent content = factory.source().cell(cell);
        Object expected = content == null ? null : content.cachedValue();
        if (content == null || !content.isFormula() || expected == null) {
            report.countSkipped();
            return;
        }
        report.countChecked();
        Object actual;
        try {
            actual = evaluator.resolve(cell);
        } catch (FormulaGraphException e) {
            report.add(new Discrepancy(cell, Discrepancy.Category.EXCEPTIONS, expected, null, e.getMessage()));
            return;
        }
        if (store.get(cell) instanceof FormulaNode fn && fn.failure() != null) {
            RuntimeException failure = fn.failure();
            if (failure instanceof FunctionNotImplementedException missing)
                report.add(new Discrepancy(cell, Discrepancy.Category.NOT_IMPLEMENTED, expected, actual,
                        missing.functionName()));
            else
                report.add(new Discrepancy(cell, Discrepancy.Category.EXCEPTIONS, expected, actual,
                        failure.getMessage()));
            return;
        }
        if (!agree(expected, actual, tolerance)) {
            report.add(new Discrepancy(cell, Discrepancy.Category.MISMATCH, expected, actual, null));
            log.debug("Mismatch at {}: expected {}, got {}", cell, expected, actual);
        }
    }

    /** True when the values match within the tolerance; expected must not be null. */
    public static boolean agree(Object expected, Object actual, double tolerance) {
        if (expected instanceof Double e && actual instanceof Double a)
            return Math.abs(a - e) <= tolerance * (1 + Math.abs(e));
        return expected.equals(actual);
    }
}
