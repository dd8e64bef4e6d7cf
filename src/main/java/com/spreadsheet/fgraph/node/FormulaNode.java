package com.spreadsheet.fgraph.node;

import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.spreadsheet.fgraph.address.Address;
import com.spreadsheet.fgraph.address.AddressCell;
import com.spreadsheet.fgraph.api.EvaluationContext;
import com.spreadsheet.fgraph.api.ExcelError;
import com.spreadsheet.fgraph.api.ExcelErrorException;
import com.spreadsheet.fgraph.api.NodeKind;
import com.spreadsheet.fgraph.api.Values;
import com.spreadsheet.fgraph.fn.FunctionNotImplementedException;
import com.spreadsheet.fgraph.formula.CompiledFormula;
import com.spreadsheet.fgraph.util.ErrorRateLimiter;

/**
 * A cell holding a formula.
 *
 * <p>
 * Failures stay local to the node: a syntax error yields {@code #VALUE!}, an
 * unknown function {@code #NAME?}, and any other exception thrown while
 * evaluating yields {@code #VALUE!} and is logged (throttled). The cause of the
 * last such failure is kept for diagnostics in {@link #failure()}.
 */
public final class FormulaNode extends CachedNode {
    private static final Logger log = LogManager.getLogger(FormulaNode.class);
    private static final ErrorRateLimiter limiter = new ErrorRateLimiter(log, 1000);

    private final CompiledFormula compiled;
    private RuntimeException failure;

    public FormulaNode(AddressCell address, CompiledFormula compiled) {
        super(address);
        this.compiled = compiled;
        this.failure = compiled.syntaxError();
    }

    public CompiledFormula compiled() {
        return compiled;
    }

    /** Cause of the last failed evaluation, or null. */
    public RuntimeException failure() {
        return failure;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FORMULA;
    }

    @Override
    public Set<Address> precedents() {
        return compiled.precedents();
    }

    @Override
    public String formula() {
        return compiled.text();
    }

    @Override
    protected Object compute(EvaluationContext context) {
        failure = compiled.syntaxError();
        try {
            return Values.normalize(compiled.evaluate(context));
        } catch (FunctionNotImplementedException e) {
            failure = e;
            return ExcelError.NAME.withDetail(e.functionName());
        } catch (ExcelErrorException e) {
            return e.error();
        } catch (RuntimeException e) {
            failure = e;
            limiter.log("Error evaluating " + address().address() + " '" + compiled.text() + "'", e);
            return ExcelError.VALUE.withDetail(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
