package com.spreadsheet.fgraph.formula;

import java.util.Collections;
import java.util.Set;

import com.spreadsheet.fgraph.address.Address;
import com.spreadsheet.fgraph.address.AddressCell;
import com.spreadsheet.fgraph.api.EvaluationContext;
import com.spreadsheet.fgraph.api.ExcelError;

/**
 * Result of compiling one formula for one cell: either an expression with its
 * precedent addresses, or the syntax error that stopped compilation.
 */
public final class CompiledFormula {
    private final String text;
    private final AddressCell cell;
    private final Expr expression;
    private final Set<Address> precedents;
    private final FormulaSyntaxException syntaxError;

    CompiledFormula(String text, AddressCell cell, Expr expression, Set<Address> precedents) {
        this.text = text;
        this.cell = cell;
        this.expression = expression;
        this.precedents = Collections.unmodifiableSet(precedents);
        this.syntaxError = null;
    }

    CompiledFormula(String text, AddressCell cell, FormulaSyntaxException syntaxError) {
        this.text = text;
        this.cell = cell;
        this.expression = null;
        this.precedents = Collections.emptySet();
        this.syntaxError = syntaxError;
    }

    public String text() {
        return text;
    }

    public AddressCell cell() {
        return cell;
    }

    /** Null when compilation failed. */
    public Expr expression() {
        return expression;
    }

    /** Normalized addresses referenced by the expression, in first-reference order. */
    public Set<Address> precedents() {
        return precedents;
    }

    public boolean hasSyntaxError() {
        return syntaxError != null;
    }

    public FormulaSyntaxException syntaxError() {
        return syntaxError;
    }

    /**
     * Evaluates the expression; a formula that failed to compile yields
     * {@code #VALUE!} carrying the syntax message.
     */
    public Object evaluate(EvaluationContext context) {
        if (syntaxError != null)
            return ExcelError.VALUE.withDetail(syntaxError.getMessage());
        return expression.evaluate(context);
    }

    @Override
    public String toString() {
        return cell + ": " + text;
    }
}
