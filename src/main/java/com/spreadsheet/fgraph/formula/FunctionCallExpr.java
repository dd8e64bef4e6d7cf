package com.spreadsheet.fgraph.formula;

import java.util.List;
import java.util.stream.Collectors;

import com.spreadsheet.fgraph.api.EvaluationContext;

/**
 * Call of a registered function. Arguments are evaluated eagerly, left to
 * right; error arguments are passed through for the function to handle.
 * Throws {@link com.spreadsheet.fgraph.fn.FunctionNotImplementedException}
 * for unknown names.
 */
public record FunctionCallExpr(String name, List<Expr> arguments) implements Expr {

    public FunctionCallExpr {
        arguments = List.copyOf(arguments);
    }

    @Override
    public Object evaluate(EvaluationContext context) {
        Object[] args = new Object[arguments.size()];
        for (int i = 0; i < args.length; i++)
            args[i] = arguments.get(i).evaluate(context);
        return context.functions().invoke(name, args);
    }

    @Override
    public String describe() {
        return name + "(" + arguments.stream().map(Expr::describe).collect(Collectors.joining(",")) + ")";
    }
}
