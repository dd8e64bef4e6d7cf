package com.spreadsheet.fgraph.engine;

import java.util.List;

/**
 * Value of a resolved address with any convergence warnings raised while
 * computing it.
 */
public record Resolution(Object value, List<ConvergenceWarning> warnings) {

    public Resolution {
        warnings = List.copyOf(warnings);
    }

    public boolean converged() {
        return warnings.isEmpty();
    }
}
