package com.spreadsheet.fgraph.focus;

/**
 * Options for {@link ModelFocuser#focus}.
 *
 * @param strictInputs fail with {@link UnreachableInputException} when an input
 *                     has no path to any output, instead of logging a warning
 */
public record FocusOptions(boolean strictInputs) {

    public static final FocusOptions DEFAULT = new FocusOptions(false);

    public static FocusOptions strict() {
        return new FocusOptions(true);
    }
}
