package com.spreadsheet.fgraph.formula;

import com.spreadsheet.fgraph.api.FormulaGraphException;

/**
 * Malformed formula text. Carries the offending token and its position.
 */
public class FormulaSyntaxException extends FormulaGraphException {
    private final String token;
    private final int position;

    public FormulaSyntaxException(String message, String token, int position) {
        super(message + " at position " + position + (token == null || token.isEmpty() ? "" : " near '" + token + "'"));
        this.token = token;
        this.position = position;
    }

    public FormulaSyntaxException(String message, Token token) {
        this(message, token.text(), token.position());
    }

    public String token() {
        return token;
    }

    public int position() {
        return position;
    }
}
