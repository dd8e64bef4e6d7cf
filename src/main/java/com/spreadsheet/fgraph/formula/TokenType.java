package com.spreadsheet.fgraph.formula;

/** Lexical categories produced by {@link FormulaTokenizer}. */
public enum TokenType {
    NUMBER,
    STRING,
    BOOLEAN,
    ERROR,
    /** Cell or range reference, possibly sheet-qualified. */
    REFERENCE,
    /** Identifier that is not a reference: a defined name or table name. */
    NAME,
    /** {@code Table[Column]} and friends. */
    STRUCTURED_REF,
    /** Identifier immediately followed by {@code (}. */
    FUNCTION,
    OPERATOR,
    LPAREN,
    RPAREN,
    COMMA,
    END
}
