package com.spreadsheet.fgraph.formula;

/**
 * A lexical token.
 *
 * @param type     category
 * @param text     source text; for strings the unescaped content
 * @param position 0-based offset of the token in the formula text
 */
public record Token(TokenType type, String text, int position) {

    public boolean is(TokenType t, String s) {
        return type == t && text.equals(s);
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + position;
    }
}
