package com.spreadsheet.fgraph.formula;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.spreadsheet.fgraph.address.Addresses;
import com.spreadsheet.fgraph.api.ExcelError;

/**
 * Splits formula text into {@link Token}s.
 *
 * <p>
 * The tokenizer decides between references and names: a word is a
 * {@link TokenType#REFERENCE} only if it reads as a cell, column span or row
 * span within sheet bounds ({@code XFD1048576}); {@code ABCD1} is therefore a
 * {@link TokenType#NAME}. An identifier followed by {@code (} is a function,
 * one followed by {@code [} a structured table reference.
 */
public final class FormulaTokenizer {
    private static final String CELL = "\\$?[A-Za-z]{1,3}\\$?[0-9]+";
    private static final Pattern COORDINATES = Pattern.compile(
            CELL + ":" + CELL + "|\\$?[A-Za-z]{1,3}:\\$?[A-Za-z]{1,3}|\\$?[0-9]+:\\$?[0-9]+|" + CELL);
    private static final Pattern ROW_SPAN = Pattern.compile("\\$?[0-9]+:\\$?[0-9]+");
    private static final Pattern NUMBER = Pattern.compile("([0-9]+\\.?[0-9]*|\\.[0-9]+)([eE][+-]?[0-9]+)?");
    private static final Pattern WORD = Pattern.compile("[A-Za-z_\\\\][A-Za-z0-9_.]*");
    private static final String[] ERROR_CODES = { "#DIV/0!", "#VALUE!", "#NULL!", "#NAME?", "#REF!", "#NUM!",
            "#N/A" };

    private final String text;
    private final List<Token> tokens = new ArrayList<>();
    private int pos;

    private FormulaTokenizer(String text) {
        this.text = text;
        this.pos = text.startsWith("=") ? 1 : 0;
    }

    /**
     * Tokenizes a formula. A leading {@code =} is skipped; the returned list
     * always ends with an {@link TokenType#END} token.
     *
     * @throws FormulaSyntaxException on characters that start no token
     */
    public static List<Token> tokenize(String formula) {
        FormulaTokenizer t = new FormulaTokenizer(formula);
        t.run();
        return t.tokens;
    }

    private void run() {
        while (true) {
            skipWhitespace();
            if (pos >= text.length()) {
                tokens.add(new Token(TokenType.END, "", pos));
                return;
            }
            char c = text.charAt(pos);
            int start = pos;
            switch (c) {
                case '"' -> readString();
                case '#' -> readError();
                case '\'' -> readQuotedReference();
                case '(' -> single(TokenType.LPAREN);
                case ')' -> single(TokenType.RPAREN);
                case ',' -> single(TokenType.COMMA);
                case '{' -> throw new FormulaSyntaxException("Array constants are not supported", "{", start);
                case '+', '-', '*', '/', '^', '&', '=', '%' -> single(TokenType.OPERATOR);
                case '<', '>' -> readComparison();
                default -> {
                    if (Character.isDigit(c) || (c == '.' && pos + 1 < text.length()
                            && Character.isDigit(text.charAt(pos + 1))))
                        readNumberOrRowSpan();
                    else if (Character.isLetter(c) || c == '$' || c == '_' || c == '\\')
                        readWord();
                    else
                        throw new FormulaSyntaxException("Unexpected character", String.valueOf(c), start);
                }
            }
        }
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos)))
            pos++;
    }

    private void single(TokenType type) {
        tokens.add(new Token(type, String.valueOf(text.charAt(pos)), pos));
        pos++;
    }

    private void readComparison() {
        int start = pos;
        char c = text.charAt(pos);
        char next = pos + 1 < text.length() ? text.charAt(pos + 1) : 0;
        String op;
        if (c == '<' && (next == '>' || next == '='))
            op = "<" + next;
        else if (c == '>' && next == '=')
            op = ">=";
        else
            op = String.valueOf(c);
        pos += op.length();
        tokens.add(new Token(TokenType.OPERATOR, op, start));
    }

    private void readString() {
        int start = pos;
        StringBuilder sb = new StringBuilder();
        pos++;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '"') {
                if (pos + 1 < text.length() && text.charAt(pos + 1) == '"') {
                    sb.append('"');
                    pos += 2;
                    continue;
                }
                pos++;
                tokens.add(new Token(TokenType.STRING, sb.toString(), start));
                return;
            }
            sb.append(c);
            pos++;
        }
        throw new FormulaSyntaxException("Unterminated string literal", text.substring(start), start);
    }

    private void readError() {
        for (String code : ERROR_CODES) {
            if (text.regionMatches(true, pos, code, 0, code.length())) {
                tokens.add(new Token(TokenType.ERROR, ExcelError.fromCode(code).code(), pos));
                pos += code.length();
                return;
            }
        }
        throw new FormulaSyntaxException("Unknown error literal", wordAt(pos), pos);
    }

    private void readQuotedReference() {
        int start = pos;
        int i = pos + 1;
        while (true) {
            if (i >= text.length())
                throw new FormulaSyntaxException("Unterminated sheet name", text.substring(start), start);
            if (text.charAt(i) == '\'') {
                if (i + 1 < text.length() && text.charAt(i + 1) == '\'') {
                    i += 2;
                    continue;
                }
                break;
            }
            i++;
        }
        if (i + 1 >= text.length() || text.charAt(i + 1) != '!')
            throw new FormulaSyntaxException("Expected '!' after sheet name", text.substring(start, i + 1), start);
        pos = i + 2;
        readCoordinatesAfterSheet(start);
    }

    private void readCoordinatesAfterSheet(int start) {
        Matcher m = COORDINATES.matcher(text).region(pos, text.length());
        if (!m.lookingAt() || continuesWord(m.end()))
            throw new FormulaSyntaxException("Bad reference", text.substring(start, Math.min(text.length(), pos + 1)),
                    start);
        pos = m.end();
        tokens.add(new Token(TokenType.REFERENCE, text.substring(start, pos), start));
    }

    private void readNumberOrRowSpan() {
        int start = pos;
        Matcher rows = ROW_SPAN.matcher(text).region(pos, text.length());
        if (rows.lookingAt() && !continuesWord(rows.end())) {
            pos = rows.end();
            tokens.add(new Token(TokenType.REFERENCE, text.substring(start, pos), start));
            return;
        }
        Matcher m = NUMBER.matcher(text).region(pos, text.length());
        if (!m.lookingAt())
            throw new FormulaSyntaxException("Bad number", wordAt(start), start);
        pos = m.end();
        tokens.add(new Token(TokenType.NUMBER, text.substring(start, pos), start));
    }

    private void readWord() {
        int start = pos;
        Matcher coords = COORDINATES.matcher(text).region(pos, text.length());
        if (coords.lookingAt() && !continuesWord(coords.end())
                && Addresses.tryParse(coords.group(), "Sheet") != null) {
            pos = coords.end();
            tokens.add(new Token(TokenType.REFERENCE, text.substring(start, pos), start));
            return;
        }
        Matcher w = WORD.matcher(text).region(pos, text.length());
        if (!w.lookingAt())
            throw new FormulaSyntaxException("Unexpected character", String.valueOf(text.charAt(pos)), start);
        String word = w.group();
        pos = w.end();

        if (pos < text.length() && text.charAt(pos) == '!') {
            pos++;
            readCoordinatesAfterSheet(start);
            return;
        }
        if (pos < text.length() && text.charAt(pos) == '[') {
            readStructuredReference(start);
            return;
        }
        int after = pos;
        while (after < text.length() && Character.isWhitespace(text.charAt(after)))
            after++;
        if (after < text.length() && text.charAt(after) == '(') {
            tokens.add(new Token(TokenType.FUNCTION, word, start));
            return;
        }
        String upper = word.toUpperCase(Locale.ROOT);
        if (upper.equals("TRUE") || upper.equals("FALSE"))
            tokens.add(new Token(TokenType.BOOLEAN, upper, start));
        else
            tokens.add(new Token(TokenType.NAME, word, start));
    }

    private void readStructuredReference(int start) {
        int depth = 0;
        while (pos < text.length()) {
            char c = text.charAt(pos++);
            if (c == '[')
                depth++;
            else if (c == ']' && --depth == 0) {
                tokens.add(new Token(TokenType.STRUCTURED_REF, text.substring(start, pos), start));
                return;
            }
        }
        throw new FormulaSyntaxException("Unterminated structured reference", text.substring(start), start);
    }

    // a reference must not run straight into more identifier characters
    private boolean continuesWord(int end) {
        if (end >= text.length())
            return false;
        char c = text.charAt(end);
        return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '!' || c == '(' || c == '['
                || c == ':' || c == '$';
    }

    private String wordAt(int from) {
        int end = from + 1;
        while (end < text.length() && !Character.isWhitespace(text.charAt(end)) && "(),".indexOf(text.charAt(end)) < 0)
            end++;
        return text.substring(from, end);
    }
}
