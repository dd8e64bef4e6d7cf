package com.spreadsheet.fgraph.formula;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.spreadsheet.fgraph.address.Address;
import com.spreadsheet.fgraph.address.AddressCell;
import com.spreadsheet.fgraph.address.AddressException;
import com.spreadsheet.fgraph.address.Addresses;
import com.spreadsheet.fgraph.address.DefinedName;
import com.spreadsheet.fgraph.address.NameResolver;
import com.spreadsheet.fgraph.address.TableDefinition;
import com.spreadsheet.fgraph.api.ExcelError;

/**
 * Precedence-climbing parser from formula text to an {@link Expr} tree.
 *
 * <p>
 * Binding, loosest first: comparisons, {@code &}, {@code + -}, {@code * /},
 * {@code ^}, prefix {@code + -}, postfix {@code %}. Every binary operator is
 * left-associative, so {@code 2^3^2} is 64, and prefix minus binds tighter than
 * {@code ^}, so {@code -2^2} is 4.
 *
 * <p>
 * Names are resolved while parsing: a defined name that refers to cells
 * becomes a reference, one that holds a formula is parsed in place (a name
 * that reaches itself again is a syntax error), a table name with brackets
 * becomes the matching table range. An unknown name compiles to a
 * {@code #NAME?} constant.
 */
public final class FormulaParser {
    private static final Logger log = LogManager.getLogger(FormulaParser.class);

    private final List<Token> tokens;
    private final AddressCell cell;
    private final NameResolver names;
    private final Set<Address> precedents;
    private final Set<String> expanding;
    private int index;

    private FormulaParser(List<Token> tokens, AddressCell cell, NameResolver names, Set<Address> precedents,
            Set<String> expanding) {
        this.tokens = tokens;
        this.cell = cell;
        this.names = names;
        this.precedents = precedents;
        this.expanding = expanding;
    }

    /**
     * Compiles a formula for the given cell. Never throws for bad formula text:
     * the syntax error is attached to the result instead.
     *
     * @param formula formula text, with or without the leading {@code =}
     * @param cell    the cell holding the formula; supplies the default sheet
     * @param names   defined names and tables, {@link NameResolver#NONE} if none
     */
    public static CompiledFormula compile(String formula, AddressCell cell, NameResolver names) {
        Set<Address> precedents = new LinkedHashSet<>();
        try {
            Expr expr = parse(formula, cell, names, precedents);
            return new CompiledFormula(formula, cell, expr, precedents);
        } catch (FormulaSyntaxException e) {
            log.warn("Syntax error in {} '{}': {}", cell, formula, e.getMessage());
            return new CompiledFormula(formula, cell, e);
        }
    }

    /**
     * Parses a formula, collecting referenced addresses into {@code precedents}.
     *
     * @throws FormulaSyntaxException on malformed text or bad references
     */
    public static Expr parse(String formula, AddressCell cell, NameResolver names, Set<Address> precedents) {
        return new FormulaParser(FormulaTokenizer.tokenize(formula), cell, names, precedents, new HashSet<>())
                .parseAll();
    }

    private Expr parseAll() {
        if (peek().type() == TokenType.END)
            throw new FormulaSyntaxException("Empty formula", peek());
        Expr e = parseExpression(1);
        Token t = peek();
        if (t.type() != TokenType.END)
            throw new FormulaSyntaxException("Unexpected token", t);
        return e;
    }

    private Expr parseExpression(int minPrecedence) {
        Expr left = parseUnary();
        while (true) {
            Token t = peek();
            if (t.type() != TokenType.OPERATOR)
                return left;
            Operator op = Operator.fromSymbol(t.text());
            if (op == null)
                throw new FormulaSyntaxException("Unexpected operator", t);
            if (op.precedence() < minPrecedence)
                return left;
            next();
            Expr right = parseExpression(op.precedence() + 1);
            left = new BinaryExpr(op, left, right);
        }
    }

    private Expr parseUnary() {
        Token t = peek();
        if (t.is(TokenType.OPERATOR, "-") || t.is(TokenType.OPERATOR, "+")) {
            next();
            return new UnaryExpr(t.text().equals("-"), parseUnary());
        }
        return parsePostfix();
    }

    private Expr parsePostfix() {
        Expr e = parsePrimary();
        while (peek().is(TokenType.OPERATOR, "%")) {
            next();
            e = new PercentExpr(e);
        }
        return e;
    }

    private Expr parsePrimary() {
        Token t = next();
        return switch (t.type()) {
            case NUMBER -> new LiteralExpr(Double.parseDouble(t.text()));
            case STRING -> new LiteralExpr(t.text());
            case BOOLEAN -> new LiteralExpr(Boolean.valueOf(t.text()));
            case ERROR -> new LiteralExpr(ExcelError.fromCode(t.text()));
            case REFERENCE -> reference(t, t.text());
            case NAME -> name(t);
            case STRUCTURED_REF -> structuredReference(t);
            case FUNCTION -> functionCall(t);
            case LPAREN -> {
                Expr inner = parseExpression(1);
                expect(TokenType.RPAREN, "Expected ')'");
                yield inner;
            }
            case END -> throw new FormulaSyntaxException("Unexpected end of formula", t);
            default -> throw new FormulaSyntaxException("Unexpected token", t);
        };
    }

    private Expr functionCall(Token nameToken) {
        expect(TokenType.LPAREN, "Expected '('");
        List<Expr> args = new ArrayList<>();
        if (peek().type() == TokenType.RPAREN) {
            next();
            return new FunctionCallExpr(nameToken.text(), args);
        }
        while (true) {
            TokenType type = peek().type();
            if (type == TokenType.COMMA || type == TokenType.RPAREN)
                args.add(new LiteralExpr(null));
            else
                args.add(parseExpression(1));
            Token sep = next();
            if (sep.type() == TokenType.RPAREN)
                return new FunctionCallExpr(nameToken.text(), args);
            if (sep.type() != TokenType.COMMA)
                throw new FormulaSyntaxException("Expected ',' or ')' in call to " + nameToken.text(), sep);
        }
    }

    private Expr reference(Token t, String text) {
        try {
            Address address = Addresses.parse(text, cell.sheet());
            precedents.add(address);
            return new ReferenceExpr(address);
        } catch (AddressException e) {
            throw new FormulaSyntaxException("Bad reference (" + e.getMessage() + ")", t);
        }
    }

    private Expr name(Token t) {
        DefinedName defined = names.definedName(t.text());
        if (defined == null) {
            if (names.table(t.text()) != null)
                return structured(t, t.text(), "");
            return new LiteralExpr(ExcelError.NAME.withDetail("unknown name " + t.text()));
        }
        if (!defined.isFormula())
            return reference(t, defined.body());

        String key = DefinedName.key(defined.name());
        if (!expanding.add(key))
            throw new FormulaSyntaxException("Defined name refers to itself", t);
        try {
            FormulaParser nested = new FormulaParser(FormulaTokenizer.tokenize(defined.body()), cell, names,
                    precedents, expanding);
            return nested.parseAll();
        } catch (FormulaSyntaxException e) {
            if (e.getMessage().startsWith("Defined name refers to itself"))
                throw e;
            throw new FormulaSyntaxException("In defined name " + defined.name() + ": " + e.getMessage(), t);
        } finally {
            expanding.remove(key);
        }
    }

    private Expr structuredReference(Token t) {
        String text = t.text();
        int open = text.indexOf('[');
        String inner = text.substring(open + 1, text.length() - 1).trim();
        if (inner.startsWith("[") && inner.endsWith("]") && inner.indexOf(']') == inner.length() - 1)
            inner = inner.substring(1, inner.length() - 1);
        if (inner.contains("[") || inner.startsWith("@") || inner.equalsIgnoreCase("#This Row"))
            throw new FormulaSyntaxException("Unsupported structured reference", t);
        return structured(t, text.substring(0, open), inner);
    }

    private Expr structured(Token t, String tableName, String specifier) {
        TableDefinition table = names.table(tableName);
        if (table == null)
            return new LiteralExpr(ExcelError.NAME.withDetail("unknown table " + tableName));
        try {
            Address address = Addresses.normalize(table.resolve(specifier));
            precedents.add(address);
            return new ReferenceExpr(address);
        } catch (AddressException e) {
            throw new FormulaSyntaxException("Bad table reference (" + e.getMessage() + ")", t);
        }
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token next() {
        Token t = tokens.get(index);
        if (t.type() != TokenType.END)
            index++;
        return t;
    }

    private void expect(TokenType type, String message) {
        Token t = next();
        if (t.type() != type)
            throw new FormulaSyntaxException(message, t);
    }
}
