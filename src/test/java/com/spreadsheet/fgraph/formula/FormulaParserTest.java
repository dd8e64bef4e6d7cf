package com.spreadsheet.fgraph.formula;

import com.spreadsheet.fgraph.FormulaSession;
import com.spreadsheet.fgraph.address.AddressCell;
import com.spreadsheet.fgraph.address.AddressRange;
import com.spreadsheet.fgraph.address.Addresses;
import com.spreadsheet.fgraph.address.NameResolver;
import com.spreadsheet.fgraph.address.TableDefinition;
import com.spreadsheet.fgraph.api.ExcelError;
import com.spreadsheet.fgraph.source.InMemoryWorkbook;
import org.junit.Before;
import org.junit.Test;

import java.util.HashSet;
import java.util.List;

import static org.junit.Assert.*;

public class FormulaParserTest {

    private static final AddressCell CELL = AddressCell.parse("S!D1");

    private InMemoryWorkbook workbook;

    @Before
    public void setUp() {
        workbook = new InMemoryWorkbook("parser").addSheet("Sheet1");
        workbook.set("B1", 4.0);
        workbook.addSheet("Data")
                .set(AddressCell.parse("Data!A1"), "Region").set(AddressCell.parse("Data!B1"), "Amount")
                .set(AddressCell.parse("Data!A2"), "North").set(AddressCell.parse("Data!B2"), 10)
                .set(AddressCell.parse("Data!A3"), "South").set(AddressCell.parse("Data!B3"), 20)
                .set(AddressCell.parse("Data!A4"), "East").set(AddressCell.parse("Data!B4"), 30);
        workbook.addTable(new TableDefinition("Sales", AddressRange.parse("Data!A1:B4", null), 1,
                List.of("Region", "Amount")));
    }

    private Object eval(String formula) {
        workbook.set("Z1", formula);
        return new FormulaSession(workbook).resolve("Z1");
    }

    @Test
    public void testOperatorPrecedence() {
        assertEquals(7.0, eval("=1+2*3"));
        assertEquals(9.0, eval("=(1+2)*3"));
        assertEquals(64.0, eval("=2^3^2"));
        assertEquals(4.0, eval("=-2^2"));
        assertEquals(-4.0, eval("=0-2^2"));
        assertEquals(1.0, eval("=2*50%"));
        assertEquals("a3", eval("=\"a\"&1+2"));
        assertEquals(Boolean.TRUE, eval("=1+1=2"));
        assertEquals(Boolean.TRUE, eval("=\"abc\"<>\"abd\""));
        assertEquals(2.0, eval("=10-5-3"));
        assertEquals(1.0, eval("=8/4/2"));
    }

    @Test
    public void testLiteralsAndEscapes() {
        assertEquals("say \"hi\"", eval("=\"say \"\"hi\"\"\""));
        assertEquals(1500.0, eval("=1.5e3"));
        assertEquals(0.5, eval("=.5"));
        assertEquals(Boolean.FALSE, eval("=NOT(TRUE)"));
        assertEquals(ExcelError.NA, eval("=#N/A"));
    }

    @Test
    public void testArithmeticErrors() {
        assertEquals(ExcelError.DIV0, eval("=1/0"));
        assertEquals(ExcelError.VALUE, eval("=\"x\"+1"));
        assertEquals(ExcelError.DIV0, eval("=(1/0)+#N/A"));
        assertEquals(5.0, eval("=\"2\"+3"));
    }

    @Test
    public void testPrecedentsInReferenceOrder() {
        CompiledFormula f = FormulaParser.compile("=A1+Other!B2*SUM(C1:C3)+A1", CELL, NameResolver.NONE);
        assertFalse(f.hasSyntaxError());
        assertEquals(List.of(Addresses.parse("S!A1", null), Addresses.parse("Other!B2", null),
                Addresses.parse("S!C1:C3", null)), List.copyOf(f.precedents()));
    }

    @Test
    public void testSameTextSamePrecedents() {
        CompiledFormula a = FormulaParser.compile("=SUM($A$1:B2)*'My Sheet'!C3", CELL, NameResolver.NONE);
        CompiledFormula b = FormulaParser.compile("=SUM($A$1:B2)*'My Sheet'!C3", CELL, NameResolver.NONE);
        assertEquals(a.precedents(), b.precedents());
    }

    @Test
    public void testSyntaxErrorIsAttached() {
        CompiledFormula f = FormulaParser.compile("=1+*2", CELL, NameResolver.NONE);
        assertTrue(f.hasSyntaxError());
        assertEquals(3, f.syntaxError().position());
        assertEquals("*", f.syntaxError().token());
        assertTrue(f.precedents().isEmpty());
    }

    @Test(expected = FormulaSyntaxException.class)
    public void testUnclosedCall() {
        FormulaParser.parse("=SUM(1,2", CELL, NameResolver.NONE, new HashSet<>());
    }

    @Test(expected = FormulaSyntaxException.class)
    public void testUnterminatedString() {
        FormulaTokenizer.tokenize("=\"abc");
    }

    @Test
    public void testSyntaxErrorEvaluatesToValueError() {
        workbook.set("A1", "=(1+2");
        workbook.set("A2", 5);
        FormulaSession session = new FormulaSession(workbook);
        Object v = session.resolve("A1");
        assertEquals(ExcelError.VALUE, v);
        assertTrue(((ExcelError) v).detail().contains("Expected ')'"));
        assertEquals(5.0, session.resolve("A2"));
    }

    @Test
    public void testTokenKinds() {
        List<Token> tokens = FormulaTokenizer.tokenize("=SUM (A1:B2, 'My Sheet'!C3) & Sales[Amount] & ABCD1");
        assertEquals(List.of(TokenType.FUNCTION, TokenType.LPAREN, TokenType.REFERENCE, TokenType.COMMA,
                TokenType.REFERENCE, TokenType.RPAREN, TokenType.OPERATOR, TokenType.STRUCTURED_REF,
                TokenType.OPERATOR, TokenType.NAME, TokenType.END), tokens.stream().map(Token::type).toList());
        assertEquals("'My Sheet'!C3", tokens.get(4).text());
        assertEquals(1, tokens.get(0).position());
    }

    @Test
    public void testWholeColumnAndRowReferences() {
        workbook.set("Data!C2", 1.0);
        assertEquals(3.0, eval("=COUNT(Data!B:B)"));
        assertEquals(3.0, eval("=COUNTA(Data!2:2)"));
    }

    @Test
    public void testUnknownNameIsNameError() {
        assertEquals(ExcelError.NAME, eval("=NoSuchName+1"));
    }

    @Test
    public void testDefinedNameReference() {
        workbook.defineName("Rate", "Sheet1!$B$1");
        assertEquals(400.0, eval("=rate*100"));
    }

    @Test
    public void testDefinedNameFormula() {
        workbook.defineName("Doubled", "=Sheet1!B1*2");
        workbook.defineName("Tax", "=0.25");
        assertEquals(9.0, eval("=Doubled+1"));
        assertEquals(2.0, eval("=Doubled*Tax"));
    }

    @Test
    public void testSelfReferentialNameIsSyntaxError() {
        workbook.defineName("Loop", "=Loop+1");
        CompiledFormula f = FormulaParser.compile("=Loop", CELL, workbook);
        assertTrue(f.hasSyntaxError());
        assertTrue(f.syntaxError().getMessage().contains("refers to itself"));
    }

    @Test
    public void testStructuredReferences() {
        assertEquals(60.0, eval("=SUM(Sales[Amount])"));
        assertEquals(60.0, eval("=SUM(Sales[[Amount]])"));
        assertEquals(60.0, eval("=SUM(Sales)"));
        assertEquals(8.0, eval("=COUNTA(Sales[#All])"));
        assertEquals(2.0, eval("=COUNTA(Sales[#Headers])"));
        assertEquals(ExcelError.VALUE, eval("=SUM(Sales[@Amount])"));
        assertEquals(ExcelError.NAME, eval("=SUM(Nope[Amount])"));
    }
}
