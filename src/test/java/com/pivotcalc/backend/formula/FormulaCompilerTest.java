package com.pivotcalc.backend.formula;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.pivotcalc.backend.field.ValueField;
import com.pivotcalc.common.Error;

import static org.junit.jupiter.api.Assertions.*;

public class FormulaCompilerTest {

    private final List<ValueField> fields = Arrays.asList(
            ValueField.builder("Revenue").header("Total Revenue").build(),
            ValueField.builder("Cost").build(),
            ValueField.builder("unit.price").build());
    private final FieldLookup lookup = FieldLookup.of(fields);

    private String rpn(String formula) throws FormulaException {
        return Formula.compile(formula, lookup).toString();
    }

    private Exception causeOf(String formula) {
        FormulaException e = assertThrows(FormulaException.class, () -> Formula.compile(formula, lookup));
        return (Exception) e.getCause();
    }

    @Test
    public void testPrecedenceAndAssociativity() throws Exception {
        assertEquals("2.0 3.0 4.0 * +", rpn("2 + 3 * 4"));
        assertEquals("2.0 3.0 + 4.0 *", rpn("(2 + 3) * 4"));
        assertEquals("8.0 4.0 - 2.0 -", rpn("8 - 4 - 2"));
        assertEquals("8.0 4.0 / 2.0 /", rpn("8 / 4 / 2"));
    }

    @Test
    public void testUnaryMinus() throws Exception {
        assertEquals("2.0 neg 3.0 +", rpn("-2 + 3"));
        assertEquals("2.0 3.0 neg *", rpn("2 * -3"));
        assertEquals("2.0 neg neg", rpn("--2"));
        assertEquals("$0 $1 - neg", rpn("-(Revenue - Cost)"));
    }

    @Test
    public void testFieldReferences() throws Exception {
        assertEquals("$0 $1 -", rpn("Revenue - Cost"));
        assertEquals("$0 $1 -", rpn("revenue-COST"));
        assertEquals("$0", rpn("[Total Revenue]"));
        assertEquals("$2 2.0 *", rpn("unit.price * 2"));
        assertEquals("ROW_TOTAL($0) PARENT_COLUMN_TOTAL($1) /", rpn("RowTotal(Revenue) / parentcolumntotal( [Cost] )"));
    }

    @Test
    public void testNumbers() throws Exception {
        assertEquals("0.5 1500.0 +", rpn(".5 + 1.5e3"));
        assertEquals("2.0 1.0E-4 *", rpn("2 * 1e-4"));
    }

    @Test
    public void testUsageFlags() throws Exception {
        Formula formula = Formula.compile("Revenue / GrandTotal(Revenue) + ParentRowTotal(Cost)", lookup);
        FormulaUsage usage = formula.getUsage();
        assertTrue(usage.usesGrandTotals());
        assertTrue(usage.usesParentRowTotals());
        assertFalse(usage.usesRowTotals());
        assertFalse(usage.usesColumnTotals());
        assertFalse(usage.usesParentColumnTotals());
        assertEquals(3, usage.getValueFieldCount());
    }

    @Test
    public void testScannerErrors() {
        assertSame(Error.EmptyFormulaException, causeOf("   "));
        assertSame(Error.InvalidCharacterException, causeOf("2 # 3"));
        assertSame(Error.FieldNotFoundException, causeOf("Profit * 2"));
        assertSame(Error.UnterminatedBracketException, causeOf("[Revenue"));
        assertSame(Error.UnknownFunctionException, causeOf("Sum(Revenue)"));
        assertSame(Error.InvalidArgumentException, causeOf("RowTotal(Revenue + 1)"));
        assertSame(Error.InvalidArgumentException, causeOf("RowTotal(2)"));
    }

    @Test
    public void testGrammarErrors() {
        assertSame(Error.UnexpectedTokenException, causeOf("2 3"));
        assertSame(Error.UnexpectedTokenException, causeOf("Revenue Cost"));
        assertSame(Error.UnexpectedTokenException, causeOf("* 2"));
        assertSame(Error.UnexpectedTokenException, causeOf("+2"));
        assertSame(Error.UnexpectedTokenException, causeOf("()"));
        assertSame(Error.UnexpectedTokenException, causeOf("2 (3)"));
        assertSame(Error.IncompleteFormulaException, causeOf("2 +"));
        assertSame(Error.MismatchedParenthesisException, causeOf("(2 + 3"));
        assertSame(Error.MismatchedParenthesisException, causeOf("2 + 3)"));
    }

    @Test
    public void testErrorPosition() {
        FormulaException e = assertThrows(FormulaException.class, () -> Formula.compile("2 # 3", lookup));
        assertEquals(2, e.getPosition());
        assertEquals("2 << # 3", e.getMarkedFormula());
        assertTrue(e.getMessage().startsWith("Invalid character in formula"));
        assertNull(Formula.tryCompile("2 #", lookup));
    }

    @Test
    public void testScannerPeekPop() throws Exception {
        FormulaScanner scanner = new FormulaScanner("Cost*2", lookup, new FormulaUsage());
        assertEquals(FormulaTokenKind.VALUE, scanner.peek().getKind());
        assertEquals(1, scanner.peek().getValueIndex());
        scanner.pop();
        assertEquals(FormulaTokenKind.MULTIPLY, scanner.peek().getKind());
        scanner.pop();
        assertEquals(2.0, scanner.peek().getConstant());
        scanner.pop();
        assertSame(FormulaToken.END, scanner.peek());
    }

    @Test
    public void testScannerErrorIsSticky() {
        FormulaScanner scanner = new FormulaScanner("$", lookup, new FormulaUsage());
        assertThrows(Exception.class, scanner::peek);
        assertTrue(scanner.hasError());
        Exception again = assertThrows(Exception.class, scanner::peek);
        assertSame(Error.InvalidCharacterException, again);
        assertEquals("<< $", scanner.errFormula());
    }

    @Test
    public void testStackDepth() throws Exception {
        assertEquals(1, FormulaCompiler.stackDepth(Formula.compile("1 + 2 * 3", lookup).getTokens()));
        assertEquals(-1, FormulaCompiler.stackDepth(Arrays.asList(FormulaToken.operator(FormulaTokenKind.ADD))));
        assertEquals(2, FormulaCompiler.stackDepth(Arrays.asList(FormulaToken.constant(1), FormulaToken.constant(2))));
    }
}
