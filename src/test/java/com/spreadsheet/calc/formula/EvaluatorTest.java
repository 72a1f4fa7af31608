package com.spreadsheet.calc.formula;

import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.CellError;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Evaluation of parsed formulas against a map of cell values,
 * covering operators, coercions, the built-in functions and error handling.
 */
class EvaluatorTest {

    private final FormulaParser parser = new FormulaParser();
    private final Evaluator evaluator = new Evaluator();
    private final Map<CellAddress, CellValue> cells = new HashMap<>();

    @BeforeEach
    void setUp() {
        cells.put(CellAddress.parse("A1"), CellValue.number(1));
        cells.put(CellAddress.parse("A2"), CellValue.text("text"));
        // A3 is left empty
        cells.put(CellAddress.parse("A4"), CellValue.number(3));
        cells.put(CellAddress.parse("B1"), CellValue.bool(true));
        cells.put(CellAddress.parse("E1"), CellValue.error(ErrorKind.DIVIDE_BY_ZERO, "Division by zero"));
    }

    private CellValue eval(String formulaBody) {
        return evaluator.evaluate(parser.parse(formulaBody),
                address -> cells.getOrDefault(address, CellValue.empty()));
    }

    private double number(String formulaBody) {
        CellValue value = eval(formulaBody);
        assertTrue(value.isNumber(), formulaBody + " gave " + value);
        return value.getNumber();
    }

    private ErrorKind errorKind(String formulaBody) {
        CellValue value = eval(formulaBody);
        assertTrue(value.isError(), formulaBody + " gave " + value);
        return value.getError().getKind();
    }

    @Test
    void testArithmetic() {
        assertEquals(7, number("1+2*3"));
        assertEquals(9, number("(1+2)*3"));
        assertEquals(512, number("2^3^2"));
        assertEquals(-4, number("-2^2"));
        assertEquals(0.5, number("2^-1"));
        assertEquals(-4, number("1-2-3"));
        assertEquals(2.5, number("5/2"));
        assertEquals(4, number("+4"));
    }

    @Test
    void testCoercions() {
        assertEquals(2, number("B1+1"));
        assertEquals(1, number("A3+1"));
        assertEquals(ErrorKind.TYPE_MISMATCH, errorKind("A2+1"));
        assertEquals(ErrorKind.TYPE_MISMATCH, errorKind("-\"x\""));
        assertEquals(CellValue.text("a1TRUE"), eval("\"a\"&A1&B1"));
        assertEquals(CellValue.text("x"), eval("\"x\"&A3"));
    }

    /**
     * A formula that only reads an empty cell shows 0.
     */
    @Test
    void testEmptyResultBecomesZero() {
        assertEquals(CellValue.number(0), eval("A3"));
        assertEquals(CellValue.number(0), eval("Z100"));
    }

    @Test
    void testComparisons() {
        assertEquals(CellValue.bool(true), eval("1<2"));
        assertEquals(CellValue.bool(true), eval("2>=2"));
        assertEquals(CellValue.bool(false), eval("1<>1"));
        assertEquals(CellValue.bool(true), eval("\"abc\"=\"ABC\""));
        assertEquals(CellValue.bool(true), eval("\"apple\"<\"Banana\""));
        assertEquals(CellValue.bool(true), eval("B1=1"));
        assertEquals(CellValue.bool(true), eval("A3=0"));
        assertEquals(CellValue.bool(true), eval("A3=\"\""));
        assertEquals(ErrorKind.TYPE_MISMATCH, errorKind("A2<1"));
    }

    @Test
    void testArithmeticErrors() {
        assertEquals(ErrorKind.DIVIDE_BY_ZERO, errorKind("1/0"));
        assertEquals(ErrorKind.DIVIDE_BY_ZERO, errorKind("1/A3"));
        assertEquals(ErrorKind.INVALID_NUMBER, errorKind("10^400"));
        assertEquals(ErrorKind.INVALID_NUMBER, errorKind("SQRT(-1)"));
    }

    /**
     * A number token too large for a double evaluates to INVALID_NUMBER, also inside functions.
     */
    @Test
    void testOverflowingNumberLiteral() {
        assertEquals(ErrorKind.INVALID_NUMBER, errorKind("1e400"));
        assertEquals(ErrorKind.INVALID_NUMBER, errorKind("ROUND(1e400)"));
        assertEquals(ErrorKind.INVALID_NUMBER, errorKind("ROUND(1e400, 2)"));
        assertEquals(1e300, number("1e300"));
    }

    @Test
    void testRoundRejectsNonFiniteCellValue() {
        cells.put(CellAddress.parse("F1"), CellValue.number(Double.POSITIVE_INFINITY));
        assertEquals(ErrorKind.INVALID_NUMBER, errorKind("ROUND(F1)"));
    }

    /**
     * Reading a cell in error yields PROPAGATED_ERROR rooted at the original kind.
     */
    @Test
    void testErrorPropagation() {
        CellError error = eval("E1+1").getError();
        assertEquals(ErrorKind.PROPAGATED_ERROR, error.getKind());
        assertEquals(ErrorKind.DIVIDE_BY_ZERO, error.getRootKind());
        assertEquals("#DIV/0!", error.getCode());
        assertTrue(error.getMessage().contains("E1"));

        assertEquals(ErrorKind.PROPAGATED_ERROR, errorKind("SUM(E1:E2)"));
        assertEquals(ErrorKind.PROPAGATED_ERROR, errorKind("IF(TRUE, 1, E1)"));

        // A chain keeps the first cause
        cells.put(CellAddress.parse("E2"), CellValue.error(error));
        assertEquals(ErrorKind.DIVIDE_BY_ZERO, eval("E2").getError().getRootKind());
    }

    @Test
    void testAggregatesOverRanges() {
        // Text and empty cells inside a range are skipped
        assertEquals(4, number("SUM(A1:A4)"));
        assertEquals(2, number("AVERAGE(A1:A4)"));
        assertEquals(1, number("MIN(A1:A4)"));
        assertEquals(3, number("MAX(A1:A4)"));
        assertEquals(2, number("COUNT(A1:A4)"));
        assertEquals(10, number("SUM(A1:A4, 6)"));
        assertEquals(0, number("MAX(C1:C3)"));
        assertEquals(ErrorKind.DIVIDE_BY_ZERO, errorKind("AVERAGE(C1:C3)"));
        // Direct arguments are converted instead of skipped
        assertEquals(ErrorKind.TYPE_MISMATCH, errorKind("SUM(1, \"x\")"));
        assertEquals(2, number("SUM(B1, 1)"));
    }

    @Test
    void testRangeOutsideFunction() {
        assertEquals(ErrorKind.TYPE_MISMATCH, errorKind("A1:A2"));
        assertEquals(ErrorKind.TYPE_MISMATCH, errorKind("ABS(A1:A2)"));
    }

    @Test
    void testMathFunctions() {
        assertEquals(Math.PI, number("PI()"));
        assertEquals(0, number("SIN(0)"));
        assertEquals(1, number("COS(0)"));
        assertEquals(Math.PI / 4, number("ATAN(1)"), 1e-12);
        assertEquals(1, number("EXP(0)"));
        assertEquals(1, number("LN(EXP(1))"), 1e-12);
        assertEquals(3, number("LOG10(1000)"), 1e-12);
        assertEquals(2, number("LOG(100)"), 1e-12);
        assertEquals(3, number("LOG(8, 2)"), 1e-12);
        assertEquals(5, number("ABS(-5)"));
        assertEquals(8, number("POWER(2, 3)"));
        assertEquals(3, number("ROUND(2.5)"));
        assertEquals(-3, number("ROUND(-2.5)"));
        assertEquals(3.14, number("ROUND(3.14159, 2)"));
        assertEquals(1200, number("ROUND(1234, -2)"));
    }

    @Test
    void testLogicalFunctions() {
        assertEquals(CellValue.text("no"), eval("IF(1>2, \"yes\", \"no\")"));
        assertEquals(CellValue.bool(false), eval("IF(FALSE, 1)"));
        assertEquals(CellValue.number(1), eval("IF(\"true\", 1, 2)"));
        assertEquals(CellValue.bool(true), eval("AND(TRUE, 1)"));
        assertEquals(CellValue.bool(false), eval("AND(A1:B1, 0)"));
        assertEquals(CellValue.bool(false), eval("OR(FALSE, 0)"));
        assertEquals(CellValue.bool(true), eval("NOT(0)"));
        assertEquals(ErrorKind.TYPE_MISMATCH, errorKind("NOT(\"maybe\")"));
    }

    @Test
    void testTextFunctions() {
        assertEquals(CellValue.text("a1TRUE"), eval("CONCAT(\"a\", 1, TRUE)"));
        assertEquals(CellValue.text("1text3"), eval("CONCAT(A1:A4)"));
        assertEquals(CellValue.number(5), eval("LEN(\"hello\")"));
        assertEquals(CellValue.text("AB"), eval("UPPER(\"ab\")"));
        assertEquals(CellValue.text("ab"), eval("lower(\"AB\")"));
    }

    @Test
    void testCallErrors() {
        assertEquals(ErrorKind.UNKNOWN_FUNCTION, errorKind("FOO(1)"));
        assertEquals(ErrorKind.ARGUMENT_COUNT, errorKind("SIN()"));
        assertEquals(ErrorKind.ARGUMENT_COUNT, errorKind("NOT(1, 2)"));
        assertEquals(ErrorKind.ARGUMENT_COUNT, errorKind("IF(TRUE)"));
        assertEquals("#N/A", eval("SUM()").getError().getCode());
    }

    @Test
    void testCustomRegistry() {
        FunctionRegistry registry = new FunctionRegistry();
        registry.register(new FormulaFunction("DOUBLE", 1, 1, false,
                args -> CellValue.number(args.number(0) * 2)));
        Evaluator custom = new Evaluator(registry);

        assertEquals(CellValue.number(8), custom.evaluate(parser.parse("double(4)"), address -> null));
        assertEquals(ErrorKind.UNKNOWN_FUNCTION,
                custom.evaluate(parser.parse("SUM(1)"), address -> null).getError().getKind());
    }
}
