package com.spreadsheet.calc.services;

import com.spreadsheet.calc.exceptions.CircularReferenceException;
import com.spreadsheet.calc.exceptions.FormulaSyntaxException;
import com.spreadsheet.calc.exceptions.InvalidCellAddressException;
import com.spreadsheet.calc.exceptions.SheetNotFoundException;
import com.spreadsheet.calc.models.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SheetService logic, using an in-memory approach
 * (no HTTP or external server).
 */
class SheetServiceTest {

    private SheetService sheetService;
    private long sheetId;

    @BeforeEach
    void setUp() {
        sheetService = new SheetService();
        sheetId = sheetService.createSheet();
    }

    /**
     * Literals are classified as numbers or text; blank means empty.
     */
    @Test
    void testSetLiteralValues() {
        sheetService.setCellValue(sheetId, "A1", "hello");
        sheetService.setCellValue(sheetId, "A2", "42");
        sheetService.setCellValue(sheetId, "A3", "  ");

        assertEquals(CellValue.text("hello"), sheetService.getCellValue(sheetId, "A1"));
        assertEquals(CellValue.number(42), sheetService.getCellValue(sheetId, "A2"));
        assertTrue(sheetService.getCellValue(sheetId, "A3").isEmpty());
        assertEquals("42", sheetService.getDisplayValue(sheetId, "A2"));
        assertEquals("", sheetService.getDisplayValue(sheetId, "Z99"));
    }

    @Test
    void testOperatorPrecedence() {
        sheetService.setCellValue(sheetId, "A1", "=1+2*3");
        sheetService.setCellValue(sheetId, "A2", "=(1+2)*3");
        sheetService.setCellValue(sheetId, "A3", "=2^3^2");

        assertEquals("7", sheetService.getDisplayValue(sheetId, "A1"));
        assertEquals("9", sheetService.getDisplayValue(sheetId, "A2"));
        assertEquals("512", sheetService.getDisplayValue(sheetId, "A3"));
    }

    /**
     * A1=5, A2=A1*2, A3=A2+1. Changing A1 refreshes the whole chain
     * and leaves unrelated cells alone.
     */
    @Test
    void testPartialReEvaluation() {
        sheetService.setCellValue(sheetId, "A1", "5");
        sheetService.setCellValue(sheetId, "A2", "=A1*2");
        sheetService.setCellValue(sheetId, "A3", "=A2+1");
        sheetService.setCellValue(sheetId, "C1", "=1+1");
        assertEquals("10", sheetService.getDisplayValue(sheetId, "A2"));
        assertEquals("11", sheetService.getDisplayValue(sheetId, "A3"));

        Cell unrelated = sheetService.getSheet(sheetId).getCell(CellAddress.parse("C1"));
        CellValue before = unrelated.getEvaluatedValue();

        sheetService.setCellValue(sheetId, "A1", "10");
        assertEquals("20", sheetService.getDisplayValue(sheetId, "A2"));
        assertEquals("21", sheetService.getDisplayValue(sheetId, "A3"));
        assertSame(before, unrelated.getEvaluatedValue());
    }

    /**
     * Single-cell cycle scenario: A1 = "=A1" is rejected, old content remains.
     */
    @Test
    void testSingleCellCycle() {
        sheetService.setCellValue(sheetId, "A1", "hello");

        assertThrows(CircularReferenceException.class, () ->
                sheetService.setCellValue(sheetId, "A1", "=A1")
        );

        assertEquals("hello", sheetService.getRawContent(sheetId, "A1"));
        assertEquals("#CIRC!", sheetService.getDisplayValue(sheetId, "A1"));
        assertEquals(ErrorKind.CIRCULAR_REFERENCE, sheetService.getCellError(sheetId, "A1").get().getKind());
        assertTrue(sheetService.getForwardDependencies(sheetId).isEmpty());
    }

    /**
     * Multi-cell cycle scenario: C1->A1, A1->B1, then B1->C1 closes the loop.
     */
    @Test
    void testThreeCellCycle() {
        sheetService.setCellValue(sheetId, "C1", "=A1");
        sheetService.setCellValue(sheetId, "A1", "=B1");

        assertThrows(CircularReferenceException.class, () ->
                sheetService.setCellValue(sheetId, "B1", "=C1")
        );

        CellView b1 = sheetService.getCellView(sheetId, "B1");
        assertEquals(CellState.ERROR, b1.getState());
        assertEquals(ErrorKind.CIRCULAR_REFERENCE, b1.getError().getKind());
        assertEquals("", b1.getContent());

        // Cells reading B1 see the error passed along
        CellError a1 = sheetService.getCellError(sheetId, "A1").get();
        assertEquals(ErrorKind.PROPAGATED_ERROR, a1.getKind());
        assertEquals(ErrorKind.CIRCULAR_REFERENCE, a1.getRootKind());
        assertEquals("#CIRC!", sheetService.getDisplayValue(sheetId, "C1"));

        // Rejected edges never reach the graph
        assertTrue(sheetService.getForwardDependencies(sheetId).get("B1").isEmpty());
    }

    @Test
    void testCycleResolvedByRewrite() {
        sheetService.setCellValue(sheetId, "C1", "=A1");
        sheetService.setCellValue(sheetId, "A1", "=B1");
        assertThrows(CircularReferenceException.class, () ->
                sheetService.setCellValue(sheetId, "B1", "=C1"));

        sheetService.setCellValue(sheetId, "B1", "3");
        assertEquals("3", sheetService.getDisplayValue(sheetId, "A1"));
        assertEquals("3", sheetService.getDisplayValue(sheetId, "C1"));
    }

    @Test
    void testDivideByZeroPropagates() {
        sheetService.setCellValue(sheetId, "A1", "=1/0");
        sheetService.setCellValue(sheetId, "B1", "=A1+1");

        assertEquals(ErrorKind.DIVIDE_BY_ZERO, sheetService.getCellError(sheetId, "A1").get().getKind());
        CellError propagated = sheetService.getCellError(sheetId, "B1").get();
        assertEquals(ErrorKind.PROPAGATED_ERROR, propagated.getKind());
        assertEquals(ErrorKind.DIVIDE_BY_ZERO, propagated.getRootKind());
        assertEquals("#DIV/0!", sheetService.getDisplayValue(sheetId, "B1"));

        // Fixing the source clears the chain
        sheetService.setCellValue(sheetId, "A1", "=1/2");
        assertEquals("1.5", sheetService.getDisplayValue(sheetId, "B1"));
        assertFalse(sheetService.getCellError(sheetId, "B1").isPresent());
    }

    /**
     * A syntax error leaves the previous formula and its edges in place.
     */
    @Test
    void testSyntaxErrorKeepsPriorContent() {
        sheetService.setCellValue(sheetId, "A1", "2");
        sheetService.setCellValue(sheetId, "B1", "=A1*3");
        sheetService.setCellValue(sheetId, "C1", "=B1");

        FormulaSyntaxException ex = assertThrows(FormulaSyntaxException.class, () ->
                sheetService.setCellValue(sheetId, "B1", "=A1*"));
        assertEquals(ErrorKind.UNEXPECTED_TOKEN, ex.getKind());

        assertEquals("=A1*3", sheetService.getRawContent(sheetId, "B1"));
        assertEquals("#SYNTAX!", sheetService.getDisplayValue(sheetId, "B1"));
        assertEquals("#SYNTAX!", sheetService.getDisplayValue(sheetId, "C1"));
        assertEquals(Collections.singleton("A1"), sheetService.getForwardDependencies(sheetId).get("B1"));

        // The kept formula comes back to life when its input changes
        sheetService.setCellValue(sheetId, "A1", "4");
        assertEquals("12", sheetService.getDisplayValue(sheetId, "B1"));
        assertEquals("12", sheetService.getDisplayValue(sheetId, "C1"));
    }

    @Test
    void testInvalidReferenceShowsRef() {
        assertThrows(FormulaSyntaxException.class, () ->
                sheetService.setCellValue(sheetId, "A1", "=A0+1"));
        assertEquals("#REF!", sheetService.getDisplayValue(sheetId, "A1"));
    }

    /**
     * A literal too large for a double is kept as text; the sheet stays readable.
     */
    @Test
    void testOverflowingLiteralStaysReadable() {
        sheetService.setCellValue(sheetId, "A1", "1e400");
        sheetService.setCellValue(sheetId, "B1", "=1e400");

        assertEquals(CellValue.text("1e400"), sheetService.getCellValue(sheetId, "A1"));
        assertEquals("1e400", sheetService.getDisplayValue(sheetId, "A1"));
        assertEquals("#NUM!", sheetService.getDisplayValue(sheetId, "B1"));
        assertEquals(ErrorKind.INVALID_NUMBER, sheetService.getCellError(sheetId, "B1").get().getKind());

        Map<String, String> data = sheetService.getSheetData(sheetId);
        assertEquals("1e400", data.get("A1"));
        assertEquals("#NUM!", data.get("B1"));
        assertEquals(Collections.singletonList(Arrays.asList("1e400", "#NUM!")),
                sheetService.exportRows(sheetId).collect(Collectors.toList()));
    }

    /**
     * ROUND of an overflowing number completes the write with an error value
     * instead of leaving the cell half-updated.
     */
    @Test
    void testRoundOfOverflowCompletesWrite() {
        sheetService.setCellValue(sheetId, "C1", "=1");
        sheetService.setCellValue(sheetId, "C2", "=C1+1");

        sheetService.setCellValue(sheetId, "C1", "=ROUND(1e400)");

        Cell c1 = sheetService.getSheet(sheetId).getCell(CellAddress.parse("C1"));
        assertEquals("=ROUND(1e400)", c1.getRawValue());
        assertFalse(c1.isDirty());
        assertEquals(ErrorKind.INVALID_NUMBER, c1.getEvaluatedValue().getError().getKind());
        assertEquals("#NUM!", sheetService.getDisplayValue(sheetId, "C2"));
        assertEquals(ErrorKind.PROPAGATED_ERROR, sheetService.getCellError(sheetId, "C2").get().getKind());
    }

    @Test
    void testRangeEndingAtLastRow() {
        sheetService.setCellValue(sheetId, "A2147483647", "4");
        sheetService.setCellValue(sheetId, "B1", "=SUM(A2147483647:A2147483647)");

        assertEquals("4", sheetService.getDisplayValue(sheetId, "B1"));
        assertEquals(Collections.singleton("B1"),
                sheetService.getReverseDependencies(sheetId).get("A2147483647"));
    }

    @Test
    void testChangeFormulaToLiteral() {
        sheetService.setCellValue(sheetId, "A1", "hello");
        sheetService.setCellValue(sheetId, "C1", "=A1");
        assertEquals("hello", sheetService.getSheetData(sheetId).get("C1"));

        // Replace the formula with a literal
        sheetService.setCellValue(sheetId, "C1", "newLiteral");
        Map<String, String> data = sheetService.getSheetData(sheetId);
        assertEquals("newLiteral", data.get("C1"));
        assertEquals("hello", data.get("A1"));
        assertFalse(sheetService.getReverseDependencies(sheetId).containsKey("A1"));
    }

    @Test
    void testReferenceToUnsetCellIsZero() {
        sheetService.setCellValue(sheetId, "C1", "=A999");
        assertEquals("0", sheetService.getSheetData(sheetId).get("C1"));
    }

    @Test
    void testSheetDataIsRowMajor() {
        sheetService.setCellValue(sheetId, "B2", "x");
        sheetService.setCellValue(sheetId, "A2", "y");
        sheetService.setCellValue(sheetId, "C1", "z");

        assertEquals(Arrays.asList("C1", "A2", "B2"), new ArrayList<>(sheetService.getSheetData(sheetId).keySet()));
    }

    @Test
    void testClearCell() {
        sheetService.setCellValue(sheetId, "A1", "7");
        sheetService.setCellValue(sheetId, "B1", "=A1*2");
        sheetService.clearCell(sheetId, "B1");
        sheetService.clearCell(sheetId, "A1");

        assertTrue(sheetService.getSheetData(sheetId).isEmpty());
        assertTrue(sheetService.getForwardDependencies(sheetId).isEmpty());
        assertEquals(CellState.EMPTY, sheetService.getCellView(sheetId, "A1").getState());
    }

    @Test
    void testClearedInputReadsAsZero() {
        sheetService.setCellValue(sheetId, "A1", "7");
        sheetService.setCellValue(sheetId, "B1", "=A1*2");
        sheetService.clearCell(sheetId, "A1");

        assertEquals("0", sheetService.getDisplayValue(sheetId, "B1"));
    }

    @Test
    void testWritingSameContentTwiceChangesNothing() {
        sheetService.setCellValue(sheetId, "A1", "3");
        sheetService.setCellValue(sheetId, "B1", "=SUM(A1, 4)");
        Map<String, String> data = sheetService.getSheetData(sheetId);
        Map<String, Set<String>> forward = sheetService.getForwardDependencies(sheetId);

        sheetService.setCellValue(sheetId, "B1", "=SUM(A1, 4)");
        assertEquals(data, sheetService.getSheetData(sheetId));
        assertEquals(forward, sheetService.getForwardDependencies(sheetId));
    }

    /**
     * Values after a chain of writes match a fresh sheet written in a different order.
     */
    @Test
    void testIncrementalMatchesFromScratch() {
        sheetService.setCellValue(sheetId, "A1", "1");
        sheetService.setCellValue(sheetId, "A2", "=A1+1");
        sheetService.setCellValue(sheetId, "A3", "=A1+A2");
        sheetService.setCellValue(sheetId, "A4", "=SUM(A1:A3)");
        sheetService.setCellValue(sheetId, "A1", "5");

        long fresh = sheetService.createSheet();
        sheetService.setCellValue(fresh, "A4", "=SUM(A1:A3)");
        sheetService.setCellValue(fresh, "A3", "=A1+A2");
        sheetService.setCellValue(fresh, "A2", "=A1+1");
        sheetService.setCellValue(fresh, "A1", "5");

        assertEquals(sheetService.getSheetData(fresh), sheetService.getSheetData(sheetId));
        assertEquals("22", sheetService.getDisplayValue(sheetId, "A4"));
    }

    @Test
    void testDirtyFlagsClearedAfterWrite() {
        sheetService.setCellValue(sheetId, "A1", "1");
        sheetService.setCellValue(sheetId, "B1", "=A1");
        sheetService.setCellValue(sheetId, "C1", "=B1");
        sheetService.setCellValue(sheetId, "A1", "2");

        for (Cell cell : sheetService.getSheet(sheetId).getCells().values()) {
            assertFalse(cell.isDirty(), "cell " + cell.getAddress() + " left dirty");
        }
    }

    @Test
    void testExportRows() {
        sheetService.setCellValue(sheetId, "B2", "5");

        List<List<String>> rows;
        try (Stream<List<String>> stream = sheetService.exportRows(sheetId)) {
            rows = stream.collect(Collectors.toList());
        }
        assertEquals(Arrays.asList(Arrays.asList("", ""), Arrays.asList("", "5")), rows);
    }

    @Test
    void testExportEmptySheet() {
        assertEquals(0, sheetService.exportRows(sheetId).count());
    }

    @Test
    void testBadAddressAndMissingSheet() {
        assertThrows(InvalidCellAddressException.class, () ->
                sheetService.setCellValue(sheetId, "1A", "x"));
        assertThrows(SheetNotFoundException.class, () ->
                sheetService.setCellValue(9999999L, "A1", "x"));

        sheetService.deleteSheet(sheetId);
        assertThrows(SheetNotFoundException.class, () -> sheetService.getSheetData(sheetId));
    }

    /**
     * Sheets are independent engine instances.
     */
    @Test
    void testSheetsAreIsolated() {
        long other = sheetService.createSheet();
        sheetService.setCellValue(sheetId, "A1", "1");
        sheetService.setCellValue(other, "A1", "2");

        assertEquals("1", sheetService.getDisplayValue(sheetId, "A1"));
        assertEquals("2", sheetService.getDisplayValue(other, "A1"));
    }

    /**
     * Simple concurrency test: ensures no concurrency errors
     * when two threads set different cells simultaneously.
     */
    @Test
    void testConcurrentCellUpdates() throws InterruptedException {
        sheetService.setCellValue(sheetId, "C1", "=A1+B1");
        Runnable task1 = () -> {
            for (int i = 1; i <= 100; i++) {
                sheetService.setCellValue(sheetId, "A1", String.valueOf(i));
            }
        };
        Runnable task2 = () -> {
            for (int i = 1; i <= 100; i++) {
                sheetService.setCellValue(sheetId, "B1", String.valueOf(i * 10));
            }
        };

        Thread t1 = new Thread(task1);
        Thread t2 = new Thread(task2);

        t1.start();
        t2.start();
        t1.join();
        t2.join();

        Map<String, String> data = sheetService.getSheetData(sheetId);
        assertEquals("100", data.get("A1"));
        assertEquals("1000", data.get("B1"));
        assertEquals("1100", data.get("C1"));
    }
}
