package com.spreadsheet.calc.services;

import com.spreadsheet.calc.config.SpreadsheetProperties;
import com.spreadsheet.calc.exceptions.CircularReferenceException;
import com.spreadsheet.calc.exceptions.FormulaSyntaxException;
import com.spreadsheet.calc.exceptions.SheetNotFoundException;
import com.spreadsheet.calc.formula.*;
import com.spreadsheet.calc.models.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Main business logic for creating sheets, writing cells, recalculating
 * dependents and reading values back for display and export.
 */
@Service
public class SheetService {

    private static final Logger log = LoggerFactory.getLogger(SheetService.class);

    // All sheets live here in memory; no persistent DB
    private final Map<Long, Sheet> sheets = new ConcurrentHashMap<>();

    private final FormulaParser parser;
    private final RecalculationScheduler scheduler;

    public SheetService() {
        this(new SpreadsheetProperties());
    }

    @Autowired
    public SheetService(SpreadsheetProperties properties) {
        this.parser = new FormulaParser(properties.getMaxRangeCells());
        this.scheduler = new RecalculationScheduler(new Evaluator());
    }

    /**
     * Creates a new, empty Sheet and returns its ID.
     */
    public long createSheet() {
        Sheet sheet = new Sheet();
        sheets.put(sheet.getId(), sheet);
        log.info("Created sheet {}", sheet.getId());
        return sheet.getId();
    }

    /**
     * Retrieves a Sheet by ID. Throws if not found.
     */
    public Sheet getSheet(long sheetId) {
        Sheet sheet = sheets.get(sheetId);
        if (sheet == null) {
            throw new SheetNotFoundException(sheetId);
        }
        return sheet;
    }

    public void deleteSheet(long sheetId) {
        if (sheets.remove(sheetId) == null) {
            throw new SheetNotFoundException(sheetId);
        }
        log.info("Deleted sheet {}", sheetId);
    }

    public void setCellValue(long sheetId, String address, String rawValue) {
        setCellValue(sheetId, CellAddress.parse(address), rawValue);
    }

    /**
     * Writes a cell (literal or "=formula") with these steps:
     * 1) Parse. A syntax error marks the cell and is rethrown; content and edges stay as they were.
     * 2) Replace the cell's dependency edges. A cycle is rolled back by the graph,
     *    the cell is marked CIRCULAR_REFERENCE and the exception is rethrown.
     * 3) Commit the new content.
     * 4) Recalculate the cell and its dependents in topological order.
     * Everything runs under the sheet's write lock, so readers never see a half-done write.
     */
    public void setCellValue(long sheetId, CellAddress address, String rawValue) {
        Sheet sheet = getSheet(sheetId);
        String content = rawValue == null ? "" : rawValue;

        // Prevent race conditions among multiple writers
        sheet.getLock().writeLock().lock();
        try {
            // 1) Literal or formula
            ParsedContent parsed;
            try {
                parsed = parser.parseContent(content);
            } catch (FormulaSyntaxException ex) {
                log.warn("Sheet {}: rejected {} = '{}': {}", sheetId, address, content, ex.getMessage());
                rejectWrite(sheet, address, ex.toCellError());
                throw ex;
            }

            // 2) Dependencies, with cycle check and rollback inside the graph
            Set<CellAddress> references = ReferenceCollector.collect(parsed.getExpression());
            try {
                sheet.getDependencyGraph().setEdges(address, references);
            } catch (CircularReferenceException ex) {
                log.warn("Sheet {}: rejected {} = '{}': {}", sheetId, address, content, ex.getMessage());
                rejectWrite(sheet, address, CellError.of(ErrorKind.CIRCULAR_REFERENCE, ex.getMessage()));
                throw ex;
            }

            // 3) Commit
            Cell cell = sheet.getOrCreateCell(address);
            if (parsed.isFormula()) {
                cell.setContent(content, parsed.getExpression(), null);
            } else if (parsed.getLiteralValue().isEmpty()) {
                cell.clear();
            } else {
                cell.setContent(content, null, parsed.getLiteralValue());
            }

            // 4) Recalculate this cell and whatever depends on it
            scheduler.recalculate(sheet, address);
        } finally {
            sheet.getLock().writeLock().unlock();
        }
    }

    public void clearCell(long sheetId, String address) {
        clearCell(sheetId, CellAddress.parse(address));
    }

    /**
     * Resets the cell to empty: no content, no formula, no outgoing edges, no error.
     */
    public void clearCell(long sheetId, CellAddress address) {
        setCellValue(sheetId, address, "");
    }

    public CellValue getCellValue(long sheetId, String address) {
        CellAddress cellAddress = CellAddress.parse(address);
        return read(sheetId, sheet -> sheet.getValue(cellAddress));
    }

    public Optional<CellError> getCellError(long sheetId, String address) {
        CellValue value = getCellValue(sheetId, address);
        return value.isError() ? Optional.of(value.getError()) : Optional.empty();
    }

    /**
     * Value formatted for the grid: canonical numbers, TRUE/FALSE, error codes, "" when empty.
     */
    public String getDisplayValue(long sheetId, String address) {
        return ValueFormatter.display(getCellValue(sheetId, address));
    }

    /**
     * The text originally typed into the cell, for editing.
     */
    public String getRawContent(long sheetId, String address) {
        CellAddress cellAddress = CellAddress.parse(address);
        return read(sheetId, sheet -> {
            Cell cell = sheet.getCell(cellAddress);
            return cell == null ? "" : cell.getRawValue();
        });
    }

    public CellView getCellView(long sheetId, String address) {
        CellAddress cellAddress = CellAddress.parse(address);
        return read(sheetId, sheet -> {
            Cell cell = sheet.getCell(cellAddress);
            if (cell == null) {
                return new CellView(cellAddress.toString(), "", "", CellState.EMPTY, ValueType.EMPTY, null);
            }
            CellValue value = cell.getEvaluatedValue();
            return new CellView(cellAddress.toString(), cell.getRawValue(), ValueFormatter.display(value),
                    cell.getState(), value.getType(), value.isError() ? value.getError() : null);
        });
    }

    /**
     * Returns "address" -> display value for every populated cell, row-major.
     * No evaluation here, values are computed at write time.
     */
    public Map<String, String> getSheetData(long sheetId) {
        return read(sheetId, sheet -> {
            Map<String, String> data = new LinkedHashMap<>();
            for (Cell cell : sheet.getPopulatedCells().values()) {
                data.put(cell.getAddress().toString(), ValueFormatter.display(cell.getEvaluatedValue()));
            }
            return data;
        });
    }

    /**
     * Display values row by row, from row 1 to the last populated row and
     * from column A to the last populated column. Rows are built lazily from
     * a snapshot taken under the read lock.
     */
    public Stream<List<String>> exportRows(long sheetId) {
        SortedMap<CellAddress, String> snapshot = read(sheetId, sheet -> {
            SortedMap<CellAddress, String> values = new TreeMap<>();
            sheet.getPopulatedCells().forEach((address, cell) ->
                    values.put(address, ValueFormatter.display(cell.getEvaluatedValue())));
            return values;
        });
        if (snapshot.isEmpty()) {
            return Stream.empty();
        }
        int maxRow = snapshot.lastKey().getRow();
        int maxColumn = snapshot.keySet().stream().mapToInt(CellAddress::getColumn).max().orElse(0);

        return IntStream.rangeClosed(1, maxRow).mapToObj(row -> {
            List<String> values = new ArrayList<>(maxColumn);
            for (int column = 1; column <= maxColumn; column++) {
                values.add(snapshot.getOrDefault(CellAddress.of(column, row), ""));
            }
            return values;
        });
    }

    public Map<String, Set<String>> getForwardDependencies(long sheetId) {
        return read(sheetId, sheet -> sheet.getDependencyGraph().getForwardGraph());
    }

    public Map<String, Set<String>> getReverseDependencies(long sheetId) {
        return read(sheetId, sheet -> sheet.getDependencyGraph().getReverseGraph());
    }

    // ----------------------------------------------------------------
    // Internal Helpers (used within this service only)
    // ----------------------------------------------------------------

    /**
     * Stores the error on the cell, leaving its content, tree and edges untouched,
     * then lets dependents pick up the propagated error.
     */
    private void rejectWrite(Sheet sheet, CellAddress address, CellError error) {
        Cell cell = sheet.getOrCreateCell(address);
        cell.setEvaluatedValue(CellValue.error(error));
        scheduler.recalculateDependents(sheet, address);
    }

    private <T> T read(long sheetId, Function<Sheet, T> reader) {
        Sheet sheet = getSheet(sheetId);
        sheet.getLock().readLock().lock();
        try {
            return reader.apply(sheet);
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }
}
