package com.spreadsheet.calc.services;

import com.spreadsheet.calc.formula.Evaluator;
import com.spreadsheet.calc.models.Cell;
import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.Sheet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;

/**
 * Re-evaluates the cells affected by a write, in dependency order.
 * Callers must hold the sheet's write lock.
 */
public class RecalculationScheduler {

    private static final Logger log = LoggerFactory.getLogger(RecalculationScheduler.class);

    private final Evaluator evaluator;

    public RecalculationScheduler(Evaluator evaluator) {
        this.evaluator = evaluator;
    }

    /**
     * Recalculates {@code origin} and everything that transitively reads it.
     * Returns the addresses in the order they were visited.
     */
    public List<CellAddress> recalculate(Sheet sheet, CellAddress origin) {
        List<CellAddress> order = sheet.getDependencyGraph().topologicalOrder(Collections.singleton(origin));
        run(sheet, order);
        return order;
    }

    /**
     * Recalculates only the dependents of {@code origin}, keeping the origin's current value.
     * Used after a rejected write has stored an error on the origin.
     */
    public List<CellAddress> recalculateDependents(Sheet sheet, CellAddress origin) {
        List<CellAddress> order = sheet.getDependencyGraph().topologicalOrder(Collections.singleton(origin));
        List<CellAddress> dependents = order.subList(1, order.size());
        run(sheet, dependents);
        return dependents;
    }

    private void run(Sheet sheet, List<CellAddress> order) {
        // Mark first so a half-finished pass is recognisable
        for (CellAddress address : order) {
            Cell cell = sheet.getCell(address);
            if (cell != null && cell.isFormula()) {
                cell.setDirty(true);
            }
        }
        int evaluated = 0;
        for (CellAddress address : order) {
            Cell cell = sheet.getCell(address);
            // Literal and never-written cells already hold their value
            if (cell == null || !cell.isFormula()) {
                continue;
            }
            cell.setEvaluatedValue(evaluator.evaluate(cell.getExpression(), sheet::getValue));
            evaluated++;
        }
        log.debug("Sheet {}: recalculated {} formula cell(s) in order {}", sheet.getId(), evaluated, order);
    }
}
