package com.spreadsheet.calc.formula;

import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.CellValue;

/**
 * Supplies the cached value of another cell during evaluation.
 * Implementations only read; they never trigger evaluation themselves.
 */
@FunctionalInterface
public interface CellValueResolver {
    CellValue resolve(CellAddress address);
}
