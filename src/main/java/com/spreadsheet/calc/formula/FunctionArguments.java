package com.spreadsheet.calc.formula;

import com.spreadsheet.calc.models.CellValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Evaluated arguments of a function call. Values expanded from a range are
 * flagged, because aggregates skip empty and text cells inside ranges while
 * the same values passed directly are converted (or rejected).
 * Never contains errors; the evaluator propagates those before the call.
 */
public final class FunctionArguments {

    private final List<CellValue> values = new ArrayList<>();
    private final List<Boolean> fromRange = new ArrayList<>();

    public void add(CellValue value, boolean expandedFromRange) {
        values.add(value);
        fromRange.add(expandedFromRange);
    }

    public int size() {
        return values.size();
    }

    public CellValue get(int index) {
        return values.get(index);
    }

    public List<CellValue> values() {
        return Collections.unmodifiableList(values);
    }

    public double number(int index) {
        return Coercions.toNumber(values.get(index));
    }

    public String text(int index) {
        return Coercions.toText(values.get(index));
    }

    public boolean bool(int index) {
        return Coercions.toBoolean(values.get(index));
    }

    /**
     * Numbers for aggregates: only NUMBER cells from ranges, every direct argument converted.
     */
    public List<Double> numbers() {
        List<Double> numbers = new ArrayList<>();
        for (int i = 0; i < values.size(); i++) {
            CellValue value = values.get(i);
            if (fromRange.get(i)) {
                if (value.isNumber()) {
                    numbers.add(value.getNumber());
                }
            } else {
                numbers.add(Coercions.toNumber(value));
            }
        }
        return numbers;
    }

    /**
     * Logical values for AND/OR: ranges contribute their BOOLEAN and NUMBER cells.
     */
    public List<Boolean> booleans() {
        List<Boolean> booleans = new ArrayList<>();
        for (int i = 0; i < values.size(); i++) {
            CellValue value = values.get(i);
            if (fromRange.get(i) && !(value.isBoolean() || value.isNumber())) {
                continue;
            }
            booleans.add(Coercions.toBoolean(value));
        }
        return booleans;
    }
}
