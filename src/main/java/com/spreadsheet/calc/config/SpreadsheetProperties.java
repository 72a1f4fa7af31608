package com.spreadsheet.calc.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Engine settings bound from the "spreadsheet.*" properties.
 */
@ConfigurationProperties(prefix = "spreadsheet")
public class SpreadsheetProperties {

    public static final int DEFAULT_MAX_RANGE_CELLS = 10_000;

    // Upper bound on the cells a single range reference may cover
    private int maxRangeCells = DEFAULT_MAX_RANGE_CELLS;

    public int getMaxRangeCells() {
        return maxRangeCells;
    }

    public void setMaxRangeCells(int maxRangeCells) {
        this.maxRangeCells = maxRangeCells;
    }
}
