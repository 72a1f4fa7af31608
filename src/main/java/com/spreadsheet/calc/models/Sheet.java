package com.spreadsheet.calc.models;

import com.spreadsheet.calc.graph.DependencyGraph;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Represents an entire spreadsheet, one engine instance:
 * - Has a unique ID
 * - A sparse map of address -> Cell (the cell store)
 * - The dependency graph tracking which cells read which
 * - A read/write lock; a write and its recalculation run under the write lock
 */
public class Sheet {

    // Generates unique IDs for newly created sheets
    private static final AtomicLong ID_GENERATOR = new AtomicLong(1);

    private final long id;
    // Only written cells are stored; absent addresses read as empty
    private final Map<CellAddress, Cell> cells = new ConcurrentHashMap<>();
    private final DependencyGraph dependencyGraph = new DependencyGraph();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Sheet() {
        this.id = ID_GENERATOR.getAndIncrement();
    }

    public long getId() {
        return id;
    }

    public Map<CellAddress, Cell> getCells() {
        return cells;
    }

    /**
     * Retrieves the cell from the 'cells' map, if it exists.
     */
    public Cell getCell(CellAddress address) {
        return cells.get(address);
    }

    /**
     * Returns the stored cell, creating an empty one on first write.
     */
    public Cell getOrCreateCell(CellAddress address) {
        return cells.computeIfAbsent(address, Cell::new);
    }

    /**
     * Cached value of a cell; empty for cells that were never written.
     */
    public CellValue getValue(CellAddress address) {
        Cell cell = cells.get(address);
        return cell == null ? CellValue.empty() : cell.getEvaluatedValue();
    }

    /**
     * Cells with content or an error, in row-major order.
     */
    public SortedMap<CellAddress, Cell> getPopulatedCells() {
        SortedMap<CellAddress, Cell> populated = new TreeMap<>();
        for (Cell cell : cells.values()) {
            if (cell.isPopulated()) {
                populated.put(cell.getAddress(), cell);
            }
        }
        return populated;
    }

    public DependencyGraph getDependencyGraph() {
        return dependencyGraph;
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }
}
