package com.pricematrix.app.models;

import com.pricematrix.app.engine.DependencyGraph;
import com.pricematrix.app.engine.UndoRedoManager;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Represents one named price matrix:
 * - A unique ID and a display name
 * - A sparse map of CellAddress -> Cell (cells exist only once written)
 * - The logical dimensions, grown by writes and changed by row/column edits
 * - The dependency graph between its formula cells
 * - Its own undo/redo history
 * - A read/write lock; every mutation runs under the write lock
 */
public class Matrix {

    // Generates unique IDs for newly created matrices
    private static final AtomicLong ID_GENERATOR = new AtomicLong(1);

    private final long id;
    private String name;
    private final int maxRows;
    private final int maxColumns;
    private final Map<CellAddress, Cell> cells = new ConcurrentHashMap<>();
    private int rowCount;
    private int columnCount;

    private final DependencyGraph graph = new DependencyGraph();
    private final UndoRedoManager history;

    // Lock to prevent race conditions when multiple threads use the same Matrix
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Matrix(String name, int maxRows, int maxColumns, int undoLimit) {
        this.id = ID_GENERATOR.getAndIncrement();
        this.name = name;
        this.maxRows = maxRows;
        this.maxColumns = maxColumns;
        this.history = new UndoRedoManager(undoLimit);
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public int getMaxRows() {
        return maxRows;
    }

    public int getMaxColumns() {
        return maxColumns;
    }

    public boolean isWithinBounds(CellAddress address) {
        return address.getRow() < maxRows && address.getColumn() < maxColumns;
    }

    /**
     * Retrieves the cell at this address, or null when nothing was ever written there.
     */
    public Cell getCell(CellAddress address) {
        return cells.get(address);
    }

    public void putCell(CellAddress address, Cell cell) {
        cells.put(address, cell);
        rowCount = Math.max(rowCount, address.getRow() + 1);
        columnCount = Math.max(columnCount, address.getColumn() + 1);
    }

    public Cell removeCell(CellAddress address) {
        return cells.remove(address);
    }

    /**
     * Swaps in a whole new cell layout, used after row/column edits and snapshot restores.
     */
    public void replaceCells(Map<CellAddress, Cell> newCells, int rows, int columns) {
        cells.clear();
        cells.putAll(newCells);
        this.rowCount = rows;
        this.columnCount = columns;
        for (CellAddress address : newCells.keySet()) {
            rowCount = Math.max(rowCount, address.getRow() + 1);
            columnCount = Math.max(columnCount, address.getColumn() + 1);
        }
    }

    public Map<CellAddress, Cell> getCells() {
        return Collections.unmodifiableMap(cells);
    }

    /**
     * Occupied addresses in row-major order.
     */
    public List<CellAddress> sortedAddresses() {
        List<CellAddress> addresses = new ArrayList<>(cells.keySet());
        Collections.sort(addresses);
        return addresses;
    }

    public boolean hasDirtyCells() {
        for (Cell cell : cells.values()) {
            if (cell.isDirty()) {
                return true;
            }
        }
        return false;
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getColumnCount() {
        return columnCount;
    }

    public DependencyGraph getGraph() {
        return graph;
    }

    public UndoRedoManager getHistory() {
        return history;
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }
}
