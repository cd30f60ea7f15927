package com.pricematrix.app.models;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Raw text of every cell plus the dimensions: the exchange format for persistence
 * and import/export collaborators. Cells are keyed by A1 address in row-major order.
 * For example:
 * {
 *   "name": "Storage surcharge",
 *   "rows": 2,
 *   "columns": 2,
 *   "cells": { "A1": "5", "B2": "=A1*2" }
 * }
 */
@JsonPropertyOrder({"name", "rows", "columns", "cells"})
public class MatrixSnapshot {
    private String name;
    private int rows;
    private int columns;
    private Map<String, String> cells = new LinkedHashMap<>();

    // Default constructor needed for JSON (de)serialization
    public MatrixSnapshot() {
    }

    public MatrixSnapshot(String name, int rows, int columns, Map<String, String> cells) {
        this.name = name;
        this.rows = rows;
        this.columns = columns;
        this.cells = new LinkedHashMap<>(cells);
    }

    public String getName() {
        return name;
    }
    public void setName(String name) {
        this.name = name;
    }

    public int getRows() {
        return rows;
    }
    public void setRows(int rows) {
        this.rows = rows;
    }

    public int getColumns() {
        return columns;
    }
    public void setColumns(int columns) {
        this.columns = columns;
    }

    public Map<String, String> getCells() {
        return cells;
    }
    public void setCells(Map<String, String> cells) {
        this.cells = cells == null ? new LinkedHashMap<>() : new LinkedHashMap<>(cells);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MatrixSnapshot)) {
            return false;
        }
        MatrixSnapshot that = (MatrixSnapshot) o;
        return rows == that.rows && columns == that.columns
                && Objects.equals(name, that.name) && Objects.equals(cells, that.cells);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, rows, columns, cells);
    }
}
