package com.pricematrix.app.engine;

import com.pricematrix.app.models.CellAddress;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable raw-text state for undo/redo. Either a partial patch (the listed cells only,
 * a null text meaning "no cell") or a full image that replaces every cell and the
 * dimensions. Edges are rebuilt from the raw text when the patch is applied; the
 * patch keeps only which formula cells were circular at the time, so the same cell
 * of a cycle ends up rejected again.
 */
public final class MatrixPatch {

    private final boolean fullImage;
    private final Map<CellAddress, String> rawTexts;
    private final Set<CellAddress> circular;
    private final int rows;
    private final int columns;

    private MatrixPatch(boolean fullImage, Map<CellAddress, String> rawTexts, Set<CellAddress> circular,
                        int rows, int columns) {
        this.fullImage = fullImage;
        this.rawTexts = Collections.unmodifiableMap(new LinkedHashMap<>(rawTexts));
        this.circular = Collections.unmodifiableSet(new TreeSet<>(circular));
        this.rows = rows;
        this.columns = columns;
    }

    public static MatrixPatch cells(Map<CellAddress, String> rawTexts, Set<CellAddress> circular) {
        return new MatrixPatch(false, rawTexts, circular, 0, 0);
    }

    public static MatrixPatch fullImage(Map<CellAddress, String> rawTexts, Set<CellAddress> circular,
                                        int rows, int columns) {
        return new MatrixPatch(true, rawTexts, circular, rows, columns);
    }

    public boolean isFullImage() {
        return fullImage;
    }

    public Map<CellAddress, String> getRawTexts() {
        return rawTexts;
    }

    /**
     * Formula cells of the whole matrix that were stored as circular when this patch was taken.
     */
    public Set<CellAddress> getCircular() {
        return circular;
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }
}
