package com.pricematrix.app.services;

import com.pricematrix.app.config.MatrixProperties;
import com.pricematrix.app.engine.CancellationToken;
import com.pricematrix.app.engine.DependencyGraph;
import com.pricematrix.app.engine.MatrixPatch;
import com.pricematrix.app.engine.PrecedentCollector;
import com.pricematrix.app.engine.RecalcReport;
import com.pricematrix.app.engine.RecalculationEngine;
import com.pricematrix.app.engine.StructuralEdit;
import com.pricematrix.app.engine.StructuralEditTranslator;
import com.pricematrix.app.engine.UndoRedoManager;
import com.pricematrix.app.exceptions.FormulaParseException;
import com.pricematrix.app.exceptions.InvalidCoordinateException;
import com.pricematrix.app.exceptions.MatrixNotFoundException;
import com.pricematrix.app.formula.FormulaParser;
import com.pricematrix.app.formula.ast.FormulaNode;
import com.pricematrix.app.functions.Coercion;
import com.pricematrix.app.models.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Main entry point for the price matrix engine: the matrix registry, cell writes and
 * reads, row/column edits, snapshots and undo/redo.
 * Every mutation runs under the matrix write lock and returns only after the affected
 * formulas are recalculated, so a read right after a write sees the new values.
 */
@Service
public class MatrixService {

    private static final Logger logger = LoggerFactory.getLogger(MatrixService.class);

    // All matrices live here in memory; persistence is the caller's business
    private final Map<Long, Matrix> matrices = new ConcurrentHashMap<>();

    private final MatrixProperties properties;
    private final FormulaParser parser;
    private final RecalculationEngine recalculationEngine;
    private final StructuralEditTranslator translator;

    public MatrixService(MatrixProperties properties, FormulaParser parser,
                         RecalculationEngine recalculationEngine, StructuralEditTranslator translator) {
        this.properties = properties;
        this.parser = parser;
        this.recalculationEngine = recalculationEngine;
        this.translator = translator;
    }

    // ----------------------------------------------------------------
    // Matrix registry
    // ----------------------------------------------------------------

    public long createMatrix(String name) {
        Matrix matrix = newMatrix(name);
        matrices.put(matrix.getId(), matrix);
        logger.info("Created matrix {} '{}'", matrix.getId(), name);
        return matrix.getId();
    }

    /**
     * Retrieves a Matrix by ID. Throws if not found.
     */
    public Matrix getMatrix(long matrixId) {
        Matrix matrix = matrices.get(matrixId);
        if (matrix == null) {
            throw new MatrixNotFoundException("Matrix not found: " + matrixId);
        }
        return matrix;
    }

    public List<MatrixSummary> listMatrices() {
        List<Matrix> all = new ArrayList<>(matrices.values());
        all.sort(Comparator.comparingLong(Matrix::getId));
        List<MatrixSummary> result = new ArrayList<>();
        for (Matrix matrix : all) {
            matrix.getLock().readLock().lock();
            try {
                result.add(new MatrixSummary(matrix.getId(), matrix.getName(),
                        matrix.getRowCount(), matrix.getColumnCount(), matrix.getCells().size(),
                        matrix.getHistory().canUndo(), matrix.getHistory().canRedo()));
            } finally {
                matrix.getLock().readLock().unlock();
            }
        }
        return result;
    }

    public boolean deleteMatrix(long matrixId) {
        boolean removed = matrices.remove(matrixId) != null;
        if (removed) {
            logger.info("Deleted matrix {}", matrixId);
        }
        return removed;
    }

    /**
     * Copies every cell's raw text into a new matrix with an empty undo history.
     * A null name keeps the source's name. Formulas that are circular in the source stay circular in the clone.
     */
    public long cloneMatrix(long matrixId, String newName) {
        Matrix source = getMatrix(matrixId);
        MatrixPatch image;
        source.getLock().readLock().lock();
        try {
            image = fullImage(source);
        } finally {
            source.getLock().readLock().unlock();
        }

        Matrix clone = newMatrix(newName != null ? newName : source.getName());
        clone.getLock().writeLock().lock();
        try {
            loadImage(clone, image);
        } finally {
            clone.getLock().writeLock().unlock();
        }
        matrices.put(clone.getId(), clone);
        logger.info("Cloned matrix {} into {}", matrixId, clone.getId());
        return clone.getId();
    }

    /**
     * Creates a matrix from a raw-text snapshot. A null name takes the snapshot's name.
     * Snapshot addresses outside the bounds are a contract violation.
     */
    public long importMatrix(String name, MatrixSnapshot snapshot) {
        Matrix matrix = newMatrix(name != null ? name : snapshot.getName());
        MatrixPatch image = toImage(matrix, snapshot);
        if (image == null) {
            throw new InvalidCoordinateException("Snapshot does not fit into "
                    + properties.getMaxRows() + "x" + properties.getMaxColumns());
        }
        matrix.getLock().writeLock().lock();
        try {
            loadImage(matrix, image);
        } finally {
            matrix.getLock().writeLock().unlock();
        }
        matrices.put(matrix.getId(), matrix);
        logger.info("Imported matrix {} '{}' with {} cells", matrix.getId(), matrix.getName(), image.getRawTexts().size());
        return matrix.getId();
    }

    // ----------------------------------------------------------------
    // Cell access
    // ----------------------------------------------------------------

    public CellResult setCell(long matrixId, int row, int column, String rawText) {
        return setCell(matrixId, row, column, rawText, CancellationToken.none());
    }

    /**
     * Writes one cell (empty text clears it), then recalculates its dependents.
     * Text starting with '=' is a formula; anything else is a number, a boolean or text.
     */
    public CellResult setCell(long matrixId, int row, int column, String rawText, CancellationToken token) {
        CellAddress address = new CellAddress(row, column);
        Matrix matrix = getMatrix(matrixId);

        // Prevent race conditions among multiple writers
        matrix.getLock().writeLock().lock();
        try {
            if (!matrix.isWithinBounds(address)) {
                return CellResult.outOfRange(address, matrix.getMaxRows(), matrix.getMaxColumns());
            }
            MatrixPatch before = MatrixPatch.cells(
                    Collections.singletonMap(address, rawTextAt(matrix, address)), matrix.getGraph().getRejected());
            assign(matrix, address, rawText);
            settle(matrix, Collections.singleton(address), token);
            MatrixPatch after = MatrixPatch.cells(
                    Collections.singletonMap(address, rawTextAt(matrix, address)), matrix.getGraph().getRejected());
            matrix.getHistory().record(new UndoRedoManager.Operation("set " + address.toA1(), before, after));
            logger.debug("Matrix {}: set {} to '{}'", matrixId, address.toA1(), rawText);
            return resultFor(matrix, address);
        } finally {
            matrix.getLock().writeLock().unlock();
        }
    }

    public List<CellResult> setCells(long matrixId, Map<CellAddress, String> rawTexts) {
        return setCells(matrixId, rawTexts, CancellationToken.none());
    }

    /**
     * Multi-cell paste: every in-bounds entry is written, one recalculation runs over
     * all of them, and the whole paste is a single undo step. Results come back in
     * row-major order.
     */
    public List<CellResult> setCells(long matrixId, Map<CellAddress, String> rawTexts, CancellationToken token) {
        Matrix matrix = getMatrix(matrixId);
        SortedMap<CellAddress, String> ordered = new TreeMap<>(rawTexts);

        matrix.getLock().writeLock().lock();
        try {
            Set<CellAddress> circularBefore = matrix.getGraph().getRejected();
            Map<CellAddress, String> before = new LinkedHashMap<>();
            Map<CellAddress, String> after = new LinkedHashMap<>();
            for (Map.Entry<CellAddress, String> entry : ordered.entrySet()) {
                CellAddress address = entry.getKey();
                if (!matrix.isWithinBounds(address)) {
                    continue;
                }
                if (!before.containsKey(address)) {
                    before.put(address, rawTextAt(matrix, address));
                }
                assign(matrix, address, entry.getValue());
                after.put(address, rawTextAt(matrix, address));
            }
            if (!after.isEmpty()) {
                settle(matrix, after.keySet(), token);
                matrix.getHistory().record(new UndoRedoManager.Operation("paste " + after.size() + " cells",
                        MatrixPatch.cells(before, circularBefore),
                        MatrixPatch.cells(after, matrix.getGraph().getRejected())));
            }
            logger.debug("Matrix {}: pasted {} of {} cells", matrixId, after.size(), ordered.size());

            List<CellResult> results = new ArrayList<>();
            for (CellAddress address : ordered.keySet()) {
                results.add(matrix.isWithinBounds(address)
                        ? resultFor(matrix, address)
                        : CellResult.outOfRange(address, matrix.getMaxRows(), matrix.getMaxColumns()));
            }
            return results;
        } finally {
            matrix.getLock().writeLock().unlock();
        }
    }

    public CellResult clearCell(long matrixId, int row, int column) {
        return setCell(matrixId, row, column, "");
    }

    public CellResult clearCell(long matrixId, int row, int column, CancellationToken token) {
        return setCell(matrixId, row, column, "", token);
    }

    /**
     * Reads one cell. An address never written gives an empty view; nothing is created.
     */
    public CellView getCell(long matrixId, int row, int column) {
        CellAddress address = new CellAddress(row, column);
        Matrix matrix = getMatrix(matrixId);

        matrix.getLock().readLock().lock();
        try {
            Cell cell = matrix.getCell(address);
            if (cell == null || !cell.isDirty()) {
                return viewOf(matrix, address);
            }
        } finally {
            matrix.getLock().readLock().unlock();
        }

        // Left dirty by a cancelled recalculation: evaluate now, which writes the cache
        matrix.getLock().writeLock().lock();
        try {
            recalculationEngine.resolvePending(matrix, address);
            return viewOf(matrix, address);
        } finally {
            matrix.getLock().writeLock().unlock();
        }
    }

    /**
     * Returns a map of A1 address -> computed value for every stored cell, row-major,
     * in the format: { "A1": 5.0, "B1": "=A1*2" evaluated to 10.0, "C1": "#DIV/0!" }.
     */
    public Map<String, Object> getMatrixData(long matrixId) {
        Matrix matrix = getMatrix(matrixId);
        boolean pending;
        matrix.getLock().readLock().lock();
        try {
            pending = matrix.hasDirtyCells();
        } finally {
            matrix.getLock().readLock().unlock();
        }
        if (pending) {
            matrix.getLock().writeLock().lock();
            try {
                for (CellAddress address : matrix.sortedAddresses()) {
                    recalculationEngine.resolvePending(matrix, address);
                }
            } finally {
                matrix.getLock().writeLock().unlock();
            }
        }

        matrix.getLock().readLock().lock();
        try {
            Map<String, Object> data = new LinkedHashMap<>();
            for (CellAddress address : matrix.sortedAddresses()) {
                data.put(address.toA1(), matrix.getCell(address).getValue().toJsonValue());
            }
            return data;
        } finally {
            matrix.getLock().readLock().unlock();
        }
    }

    /**
     * Full recalculation of every formula cell.
     */
    public RecalcReport recalculate(long matrixId) {
        return recalculate(matrixId, CancellationToken.none());
    }

    public RecalcReport recalculate(long matrixId, CancellationToken token) {
        Matrix matrix = getMatrix(matrixId);
        matrix.getLock().writeLock().lock();
        try {
            return recalculationEngine.recalculateAll(matrix, token);
        } finally {
            matrix.getLock().writeLock().unlock();
        }
    }

    // ----------------------------------------------------------------
    // Row / column edits
    // ----------------------------------------------------------------

    public EditStatus insertRow(long matrixId, int index) {
        return applyStructuralEdit(matrixId, StructuralEdit.insertRow(index));
    }

    public EditStatus deleteRow(long matrixId, int index) {
        return applyStructuralEdit(matrixId, StructuralEdit.deleteRow(index));
    }

    public EditStatus insertColumn(long matrixId, int index) {
        return applyStructuralEdit(matrixId, StructuralEdit.insertColumn(index));
    }

    public EditStatus deleteColumn(long matrixId, int index) {
        return applyStructuralEdit(matrixId, StructuralEdit.deleteColumn(index));
    }

    /**
     * Shifts storage, rewrites formula references, then rebuilds the graph and
     * recalculates the whole matrix. An insertion that would push occupied cells past
     * the bounds, or any index at or past the bounds, is OUT_OF_RANGE.
     */
    private EditStatus applyStructuralEdit(long matrixId, StructuralEdit edit) {
        if (edit.getIndex() < 0) {
            throw new InvalidCoordinateException("Negative index: " + edit.getIndex());
        }
        Matrix matrix = getMatrix(matrixId);

        matrix.getLock().writeLock().lock();
        try {
            boolean rows = edit.getAxis() == StructuralEdit.Axis.ROW;
            int bound = rows ? matrix.getMaxRows() : matrix.getMaxColumns();
            int extent = rows ? matrix.getRowCount() : matrix.getColumnCount();
            if (edit.getIndex() >= bound
                    || (edit.getKind() == StructuralEdit.Kind.INSERT && extent >= bound)) {
                return EditStatus.OUT_OF_RANGE;
            }

            MatrixPatch before = fullImage(matrix);
            Set<CellAddress> circular = new HashSet<>();
            for (CellAddress address : matrix.getGraph().getRejected()) {
                CellAddress shifted = edit.shift(address);
                if (shifted != null) {
                    circular.add(shifted);
                }
            }
            Map<CellAddress, Cell> moved = translator.translate(new HashMap<>(matrix.getCells()), edit);
            int newExtent = extent;
            if (edit.getIndex() < extent) {
                newExtent = edit.getKind() == StructuralEdit.Kind.INSERT ? extent + 1 : extent - 1;
            }
            matrix.replaceCells(moved,
                    rows ? newExtent : matrix.getRowCount(),
                    rows ? matrix.getColumnCount() : newExtent);
            rebuild(matrix, circular);
            matrix.getHistory().record(new UndoRedoManager.Operation(edit.describe(), before, fullImage(matrix)));
            logger.info("Matrix {}: applied {}", matrixId, edit);
            return EditStatus.APPLIED;
        } finally {
            matrix.getLock().writeLock().unlock();
        }
    }

    // ----------------------------------------------------------------
    // Snapshots
    // ----------------------------------------------------------------

    /**
     * Raw text of every cell (row-major, A1 keys) plus the dimensions.
     */
    public MatrixSnapshot serialize(long matrixId) {
        Matrix matrix = getMatrix(matrixId);
        matrix.getLock().readLock().lock();
        try {
            Map<String, String> cells = new LinkedHashMap<>();
            for (CellAddress address : matrix.sortedAddresses()) {
                cells.put(address.toA1(), matrix.getCell(address).getRawText());
            }
            return new MatrixSnapshot(matrix.getName(), matrix.getRowCount(), matrix.getColumnCount(), cells);
        } finally {
            matrix.getLock().readLock().unlock();
        }
    }

    /**
     * Replaces the matrix contents with a snapshot, as one undoable step.
     * The matrix keeps its own name.
     */
    public EditStatus deserialize(long matrixId, MatrixSnapshot snapshot) {
        Matrix matrix = getMatrix(matrixId);
        MatrixPatch image = toImage(matrix, snapshot);
        if (image == null) {
            return EditStatus.OUT_OF_RANGE;
        }
        matrix.getLock().writeLock().lock();
        try {
            MatrixPatch before = fullImage(matrix);
            loadImage(matrix, image);
            matrix.getHistory().record(new UndoRedoManager.Operation("load snapshot", before, fullImage(matrix)));
            logger.info("Matrix {}: loaded snapshot with {} cells", matrixId, image.getRawTexts().size());
            return EditStatus.APPLIED;
        } finally {
            matrix.getLock().writeLock().unlock();
        }
    }

    // ----------------------------------------------------------------
    // Undo / redo
    // ----------------------------------------------------------------

    /**
     * @return false if there was nothing to undo
     */
    public boolean undo(long matrixId) {
        Matrix matrix = getMatrix(matrixId);
        matrix.getLock().writeLock().lock();
        try {
            return matrix.getHistory().undo(patch -> applyPatch(matrix, patch));
        } finally {
            matrix.getLock().writeLock().unlock();
        }
    }

    /**
     * @return false if there was nothing to redo
     */
    public boolean redo(long matrixId) {
        Matrix matrix = getMatrix(matrixId);
        matrix.getLock().writeLock().lock();
        try {
            return matrix.getHistory().redo(patch -> applyPatch(matrix, patch));
        } finally {
            matrix.getLock().writeLock().unlock();
        }
    }

    // ----------------------------------------------------------------
    // Dependency inspection
    // ----------------------------------------------------------------

    /**
     * For each formula cell => the cells it reads.
     */
    public Map<String, List<String>> getForwardDependencies(long matrixId) {
        Matrix matrix = getMatrix(matrixId);
        matrix.getLock().readLock().lock();
        try {
            return matrix.getGraph().forwardView();
        } finally {
            matrix.getLock().readLock().unlock();
        }
    }

    /**
     * For each cell => the formula cells that read it.
     */
    public Map<String, List<String>> getReverseDependencies(long matrixId) {
        Matrix matrix = getMatrix(matrixId);
        matrix.getLock().readLock().lock();
        try {
            return matrix.getGraph().reverseView();
        } finally {
            matrix.getLock().readLock().unlock();
        }
    }

    // ----------------------------------------------------------------
    // Internal Helpers (callers hold the write lock)
    // ----------------------------------------------------------------

    private Matrix newMatrix(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Matrix name must not be blank");
        }
        return new Matrix(name.trim(), properties.getMaxRows(), properties.getMaxColumns(), properties.getUndoLimit());
    }

    /**
     * Stores raw text in a cell and updates the graph. Does not evaluate formulas: an
     * accepted formula is left dirty for the recalculation that follows. A formula that
     * would close a cycle keeps its text but gets #CIRC! and no edges; one that does not
     * parse gets #ERROR / #NAME? with the parser's message.
     */
    private void assign(Matrix matrix, CellAddress address, String rawText) {
        DependencyGraph graph = matrix.getGraph();
        if (rawText == null || rawText.isEmpty()) {
            matrix.removeCell(address);
            graph.clearPrecedents(address);
            return;
        }

        Cell cell = new Cell(rawText);
        matrix.putCell(address, cell);
        if (!cell.isFormulaText()) {
            graph.clearPrecedents(address);
            cell.setValue(parseLiteral(rawText));
            return;
        }

        try {
            FormulaNode formula = parser.parse(rawText);
            cell.setFormula(formula);
            Set<CellAddress> precedents = PrecedentCollector.collect(formula, matrix.getMaxRows(), matrix.getMaxColumns());
            if (graph.setPrecedents(address, precedents)) {
                cell.setDirty(true);
            } else {
                cell.setValue(Value.error(ErrorType.CIRCULAR_REFERENCE));
                logger.debug("Matrix {}: {} would close a cycle, stored as {}",
                        matrix.getId(), address.toA1(), ErrorType.CIRCULAR_REFERENCE.getCode());
            }
        } catch (FormulaParseException e) {
            graph.clearPrecedents(address);
            cell.setValue(Value.error(e.getErrorType()));
            cell.setDiagnostic(e.getPosition() >= 0
                    ? e.getMessage() + " (position " + (e.getPosition() + 1) + ")"
                    : e.getMessage());
        }
    }

    /**
     * Number first, then TRUE/FALSE, otherwise the text itself.
     */
    static Value parseLiteral(String rawText) {
        Double number = Coercion.parseNumber(rawText);
        if (number != null) {
            return Value.number(number);
        }
        if (rawText.equalsIgnoreCase("TRUE")) {
            return Value.TRUE;
        }
        if (rawText.equalsIgnoreCase("FALSE")) {
            return Value.FALSE;
        }
        return Value.text(rawText);
    }

    /**
     * Re-admits circular formulas that no longer close a cycle, then recalculates the
     * dirty closure of the changed cells.
     */
    private RecalcReport settle(Matrix matrix, Collection<CellAddress> changed, CancellationToken token) {
        Set<CellAddress> start = new HashSet<>(changed);
        start.addAll(matrix.getGraph().readmitRejected());
        return recalculationEngine.recalculate(matrix, start, token);
    }

    /**
     * Re-parses every cell into an empty graph and recalculates everything. Cells are
     * assigned row-major, except that the 'circular' ones come last: where a cycle
     * remains they are the cells left out of it.
     */
    private void rebuild(Matrix matrix, Set<CellAddress> circular) {
        matrix.getGraph().clear();
        List<CellAddress> deferred = new ArrayList<>();
        for (CellAddress address : matrix.sortedAddresses()) {
            if (circular.contains(address)) {
                deferred.add(address);
            } else {
                assign(matrix, address, matrix.getCell(address).getRawText());
            }
        }
        for (CellAddress address : deferred) {
            assign(matrix, address, matrix.getCell(address).getRawText());
        }
        recalculationEngine.recalculateAll(matrix, CancellationToken.none());
    }

    /**
     * A partial patch restores its cells and the circular status recorded with it:
     * formulas that were circular then give up their edges before the patched cells
     * are written, and are the last to be re-admitted.
     */
    private void applyPatch(Matrix matrix, MatrixPatch patch) {
        if (patch.isFullImage()) {
            loadImage(matrix, patch);
            return;
        }
        DependencyGraph graph = matrix.getGraph();
        Set<CellAddress> circular = patch.getCircular();
        Set<CellAddress> changed = new HashSet<>(patch.getRawTexts().keySet());
        for (CellAddress address : circular) {
            if (!changed.contains(address) && graph.demote(address)) {
                matrix.getCell(address).setValue(Value.error(ErrorType.CIRCULAR_REFERENCE));
                changed.add(address);
            }
        }

        List<CellAddress> deferred = new ArrayList<>();
        for (Map.Entry<CellAddress, String> entry : patch.getRawTexts().entrySet()) {
            if (circular.contains(entry.getKey())) {
                deferred.add(entry.getKey());
            } else {
                assign(matrix, entry.getKey(), entry.getValue());
            }
        }
        for (CellAddress address : deferred) {
            assign(matrix, address, patch.getRawTexts().get(address));
        }

        Set<CellAddress> start = new HashSet<>(changed);
        start.addAll(graph.readmitRejected(circular));
        recalculationEngine.recalculate(matrix, start, CancellationToken.none());
    }

    private void loadImage(Matrix matrix, MatrixPatch image) {
        Map<CellAddress, Cell> cells = new HashMap<>();
        for (Map.Entry<CellAddress, String> entry : image.getRawTexts().entrySet()) {
            cells.put(entry.getKey(), new Cell(entry.getValue()));
        }
        matrix.replaceCells(cells, image.getRows(), image.getColumns());
        rebuild(matrix, image.getCircular());
    }

    private MatrixPatch fullImage(Matrix matrix) {
        Map<CellAddress, String> rawTexts = new LinkedHashMap<>();
        for (CellAddress address : matrix.sortedAddresses()) {
            rawTexts.put(address, matrix.getCell(address).getRawText());
        }
        return MatrixPatch.fullImage(rawTexts, matrix.getGraph().getRejected(),
                matrix.getRowCount(), matrix.getColumnCount());
    }

    /**
     * Converts a snapshot into a full image; null if anything lies outside the bounds.
     */
    private MatrixPatch toImage(Matrix matrix, MatrixSnapshot snapshot) {
        if (snapshot.getRows() < 0 || snapshot.getColumns() < 0) {
            throw new InvalidCoordinateException("Negative snapshot dimensions");
        }
        if (snapshot.getRows() > matrix.getMaxRows() || snapshot.getColumns() > matrix.getMaxColumns()) {
            return null;
        }
        Map<CellAddress, String> rawTexts = new TreeMap<>();
        for (Map.Entry<String, String> entry : snapshot.getCells().entrySet()) {
            CellAddress address = CellAddress.fromA1(entry.getKey());
            if (!matrix.isWithinBounds(address)) {
                return null;
            }
            if (entry.getValue() != null && !entry.getValue().isEmpty()) {
                rawTexts.put(address, entry.getValue());
            }
        }
        return MatrixPatch.fullImage(rawTexts, Collections.emptySet(), snapshot.getRows(), snapshot.getColumns());
    }

    private String rawTextAt(Matrix matrix, CellAddress address) {
        Cell cell = matrix.getCell(address);
        return cell == null ? null : cell.getRawText();
    }

    private CellView viewOf(Matrix matrix, CellAddress address) {
        Cell cell = matrix.getCell(address);
        if (cell == null) {
            return CellView.empty(address);
        }
        return new CellView(address, cell.getRawText(), cell.getValue(), cell.getDiagnostic());
    }

    private CellResult resultFor(Matrix matrix, CellAddress address) {
        CellView view = viewOf(matrix, address);
        return view.getDiagnostic() != null ? CellResult.parseError(view) : CellResult.ok(view);
    }
}
