package com.pricematrix.app.engine;

import com.pricematrix.app.models.Cell;
import com.pricematrix.app.models.CellAddress;
import com.pricematrix.app.models.Matrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Brings formula values up to date after a write: computes the dirty closure of the
 * changed cells, orders it topologically and evaluates every dirty formula cell once,
 * after all of its in-closure precedents.
 */
@Component
public class RecalculationEngine {

    private static final Logger logger = LoggerFactory.getLogger(RecalculationEngine.class);

    private final Evaluator evaluator;

    public RecalculationEngine(Evaluator evaluator) {
        this.evaluator = evaluator;
    }

    public RecalcReport recalculate(Matrix matrix, Collection<CellAddress> changed, CancellationToken token) {
        DependencyGraph graph = matrix.getGraph();
        Set<CellAddress> dirty = graph.dependentClosure(changed);
        for (CellAddress address : dirty) {
            Cell cell = matrix.getCell(address);
            if (cell != null && cell.getFormula() != null) {
                cell.setDirty(true);
            }
        }

        List<CellAddress> order = graph.topologicalOrder(dirty);
        int evaluated = 0;
        for (int i = 0; i < order.size(); i++) {
            if (token.isCancelled()) {
                logger.warn("Recalculation of matrix {} cancelled with {} of {} cells pending",
                        matrix.getId(), order.size() - i, order.size());
                return new RecalcReport(dirty.size(), evaluated, true);
            }
            CellAddress address = order.get(i);
            Cell cell = matrix.getCell(address);
            // Already refreshed on demand by an earlier cell in this pass
            if (cell == null || !cell.isDirty()) {
                continue;
            }
            if (evaluator.refresh(matrix, address)) {
                evaluated++;
            }
        }
        logger.debug("Matrix {}: recalculated {} formula cells (dirty closure {})",
                matrix.getId(), evaluated, dirty.size());
        return new RecalcReport(dirty.size(), evaluated, false);
    }

    /**
     * Evaluates a cell left dirty by a cancelled pass, together with whatever dirty
     * precedents it needs.
     */
    public void resolvePending(Matrix matrix, CellAddress address) {
        Cell cell = matrix.getCell(address);
        if (cell != null && cell.isDirty()) {
            evaluator.refresh(matrix, address);
        }
    }

    /**
     * Recalculates every cell of the matrix.
     */
    public RecalcReport recalculateAll(Matrix matrix, CancellationToken token) {
        return recalculate(matrix, matrix.getCells().keySet(), token);
    }
}
