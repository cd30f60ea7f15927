package com.pricematrix.app.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Per-matrix undo and redo stacks. One entry is one user-visible operation
 * (a single write, a paste, a row/column edit, a snapshot load), holding the
 * state before and after it. Recording a new operation clears the redo stack.
 * Not thread-safe; callers hold the matrix write lock.
 */
public class UndoRedoManager {

    private static final Logger logger = LoggerFactory.getLogger(UndoRedoManager.class);

    /**
     * Restores a patch onto the live matrix.
     */
    public interface PatchApplier {
        void apply(MatrixPatch patch);
    }

    public static final class Operation {
        private final String description;
        private final MatrixPatch before;
        private final MatrixPatch after;

        public Operation(String description, MatrixPatch before, MatrixPatch after) {
            this.description = description;
            this.before = before;
            this.after = after;
        }

        public String getDescription() {
            return description;
        }

        public MatrixPatch getBefore() {
            return before;
        }

        public MatrixPatch getAfter() {
            return after;
        }
    }

    private final int limit;
    private final Deque<Operation> undoStack = new ArrayDeque<>();
    private final Deque<Operation> redoStack = new ArrayDeque<>();

    public UndoRedoManager(int limit) {
        this.limit = limit;
    }

    public void record(Operation operation) {
        undoStack.push(operation);
        while (undoStack.size() > limit) {
            undoStack.removeLast();
        }
        redoStack.clear();
    }

    /**
     * @return false when there was nothing to undo
     */
    public boolean undo(PatchApplier applier) {
        Operation operation = undoStack.poll();
        if (operation == null) {
            return false;
        }
        applier.apply(operation.getBefore());
        redoStack.push(operation);
        logger.debug("Undid '{}'", operation.getDescription());
        return true;
    }

    /**
     * @return false when there was nothing to redo
     */
    public boolean redo(PatchApplier applier) {
        Operation operation = redoStack.poll();
        if (operation == null) {
            return false;
        }
        applier.apply(operation.getAfter());
        undoStack.push(operation);
        logger.debug("Redid '{}'", operation.getDescription());
        return true;
    }

    public boolean canUndo() {
        return !undoStack.isEmpty();
    }

    public boolean canRedo() {
        return !redoStack.isEmpty();
    }
}
