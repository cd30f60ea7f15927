package com.pricematrix.app.controllers;

import com.pricematrix.app.exceptions.OutOfRangeException;
import com.pricematrix.app.models.CellAddress;
import com.pricematrix.app.models.CellResult;
import com.pricematrix.app.models.CellView;
import com.pricematrix.app.models.EditStatus;
import com.pricematrix.app.models.MatrixSnapshot;
import com.pricematrix.app.models.MatrixSummary;
import com.pricematrix.app.services.MatrixService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST endpoints for managing price matrices.
 * "/matrix" is the base path. Rows and columns in paths are 0-based.
 */
@RestController
@RequestMapping("/matrix")
public class MatrixController {

    @Autowired
    private MatrixService matrixService;

    /**
     * POST /matrix
     * Body: { "name": "..." }. Creates an empty matrix, returns its id.
     */
    @PostMapping
    public ResponseEntity<Long> createMatrix(@RequestBody Map<String, String> request) {
        long matrixId = matrixService.createMatrix(request.get("name"));
        return ResponseEntity.ok(matrixId);
    }

    @GetMapping
    public ResponseEntity<List<MatrixSummary>> listMatrices() {
        return ResponseEntity.ok(matrixService.listMatrices());
    }

    /**
     * DELETE /matrix/{matrixId}
     * 200 when removed, 404 when there was no such matrix.
     */
    @DeleteMapping("/{matrixId}")
    public ResponseEntity<Void> deleteMatrix(@PathVariable long matrixId) {
        if (!matrixService.deleteMatrix(matrixId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok().build();
    }

    /**
     * POST /matrix/{matrixId}/clone
     * Body: { "name": "..." }. Returns the id of the copy.
     */
    @PostMapping("/{matrixId}/clone")
    public ResponseEntity<Long> cloneMatrix(@PathVariable long matrixId, @RequestBody Map<String, String> request) {
        return ResponseEntity.ok(matrixService.cloneMatrix(matrixId, request.get("name")));
    }

    /**
     * PUT /matrix/{matrixId}/cell/{row}/{column}
     * Body: raw text (a literal, or a formula starting with '=').
     * A formula that fails to parse is still stored and comes back with status PARSE_ERROR;
     * an address past the bounds is a 400.
     */
    @PutMapping("/{matrixId}/cell/{row}/{column}")
    public ResponseEntity<CellResult> setCell(
            @PathVariable long matrixId,
            @PathVariable int row,
            @PathVariable int column,
            @RequestBody(required = false) String rawText
    ) {
        CellResult result = matrixService.setCell(matrixId, row, column, rawText == null ? "" : rawText);
        if (!result.isStored()) {
            throw new OutOfRangeException(result.getMessage());
        }
        return ResponseEntity.ok(result);
    }

    /**
     * PUT /matrix/{matrixId}/cells
     * Body: { "A1": "5", "B1": "=A1*2" }. Applied as one paste and one undo step.
     */
    @PutMapping("/{matrixId}/cells")
    public ResponseEntity<List<CellResult>> setCells(@PathVariable long matrixId,
                                                     @RequestBody Map<String, String> rawTexts) {
        Map<CellAddress, String> byAddress = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : rawTexts.entrySet()) {
            byAddress.put(CellAddress.fromA1(entry.getKey()), entry.getValue());
        }
        return ResponseEntity.ok(matrixService.setCells(matrixId, byAddress));
    }

    @DeleteMapping("/{matrixId}/cell/{row}/{column}")
    public ResponseEntity<CellResult> clearCell(@PathVariable long matrixId,
                                                @PathVariable int row,
                                                @PathVariable int column) {
        CellResult result = matrixService.clearCell(matrixId, row, column);
        if (!result.isStored()) {
            throw new OutOfRangeException(result.getMessage());
        }
        return ResponseEntity.ok(result);
    }

    @GetMapping("/{matrixId}/cell/{row}/{column}")
    public ResponseEntity<CellView> getCell(@PathVariable long matrixId,
                                            @PathVariable int row,
                                            @PathVariable int column) {
        return ResponseEntity.ok(matrixService.getCell(matrixId, row, column));
    }

    /**
     * GET /matrix/{matrixId}
     * Returns a map of computed values for every stored cell,
     * in the format: { "A1": 5, "B1": 10, "C1": "#DIV/0!" }.
     */
    @GetMapping("/{matrixId}")
    public ResponseEntity<Map<String, Object>> getMatrix(@PathVariable long matrixId) {
        return ResponseEntity.ok(matrixService.getMatrixData(matrixId));
    }

    @PostMapping("/{matrixId}/rows/{index}")
    public ResponseEntity<Void> insertRow(@PathVariable long matrixId, @PathVariable int index) {
        return toResponse(matrixService.insertRow(matrixId, index), "row", index);
    }

    @DeleteMapping("/{matrixId}/rows/{index}")
    public ResponseEntity<Void> deleteRow(@PathVariable long matrixId, @PathVariable int index) {
        return toResponse(matrixService.deleteRow(matrixId, index), "row", index);
    }

    @PostMapping("/{matrixId}/columns/{index}")
    public ResponseEntity<Void> insertColumn(@PathVariable long matrixId, @PathVariable int index) {
        return toResponse(matrixService.insertColumn(matrixId, index), "column", index);
    }

    @DeleteMapping("/{matrixId}/columns/{index}")
    public ResponseEntity<Void> deleteColumn(@PathVariable long matrixId, @PathVariable int index) {
        return toResponse(matrixService.deleteColumn(matrixId, index), "column", index);
    }

    /**
     * GET /matrix/{matrixId}/snapshot
     * Raw text per cell plus dimensions, for persistence and import/export.
     */
    @GetMapping("/{matrixId}/snapshot")
    public ResponseEntity<MatrixSnapshot> getSnapshot(@PathVariable long matrixId) {
        return ResponseEntity.ok(matrixService.serialize(matrixId));
    }

    @PutMapping("/{matrixId}/snapshot")
    public ResponseEntity<Void> loadSnapshot(@PathVariable long matrixId, @RequestBody MatrixSnapshot snapshot) {
        if (matrixService.deserialize(matrixId, snapshot) == EditStatus.OUT_OF_RANGE) {
            throw new OutOfRangeException("Snapshot does not fit into matrix " + matrixId);
        }
        return ResponseEntity.ok().build();
    }

    /**
     * POST /matrix/{matrixId}/undo
     * Returns false when there was nothing to undo.
     */
    @PostMapping("/{matrixId}/undo")
    public ResponseEntity<Boolean> undo(@PathVariable long matrixId) {
        return ResponseEntity.ok(matrixService.undo(matrixId));
    }

    @PostMapping("/{matrixId}/redo")
    public ResponseEntity<Boolean> redo(@PathVariable long matrixId) {
        return ResponseEntity.ok(matrixService.redo(matrixId));
    }

    /**
     * GET /matrix/{matrixId}/forwardDependencies
     * For each formula cell => the cells it references.
     */
    @GetMapping("/{matrixId}/forwardDependencies")
    public ResponseEntity<Map<String, List<String>>> getForwardDependencies(@PathVariable long matrixId) {
        return ResponseEntity.ok(matrixService.getForwardDependencies(matrixId));
    }

    /**
     * GET /matrix/{matrixId}/reverseDependencies
     * For each referenced cell => the formula cells that read it.
     */
    @GetMapping("/{matrixId}/reverseDependencies")
    public ResponseEntity<Map<String, List<String>>> getReverseDependencies(@PathVariable long matrixId) {
        return ResponseEntity.ok(matrixService.getReverseDependencies(matrixId));
    }

    private ResponseEntity<Void> toResponse(EditStatus status, String axis, int index) {
        if (status == EditStatus.OUT_OF_RANGE) {
            throw new OutOfRangeException("Cannot edit " + axis + " " + index + ": outside the matrix bounds");
        }
        return ResponseEntity.ok().build();
    }
}
