package com.pricematrix.app.models;

import com.pricematrix.app.formula.ast.FormulaNode;

/**
 * Represents a single matrix cell.
 * Stores:
 * - rawText (what the user typed: a literal like "42" or a formula like "=A1*2")
 * - formula (the parsed tree, null for literals and for formulas that failed to parse)
 * - value (the cached computed result, possibly an error marker)
 * - diagnostic (parser message for #ERROR / #NAME? cells)
 * - dirty flag to signal the cached value is stale
 * Cells do not know their own coordinates; row/column edits move them between keys.
 */
public class Cell {
    private String rawText;
    private FormulaNode formula;
    private Value value = Value.BLANK;
    private String diagnostic;
    private boolean dirty;

    public Cell(String rawText) {
        this.rawText = rawText;
    }

    public String getRawText() {
        return rawText;
    }

    public void setRawText(String rawText) {
        this.rawText = rawText;
    }

    public boolean isFormulaText() {
        return rawText.startsWith("=");
    }

    public FormulaNode getFormula() {
        return formula;
    }

    public void setFormula(FormulaNode formula) {
        this.formula = formula;
    }

    public Value getValue() {
        return value;
    }

    // Storing a value means the cache is fresh again
    public void setValue(Value value) {
        this.value = value;
        this.dirty = false;
    }

    public String getDiagnostic() {
        return diagnostic;
    }

    public void setDiagnostic(String diagnostic) {
        this.diagnostic = diagnostic;
    }

    public boolean isDirty() {
        return dirty;
    }

    public void setDirty(boolean dirty) {
        this.dirty = dirty;
    }
}
