package com.pricematrix.app.engine;

import com.pricematrix.app.formula.CellReference;
import com.pricematrix.app.formula.FormulaTokenizer;
import com.pricematrix.app.formula.Token;
import com.pricematrix.app.formula.TokenType;
import com.pricematrix.app.models.Cell;
import com.pricematrix.app.models.CellAddress;
import com.pricematrix.app.models.ErrorType;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies a row/column insertion or deletion to cell storage and to the reference
 * text of every formula. The formula text is spliced token by token, so spacing and
 * the '$' markers survive. A reference to a deleted row/column becomes "#REF!";
 * a range becomes "#REF!" as soon as one of its corners was deleted.
 */
@Component
public class StructuralEditTranslator {

    private static final String BROKEN = ErrorType.BROKEN_REFERENCE.getCode();

    /**
     * Moves cells to their new addresses; cells in a deleted row/column are dropped.
     * Formula cells get their raw text rewritten.
     */
    public Map<CellAddress, Cell> translate(Map<CellAddress, Cell> cells, StructuralEdit edit) {
        Map<CellAddress, Cell> moved = new HashMap<>();
        for (Map.Entry<CellAddress, Cell> entry : cells.entrySet()) {
            CellAddress target = edit.shift(entry.getKey());
            if (target == null) {
                continue;
            }
            Cell cell = entry.getValue();
            if (cell.isFormulaText()) {
                cell.setRawText(rewriteFormula(cell.getRawText(), edit));
            }
            moved.put(target, cell);
        }
        return moved;
    }

    /**
     * Rewrites the references in one formula. Literals come back unchanged; in a formula
     * with parts that do not tokenize the references that do are still rewritten.
     */
    public String rewriteFormula(String rawText, StructuralEdit edit) {
        if (!rawText.startsWith("=")) {
            return rawText;
        }
        String body = rawText.substring(1);
        List<Token> tokens = FormulaTokenizer.tokenizeLenient(body);

        StringBuilder out = new StringBuilder("=");
        int copied = 0;
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (!token.is(TokenType.CELL_REF)) {
                continue;
            }
            boolean isRange = i + 2 < tokens.size()
                    && tokens.get(i + 1).is(TokenType.COLON)
                    && tokens.get(i + 2).is(TokenType.CELL_REF);
            String replacement;
            int end;
            if (isRange) {
                Token second = tokens.get(i + 2);
                replacement = rewriteRange(CellReference.parse(token.getText()),
                        CellReference.parse(second.getText()), edit);
                end = second.getEnd();
                i += 2;
            } else {
                replacement = rewriteSingle(CellReference.parse(token.getText()), edit);
                end = token.getEnd();
            }
            if (replacement != null) {
                out.append(body, copied, token.getStart()).append(replacement);
                copied = end;
            }
        }
        out.append(body.substring(copied));
        return out.toString();
    }

    /**
     * @return the new text, or null when the reference is unaffected
     */
    private String rewriteSingle(CellReference reference, StructuralEdit edit) {
        CellReference shifted = shift(reference, edit);
        if (shifted == null) {
            return BROKEN;
        }
        return shifted.equals(reference) ? null : shifted.toText();
    }

    /**
     * Corners are shifted independently and the result is written ascending again.
     */
    private String rewriteRange(CellReference first, CellReference second, StructuralEdit edit) {
        CellReference a = shift(first, edit);
        CellReference b = shift(second, edit);
        if (a == null || b == null) {
            return BROKEN;
        }
        if (a.equals(first) && b.equals(second)) {
            return null;
        }
        CellAddress pa = a.getAddress();
        CellAddress pb = b.getAddress();
        boolean aTop = pa.getRow() <= pb.getRow();
        boolean aLeft = pa.getColumn() <= pb.getColumn();
        CellReference topLeft = new CellReference(
                new CellAddress(Math.min(pa.getRow(), pb.getRow()), Math.min(pa.getColumn(), pb.getColumn())),
                aLeft ? a.isAbsoluteColumn() : b.isAbsoluteColumn(),
                aTop ? a.isAbsoluteRow() : b.isAbsoluteRow());
        CellReference bottomRight = new CellReference(
                new CellAddress(Math.max(pa.getRow(), pb.getRow()), Math.max(pa.getColumn(), pb.getColumn())),
                aLeft ? b.isAbsoluteColumn() : a.isAbsoluteColumn(),
                aTop ? b.isAbsoluteRow() : a.isAbsoluteRow());
        return topLeft.toText() + ":" + bottomRight.toText();
    }

    // '$' markers do not pin a reference; absolute and relative shift alike
    private CellReference shift(CellReference reference, StructuralEdit edit) {
        CellAddress moved = edit.shift(reference.getAddress());
        if (moved == null) {
            return null;
        }
        return reference.moveTo(moved.getRow(), moved.getColumn());
    }
}
