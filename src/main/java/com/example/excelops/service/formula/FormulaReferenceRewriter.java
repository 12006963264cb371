package com.example.excelops.service.formula;

import com.example.excelops.service.grid.RangeShifter;
import com.example.excelops.service.reference.Axis;
import com.example.excelops.service.reference.CellAddress;
import org.apache.poi.ss.formula.SheetNameFormatter;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Rewrites the references inside formula text.
 * <p>
 * Structural shifting follows the cells a reference names when whole rows or columns (or a
 * band of them) are inserted or deleted; absolute axes move too unless configured otherwise.
 * Copy translation offsets relative axes by the copy delta and leaves anchored axes alone.
 * Sheet renames re-qualify references and sheet removal breaks them. References that lose
 * their target are replaced by {@code #REF!}.
 */
public class FormulaReferenceRewriter {

    public static final String REF_ERROR = "#REF!";

    private final boolean shiftAbsoluteReferences;

    public FormulaReferenceRewriter(boolean shiftAbsoluteReferences) {
        this.shiftAbsoluteReferences = shiftAbsoluteReferences;
    }

    public FormulaReferenceRewriter() {
        this(true);
    }

    /**
     * Applies a structural shift on {@code shift.sheetName()} to a formula that lives on
     * {@code hostSheet}. References into other sheets are left as they are.
     */
    public FormulaRewrite shiftStructural(String formula, String hostSheet, StructuralShift shift) {
        String cause = shift.isInsert()
                ? "pushed past the sheet edge by the insertion"
                : "deleted by the removal of " + Math.abs(shift.delta()) + " " + shift.axis().label(Math.abs(shift.delta()));
        return rewrite(formula, ref -> ref.pointsInto(shift.sheetName(), hostSheet) ? shiftReference(ref, shift) : ref,
                cause);
    }

    /**
     * Offsets the relative axes of every reference by the copy delta, for a formula pasted onto
     * {@code targetSheet}. Unqualified references and references qualified with the target sheet
     * are translated; references into any other sheet are kept.
     */
    public FormulaRewrite translate(String formula, String targetSheet, int columnDelta, int rowDelta) {
        if (formula != null && columnDelta == 0 && rowDelta == 0) {
            return FormulaRewrite.unchanged(formula);
        }
        return rewrite(formula, ref -> ref.sheetQualifier() != null && !ref.pointsInto(targetSheet, targetSheet)
                ? ref
                : translateReference(ref, columnDelta, rowDelta), "moved off the sheet by the copy");
    }

    /**
     * Re-qualifies references into {@code oldName} with {@code newName}, quoting it where a
     * formula needs quotes. Unqualified references stay unqualified.
     */
    public FormulaRewrite renameSheet(String formula, String oldName, String newName) {
        String qualifier = SheetNameFormatter.format(newName);
        return rewrite(formula, ref -> ref.sheetQualifier() != null && ref.pointsInto(oldName, null)
                ? new FormulaReference(qualifier, ref.shape(), ref.first(), ref.second(), ref.startIndex(), ref.endIndex())
                : ref, "");
    }

    /**
     * Replaces every reference into the removed sheet {@code gone} with {@code #REF!}.
     */
    public FormulaRewrite dropSheet(String formula, String gone) {
        return rewrite(formula, ref -> ref.sheetQualifier() != null && ref.pointsInto(gone, null) ? null : ref,
                "points into the deleted sheet '" + gone + "'");
    }

    /**
     * Passes each reference through {@code mapper}: the same instance keeps the original text,
     * another instance is re-encoded, and {@code null} marks the reference as lost.
     */
    private FormulaRewrite rewrite(String formula, UnaryOperator<FormulaReference> mapper, String cause) {
        if (formula == null) {
            return null;
        }
        List<FormulaReference> refs = FormulaTokenizer.scan(formula);
        if (refs.isEmpty()) {
            return FormulaRewrite.unchanged(formula);
        }
        StringBuilder out = new StringBuilder(formula.length() + 8);
        List<String> lost = new ArrayList<>();
        int cursor = 0;
        for (FormulaReference ref : refs) {
            out.append(formula, cursor, ref.startIndex());
            cursor = ref.endIndex();
            String original = formula.substring(ref.startIndex(), ref.endIndex());
            FormulaReference moved = mapper.apply(ref);
            if (moved == null) {
                lost.add(original);
                out.append(REF_ERROR);
            } else if (moved == ref) {
                out.append(original);
            } else {
                out.append(moved.encode());
            }
        }
        out.append(formula.substring(cursor));
        return finish(formula, out.toString(), lost, cause);
    }

    private FormulaRewrite finish(String original, String rewritten, List<String> lost, String cause) {
        if (lost.isEmpty()) {
            return new FormulaRewrite(original, rewritten, null);
        }
        String reason = "Reference " + String.join(", ", lost) + " " + cause;
        return new FormulaRewrite(original, rewritten, new BrokenReference(original, reason));
    }

    /**
     * Returns the same instance when nothing moves and {@code null} when the target is gone.
     */
    FormulaReference shiftReference(FormulaReference ref, StructuralShift shift) {
        Axis axis = shift.axis();
        if (!ref.spans(axis)) {
            return ref;
        }
        if (!shiftAbsoluteReferences && ref.absolute(axis)) {
            return ref;
        }
        if (shift.isBanded()) {
            Axis cross = shift.crossAxis();
            if (!ref.spans(cross) || ref.low(cross) < shift.crossLow() || ref.high(cross) > shift.crossHigh()) {
                return ref;
            }
        }
        int low = ref.low(axis);
        int high = ref.high(axis);
        // a reference moved wholly by an insertion must fit on the sheet; one straddling it is clipped
        if (shift.isInsert() && low >= shift.start() && (long) high + shift.delta() > axis.limit()) {
            return null;
        }
        int[] bounds = RangeShifter.shiftBounds(low, high, shift.start(), shift.delta(), axis.limit());
        if (bounds == null) {
            return null;
        }
        if (bounds[0] == low && bounds[1] == high) {
            return ref;
        }
        return withBounds(ref, axis, bounds[0], bounds[1]);
    }

    FormulaReference translateReference(FormulaReference ref, int columnDelta, int rowDelta) {
        FormulaReference.Corner first = translateCorner(ref.first(), columnDelta, rowDelta);
        FormulaReference.Corner second = ref.second() == null ? null : translateCorner(ref.second(), columnDelta, rowDelta);
        if (first == null || (ref.second() != null && second == null)) {
            return null;
        }
        if (first.equals(ref.first()) && (second == null || second.equals(ref.second()))) {
            return ref;
        }
        return normalize(new FormulaReference(ref.sheetQualifier(), ref.shape(), first, second,
                ref.startIndex(), ref.endIndex()));
    }

    private FormulaReference.Corner translateCorner(FormulaReference.Corner corner, int columnDelta, int rowDelta) {
        FormulaReference.Corner result = corner;
        if (corner.column() > 0 && !corner.columnAbsolute() && columnDelta != 0) {
            int column = corner.column() + columnDelta;
            if (column < 1 || column > CellAddress.MAX_COLUMNS) {
                return null;
            }
            result = result.with(Axis.COLUMN, column);
        }
        if (corner.row() > 0 && !corner.rowAbsolute() && rowDelta != 0) {
            int row = corner.row() + rowDelta;
            if (row < 1 || row > CellAddress.MAX_ROWS) {
                return null;
            }
            result = result.with(Axis.ROW, row);
        }
        return result;
    }

    /**
     * Sets the reference's extent along {@code axis} to {@code [low, high]}, keeping each
     * bound's anchoring with the corner that held it.
     */
    private FormulaReference withBounds(FormulaReference ref, Axis axis, int low, int high) {
        if (ref.second() == null) {
            return new FormulaReference(ref.sheetQualifier(), ref.shape(), ref.first().with(axis, low), null,
                    ref.startIndex(), ref.endIndex());
        }
        boolean firstIsLow = ref.first().coordinate(axis) <= ref.second().coordinate(axis);
        FormulaReference.Corner first = ref.first().with(axis, firstIsLow ? low : high);
        FormulaReference.Corner second = ref.second().with(axis, firstIsLow ? high : low);
        return normalize(new FormulaReference(ref.sheetQualifier(), ref.shape(), first, second,
                ref.startIndex(), ref.endIndex()));
    }

    /**
     * Puts the smaller coordinate of each axis on the first corner. The anchoring flag travels
     * with its coordinate.
     */
    private FormulaReference normalize(FormulaReference ref) {
        if (ref.second() == null) {
            return ref;
        }
        FormulaReference.Corner a = ref.first();
        FormulaReference.Corner b = ref.second();
        boolean swapColumns = a.column() > b.column();
        boolean swapRows = a.row() > b.row();
        if (!swapColumns && !swapRows) {
            return ref;
        }
        FormulaReference.Corner first = new FormulaReference.Corner(
                swapColumns ? b.column() : a.column(), swapColumns ? b.columnAbsolute() : a.columnAbsolute(),
                swapRows ? b.row() : a.row(), swapRows ? b.rowAbsolute() : a.rowAbsolute());
        FormulaReference.Corner second = new FormulaReference.Corner(
                swapColumns ? a.column() : b.column(), swapColumns ? a.columnAbsolute() : b.columnAbsolute(),
                swapRows ? a.row() : b.row(), swapRows ? a.rowAbsolute() : b.rowAbsolute());
        return new FormulaReference(ref.sheetQualifier(), ref.shape(), first, second, ref.startIndex(), ref.endIndex());
    }
}
