package com.example.excelops.service.engine;

import com.example.excelops.service.ErrorKind;
import com.example.excelops.service.SheetOperationException;
import com.example.excelops.service.formula.FormulaReferenceRewriter;
import com.example.excelops.service.formula.FormulaRewrite;
import com.example.excelops.service.formula.StructuralShift;
import com.example.excelops.service.grid.CellContent;
import com.example.excelops.service.grid.MergedRegion;
import com.example.excelops.service.grid.SheetGrid;
import com.example.excelops.service.grid.TableRegion;
import com.example.excelops.service.grid.ValidationCriteria;
import com.example.excelops.service.grid.ValidationRule;
import com.example.excelops.service.reference.Axis;
import com.example.excelops.service.reference.CellAddress;
import com.example.excelops.service.reference.CellRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Inserts and deletes whole rows or columns, or deletes a rectangle and closes the gap, keeping
 * formulas, merged regions, tables, validation rules and line sizes consistent with the moved
 * cells. Sheet renames and removals are carried into the formulas of the remaining sheets.
 * <p>
 * All work happens on a scratch copy of the grid which replaces the caller's grid only once
 * everything has been rewritten. Cells move in descending order on insertion and ascending order
 * on deletion so that no cell is overwritten before it has moved.
 */
public class StructuralMutator {

    private static final Logger log = LoggerFactory.getLogger(StructuralMutator.class);

    private final FormulaReferenceRewriter rewriter;

    public StructuralMutator(FormulaReferenceRewriter rewriter) {
        this.rewriter = rewriter;
    }

    public MutationReport insert(SheetGrid grid, Axis axis, int start, int count) {
        checkPositionAndCount(axis, start, count);
        int lastUsed = grid.lastUsed(axis);
        if (lastUsed >= start && (long) lastUsed + count > axis.limit()) {
            throw SheetOperationException.outOfBounds("Inserting " + count + " " + axis.label(count)
                    + " would push populated cells past the last " + axis.label(1));
        }
        checkRangesFit(grid, axis, start, count);

        SheetGrid scratch = grid.copy();
        List<CellAddress> moving = new ArrayList<>();
        for (CellAddress address : scratch.cells().keySet()) {
            if (axis.coordinate(address) >= start) {
                moving.add(address);
            }
        }
        moving.sort(Comparator.<CellAddress>comparingInt(axis::coordinate).reversed());
        for (CellAddress from : moving) {
            CellContent content = scratch.remove(from);
            scratch.put(axis.withCoordinate(from, axis.coordinate(from) + count), content);
        }

        StructuralShift shift = StructuralShift.insert(grid.sheetName(), axis, start, count);
        List<BrokenFormula> broken = new ArrayList<>();
        int rewritten = rewriteFormulas(scratch, shift, broken);
        int mergesDropped = scratch.merges().shiftAll(axis, start, count);
        int validationsDropped = scratch.validations().shiftAll(axis, start, count);
        scratch.tables().shiftAll(axis, start, count);
        rewriteValidationFormulas(scratch, shift);
        shiftLineSizes(lineSizes(scratch, axis), start, count, axis.limit());

        grid.replaceWith(scratch);
        log.debug("Inserted {} {} at {} on '{}': {} cells moved, {} formulas rewritten",
                count, axis.label(count), start, grid.sheetName(), moving.size(), rewritten);
        return new MutationReport(moving.size(), 0, rewritten, mergesDropped, validationsDropped, broken);
    }

    public MutationReport delete(SheetGrid grid, Axis axis, int start, int count) {
        checkPositionAndCount(axis, start, count);
        if ((long) start + count - 1 > axis.limit()) {
            throw SheetOperationException.outOfBounds("Cannot delete " + count + " " + axis.label(count)
                    + " from " + axis.label(1) + " " + start + ": past the sheet limit");
        }
        int bandEnd = start + count - 1;
        if (axis == Axis.ROW) {
            checkTableHeaders(grid, start, bandEnd, 0, 0);
        }

        SheetGrid scratch = grid.copy();
        List<CellAddress> removed = new ArrayList<>();
        List<CellAddress> moving = new ArrayList<>();
        for (CellAddress address : scratch.cells().keySet()) {
            int coordinate = axis.coordinate(address);
            if (coordinate >= start && coordinate <= bandEnd) {
                removed.add(address);
            } else if (coordinate > bandEnd) {
                moving.add(address);
            }
        }
        removed.forEach(scratch::remove);
        moving.sort(Comparator.comparingInt(axis::coordinate));
        for (CellAddress from : moving) {
            CellContent content = scratch.remove(from);
            scratch.put(axis.withCoordinate(from, axis.coordinate(from) - count), content);
        }

        StructuralShift shift = StructuralShift.delete(grid.sheetName(), axis, start, count);
        List<BrokenFormula> broken = new ArrayList<>();
        int rewritten = rewriteFormulas(scratch, shift, broken);
        int mergesDropped = scratch.merges().shiftAll(axis, start, -count);
        int validationsDropped = scratch.validations().shiftAll(axis, start, -count);
        logDroppedTables(scratch, scratch.tables().shiftAll(axis, start, -count));
        rewriteValidationFormulas(scratch, shift);
        NavigableMap<Integer, ?> sizes = lineSizes(scratch, axis);
        sizes.subMap(start, true, bandEnd, true).clear();
        shiftLineSizes(sizes, bandEnd + 1, -count, axis.limit());

        grid.replaceWith(scratch);
        log.debug("Deleted {} {} at {} on '{}': {} cells removed, {} moved, {} formulas rewritten",
                count, axis.label(count), start, grid.sheetName(), removed.size(), moving.size(), rewritten);
        return new MutationReport(moving.size(), removed.size(), rewritten, mergesDropped, validationsDropped, broken);
    }

    /**
     * Deletes the cells of {@code range} and moves the cells beyond it along {@code axis} back
     * by the range's extent, within the range's band on the other axis only. Rows move up for
     * {@link Axis#ROW}; columns move left for {@link Axis#COLUMN}.
     */
    public MutationReport deleteRange(SheetGrid grid, CellRange range, Axis axis) {
        Axis cross = axis == Axis.ROW ? Axis.COLUMN : Axis.ROW;
        int start = range.low(axis);
        int count = range.high(axis) - start + 1;
        int crossLow = range.low(cross);
        int crossHigh = range.high(cross);

        for (MergedRegion merge : grid.merges().list()) {
            checkNotSplit(range, axis, merge.range(), "merged region " + merge.range().encode());
        }
        for (TableRegion table : grid.tables().list()) {
            checkNotSplit(range, axis, table.range(), "table '" + table.name() + "'");
        }
        if (axis == Axis.ROW) {
            checkTableHeaders(grid, start, range.high(axis), crossLow, crossHigh);
        }

        SheetGrid scratch = grid.copy();
        List<CellAddress> removed = new ArrayList<>();
        List<CellAddress> moving = new ArrayList<>();
        for (CellAddress address : scratch.cells().keySet()) {
            int c = cross.coordinate(address);
            if (c < crossLow || c > crossHigh) {
                continue;
            }
            if (range.contains(address)) {
                removed.add(address);
            } else if (axis.coordinate(address) > range.high(axis)) {
                moving.add(address);
            }
        }
        removed.forEach(scratch::remove);
        moving.sort(Comparator.comparingInt(axis::coordinate));
        for (CellAddress from : moving) {
            CellContent content = scratch.remove(from);
            scratch.put(axis.withCoordinate(from, axis.coordinate(from) - count), content);
        }

        StructuralShift shift = StructuralShift.deleteWithinBand(grid.sheetName(), axis, start, count, crossLow, crossHigh);
        List<BrokenFormula> broken = new ArrayList<>();
        int rewritten = rewriteFormulas(scratch, shift, broken);
        int mergesDropped = scratch.merges().shiftWithinBand(axis, start, -count, crossLow, crossHigh);
        int validationsDropped = scratch.validations().shiftWithinBand(axis, start, -count, crossLow, crossHigh);
        logDroppedTables(scratch, scratch.tables().shiftWithinBand(axis, start, -count, crossLow, crossHigh));
        rewriteValidationFormulas(scratch, shift);

        grid.replaceWith(scratch);
        log.debug("Deleted range {} on '{}' shifting {}: {} cells removed, {} moved",
                range.encode(), grid.sheetName(), axis == Axis.ROW ? "up" : "left", removed.size(), moving.size());
        return new MutationReport(moving.size(), removed.size(), rewritten, mergesDropped, validationsDropped, broken);
    }

    /**
     * Rewrites references to the shifted sheet in the formulas of another sheet of the same
     * workbook. Cells, merges and validation ranges of {@code dependent} stay where they are.
     */
    public MutationReport rewriteDependents(SheetGrid dependent, StructuralShift shift) {
        return rewriteAllFormulas(dependent,
                formula -> rewriter.shiftStructural(formula, dependent.sheetName(), shift));
    }

    /**
     * Re-qualifies references to a renamed sheet in the cell and validation formulas of
     * {@code grid}.
     */
    public MutationReport renameSheetReferences(SheetGrid grid, String oldName, String newName) {
        return rewriteAllFormulas(grid, formula -> rewriter.renameSheet(formula, oldName, newName));
    }

    /**
     * Turns references to a deleted sheet into {@code #REF!} in the cell and validation
     * formulas of {@code grid}.
     */
    public MutationReport dropSheetReferences(SheetGrid grid, String deletedSheet) {
        return rewriteAllFormulas(grid, formula -> rewriter.dropSheet(formula, deletedSheet));
    }

    private MutationReport rewriteAllFormulas(SheetGrid grid, Function<String, FormulaRewrite> policy) {
        SheetGrid scratch = grid.copy();
        List<BrokenFormula> broken = new ArrayList<>();
        int rewritten = rewriteFormulas(scratch, policy, broken);
        rewriteValidationFormulas(scratch, policy);
        grid.replaceWith(scratch);
        return MutationReport.formulasOnly(rewritten, broken);
    }

    private int rewriteFormulas(SheetGrid scratch, StructuralShift shift, List<BrokenFormula> broken) {
        return rewriteFormulas(scratch, formula -> rewriter.shiftStructural(formula, scratch.sheetName(), shift), broken);
    }

    private int rewriteFormulas(SheetGrid scratch, Function<String, FormulaRewrite> policy, List<BrokenFormula> broken) {
        int rewritten = 0;
        for (Map.Entry<CellAddress, CellContent> entry : new ArrayList<>(scratch.cells().entrySet())) {
            CellContent content = entry.getValue();
            if (!content.isFormula()) {
                continue;
            }
            FormulaRewrite result = policy.apply(content.formula());
            if (!result.changed()) {
                continue;
            }
            scratch.put(entry.getKey(), content.withFormula(result.formula()));
            rewritten++;
            if (result.isBroken()) {
                log.warn("Formula in {}!{} lost a reference: {}", scratch.sheetName(), entry.getKey().encode(),
                        result.broken().reason());
                broken.add(new BrokenFormula(scratch.sheetName(), entry.getKey(),
                        "=" + result.formula(), result.broken()));
            }
        }
        return rewritten;
    }

    private void rewriteValidationFormulas(SheetGrid scratch, StructuralShift shift) {
        rewriteValidationFormulas(scratch, formula -> rewriter.shiftStructural(formula, scratch.sheetName(), shift));
    }

    private void rewriteValidationFormulas(SheetGrid scratch, Function<String, FormulaRewrite> policy) {
        scratch.validations().replaceAll(rule -> {
            ValidationCriteria criteria = rule.criteria();
            FormulaRewrite f1 = criteria.formula1() == null ? null : policy.apply(criteria.formula1());
            FormulaRewrite f2 = criteria.formula2() == null ? null : policy.apply(criteria.formula2());
            boolean changed = (f1 != null && f1.changed()) || (f2 != null && f2.changed());
            if (!changed) {
                return rule;
            }
            if ((f1 != null && f1.isBroken()) || (f2 != null && f2.isBroken())) {
                log.warn("Validation rule on {}!{} now refers to deleted cells", scratch.sheetName(),
                        rule.range().encode());
            }
            return rule.withCriteria(criteria.withFormulas(
                    f1 == null ? null : f1.formula(), f2 == null ? null : f2.formula()));
        });
    }

    /**
     * Merges and tables keep their shape, so one that reaches the insertion point must still
     * fit on the sheet afterwards. Validation rules that already run to the sheet edge are
     * clipped instead.
     */
    private static void checkRangesFit(SheetGrid grid, Axis axis, int start, int count) {
        for (MergedRegion merge : grid.merges().list()) {
            requireFits(merge.range(), axis, start, count, "merged region " + merge.range().encode());
        }
        for (TableRegion table : grid.tables().list()) {
            requireFits(table.range(), axis, start, count, "table '" + table.name() + "'");
        }
        for (ValidationRule rule : grid.validations().list()) {
            if (rule.range().high(axis) < axis.limit()) {
                requireFits(rule.range(), axis, start, count, "validation rule on " + rule.range().encode());
            }
        }
    }

    private static void requireFits(CellRange range, Axis axis, int start, int count, String what) {
        int high = range.high(axis);
        if (high >= start && (long) high + count > axis.limit()) {
            throw SheetOperationException.outOfBounds("Inserting " + count + " " + axis.label(count)
                    + " would push " + what + " past the last " + axis.label(1));
        }
    }

    private static void checkNotSplit(CellRange deleted, Axis axis, CellRange anchored, String what) {
        Axis cross = axis == Axis.ROW ? Axis.COLUMN : Axis.ROW;
        int crossLow = deleted.low(cross);
        int crossHigh = deleted.high(cross);
        boolean inMovingArea = anchored.high(axis) >= deleted.low(axis)
                && anchored.high(cross) >= crossLow && anchored.low(cross) <= crossHigh;
        boolean withinBand = anchored.low(cross) >= crossLow && anchored.high(cross) <= crossHigh;
        if (inMovingArea && !withinBand) {
            throw new SheetOperationException(ErrorKind.OVERLAP, "Deleting " + deleted.encode()
                    + " would split " + what);
        }
    }

    // a table may lose its data rows but never its header while data rows remain
    private static void checkTableHeaders(SheetGrid grid, int firstRow, int lastRow, int crossLow, int crossHigh) {
        for (TableRegion table : grid.tables().list()) {
            CellRange range = table.range();
            boolean inBand = crossLow == 0 || (range.firstColumn() >= crossLow && range.lastColumn() <= crossHigh);
            int header = table.headerRow();
            if (inBand && header >= firstRow && header <= lastRow && range.lastRow() > lastRow) {
                throw new SheetOperationException(ErrorKind.OVERLAP, "Deleting rows " + firstRow + "-" + lastRow
                        + " would remove the header row of table '" + table.name() + "'");
            }
        }
    }

    private static void logDroppedTables(SheetGrid scratch, int dropped) {
        if (dropped > 0) {
            log.warn("{} table(s) on '{}' lost all their data rows and were removed", dropped, scratch.sheetName());
        }
    }

    private static NavigableMap<Integer, ?> lineSizes(SheetGrid grid, Axis axis) {
        return axis == Axis.ROW ? grid.rowHeights() : grid.columnWidths();
    }

    private static <V> void shiftLineSizes(NavigableMap<Integer, V> sizes, int from, int delta, int limit) {
        NavigableMap<Integer, V> tail = new TreeMap<>(sizes.tailMap(from, true));
        sizes.keySet().removeAll(tail.keySet());
        for (Map.Entry<Integer, V> e : tail.entrySet()) {
            int key = e.getKey() + delta;
            if (key >= 1 && key <= limit) {
                sizes.put(key, e.getValue());
            }
        }
    }

    private static void checkPositionAndCount(Axis axis, int start, int count) {
        if (start < 1 || start > axis.limit()) {
            throw new SheetOperationException(ErrorKind.INVALID_POSITION,
                    "Start " + axis.label(1) + " must be between 1 and " + axis.limit() + ", got " + start);
        }
        if (count < 1) {
            throw new SheetOperationException(ErrorKind.INVALID_COUNT,
                    "Count must be at least 1, got " + count);
        }
    }
}
