package com.example.excelops.service.formula;

import com.example.excelops.service.reference.Axis;

/**
 * Insertion ({@code delta > 0}) or deletion ({@code delta < 0}) of lines on one sheet.
 * When {@code crossLow}/{@code crossHigh} are non-zero, only the band between them on the other
 * axis moves, as in a delete-range with shifting; otherwise whole rows or columns move.
 */
public record StructuralShift(String sheetName, Axis axis, int start, int delta, int crossLow, int crossHigh) {

    public static StructuralShift insert(String sheetName, Axis axis, int start, int count) {
        return new StructuralShift(sheetName, axis, start, count, 0, 0);
    }

    public static StructuralShift delete(String sheetName, Axis axis, int start, int count) {
        return new StructuralShift(sheetName, axis, start, -count, 0, 0);
    }

    public static StructuralShift deleteWithinBand(String sheetName, Axis axis, int start, int count,
                                                   int crossLow, int crossHigh) {
        return new StructuralShift(sheetName, axis, start, -count, crossLow, crossHigh);
    }

    public boolean isInsert() {
        return delta > 0;
    }

    public boolean isBanded() {
        return crossLow > 0;
    }

    public Axis crossAxis() {
        return axis == Axis.ROW ? Axis.COLUMN : Axis.ROW;
    }
}
