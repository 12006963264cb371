package com.example.excelops.service.formula;

import com.example.excelops.service.reference.Axis;
import com.example.excelops.service.reference.CellAddress;
import com.example.excelops.service.reference.CellRange;

/**
 * A cell, area, whole-column or whole-row reference found in formula text, together with its
 * position ({@code startIndex} inclusive, {@code endIndex} exclusive) in that text.
 */
public record FormulaReference(
        String sheetQualifier,
        Shape shape,
        Corner first,
        Corner second,
        int startIndex,
        int endIndex
) {

    public enum Shape {
        CELL,
        AREA,
        COLUMNS,
        ROWS
    }

    /**
     * One corner of a reference. A zero column (row) means the corner has no column (row)
     * part, as in {@code 3:5} ({@code A:C}).
     */
    public record Corner(int column, boolean columnAbsolute, int row, boolean rowAbsolute) {

        public int coordinate(Axis axis) {
            return axis == Axis.ROW ? row : column;
        }

        public boolean absolute(Axis axis) {
            return axis == Axis.ROW ? rowAbsolute : columnAbsolute;
        }

        public Corner with(Axis axis, int value) {
            return axis == Axis.ROW
                    ? new Corner(column, columnAbsolute, value, rowAbsolute)
                    : new Corner(value, columnAbsolute, row, rowAbsolute);
        }

        public String encode() {
            StringBuilder sb = new StringBuilder();
            if (column > 0) {
                if (columnAbsolute) {
                    sb.append('$');
                }
                sb.append(CellAddress.columnLetters(column));
            }
            if (row > 0) {
                if (rowAbsolute) {
                    sb.append('$');
                }
                sb.append(row);
            }
            return sb.toString();
        }
    }

    public boolean isExternal() {
        return sheetQualifier != null
                && (sheetQualifier.startsWith("[") || sheetQualifier.startsWith("'["));
    }

    /**
     * The sheet name without quotes, or {@code null} for an unqualified reference.
     */
    public String sheetName() {
        if (sheetQualifier == null) {
            return null;
        }
        if (sheetQualifier.length() >= 2 && sheetQualifier.startsWith("'") && sheetQualifier.endsWith("'")) {
            return sheetQualifier.substring(1, sheetQualifier.length() - 1).replace("''", "'");
        }
        return sheetQualifier;
    }

    /**
     * Whether the reference points into {@code sheet} when the formula lives on {@code hostSheet}.
     */
    public boolean pointsInto(String sheet, String hostSheet) {
        if (isExternal()) {
            return false;
        }
        String target = sheetQualifier == null ? hostSheet : sheetName();
        return target != null && target.equalsIgnoreCase(sheet);
    }

    /**
     * Whether the reference spans this axis at all. Whole-row references have no column
     * extent and whole-column references no row extent.
     */
    public boolean spans(Axis axis) {
        return first.coordinate(axis) > 0;
    }

    public int low(Axis axis) {
        int a = first.coordinate(axis);
        return second == null ? a : Math.min(a, second.coordinate(axis));
    }

    public int high(Axis axis) {
        int a = first.coordinate(axis);
        return second == null ? a : Math.max(a, second.coordinate(axis));
    }

    /**
     * Whether every corner is anchored ({@code $}) on this axis.
     */
    public boolean absolute(Axis axis) {
        return first.absolute(axis) && (second == null || second.absolute(axis));
    }

    public boolean columnAbsolute() {
        return absolute(Axis.COLUMN);
    }

    public boolean rowAbsolute() {
        return absolute(Axis.ROW);
    }

    /**
     * Cells covered by the reference; whole-column and whole-row references cover the sheet's
     * full height or width.
     */
    public CellRange range() {
        int firstColumn = spans(Axis.COLUMN) ? low(Axis.COLUMN) : 1;
        int lastColumn = spans(Axis.COLUMN) ? high(Axis.COLUMN) : CellAddress.MAX_COLUMNS;
        int firstRow = spans(Axis.ROW) ? low(Axis.ROW) : 1;
        int lastRow = spans(Axis.ROW) ? high(Axis.ROW) : CellAddress.MAX_ROWS;
        return CellRange.of(firstColumn, firstRow, lastColumn, lastRow);
    }

    public String encode() {
        StringBuilder sb = new StringBuilder();
        if (sheetQualifier != null) {
            sb.append(sheetQualifier).append('!');
        }
        sb.append(first.encode());
        if (second != null) {
            sb.append(':').append(second.encode());
        }
        return sb.toString();
    }
}
