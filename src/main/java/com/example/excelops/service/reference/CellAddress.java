package com.example.excelops.service.reference;

import com.example.excelops.service.SheetOperationException;
import org.apache.poi.ss.util.CellReference;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A single cell coordinate, 1-based on both axes.
 */
public record CellAddress(int column, int row) implements Comparable<CellAddress> {

    public static final int MAX_COLUMNS = 16_384;
    public static final int MAX_ROWS = 1_048_576;

    private static final Pattern ADDRESS_PATTERN = Pattern.compile("^([A-Za-z]+)([0-9]+)$");

    public CellAddress {
        if (column < 1 || column > MAX_COLUMNS || row < 1 || row > MAX_ROWS) {
            throw SheetOperationException.outOfBounds(
                    "Cell coordinate out of sheet limits: column " + column + ", row " + row);
        }
    }

    public static CellAddress of(int column, int row) {
        return new CellAddress(column, row);
    }

    /**
     * Builds an address from POI's 0-based row and column indexes.
     */
    public static CellAddress fromZeroBased(int rowIndex, int columnIndex) {
        return new CellAddress(columnIndex + 1, rowIndex + 1);
    }

    public static CellAddress parse(String text) {
        if (text == null || text.isBlank()) {
            throw SheetOperationException.malformed("Cell reference is empty");
        }
        Matcher m = ADDRESS_PATTERN.matcher(text.trim());
        if (!m.matches()) {
            throw SheetOperationException.malformed("Invalid cell reference: " + text);
        }
        int column = columnNumber(m.group(1));
        int row = parseRow(m.group(2));
        if (column < 1 || column > MAX_COLUMNS || row < 1 || row > MAX_ROWS) {
            throw SheetOperationException.malformed("Cell reference outside sheet limits: " + text);
        }
        return new CellAddress(column, row);
    }

    /**
     * Converts column letters to a 1-based number (A=1, Z=26, AA=27). Returns -1 when the
     * letters exceed the sheet's column limit.
     */
    public static int columnNumber(String letters) {
        String col = letters.toUpperCase(Locale.ROOT);
        if (col.isEmpty() || col.length() > 3 || !col.chars().allMatch(c -> c >= 'A' && c <= 'Z')) {
            return -1;
        }
        int number = CellReference.convertColStringToIndex(col) + 1;
        return number > MAX_COLUMNS ? -1 : number;
    }

    public static String columnLetters(int column) {
        if (column < 1) {
            throw new IllegalArgumentException("Column number must be positive: " + column);
        }
        return CellReference.convertNumToColString(column - 1);
    }

    // rows with more than 7 digits can never be in bounds
    private static int parseRow(String digits) {
        String stripped = digits.replaceFirst("^0+(?=\\d)", "");
        if (stripped.length() > 7) {
            return -1;
        }
        return Integer.parseInt(stripped);
    }

    public String encode() {
        return columnLetters(column) + row;
    }

    public CellAddress shift(int columnDelta, int rowDelta) {
        long newColumn = (long) column + columnDelta;
        long newRow = (long) row + rowDelta;
        if (newColumn < 1 || newRow < 1 || newColumn > MAX_COLUMNS || newRow > MAX_ROWS) {
            throw SheetOperationException.outOfBounds(
                    "Shifting " + encode() + " by (" + columnDelta + ", " + rowDelta + ") leaves the sheet");
        }
        return new CellAddress((int) newColumn, (int) newRow);
    }

    public int rowIndex() {
        return row - 1;
    }

    public int columnIndex() {
        return column - 1;
    }

    @Override
    public int compareTo(CellAddress other) {
        int byRow = Integer.compare(row, other.row);
        return byRow != 0 ? byRow : Integer.compare(column, other.column);
    }

    @Override
    public String toString() {
        return encode();
    }
}
