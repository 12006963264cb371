package com.example.excelops.service.reference;

import com.example.excelops.service.SheetOperationException;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Inclusive rectangle of cells. Corners are normalized on construction so that
 * {@code start} is always the top-left and {@code end} the bottom-right corner.
 */
public record CellRange(CellAddress start, CellAddress end) {

    public CellRange {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Range corners must not be null");
        }
        if (start.column() > end.column() || start.row() > end.row()) {
            CellAddress topLeft = new CellAddress(
                    Math.min(start.column(), end.column()), Math.min(start.row(), end.row()));
            CellAddress bottomRight = new CellAddress(
                    Math.max(start.column(), end.column()), Math.max(start.row(), end.row()));
            start = topLeft;
            end = bottomRight;
        }
    }

    public static CellRange of(CellAddress a, CellAddress b) {
        return new CellRange(a, b);
    }

    public static CellRange single(CellAddress address) {
        return new CellRange(address, address);
    }

    public static CellRange of(int firstColumn, int firstRow, int lastColumn, int lastRow) {
        return new CellRange(new CellAddress(firstColumn, firstRow), new CellAddress(lastColumn, lastRow));
    }

    public static CellRange parse(String text) {
        return parse(text, null);
    }

    /**
     * Parses {@code "A1"} or {@code "A1:C5"}. When the text names a single cell and
     * {@code defaultEnd} is given, the range stretches from that cell to {@code defaultEnd}.
     */
    public static CellRange parse(String text, CellAddress defaultEnd) {
        if (text == null || text.isBlank()) {
            throw SheetOperationException.malformed("Range reference is empty");
        }
        String[] parts = text.trim().split(":", -1);
        if (parts.length > 2) {
            throw SheetOperationException.malformed("Invalid range reference: " + text);
        }
        CellAddress first = CellAddress.parse(parts[0]);
        if (parts.length == 2) {
            return new CellRange(first, CellAddress.parse(parts[1]));
        }
        return new CellRange(first, defaultEnd == null ? first : defaultEnd);
    }

    /**
     * Parses separate start and optional end cells, the form most operations take.
     */
    public static CellRange parse(String startCell, String endCell, CellAddress defaultEnd) {
        CellAddress first = CellAddress.parse(startCell);
        if (endCell != null && !endCell.isBlank()) {
            return new CellRange(first, CellAddress.parse(endCell));
        }
        return new CellRange(first, defaultEnd == null ? first : defaultEnd);
    }

    public int firstColumn() {
        return start.column();
    }

    public int lastColumn() {
        return end.column();
    }

    public int firstRow() {
        return start.row();
    }

    public int lastRow() {
        return end.row();
    }

    public int low(Axis axis) {
        return axis.coordinate(start);
    }

    public int high(Axis axis) {
        return axis.coordinate(end);
    }

    /**
     * Same range with the bounds along {@code axis} replaced.
     */
    public CellRange withBounds(Axis axis, int low, int high) {
        return new CellRange(axis.withCoordinate(start, low), axis.withCoordinate(end, high));
    }

    public CellRange offset(int columnDelta, int rowDelta) {
        return new CellRange(start.shift(columnDelta, rowDelta), end.shift(columnDelta, rowDelta));
    }

    public int width() {
        return end.column() - start.column() + 1;
    }

    public int height() {
        return end.row() - start.row() + 1;
    }

    public long cellCount() {
        return (long) width() * height();
    }

    public boolean isSingleCell() {
        return start.equals(end);
    }

    public boolean contains(CellAddress address) {
        return address.column() >= start.column() && address.column() <= end.column()
                && address.row() >= start.row() && address.row() <= end.row();
    }

    public boolean contains(CellRange other) {
        return contains(other.start) && contains(other.end);
    }

    public boolean intersects(CellRange other) {
        return start.column() <= other.end.column() && other.start.column() <= end.column()
                && start.row() <= other.end.row() && other.start.row() <= end.row();
    }

    /**
     * Addresses in row-major order. Each call to {@code iterator()} starts over.
     */
    public Iterable<CellAddress> cells() {
        return () -> new Iterator<>() {
            private int row = start.row();
            private int column = start.column();

            @Override
            public boolean hasNext() {
                return row <= end.row();
            }

            @Override
            public CellAddress next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                CellAddress next = new CellAddress(column, row);
                if (column == end.column()) {
                    column = start.column();
                    row++;
                } else {
                    column++;
                }
                return next;
            }
        };
    }

    public String encode() {
        return isSingleCell() ? start.encode() : start.encode() + ":" + end.encode();
    }

    @Override
    public String toString() {
        return encode();
    }
}
