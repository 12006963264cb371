package com.example.excelops.service.grid;

import com.example.excelops.service.reference.Axis;
import com.example.excelops.service.reference.CellAddress;
import com.example.excelops.service.reference.CellRange;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Working state of one worksheet for the duration of a single operation. Cells are sparse:
 * an address with no entry is unset. Instances are never shared between operations.
 */
public class SheetGrid {

    private final String sheetName;
    private final NavigableMap<CellAddress, CellContent> cells = new TreeMap<>();
    private final MergeRegistry merges = new MergeRegistry();
    private final ValidationRegistry validations = new ValidationRegistry();
    private final TableRegistry tables = new TableRegistry();
    private final NavigableMap<Integer, Float> rowHeights = new TreeMap<>();
    private final NavigableMap<Integer, Integer> columnWidths = new TreeMap<>();

    public SheetGrid(String sheetName) {
        this.sheetName = sheetName;
    }

    public String sheetName() {
        return sheetName;
    }

    public Optional<CellContent> get(CellAddress address) {
        return Optional.ofNullable(cells.get(address));
    }

    public void put(CellAddress address, CellContent content) {
        if (content == null) {
            cells.remove(address);
        } else {
            cells.put(address, content);
        }
    }

    public CellContent remove(CellAddress address) {
        return cells.remove(address);
    }

    /**
     * Read-only view in row-major order.
     */
    public NavigableMap<CellAddress, CellContent> cells() {
        return Collections.unmodifiableNavigableMap(cells);
    }

    public MergeRegistry merges() {
        return merges;
    }

    public ValidationRegistry validations() {
        return validations;
    }

    public TableRegistry tables() {
        return tables;
    }

    /**
     * Row heights in points, keyed by 1-based row.
     */
    public NavigableMap<Integer, Float> rowHeights() {
        return rowHeights;
    }

    /**
     * Column widths in 1/256 character units, keyed by 1-based column.
     */
    public NavigableMap<Integer, Integer> columnWidths() {
        return columnWidths;
    }

    /**
     * Smallest range anchored at A1 that holds every populated cell.
     */
    public Optional<CellRange> populatedExtent() {
        int maxRow = 0;
        int maxColumn = 0;
        for (Map.Entry<CellAddress, CellContent> e : cells.entrySet()) {
            if (!e.getValue().isPopulated()) {
                continue;
            }
            maxRow = Math.max(maxRow, e.getKey().row());
            maxColumn = Math.max(maxColumn, e.getKey().column());
        }
        if (maxRow == 0) {
            return Optional.empty();
        }
        return Optional.of(CellRange.of(1, 1, maxColumn, maxRow));
    }

    /**
     * Highest line index along {@code axis} that holds a cell, or 0 when the sheet is empty.
     */
    public int lastUsed(Axis axis) {
        int last = 0;
        for (CellAddress address : cells.keySet()) {
            last = Math.max(last, axis.coordinate(address));
        }
        return last;
    }

    /**
     * Deep copy used as scratch space for a mutation.
     */
    public SheetGrid copy() {
        return copyAs(sheetName);
    }

    /**
     * Deep copy under another sheet name.
     */
    public SheetGrid copyAs(String newSheetName) {
        SheetGrid copy = new SheetGrid(newSheetName);
        copy.replaceWith(this);
        return copy;
    }

    /**
     * Takes over the full state of {@code other}. Used to publish a finished scratch copy.
     */
    public void replaceWith(SheetGrid other) {
        if (other == this) {
            return;
        }
        cells.clear();
        cells.putAll(other.cells);
        other.merges.copyInto(merges);
        other.validations.copyInto(validations);
        other.tables.copyInto(tables);
        rowHeights.clear();
        rowHeights.putAll(other.rowHeights);
        columnWidths.clear();
        columnWidths.putAll(other.columnWidths);
    }
}
