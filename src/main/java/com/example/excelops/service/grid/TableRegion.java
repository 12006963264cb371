package com.example.excelops.service.grid;

import com.example.excelops.service.reference.CellRange;

/**
 * A named table. The first row of {@code range} holds the column headers; {@code style} is the
 * table style name, or {@code null} for the workbook default.
 */
public record TableRegion(String name, CellRange range, String style) implements RangedEntity<TableRegion> {

    @Override
    public TableRegion withRange(CellRange newRange) {
        return new TableRegion(name, newRange, style);
    }

    public int headerRow() {
        return range.firstRow();
    }
}
