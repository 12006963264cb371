package com.example.excelops.service.grid;

import com.example.excelops.service.reference.CellRange;

/**
 * A sheet entity anchored to a rectangle of cells.
 */
public interface RangedEntity<T extends RangedEntity<T>> {

    CellRange range();

    T withRange(CellRange range);
}
