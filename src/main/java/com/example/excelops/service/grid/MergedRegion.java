package com.example.excelops.service.grid;

import com.example.excelops.service.reference.CellRange;

public record MergedRegion(CellRange range) implements RangedEntity<MergedRegion> {

    @Override
    public MergedRegion withRange(CellRange newRange) {
        return new MergedRegion(newRange);
    }
}
