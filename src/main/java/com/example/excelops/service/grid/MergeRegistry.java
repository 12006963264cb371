package com.example.excelops.service.grid;

import com.example.excelops.service.ErrorKind;
import com.example.excelops.service.SheetOperationException;
import com.example.excelops.service.reference.CellRange;

import java.util.Optional;

/**
 * Merged regions of one sheet. No two regions overlap and each spans at least two cells.
 */
public class MergeRegistry extends RangedRegistry<MergedRegion> {

    public MergedRegion register(CellRange range) {
        if (range.isSingleCell()) {
            throw new SheetOperationException(ErrorKind.DEGENERATE_RANGE,
                    "Cannot merge a single cell: " + range.encode());
        }
        Optional<MergedRegion> clash = intersecting(range).stream().findFirst();
        if (clash.isPresent()) {
            throw new SheetOperationException(ErrorKind.OVERLAP,
                    "Range " + range.encode() + " overlaps merged region " + clash.get().range().encode());
        }
        MergedRegion region = new MergedRegion(range);
        entries.add(region);
        return region;
    }

    public MergedRegion unregister(CellRange range) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).range().equals(range)) {
                return entries.remove(i);
            }
        }
        throw new SheetOperationException(ErrorKind.NOT_FOUND,
                "No merged region matches " + range.encode());
    }

    /**
     * Adds a region read from a file without re-checking it against the others.
     */
    public void restore(CellRange range) {
        if (accepts(range)) {
            entries.add(new MergedRegion(range));
        }
    }

    @Override
    protected boolean accepts(CellRange range) {
        return range.cellCount() >= 2;
    }
}
