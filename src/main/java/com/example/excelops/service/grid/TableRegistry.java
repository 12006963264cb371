package com.example.excelops.service.grid;

import com.example.excelops.service.ErrorKind;
import com.example.excelops.service.SheetOperationException;
import com.example.excelops.service.reference.CellRange;

import java.util.Optional;

/**
 * Tables of one sheet. Tables never overlap, and each keeps a header row plus at least one
 * data row; a table shifted down to its header alone is dropped.
 */
public class TableRegistry extends RangedRegistry<TableRegion> {

    public TableRegion register(TableRegion table) {
        if (!accepts(table.range())) {
            throw new SheetOperationException(ErrorKind.DEGENERATE_RANGE,
                    "A table needs a header row and at least one data row: " + table.range().encode());
        }
        if (find(table.name()).isPresent()) {
            throw new SheetOperationException(ErrorKind.ALREADY_EXISTS,
                    "Table '" + table.name() + "' already exists");
        }
        Optional<TableRegion> clash = intersecting(table.range()).stream().findFirst();
        if (clash.isPresent()) {
            throw new SheetOperationException(ErrorKind.OVERLAP, "Range " + table.range().encode()
                    + " overlaps table '" + clash.get().name() + "' at " + clash.get().range().encode());
        }
        entries.add(table);
        return table;
    }

    public Optional<TableRegion> find(String name) {
        return entries.stream()
                .filter(t -> t.name().equalsIgnoreCase(name))
                .findFirst();
    }

    /**
     * Adds a table read from a file without re-checking it against the others.
     */
    public void restore(TableRegion table) {
        if (accepts(table.range())) {
            entries.add(table);
        }
    }

    @Override
    protected boolean accepts(CellRange range) {
        return range.height() >= 2;
    }
}
