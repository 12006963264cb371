package com.example.excelops.service.store;

import com.example.excelops.service.RangeFormat;
import com.example.excelops.service.grid.SheetGrid;
import com.example.excelops.service.reference.CellRange;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Reads worksheets into {@link SheetGrid}s and writes them back. Implementations own all file
 * access; a failed write must leave the original file untouched.
 */
public interface SpreadsheetStore {

    SheetGrid load(Path file, String sheetName);

    /**
     * Every sheet of the workbook, in workbook order, keyed by sheet name.
     */
    Map<String, SheetGrid> loadAll(Path file);

    default void save(Path file, SheetGrid grid) {
        saveAll(file, List.of(grid));
    }

    /**
     * Replaces the named sheets with the given grids in a single write.
     */
    void saveAll(Path file, Collection<SheetGrid> grids);

    /**
     * Creates a new workbook holding one empty sheet. Fails with {@code ALREADY_EXISTS} when the
     * file is present.
     */
    void createWorkbook(Path file, String firstSheetName);

    /**
     * Appends a sheet named after {@code grid} and fills it from the grid.
     */
    void addSheet(Path file, SheetGrid grid);

    /**
     * Renames a sheet, then writes {@code grids} (named after the rename) in the same save.
     */
    void renameSheet(Path file, String oldName, String newName, Collection<SheetGrid> grids);

    /**
     * Removes a sheet, then writes {@code grids} in the same save.
     */
    void deleteSheet(Path file, String sheetName, Collection<SheetGrid> grids);

    /**
     * Saves {@code grid} and styles {@code range} of its sheet in the same write.
     */
    void saveWithFormat(Path file, SheetGrid grid, CellRange range, RangeFormat format);
}
