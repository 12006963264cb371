package com.example.excelops.service;

import com.example.excelops.service.engine.BrokenFormula;
import com.example.excelops.service.engine.CopyRangeEngine;
import com.example.excelops.service.engine.CopyReport;
import com.example.excelops.service.engine.MutationReport;
import com.example.excelops.service.engine.StructuralMutator;
import com.example.excelops.service.formula.FormulaReference;
import com.example.excelops.service.formula.StructuralShift;
import com.example.excelops.service.grid.CellContent;
import com.example.excelops.service.grid.ErrorValue;
import com.example.excelops.service.grid.MergedRegion;
import com.example.excelops.service.grid.SheetGrid;
import com.example.excelops.service.grid.TableRegion;
import com.example.excelops.service.grid.ValidationCriteria;
import com.example.excelops.service.grid.ValidationRule;
import com.example.excelops.service.reference.Axis;
import com.example.excelops.service.reference.CellAddress;
import com.example.excelops.service.reference.CellRange;
import com.example.excelops.service.store.SpreadsheetStore;
import lombok.RequiredArgsConstructor;
import org.apache.poi.ss.util.WorkbookUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Entry point for every sheet operation. Each call resolves the workbook path, takes the file's
 * lock, loads the sheets it needs, runs the change in memory and saves the result in one write.
 */
@Service
@RequiredArgsConstructor
public class SheetOperationsService {

    private static final Logger log = LoggerFactory.getLogger(SheetOperationsService.class);

    static final String DEFAULT_SHEET_NAME = "Sheet";

    private static final Pattern TABLE_NAME = Pattern.compile("^[\\p{L}_\\\\][\\p{L}\\p{N}_.]{0,254}$");
    private static final Pattern CELL_LIKE_NAME = Pattern.compile("(?i)^(?:[A-Z]{1,3}[0-9]+|R[0-9]*C?[0-9]*|C[0-9]*)$");

    private final SpreadsheetStore store;
    private final StructuralMutator mutator;
    private final CopyRangeEngine copyEngine;
    private final FormulaValidator formulaValidator;
    private final FileLocks fileLocks;
    private final ExcelOpsProperties properties;

    // =========================
    // formulas
    // =========================

    public OperationResult applyFormula(String filePath, String sheetName, String cell, String formula) {
        Path path = resolve(filePath);
        CellAddress address = CellAddress.parse(cell);
        return fileLocks.withLock(path, () -> {
            Map<String, SheetGrid> grids = store.loadAll(path);
            SheetGrid grid = requireGrid(grids, sheetName);
            formulaValidator.validate(formula, grids.keySet());

            String body = CellContent.stripEquals(formula.trim());
            Short style = grid.get(address).map(CellContent::styleIndex).orElse(null);
            grid.put(address, new CellContent(null, body, style));
            store.save(path, grid);

            log.info("Applied formula to {}!{} in {}", grid.sheetName(), address.encode(), path);
            return OperationResult.of("Applied formula '" + formula.trim() + "' to cell " + address.encode());
        });
    }

    public FormulaCheck validateFormula(String filePath, String sheetName, String cell, String formula) {
        Path path = resolve(filePath);
        CellAddress address = CellAddress.parse(cell);
        return fileLocks.withLock(path, () -> {
            Map<String, SheetGrid> grids = store.loadAll(path);
            SheetGrid grid = requireGrid(grids, sheetName);
            List<FormulaReference> refs = formulaValidator.validate(formula, grids.keySet());

            String current = grid.get(address)
                    .filter(CellContent::isFormula)
                    .map(CellContent::formulaText)
                    .orElse(null);
            String text = formula.trim();
            String message;
            if (current == null) {
                message = "Formula '" + text + "' is valid; cell " + address.encode() + " holds no formula";
            } else if (current.equals(text)) {
                message = "Formula '" + text + "' is valid and matches cell " + address.encode();
            } else {
                message = "Formula '" + text + "' is valid but cell " + address.encode() + " holds '" + current + "'";
            }
            List<String> references = refs.stream()
                    .map(ref -> text.substring(ref.startIndex(), ref.endIndex()))
                    .toList();
            return new FormulaCheck(address.encode(), text, references, current, message);
        });
    }

    // =========================
    // copy / delete range
    // =========================

    public OperationResult copyRange(String filePath, String sheetName, String sourceStart, String sourceEnd,
                                     String targetStart, String targetSheet) {
        Path path = resolve(filePath);
        CellRange source = CellRange.parse(sourceStart, sourceEnd, null);
        CellAddress target = CellAddress.parse(targetStart);
        return fileLocks.withLock(path, () -> {
            Map<String, SheetGrid> grids = store.loadAll(path);
            SheetGrid sourceGrid = requireGrid(grids, sheetName);
            SheetGrid targetGrid = targetSheet == null || targetSheet.isBlank()
                    ? sourceGrid
                    : requireGrid(grids, targetSheet);

            CopyReport report = copyEngine.copy(sourceGrid, source, targetGrid, target);
            store.save(path, targetGrid);

            log.info("Copied {}!{} to {}!{} in {}: {} cells, {} formulas translated", sourceGrid.sheetName(),
                    source.encode(), targetGrid.sheetName(), target.encode(), path, report.cellsWritten(),
                    report.formulasTranslated());
            return new OperationResult("Range " + source.encode() + " copied to " + target.encode()
                    + " on sheet '" + targetGrid.sheetName() + "'", toBrokenCells(report.brokenFormulas()));
        });
    }

    public OperationResult deleteRange(String filePath, String sheetName, String startCell, String endCell,
                                       String shiftDirection) {
        Path path = resolve(filePath);
        CellRange range = CellRange.parse(startCell, endCell, null);
        Axis axis = shiftAxis(shiftDirection);
        return fileLocks.withLock(path, () -> {
            Map<String, SheetGrid> grids = store.loadAll(path);
            SheetGrid grid = requireGrid(grids, sheetName);
            MutationReport report = mutator.deleteRange(grid, range, axis);

            Axis cross = axis == Axis.ROW ? Axis.COLUMN : Axis.ROW;
            StructuralShift shift = StructuralShift.deleteWithinBand(grid.sheetName(), axis, range.low(axis),
                    range.high(axis) - range.low(axis) + 1, range.low(cross), range.high(cross));
            List<BrokenFormula> broken = new ArrayList<>(report.brokenFormulas());
            List<SheetGrid> changed = saveWithDependents(path, grids, grid, shift, broken);

            log.info("Deleted range {}!{} in {} shifting {}: {} sheets written", grid.sheetName(), range.encode(),
                    path, shiftDirection, changed.size());
            return new OperationResult("Range " + range.encode() + " deleted from sheet '" + grid.sheetName()
                    + "', cells shifted " + shiftDirection.toLowerCase(Locale.ROOT), toBrokenCells(broken));
        });
    }

    // =========================
    // rows and columns
    // =========================

    public OperationResult insertRows(String filePath, String sheetName, int startRow, int count) {
        return structural(filePath, sheetName, Axis.ROW, startRow, count, true);
    }

    public OperationResult insertColumns(String filePath, String sheetName, int startColumn, int count) {
        return structural(filePath, sheetName, Axis.COLUMN, startColumn, count, true);
    }

    public OperationResult deleteRows(String filePath, String sheetName, int startRow, int count) {
        return structural(filePath, sheetName, Axis.ROW, startRow, count, false);
    }

    public OperationResult deleteColumns(String filePath, String sheetName, int startColumn, int count) {
        return structural(filePath, sheetName, Axis.COLUMN, startColumn, count, false);
    }

    private OperationResult structural(String filePath, String sheetName, Axis axis, int start, int count,
                                       boolean insert) {
        Path path = resolve(filePath);
        return fileLocks.withLock(path, () -> {
            Map<String, SheetGrid> grids = store.loadAll(path);
            SheetGrid grid = requireGrid(grids, sheetName);
            MutationReport report = insert
                    ? mutator.insert(grid, axis, start, count)
                    : mutator.delete(grid, axis, start, count);

            StructuralShift shift = insert
                    ? StructuralShift.insert(grid.sheetName(), axis, start, count)
                    : StructuralShift.delete(grid.sheetName(), axis, start, count);
            List<BrokenFormula> broken = new ArrayList<>(report.brokenFormulas());
            List<SheetGrid> changed = saveWithDependents(path, grids, grid, shift, broken);

            String verb = insert ? "Inserted" : "Deleted";
            log.info("{} {} {} at {} on '{}' in {}: {} formulas rewritten, {} broken, {} sheets written", verb,
                    count, axis.label(count), start, grid.sheetName(), path, report.formulasRewritten(),
                    broken.size(), changed.size());
            return new OperationResult(verb + " " + count + " " + axis.label(count) + " starting at "
                    + axis.label(1) + " " + start + " in sheet '" + grid.sheetName() + "'", toBrokenCells(broken));
        });
    }

    /**
     * Applies {@code shift} to formulas on the other sheets, then saves the mutated sheet together
     * with every sheet whose formulas changed.
     */
    private List<SheetGrid> saveWithDependents(Path path, Map<String, SheetGrid> grids, SheetGrid mutated,
                                               StructuralShift shift, List<BrokenFormula> broken) {
        List<SheetGrid> changed = new ArrayList<>();
        changed.add(mutated);
        for (SheetGrid other : grids.values()) {
            if (other == mutated) {
                continue;
            }
            MutationReport dependents = mutator.rewriteDependents(other, shift);
            if (dependents.formulasRewritten() > 0) {
                changed.add(other);
                broken.addAll(dependents.brokenFormulas());
            }
        }
        store.saveAll(path, changed);
        return changed;
    }

    // =========================
    // workbooks and worksheets
    // =========================

    public OperationResult createWorkbook(String filePath) {
        Path path = resolve(filePath);
        if (!path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".xlsx")) {
            throw SheetOperationException.invalidArgument("New workbooks must use the .xlsx extension: " + filePath);
        }
        return fileLocks.withLock(path, () -> {
            store.createWorkbook(path, DEFAULT_SHEET_NAME);
            return OperationResult.of("Created workbook at " + path);
        });
    }

    public OperationResult createWorksheet(String filePath, String sheetName) {
        Path path = resolve(filePath);
        requireValidSheetName(sheetName);
        return fileLocks.withLock(path, () -> {
            Map<String, SheetGrid> grids = store.loadAll(path);
            requireFreeSheetName(grids, sheetName, null);
            store.addSheet(path, new SheetGrid(sheetName));
            log.info("Created sheet '{}' in {}", sheetName, path);
            return OperationResult.of("Sheet '" + sheetName + "' created");
        });
    }

    /**
     * Appends a copy of a sheet's cells, merges, validations and line sizes. Tables are not
     * copied because table names are unique across the workbook.
     */
    public OperationResult copyWorksheet(String filePath, String sourceSheet, String targetSheet) {
        Path path = resolve(filePath);
        requireValidSheetName(targetSheet);
        return fileLocks.withLock(path, () -> {
            Map<String, SheetGrid> grids = store.loadAll(path);
            SheetGrid source = requireGrid(grids, sourceSheet);
            requireFreeSheetName(grids, targetSheet, null);

            SheetGrid copy = source.copyAs(targetSheet);
            copy.tables().clear();
            store.addSheet(path, copy);
            log.info("Copied sheet '{}' to '{}' in {}", source.sheetName(), targetSheet, path);
            return OperationResult.of("Sheet '" + source.sheetName() + "' copied to '" + targetSheet + "'");
        });
    }

    /**
     * Renames a sheet and re-qualifies every formula reference to it, on every sheet.
     */
    public OperationResult renameWorksheet(String filePath, String oldName, String newName) {
        Path path = resolve(filePath);
        requireValidSheetName(newName);
        return fileLocks.withLock(path, () -> {
            Map<String, SheetGrid> grids = store.loadAll(path);
            SheetGrid renamed = requireGrid(grids, oldName);
            requireFreeSheetName(grids, newName, renamed);

            String previous = renamed.sheetName();
            List<SheetGrid> changed = new ArrayList<>();
            int rewritten = 0;
            for (SheetGrid grid : grids.values()) {
                MutationReport report = mutator.renameSheetReferences(grid, previous, newName);
                rewritten += report.formulasRewritten();
                if (grid == renamed) {
                    changed.add(grid.copyAs(newName));
                } else if (report.formulasRewritten() > 0) {
                    changed.add(grid);
                }
            }
            store.renameSheet(path, previous, newName, changed);
            log.info("Renamed sheet '{}' to '{}' in {}: {} formulas rewritten", previous, newName, path, rewritten);
            return OperationResult.of("Sheet '" + previous + "' renamed to '" + newName + "'");
        });
    }

    /**
     * Deletes a sheet. Formulas elsewhere that referred to it become {@code #REF!} and are
     * reported as broken.
     */
    public OperationResult deleteWorksheet(String filePath, String sheetName) {
        Path path = resolve(filePath);
        return fileLocks.withLock(path, () -> {
            Map<String, SheetGrid> grids = store.loadAll(path);
            SheetGrid deleted = requireGrid(grids, sheetName);
            if (grids.size() == 1) {
                throw SheetOperationException.invalidArgument(
                        "Cannot delete sheet '" + deleted.sheetName() + "': a workbook needs at least one sheet");
            }
            List<SheetGrid> changed = new ArrayList<>();
            List<BrokenFormula> broken = new ArrayList<>();
            for (SheetGrid grid : grids.values()) {
                if (grid == deleted) {
                    continue;
                }
                MutationReport report = mutator.dropSheetReferences(grid, deleted.sheetName());
                if (report.formulasRewritten() > 0) {
                    changed.add(grid);
                    broken.addAll(report.brokenFormulas());
                }
            }
            store.deleteSheet(path, deleted.sheetName(), changed);
            log.info("Deleted sheet '{}' from {}: {} formulas broken", deleted.sheetName(), path, broken.size());
            return new OperationResult("Sheet '" + deleted.sheetName() + "' deleted", toBrokenCells(broken));
        });
    }

    // =========================
    // tables
    // =========================

    /**
     * Turns a range into a named table. The first row becomes the header and must hold a
     * distinct label in every column; numbers and booleans there are stored as text. Without a
     * name the first free {@code TableN} is used.
     */
    public OperationResult createTable(String filePath, String sheetName, String startCell, String endCell,
                                       String tableName, String tableStyle) {
        Path path = resolve(filePath);
        CellRange range = CellRange.parse(startCell, endCell, null);
        if (tableName != null && !tableName.isBlank()) {
            requireValidTableName(tableName);
        }
        return fileLocks.withLock(path, () -> {
            Map<String, SheetGrid> grids = store.loadAll(path);
            SheetGrid grid = requireGrid(grids, sheetName);
            String name = tableName == null || tableName.isBlank() ? nextTableName(grids) : tableName;
            for (SheetGrid other : grids.values()) {
                if (other != grid && other.tables().find(name).isPresent()) {
                    throw new SheetOperationException(ErrorKind.ALREADY_EXISTS, "Table '" + name
                            + "' already exists in sheet '" + other.sheetName() + "'");
                }
            }
            if (!grid.merges().intersecting(range).isEmpty()) {
                throw new SheetOperationException(ErrorKind.OVERLAP,
                        "Range " + range.encode() + " overlaps a merged region");
            }
            writeTableHeader(grid, range);
            grid.tables().register(new TableRegion(name, range,
                    tableStyle == null || tableStyle.isBlank() ? null : tableStyle));
            store.save(path, grid);

            log.info("Created table '{}' on {}!{} in {}", name, grid.sheetName(), range.encode(), path);
            return OperationResult.of("Table '" + name + "' created for range " + range.encode()
                    + " in sheet '" + grid.sheetName() + "'");
        });
    }

    private static void writeTableHeader(SheetGrid grid, CellRange range) {
        Set<String> seen = new HashSet<>();
        for (int column = range.firstColumn(); column <= range.lastColumn(); column++) {
            CellAddress address = CellAddress.of(column, range.firstRow());
            CellContent content = grid.get(address).orElse(null);
            if (content == null || !content.isPopulated() || content.isFormula()) {
                throw SheetOperationException.invalidArgument("Table header cell " + address.encode()
                        + " must hold a label");
            }
            String label = headerLabel(content.value());
            if (!seen.add(label.toLowerCase(Locale.ROOT))) {
                throw SheetOperationException.invalidArgument("Duplicate table header '" + label + "' in "
                        + address.encode());
            }
            grid.put(address, new CellContent(label, null, content.styleIndex()));
        }
    }

    private static String headerLabel(Object value) {
        if (value instanceof Double d && d == Math.rint(d) && !d.isInfinite()) {
            return String.valueOf(d.longValue());
        }
        if (value instanceof Boolean b) {
            return b ? "TRUE" : "FALSE";
        }
        return displayValue(value).toString();
    }

    private static String nextTableName(Map<String, SheetGrid> grids) {
        for (int n = 1; ; n++) {
            String candidate = "Table" + n;
            if (grids.values().stream().allMatch(g -> g.tables().find(candidate).isEmpty())) {
                return candidate;
            }
        }
    }

    // =========================
    // merges and validations
    // =========================

    public OperationResult mergeCells(String filePath, String sheetName, String startCell, String endCell) {
        Path path = resolve(filePath);
        CellRange range = CellRange.parse(startCell, endCell, null);
        return fileLocks.withLock(path, () -> {
            SheetGrid grid = store.load(path, sheetName);
            registerMerge(grid, range);
            store.save(path, grid);
            log.info("Merged {}!{} in {}", grid.sheetName(), range.encode(), path);
            return OperationResult.of("Range '" + range.encode() + "' merged in sheet '" + grid.sheetName() + "'");
        });
    }

    public OperationResult unmergeCells(String filePath, String sheetName, String startCell, String endCell) {
        Path path = resolve(filePath);
        CellRange range = CellRange.parse(startCell, endCell, null);
        return fileLocks.withLock(path, () -> {
            SheetGrid grid = store.load(path, sheetName);
            grid.merges().unregister(range);
            store.save(path, grid);
            log.info("Unmerged {}!{} in {}", grid.sheetName(), range.encode(), path);
            return OperationResult.of("Range '" + range.encode() + "' unmerged in sheet '" + grid.sheetName() + "'");
        });
    }

    public List<String> listMerges(String filePath, String sheetName) {
        Path path = resolve(filePath);
        return fileLocks.withLock(path, () -> store.load(path, sheetName).merges().list().stream()
                .map(MergedRegion::range)
                .map(CellRange::encode)
                .toList());
    }

    public ValidationListing listValidations(String filePath, String sheetName) {
        Path path = resolve(filePath);
        return fileLocks.withLock(path, () -> {
            SheetGrid grid = store.load(path, sheetName);
            List<ValidationInfo> rules = grid.validations().listForSheet().stream()
                    .map(SheetOperationsService::toInfo)
                    .toList();
            String message = rules.isEmpty()
                    ? "No data validation rules found in sheet '" + grid.sheetName() + "'"
                    : rules.size() + " data validation rule(s) in sheet '" + grid.sheetName() + "'";
            return new ValidationListing(grid.sheetName(), rules, message);
        });
    }

    // =========================
    // reading and writing data
    // =========================

    /**
     * Reads the populated cells of a range. Without {@code endCell} the range runs from
     * {@code startCell} to the far corner of the sheet's data.
     */
    public RangeReadout readData(String filePath, String sheetName, String startCell, String endCell,
                                 boolean previewOnly) {
        Path path = resolve(filePath);
        CellAddress start = CellAddress.parse(startCell == null || startCell.isBlank() ? "A1" : startCell);
        return fileLocks.withLock(path, () -> {
            SheetGrid grid = store.load(path, sheetName);
            CellAddress defaultEnd = grid.populatedExtent()
                    .map(extent -> CellAddress.of(Math.max(start.column(), extent.lastColumn()),
                            Math.max(start.row(), extent.lastRow())))
                    .orElse(start);
            CellRange range = CellRange.parse(start.encode(), endCell, defaultEnd);

            int limit = previewOnly ? properties.readPreviewLimit() : Integer.MAX_VALUE;
            List<CellReadout> cells = new ArrayList<>();
            boolean truncated = false;
            for (Map.Entry<CellAddress, CellContent> entry : grid.cells().entrySet()) {
                CellAddress address = entry.getKey();
                CellContent content = entry.getValue();
                if (!range.contains(address) || !content.isPopulated()) {
                    continue;
                }
                if (cells.size() >= limit) {
                    truncated = true;
                    break;
                }
                ValidationInfo validation = grid.validations().applicableTo(address)
                        .map(SheetOperationsService::toInfo)
                        .orElse(null);
                cells.add(new CellReadout(address.encode(), displayValue(content.value()),
                        content.isFormula() ? content.formulaText() : null,
                        address.row(), address.column(), validation));
            }
            String message = cells.isEmpty() ? "No data found in specified range" : null;
            return new RangeReadout(grid.sheetName(), range.encode(), cells, truncated, message);
        });
    }

    /**
     * Writes {@code rows} as a block whose top-left cell is {@code startCell}. Strings starting
     * with '=' are stored as formulas; {@code null} clears the cell's value.
     */
    public OperationResult writeData(String filePath, String sheetName, List<List<Object>> rows, String startCell) {
        if (rows == null || rows.isEmpty()) {
            return OperationResult.of("No data provided to write");
        }
        Path path = resolve(filePath);
        CellAddress start = CellAddress.parse(startCell == null || startCell.isBlank() ? "A1" : startCell);
        int width = rows.stream().mapToInt(row -> row == null ? 0 : row.size()).max().orElse(0);
        if ((long) start.row() + rows.size() - 1 > CellAddress.MAX_ROWS
                || (long) start.column() + Math.max(width, 1) - 1 > CellAddress.MAX_COLUMNS) {
            throw SheetOperationException.outOfBounds("Writing " + rows.size() + "x" + width + " values at "
                    + start.encode() + " would run past the sheet limits");
        }
        return fileLocks.withLock(path, () -> {
            SheetGrid grid = store.load(path, sheetName);
            int written = 0;
            for (int r = 0; r < rows.size(); r++) {
                List<Object> row = rows.get(r);
                if (row == null) {
                    continue;
                }
                for (int c = 0; c < row.size(); c++) {
                    CellAddress address = start.shift(c, r);
                    Short style = grid.get(address).map(CellContent::styleIndex).orElse(null);
                    grid.put(address, toContent(row.get(c), style));
                    written++;
                }
            }
            store.save(path, grid);
            log.info("Wrote {} cells to {}!{} in {}", written, grid.sheetName(), start.encode(), path);
            return OperationResult.of("Data written to sheet '" + grid.sheetName() + "' starting at " + start.encode());
        });
    }

    public RangeCheck validateRange(String filePath, String sheetName, String startCell, String endCell) {
        Path path = resolve(filePath);
        CellRange range = CellRange.parse(startCell, endCell, null);
        return fileLocks.withLock(path, () -> {
            SheetGrid grid = store.load(path, sheetName);
            Optional<CellRange> extent = grid.populatedExtent();
            boolean within = extent.map(e -> e.contains(range)).orElse(false);
            String message;
            if (extent.isEmpty()) {
                message = "Range " + range.encode() + " is valid; sheet '" + grid.sheetName() + "' has no data";
            } else if (within) {
                message = "Range " + range.encode() + " is valid; sheet data range is " + extent.get().encode();
            } else {
                message = "Range " + range.encode() + " is valid but extends beyond the sheet data range "
                        + extent.get().encode();
            }
            return new RangeCheck(range.encode(), range.width(), range.height(),
                    extent.map(CellRange::encode).orElse(null), within, message);
        });
    }

    public OperationResult formatRange(String filePath, String sheetName, String startCell, String endCell,
                                       RangeFormat format) {
        if (format == null) {
            throw SheetOperationException.invalidArgument("No formatting given");
        }
        Path path = resolve(filePath);
        CellRange range = CellRange.parse(startCell, endCell, null);
        return fileLocks.withLock(path, () -> {
            SheetGrid grid = store.load(path, sheetName);
            if (format.mergeCells()) {
                registerMerge(grid, range);
            }
            store.saveWithFormat(path, grid, range, format);
            log.info("Formatted {}!{} in {}", grid.sheetName(), range.encode(), path);
            return OperationResult.of("Range " + range.encode() + " formatted in sheet '" + grid.sheetName() + "'");
        });
    }

    // =========================
    // helpers
    // =========================

    Path resolve(String filePath) {
        if (filePath == null || filePath.isBlank()) {
            throw SheetOperationException.invalidArgument("File path is required");
        }
        try {
            Path path = Path.of(filePath);
            if (path.isAbsolute()) {
                return path.normalize();
            }
            String base = properties.filesPath();
            if (base == null || base.isBlank()) {
                throw SheetOperationException.invalidArgument("Invalid file path '" + filePath
                        + "': must be absolute when no base directory is configured");
            }
            return Path.of(base).resolve(path).normalize();
        } catch (InvalidPathException e) {
            throw SheetOperationException.invalidArgument("Invalid file path '" + filePath + "': " + e.getReason());
        }
    }

    private static SheetGrid requireGrid(Map<String, SheetGrid> grids, String sheetName) {
        if (sheetName != null) {
            SheetGrid exact = grids.get(sheetName);
            if (exact != null) {
                return exact;
            }
            for (SheetGrid grid : grids.values()) {
                if (grid.sheetName().equalsIgnoreCase(sheetName)) {
                    return grid;
                }
            }
        }
        throw new SheetOperationException(ErrorKind.SHEET_NOT_FOUND, "Sheet '" + sheetName + "' not found");
    }

    private static void registerMerge(SheetGrid grid, CellRange range) {
        grid.tables().intersecting(range).stream().findFirst().ifPresent(table -> {
            throw new SheetOperationException(ErrorKind.OVERLAP, "Range " + range.encode()
                    + " overlaps table '" + table.name() + "'");
        });
        grid.merges().register(range);
    }

    private static void requireValidSheetName(String sheetName) {
        if (sheetName == null || sheetName.isBlank()) {
            throw SheetOperationException.invalidArgument("Sheet name is required");
        }
        try {
            WorkbookUtil.validateSheetName(sheetName);
        } catch (IllegalArgumentException e) {
            throw SheetOperationException.invalidArgument("Invalid sheet name '" + sheetName + "': " + e.getMessage());
        }
    }

    // sheet names are unique regardless of case; a sheet may be renamed to a new casing of its own name
    private static void requireFreeSheetName(Map<String, SheetGrid> grids, String sheetName, SheetGrid self) {
        for (SheetGrid grid : grids.values()) {
            if (grid != self && grid.sheetName().equalsIgnoreCase(sheetName)) {
                throw new SheetOperationException(ErrorKind.ALREADY_EXISTS,
                        "Sheet '" + grid.sheetName() + "' already exists");
            }
        }
    }

    private static void requireValidTableName(String tableName) {
        if (!TABLE_NAME.matcher(tableName).matches() || CELL_LIKE_NAME.matcher(tableName).matches()) {
            throw SheetOperationException.invalidArgument("Invalid table name '" + tableName
                    + "': use letters, digits, '_' or '.', starting with a letter or '_', and not a cell reference");
        }
    }

    private static Axis shiftAxis(String direction) {
        if ("up".equalsIgnoreCase(direction)) {
            return Axis.ROW;
        }
        if ("left".equalsIgnoreCase(direction)) {
            return Axis.COLUMN;
        }
        throw SheetOperationException.invalidArgument("Invalid shift direction '" + direction
                + "', must be 'up' or 'left'");
    }

    private static CellContent toContent(Object value, Short style) {
        if (value instanceof String text && text.startsWith("=") && text.length() > 1) {
            return new CellContent(null, CellContent.stripEquals(text), style);
        }
        if (value == null || value instanceof Number || value instanceof Boolean || value instanceof String) {
            return new CellContent(value, null, style);
        }
        return new CellContent(value.toString(), null, style);
    }

    private static Object displayValue(Object value) {
        return value instanceof ErrorValue error ? error.text() : value;
    }

    private static List<BrokenCell> toBrokenCells(List<BrokenFormula> broken) {
        return broken.stream()
                .map(b -> new BrokenCell(b.sheetName(), b.cell().encode(), b.formula(), b.reference().reason()))
                .toList();
    }

    static ValidationInfo toInfo(ValidationRule rule) {
        ValidationCriteria criteria = rule.criteria();
        return new ValidationInfo(
                rule.range().encode(),
                rule.kind().name().toLowerCase(Locale.ROOT),
                criteria.operator() == null ? null : criteria.operator().name().toLowerCase(Locale.ROOT),
                criteria.formula1(),
                criteria.formula2(),
                criteria.explicitValues(),
                criteria.allowBlank(),
                criteria.promptTitle(),
                criteria.promptText(),
                criteria.errorTitle(),
                criteria.errorText());
    }
}
