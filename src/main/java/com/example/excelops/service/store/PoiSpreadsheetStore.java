package com.example.excelops.service.store;

import com.example.excelops.service.ErrorKind;
import com.example.excelops.service.RangeFormat;
import com.example.excelops.service.SheetOperationException;
import com.example.excelops.service.grid.CellContent;
import com.example.excelops.service.grid.ErrorValue;
import com.example.excelops.service.grid.MergedRegion;
import com.example.excelops.service.grid.SheetGrid;
import com.example.excelops.service.grid.TableRegion;
import com.example.excelops.service.grid.ValidationCriteria;
import com.example.excelops.service.grid.ValidationKind;
import com.example.excelops.service.grid.ValidationOperator;
import com.example.excelops.service.grid.ValidationRule;
import com.example.excelops.service.reference.CellAddress;
import com.example.excelops.service.reference.CellRange;
import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.formula.FormulaParseException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataValidation;
import org.apache.poi.ss.usermodel.DataValidationConstraint;
import org.apache.poi.ss.usermodel.DataValidationConstraint.OperatorType;
import org.apache.poi.ss.usermodel.DataValidationConstraint.ValidationType;
import org.apache.poi.ss.usermodel.DataValidationHelper;
import org.apache.poi.ss.usermodel.FormulaError;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.ss.util.AreaReference;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.ss.util.CellRangeAddressList;
import org.apache.poi.ss.util.CellReference;
import org.apache.poi.xssf.usermodel.XSSFDataValidationConstraint;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFTable;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.openxmlformats.schemas.spreadsheetml.x2006.main.CTTable;
import org.openxmlformats.schemas.spreadsheetml.x2006.main.CTTableStyleInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.IntStream;

/**
 * {@link SpreadsheetStore} for {@code .xlsx} workbooks backed by Apache POI.
 * <p>
 * Saving rebuilds the cells, merged regions, data validations and tables of each written sheet
 * from its grid, forces a full recalculation on open, and replaces the file through a temporary sibling so
 * a failed write never leaves a partial workbook behind.
 */
@Component
public class PoiSpreadsheetStore implements SpreadsheetStore {

    private static final Logger log = LoggerFactory.getLogger(PoiSpreadsheetStore.class);

    static final String DEFAULT_TABLE_STYLE = "TableStyleMedium9";

    @Override
    public SheetGrid load(Path file, String sheetName) {
        return read(file, workbook -> readSheet(requireSheet(workbook, sheetName)));
    }

    @Override
    public Map<String, SheetGrid> loadAll(Path file) {
        return read(file, workbook -> {
            Map<String, SheetGrid> grids = new LinkedHashMap<>();
            for (Sheet sheet : workbook) {
                grids.put(sheet.getSheetName(), readSheet(sheet));
            }
            return grids;
        });
    }

    @Override
    public void createWorkbook(Path file, String firstSheetName) {
        if (Files.exists(file)) {
            throw new SheetOperationException(ErrorKind.ALREADY_EXISTS, "Workbook already exists: " + file);
        }
        Path temp = null;
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            workbook.createSheet(firstSheetName);
            Path dir = file.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            temp = Files.createTempFile(dir, ".excel-ops-", ".tmp");
            try (OutputStream out = Files.newOutputStream(temp)) {
                workbook.write(out);
            }
            Files.move(temp, file);
            temp = null;
            log.info("Created workbook {} with sheet '{}'", file, firstSheetName);
        } catch (FileAlreadyExistsException e) {
            throw new SheetOperationException(ErrorKind.ALREADY_EXISTS, "Workbook already exists: " + file);
        } catch (IOException e) {
            log.error("Failed to create workbook {}: {}", file, e.getMessage());
            throw new UncheckedIOException("Failed to create workbook " + file, e);
        } finally {
            deleteQuietly(temp);
        }
    }

    @Override
    public void addSheet(Path file, SheetGrid grid) {
        write(file, workbook -> writeSheet(workbook, workbook.createSheet(grid.sheetName()), grid));
    }

    @Override
    public void renameSheet(Path file, String oldName, String newName, Collection<SheetGrid> grids) {
        write(file, workbook -> {
            workbook.setSheetName(workbook.getSheetIndex(requireSheet(workbook, oldName)), newName);
            for (SheetGrid grid : grids) {
                writeSheet(workbook, requireSheet(workbook, grid.sheetName()), grid);
            }
        });
    }

    @Override
    public void deleteSheet(Path file, String sheetName, Collection<SheetGrid> grids) {
        write(file, workbook -> {
            workbook.removeSheetAt(workbook.getSheetIndex(requireSheet(workbook, sheetName)));
            for (SheetGrid grid : grids) {
                writeSheet(workbook, requireSheet(workbook, grid.sheetName()), grid);
            }
        });
    }

    @Override
    public void saveAll(Path file, Collection<SheetGrid> grids) {
        write(file, workbook -> {
            for (SheetGrid grid : grids) {
                writeSheet(workbook, requireSheet(workbook, grid.sheetName()), grid);
            }
        });
    }

    @Override
    public void saveWithFormat(Path file, SheetGrid grid, CellRange range, RangeFormat format) {
        write(file, workbook -> {
            PoiRangeStyler styler = new PoiRangeStyler(workbook, format);
            Sheet sheet = requireSheet(workbook, grid.sheetName());
            writeSheet(workbook, sheet, grid);
            styler.apply(sheet, range);
        });
    }

    private <T> T read(Path file, Function<Workbook, T> reader) {
        try (InputStream in = Files.newInputStream(requireFile(file));
             Workbook workbook = WorkbookFactory.create(in)) {
            return reader.apply(workbook);
        } catch (IOException e) {
            log.error("Failed to read workbook {}: {}", file, e.getMessage());
            throw new UncheckedIOException("Failed to read workbook " + file, e);
        }
    }

    private void write(Path file, Consumer<Workbook> changes) {
        Path source = requireFile(file);
        Path temp = null;
        try (InputStream in = Files.newInputStream(source);
             Workbook workbook = WorkbookFactory.create(in)) {
            if (!(workbook instanceof XSSFWorkbook)) {
                throw SheetOperationException.invalidArgument("Only .xlsx workbooks can be modified: " + file);
            }
            changes.accept(workbook);
            workbook.setForceFormulaRecalculation(true);

            Path dir = source.toAbsolutePath().getParent();
            temp = Files.createTempFile(dir, ".excel-ops-", ".tmp");
            try (OutputStream out = Files.newOutputStream(temp)) {
                workbook.write(out);
            }
            moveIntoPlace(temp, source);
            temp = null;
        } catch (IOException e) {
            log.error("Failed to write workbook {}: {}", file, e.getMessage());
            throw new UncheckedIOException("Failed to write workbook " + file, e);
        } finally {
            deleteQuietly(temp);
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temporary file {}: {}", temp, e.getMessage());
        }
    }

    private static Path requireFile(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new UncheckedIOException("Workbook not found: " + file, new NoSuchFileException(file.toString()));
        }
        return file;
    }

    private static Sheet requireSheet(Workbook workbook, String sheetName) {
        Sheet sheet = sheetName == null ? null : workbook.getSheet(sheetName);
        if (sheet == null) {
            throw new SheetOperationException(ErrorKind.SHEET_NOT_FOUND, "Sheet '" + sheetName + "' not found");
        }
        return sheet;
    }

    // =========================
    // reading
    // =========================

    SheetGrid readSheet(Sheet sheet) {
        SheetGrid grid = new SheetGrid(sheet.getSheetName());
        int lastColumn = -1;
        for (Row row : sheet) {
            if (row.getHeight() != sheet.getDefaultRowHeight()) {
                grid.rowHeights().put(row.getRowNum() + 1, row.getHeightInPoints());
            }
            for (Cell cell : row) {
                CellContent content = readCell(cell);
                if (content != null) {
                    grid.put(CellAddress.fromZeroBased(cell.getRowIndex(), cell.getColumnIndex()), content);
                    lastColumn = Math.max(lastColumn, cell.getColumnIndex());
                }
            }
        }
        for (CellRangeAddress region : sheet.getMergedRegions()) {
            grid.merges().restore(toRange(region));
            lastColumn = Math.max(lastColumn, region.getLastColumn());
        }
        for (DataValidation validation : sheet.getDataValidations()) {
            ValidationKind kind = kindOf(validation.getValidationConstraint());
            ValidationCriteria criteria = criteriaOf(validation);
            for (CellRangeAddress region : validation.getRegions().getCellRangeAddresses()) {
                grid.validations().add(new ValidationRule(toRange(region), kind, criteria));
            }
        }
        if (sheet instanceof XSSFSheet xssfSheet) {
            for (XSSFTable table : xssfSheet.getTables()) {
                CellRange range = rangeOf(table);
                grid.tables().restore(new TableRegion(tableName(table), range, styleName(table)));
                lastColumn = Math.max(lastColumn, range.lastColumn() - 1);
            }
        }
        int defaultWidth = sheet.getDefaultColumnWidth() * 256;
        for (int c = 0; c <= lastColumn; c++) {
            int width = sheet.getColumnWidth(c);
            if (width != defaultWidth) {
                grid.columnWidths().put(c + 1, width);
            }
        }
        return grid;
    }

    private CellContent readCell(Cell cell) {
        Short style = cell.getCellStyle() == null || cell.getCellStyle().getIndex() == 0
                ? null
                : cell.getCellStyle().getIndex();
        CellType type = cell.getCellType();
        return switch (type) {
            case FORMULA -> new CellContent(cachedValue(cell), cell.getCellFormula(), style);
            case NUMERIC -> new CellContent(cell.getNumericCellValue(), null, style);
            case STRING -> new CellContent(cell.getStringCellValue(), null, style);
            case BOOLEAN -> new CellContent(cell.getBooleanCellValue(), null, style);
            case ERROR -> new CellContent(errorValue(cell.getErrorCellValue()), null, style);
            default -> style == null ? null : new CellContent(null, null, style);
        };
    }

    private Object cachedValue(Cell cell) {
        return switch (cell.getCachedFormulaResultType()) {
            case NUMERIC -> cell.getNumericCellValue();
            case STRING -> cell.getStringCellValue();
            case BOOLEAN -> cell.getBooleanCellValue();
            case ERROR -> errorValue(cell.getErrorCellValue());
            default -> null;
        };
    }

    private static ErrorValue errorValue(byte code) {
        try {
            return new ErrorValue(FormulaError.forInt(code).getString());
        } catch (IllegalArgumentException e) {
            return new ErrorValue("#N/A");
        }
    }

    private static String tableName(XSSFTable table) {
        return table.getName() != null ? table.getName() : table.getDisplayName();
    }

    private static String styleName(XSSFTable table) {
        CTTable ct = table.getCTTable();
        return ct.isSetTableStyleInfo() ? ct.getTableStyleInfo().getName() : null;
    }

    private static CellRange toRange(CellRangeAddress region) {
        int firstRow = region.getFirstRow() < 0 ? 0 : region.getFirstRow();
        int lastRow = region.getLastRow() < 0 ? CellAddress.MAX_ROWS - 1 : region.getLastRow();
        int firstColumn = region.getFirstColumn() < 0 ? 0 : region.getFirstColumn();
        int lastColumn = region.getLastColumn() < 0 ? CellAddress.MAX_COLUMNS - 1 : region.getLastColumn();
        return CellRange.of(firstColumn + 1, firstRow + 1, lastColumn + 1, lastRow + 1);
    }

    private static CellRangeAddress toRegion(CellRange range) {
        return new CellRangeAddress(range.firstRow() - 1, range.lastRow() - 1,
                range.firstColumn() - 1, range.lastColumn() - 1);
    }

    private static ValidationKind kindOf(DataValidationConstraint constraint) {
        return switch (constraint.getValidationType()) {
            case ValidationType.INTEGER -> ValidationKind.WHOLE;
            case ValidationType.DECIMAL -> ValidationKind.DECIMAL;
            case ValidationType.LIST -> ValidationKind.LIST;
            case ValidationType.DATE -> ValidationKind.DATE;
            case ValidationType.TIME -> ValidationKind.TIME;
            case ValidationType.TEXT_LENGTH -> ValidationKind.TEXT_LENGTH;
            case ValidationType.FORMULA -> ValidationKind.CUSTOM;
            default -> ValidationKind.ANY;
        };
    }

    private static ValidationCriteria criteriaOf(DataValidation validation) {
        DataValidationConstraint constraint = validation.getValidationConstraint();
        ValidationKind kind = kindOf(constraint);
        ValidationOperator operator = null;
        if (kind != ValidationKind.ANY && kind != ValidationKind.LIST && kind != ValidationKind.CUSTOM) {
            int code = constraint.getOperator();
            ValidationOperator[] operators = ValidationOperator.values();
            operator = code >= 0 && code < operators.length ? operators[code] : ValidationOperator.BETWEEN;
        }
        String[] explicit = constraint.getExplicitListValues();
        List<String> explicitValues = explicit == null ? null : Arrays.asList(explicit);
        return new ValidationCriteria(
                operator,
                explicitValues == null ? constraint.getFormula1() : null,
                constraint.getFormula2(),
                explicitValues,
                validation.getEmptyCellAllowed(),
                validation.getSuppressDropDownArrow(),
                validation.getShowPromptBox(),
                validation.getPromptBoxTitle(),
                validation.getPromptBoxText(),
                validation.getShowErrorBox(),
                validation.getErrorStyle(),
                validation.getErrorBoxTitle(),
                validation.getErrorBoxText());
    }

    // =========================
    // writing
    // =========================

    void writeSheet(Workbook workbook, Sheet sheet, SheetGrid grid) {
        clearSheet(sheet, grid);

        for (Map.Entry<CellAddress, CellContent> entry : grid.cells().entrySet()) {
            CellAddress address = entry.getKey();
            Row row = sheet.getRow(address.rowIndex());
            if (row == null) {
                row = sheet.createRow(address.rowIndex());
            }
            writeCell(workbook, row.createCell(address.columnIndex()), address, entry.getValue());
        }
        for (Map.Entry<Integer, Float> entry : grid.rowHeights().entrySet()) {
            Row row = sheet.getRow(entry.getKey() - 1);
            if (row == null) {
                row = sheet.createRow(entry.getKey() - 1);
            }
            row.setHeightInPoints(entry.getValue());
        }
        for (Map.Entry<Integer, Integer> entry : grid.columnWidths().entrySet()) {
            sheet.setColumnWidth(entry.getKey() - 1, entry.getValue());
        }
        for (MergedRegion merge : grid.merges().list()) {
            sheet.addMergedRegionUnsafe(toRegion(merge.range()));
        }
        DataValidationHelper helper = sheet.getDataValidationHelper();
        for (ValidationRule rule : grid.validations().list()) {
            DataValidation validation = toValidation(helper, rule);
            if (validation != null) {
                sheet.addValidationData(validation);
            }
        }
        if (sheet instanceof XSSFSheet xssfSheet) {
            writeTables(xssfSheet, grid);
        }
    }

    /**
     * Brings the sheet's table parts in line with the grid: removed tables are dropped, moved
     * ones get their new area, and new ones are created with their style. Runs after the cells
     * are written since POI takes column names from the header row.
     */
    private void writeTables(XSSFSheet sheet, SheetGrid grid) {
        Map<String, XSSFTable> existing = new LinkedHashMap<>();
        for (XSSFTable table : new ArrayList<>(sheet.getTables())) {
            Optional<TableRegion> region = grid.tables().find(tableName(table));
            if (region.isEmpty()) {
                sheet.removeTable(table);
                continue;
            }
            existing.put(region.get().name().toLowerCase(Locale.ROOT), table);
            CellRange range = region.get().range();
            if (!range.equals(rangeOf(table))) {
                table.setArea(toArea(range));
                if (table.getCTTable().isSetAutoFilter()) {
                    table.getCTTable().getAutoFilter().setRef(range.encode());
                }
            } else {
                table.updateHeaders();
            }
        }
        for (TableRegion region : grid.tables().list()) {
            if (existing.containsKey(region.name().toLowerCase(Locale.ROOT))) {
                continue;
            }
            XSSFTable table = sheet.createTable(toArea(region.range()));
            table.setName(region.name());
            table.setDisplayName(region.name());
            CTTable ct = table.getCTTable();
            CTTableStyleInfo styleInfo = ct.isSetTableStyleInfo() ? ct.getTableStyleInfo() : ct.addNewTableStyleInfo();
            styleInfo.setName(region.style() == null ? DEFAULT_TABLE_STYLE : region.style());
            styleInfo.setShowRowStripes(true);
            styleInfo.setShowColumnStripes(false);
            (ct.isSetAutoFilter() ? ct.getAutoFilter() : ct.addNewAutoFilter()).setRef(region.range().encode());
        }
    }

    private static CellRange rangeOf(XSSFTable table) {
        AreaReference area = table.getArea();
        return CellRange.of(area.getFirstCell().getCol() + 1, area.getFirstCell().getRow() + 1,
                area.getLastCell().getCol() + 1, area.getLastCell().getRow() + 1);
    }

    private static AreaReference toArea(CellRange range) {
        return new AreaReference(
                new CellReference(range.firstRow() - 1, range.firstColumn() - 1),
                new CellReference(range.lastRow() - 1, range.lastColumn() - 1),
                SpreadsheetVersion.EXCEL2007);
    }

    private void clearSheet(Sheet sheet, SheetGrid grid) {
        List<Row> rows = new ArrayList<>();
        sheet.forEach(rows::add);
        int lastColumn = 0;
        for (Row row : rows) {
            lastColumn = Math.max(lastColumn, row.getLastCellNum());
            sheet.removeRow(row);
        }
        int defaultWidth = sheet.getDefaultColumnWidth() * 256;
        for (int c = 0; c < lastColumn; c++) {
            if (!grid.columnWidths().containsKey(c + 1) && sheet.getColumnWidth(c) != defaultWidth) {
                sheet.setColumnWidth(c, defaultWidth);
            }
        }
        if (sheet.getNumMergedRegions() > 0) {
            sheet.removeMergedRegions(IntStream.range(0, sheet.getNumMergedRegions()).boxed().toList());
        }
        if (sheet instanceof XSSFSheet xssfSheet && xssfSheet.getCTWorksheet().isSetDataValidations()) {
            xssfSheet.getCTWorksheet().unsetDataValidations();
        }
    }

    private void writeCell(Workbook workbook, Cell cell, CellAddress address, CellContent content) {
        if (content.styleIndex() != null && content.styleIndex() < workbook.getNumCellStyles()) {
            cell.setCellStyle(workbook.getCellStyleAt(content.styleIndex()));
        }
        if (content.isFormula()) {
            try {
                cell.setCellFormula(content.formula());
            } catch (FormulaParseException e) {
                throw new SheetOperationException(ErrorKind.INVALID_FORMULA,
                        "Cannot store formula in " + address.encode() + ": " + e.getMessage());
            }
            return;
        }
        Object value = content.value();
        if (value == null) {
            cell.setBlank();
        } else if (value instanceof Number number) {
            cell.setCellValue(number.doubleValue());
        } else if (value instanceof Boolean bool) {
            cell.setCellValue(bool);
        } else if (value instanceof ErrorValue error) {
            writeError(cell, error);
        } else {
            cell.setCellValue(value.toString());
        }
    }

    private static void writeError(Cell cell, ErrorValue error) {
        try {
            cell.setCellErrorValue(FormulaError.forString(error.text()).getCode());
        } catch (IllegalArgumentException e) {
            cell.setCellValue(error.text());
        }
    }

    private DataValidation toValidation(DataValidationHelper helper, ValidationRule rule) {
        ValidationCriteria criteria = rule.criteria();
        int operator = criteria.operator() == null ? OperatorType.BETWEEN : criteria.operator().ordinal();
        String f1 = criteria.formula1();
        String f2 = criteria.formula2();
        DataValidationConstraint constraint;
        try {
            constraint = switch (rule.kind()) {
                case WHOLE -> helper.createIntegerConstraint(operator, f1, f2);
                case DECIMAL -> helper.createDecimalConstraint(operator, f1, f2);
                case TEXT_LENGTH -> helper.createTextLengthConstraint(operator, f1, f2);
                case DATE -> helper.createDateConstraint(operator, f1, f2, null);
                case TIME -> helper.createTimeConstraint(operator, f1, f2);
                case LIST -> criteria.explicitValues() != null
                        ? helper.createExplicitListConstraint(criteria.explicitValues().toArray(new String[0]))
                        : helper.createFormulaListConstraint(f1);
                case CUSTOM -> helper.createCustomConstraint(f1);
                case ANY -> new XSSFDataValidationConstraint(ValidationType.ANY, OperatorType.IGNORED, null, null);
            };
        } catch (IllegalArgumentException e) {
            log.warn("Skipping validation rule on {}: {}", rule.range().encode(), e.getMessage());
            return null;
        }

        CellRange range = rule.range();
        CellRangeAddressList regions = new CellRangeAddressList(range.firstRow() - 1, range.lastRow() - 1,
                range.firstColumn() - 1, range.lastColumn() - 1);
        DataValidation validation = helper.createValidation(constraint, regions);
        validation.setEmptyCellAllowed(criteria.allowBlank());
        validation.setSuppressDropDownArrow(criteria.suppressDropDown());
        validation.setShowPromptBox(criteria.showPrompt());
        if (criteria.promptTitle() != null || criteria.promptText() != null) {
            validation.createPromptBox(criteria.promptTitle(), criteria.promptText());
        }
        validation.setShowErrorBox(criteria.showError());
        validation.setErrorStyle(criteria.errorStyle());
        if (criteria.errorTitle() != null || criteria.errorText() != null) {
            validation.createErrorBox(criteria.errorTitle(), criteria.errorText());
        }
        return validation;
    }
}
