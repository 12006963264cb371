package com.example.excelops.service.store;

import com.example.excelops.service.RangeFormat;
import com.example.excelops.service.SheetOperationException;
import com.example.excelops.service.reference.CellAddress;
import com.example.excelops.service.reference.CellRange;
import org.apache.poi.ss.usermodel.BorderStyle;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFColor;
import org.apache.poi.xssf.usermodel.XSSFFont;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Applies a {@link RangeFormat} to the cells of a range. Each distinct source style is derived
 * once, so styling a large range adds only as many styles as the range already used.
 */
class PoiRangeStyler {

    private static final Pattern HEX_COLOR = Pattern.compile("#?[0-9A-Fa-f]{6}");

    private final Workbook workbook;
    private final RangeFormat format;
    private final XSSFColor fontColor;
    private final XSSFColor bgColor;
    private final XSSFColor borderColor;
    private final BorderStyle borderStyle;
    private final HorizontalAlignment alignment;
    private final Map<Short, CellStyle> derived = new HashMap<>();

    PoiRangeStyler(Workbook workbook, RangeFormat format) {
        this.workbook = workbook;
        this.format = format;
        this.fontColor = color(format.fontColor(), "font color");
        this.bgColor = color(format.bgColor(), "background color");
        this.borderColor = color(format.borderColor(), "border color");
        this.borderStyle = borderStyle(format.borderStyle());
        this.alignment = alignment(format.alignment());
        if (format.fontSize() != null && (format.fontSize() < 1 || format.fontSize() > 409)) {
            throw SheetOperationException.invalidArgument("Font size must be between 1 and 409, got " + format.fontSize());
        }
    }

    void apply(Sheet sheet, CellRange range) {
        if (!format.changesStyle()) {
            return;
        }
        for (CellAddress address : range.cells()) {
            Row row = sheet.getRow(address.rowIndex());
            if (row == null) {
                row = sheet.createRow(address.rowIndex());
            }
            Cell cell = row.getCell(address.columnIndex());
            if (cell == null) {
                cell = row.createCell(address.columnIndex());
            }
            CellStyle base = cell.getCellStyle();
            cell.setCellStyle(derived.computeIfAbsent(base.getIndex(), k -> derive(base)));
        }
    }

    private CellStyle derive(CellStyle base) {
        CellStyle style = workbook.createCellStyle();
        style.cloneStyleFrom(base);

        if (format.bold() != null || format.italic() != null || format.underline() != null
                || format.fontSize() != null || fontColor != null) {
            style.setFont(deriveFont(workbook.getFontAt(base.getFontIndex())));
        }
        if (bgColor != null && style instanceof XSSFCellStyle xssf) {
            xssf.setFillForegroundColor(bgColor);
            xssf.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        }
        if (borderStyle != null) {
            style.setBorderTop(borderStyle);
            style.setBorderBottom(borderStyle);
            style.setBorderLeft(borderStyle);
            style.setBorderRight(borderStyle);
        }
        if (borderColor != null && style instanceof XSSFCellStyle xssf) {
            xssf.setTopBorderColor(borderColor);
            xssf.setBottomBorderColor(borderColor);
            xssf.setLeftBorderColor(borderColor);
            xssf.setRightBorderColor(borderColor);
        }
        if (format.numberFormat() != null) {
            style.setDataFormat(workbook.createDataFormat().getFormat(format.numberFormat()));
        }
        if (alignment != null) {
            style.setAlignment(alignment);
        }
        if (format.wrapText() != null) {
            style.setWrapText(format.wrapText());
        }
        return style;
    }

    private Font deriveFont(Font base) {
        Font font = workbook.createFont();
        font.setFontName(base.getFontName());
        font.setFontHeightInPoints(base.getFontHeightInPoints());
        font.setBold(base.getBold());
        font.setItalic(base.getItalic());
        font.setUnderline(base.getUnderline());
        font.setColor(base.getColor());
        if (base instanceof XSSFFont xssfBase && font instanceof XSSFFont xssfFont && xssfBase.getXSSFColor() != null) {
            xssfFont.setColor(xssfBase.getXSSFColor());
        }

        if (format.bold() != null) {
            font.setBold(format.bold());
        }
        if (format.italic() != null) {
            font.setItalic(format.italic());
        }
        if (format.underline() != null) {
            font.setUnderline(format.underline() ? Font.U_SINGLE : Font.U_NONE);
        }
        if (format.fontSize() != null) {
            font.setFontHeightInPoints(format.fontSize().shortValue());
        }
        if (fontColor != null && font instanceof XSSFFont xssfFont) {
            xssfFont.setColor(fontColor);
        }
        return font;
    }

    private static XSSFColor color(String hex, String what) {
        if (hex == null) {
            return null;
        }
        if (!HEX_COLOR.matcher(hex).matches()) {
            throw SheetOperationException.invalidArgument("Invalid " + what + " '" + hex + "', expected RRGGBB");
        }
        int rgb = Integer.parseInt(hex.startsWith("#") ? hex.substring(1) : hex, 16);
        byte[] bytes = {(byte) (rgb >> 16), (byte) (rgb >> 8), (byte) rgb};
        return new XSSFColor(bytes, null);
    }

    private static BorderStyle borderStyle(String name) {
        if (name == null) {
            return null;
        }
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "thin" -> BorderStyle.THIN;
            case "medium" -> BorderStyle.MEDIUM;
            case "thick" -> BorderStyle.THICK;
            case "double" -> BorderStyle.DOUBLE;
            case "dashed" -> BorderStyle.DASHED;
            case "dotted" -> BorderStyle.DOTTED;
            case "hair" -> BorderStyle.HAIR;
            case "none" -> BorderStyle.NONE;
            default -> throw SheetOperationException.invalidArgument("Unknown border style '" + name + "'");
        };
    }

    private static HorizontalAlignment alignment(String name) {
        if (name == null) {
            return null;
        }
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "general" -> HorizontalAlignment.GENERAL;
            case "left" -> HorizontalAlignment.LEFT;
            case "center" -> HorizontalAlignment.CENTER;
            case "right" -> HorizontalAlignment.RIGHT;
            case "justify" -> HorizontalAlignment.JUSTIFY;
            case "fill" -> HorizontalAlignment.FILL;
            default -> throw SheetOperationException.invalidArgument("Unknown alignment '" + name + "'");
        };
    }
}
