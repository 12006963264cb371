package com.example.excelops.service;

/**
 * Styling to apply to a range. Null fields leave the existing style alone; colours are
 * {@code RRGGBB} hex, with or without a leading '#'.
 */
public record RangeFormat(
        Boolean bold,
        Boolean italic,
        Boolean underline,
        Integer fontSize,
        String fontColor,
        String bgColor,
        String borderStyle,
        String borderColor,
        String numberFormat,
        String alignment,
        Boolean wrapText,
        boolean mergeCells
) {

    public boolean changesStyle() {
        return bold != null || italic != null || underline != null || fontSize != null || fontColor != null
                || bgColor != null || borderStyle != null || borderColor != null || numberFormat != null
                || alignment != null || wrapText != null;
    }
}
