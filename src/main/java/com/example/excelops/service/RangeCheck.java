package com.example.excelops.service;

/**
 * @param dataRange         the populated extent of the sheet, or {@code null} for an empty sheet
 * @param withinDataRange   whether the checked range lies inside {@code dataRange}
 */
public record RangeCheck(String range, int width, int height, String dataRange, boolean withinDataRange,
                         String message) {
}
