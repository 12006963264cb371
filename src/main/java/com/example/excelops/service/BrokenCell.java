package com.example.excelops.service;

/**
 * A cell whose formula now contains {@code #REF!} because the cells it pointed at were removed.
 */
public record BrokenCell(String sheetName, String cell, String formula, String reason) {
}
