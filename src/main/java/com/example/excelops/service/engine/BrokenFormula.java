package com.example.excelops.service.engine;

import com.example.excelops.service.formula.BrokenReference;
import com.example.excelops.service.reference.CellAddress;

/**
 * A formula cell that now shows {@code #REF!} because cells it referenced were removed.
 */
public record BrokenFormula(String sheetName, CellAddress cell, String formula, BrokenReference reference) {
}
