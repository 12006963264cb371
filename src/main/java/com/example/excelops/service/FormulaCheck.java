package com.example.excelops.service;

import java.util.List;

/**
 * Outcome of validating a formula against a target cell.
 *
 * @param references     the references the formula contains, as written
 * @param currentFormula the formula the cell holds now, or {@code null} when it holds none
 */
public record FormulaCheck(String cell, String formula, List<String> references, String currentFormula,
                           String message) {
}
