package com.example.excelops.service.formula;

/**
 * Marks a formula that pointed at cells which no longer exist.
 */
public record BrokenReference(String originalFormula, String reason) {
}
