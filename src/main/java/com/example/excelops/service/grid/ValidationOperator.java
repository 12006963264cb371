package com.example.excelops.service.grid;

/**
 * Comparison applied by numeric, date, time and text-length rules. Declaration order matches
 * the operator codes of the spreadsheet format.
 */
public enum ValidationOperator {
    BETWEEN,
    NOT_BETWEEN,
    EQUAL,
    NOT_EQUAL,
    GREATER_THAN,
    LESS_THAN,
    GREATER_OR_EQUAL,
    LESS_OR_EQUAL
}
