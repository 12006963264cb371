package com.example.excelops.service;

/**
 * Closed set of input problems an operation reports to its caller. Every kind is correctable by
 * the caller; environment failures such as a missing or unreadable workbook never appear here
 * and propagate as {@link java.io.UncheckedIOException} instead.
 * <p>
 * Formulas that lose a reference are not failures: they are rewritten to {@code #REF!} and
 * listed in the operation result.
 */
public enum ErrorKind {
    MALFORMED_REFERENCE,
    INVALID_POSITION,
    INVALID_COUNT,
    OUT_OF_BOUNDS,
    OVERLAP,
    DEGENERATE_RANGE,
    INVALID_FORMULA,
    INVALID_ARGUMENT,
    ALREADY_EXISTS,
    SHEET_NOT_FOUND,
    NOT_FOUND;

    public boolean isNotFound() {
        return this == SHEET_NOT_FOUND || this == NOT_FOUND;
    }

    public boolean isConflict() {
        return this == OVERLAP || this == ALREADY_EXISTS;
    }
}
