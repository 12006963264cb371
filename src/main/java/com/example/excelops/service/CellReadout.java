package com.example.excelops.service;

/**
 * One populated cell of a read. {@code value} is the stored or cached value; error values are
 * rendered as their text, e.g. {@code #REF!}.
 */
public record CellReadout(String address, Object value, String formula, int row, int column,
                          ValidationInfo validation) {
}
