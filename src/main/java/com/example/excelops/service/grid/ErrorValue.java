package com.example.excelops.service.grid;

/**
 * An error literal held by a cell, such as {@code #DIV/0!}.
 */
public record ErrorValue(String text) {

    @Override
    public String toString() {
        return text;
    }
}
