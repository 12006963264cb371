package com.example.excelops.service;

import java.util.List;

public record OperationResult(String message, List<BrokenCell> brokenFormulas) {

    public OperationResult {
        brokenFormulas = brokenFormulas == null ? List.of() : List.copyOf(brokenFormulas);
    }

    public static OperationResult of(String message) {
        return new OperationResult(message, List.of());
    }
}
