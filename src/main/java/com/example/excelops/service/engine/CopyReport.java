package com.example.excelops.service.engine;

import java.util.List;

public record CopyReport(int cellsWritten, int formulasTranslated, List<BrokenFormula> brokenFormulas) {

    public CopyReport {
        brokenFormulas = List.copyOf(brokenFormulas);
    }
}
