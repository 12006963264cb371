package com.example.excelops.service.engine;

import java.util.List;

/**
 * Summary of what a structural change did to one sheet.
 */
public record MutationReport(
        int cellsMoved,
        int cellsRemoved,
        int formulasRewritten,
        int mergesDropped,
        int validationsDropped,
        List<BrokenFormula> brokenFormulas
) {

    public MutationReport {
        brokenFormulas = List.copyOf(brokenFormulas);
    }

    public static MutationReport formulasOnly(int formulasRewritten, List<BrokenFormula> brokenFormulas) {
        return new MutationReport(0, 0, formulasRewritten, 0, 0, brokenFormulas);
    }

    public boolean hasBrokenFormulas() {
        return !brokenFormulas.isEmpty();
    }
}
