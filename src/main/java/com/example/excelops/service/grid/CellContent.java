package com.example.excelops.service.grid;

/**
 * What one populated cell holds. {@code formula} is stored without the leading '=' and, when
 * present, {@code value} is only the last cached result. {@code styleIndex} points into the
 * workbook's style table and is opaque to the engine.
 */
public record CellContent(Object value, String formula, Short styleIndex) {

    public static CellContent ofValue(Object value) {
        return new CellContent(value, null, null);
    }

    public static CellContent ofFormula(String formula) {
        return new CellContent(null, stripEquals(formula), null);
    }

    public boolean isFormula() {
        return formula != null;
    }

    public boolean isPopulated() {
        return formula != null || (value != null && !(value instanceof String s && s.isEmpty()));
    }

    public CellContent withFormula(String newFormula) {
        return new CellContent(null, stripEquals(newFormula), styleIndex);
    }

    /**
     * The formula as a user types it, with the leading '='.
     */
    public String formulaText() {
        return formula == null ? null : "=" + formula;
    }

    public static String stripEquals(String formula) {
        if (formula == null) {
            return null;
        }
        String trimmed = formula.trim();
        return trimmed.startsWith("=") ? trimmed.substring(1) : trimmed;
    }
}
