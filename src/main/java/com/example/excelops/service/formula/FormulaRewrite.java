package com.example.excelops.service.formula;

/**
 * Result of passing one formula through a rewriting policy. When {@code broken} is set,
 * {@code formula} holds the text with every unresolvable reference replaced by {@code #REF!}.
 */
public record FormulaRewrite(String original, String formula, BrokenReference broken) {

    static FormulaRewrite unchanged(String formula) {
        return new FormulaRewrite(formula, formula, null);
    }

    public boolean changed() {
        return !original.equals(formula);
    }

    public boolean isBroken() {
        return broken != null;
    }
}
