package com.example.excelops.service.grid;

import java.util.List;

/**
 * Everything a validation rule checks and shows, apart from where it applies.
 * Formula operands are kept without a leading '='.
 */
public record ValidationCriteria(
        ValidationOperator operator,
        String formula1,
        String formula2,
        List<String> explicitValues,
        boolean allowBlank,
        boolean suppressDropDown,
        boolean showPrompt,
        String promptTitle,
        String promptText,
        boolean showError,
        int errorStyle,
        String errorTitle,
        String errorText
) {

    public ValidationCriteria {
        explicitValues = explicitValues == null ? null : List.copyOf(explicitValues);
    }

    public static ValidationCriteria list(List<String> values) {
        return new ValidationCriteria(null, null, null, values, true, false,
                false, null, null, true, 0, null, null);
    }

    public static ValidationCriteria formulas(ValidationOperator operator, String formula1, String formula2) {
        return new ValidationCriteria(operator, formula1, formula2, null, true, false,
                false, null, null, true, 0, null, null);
    }

    public ValidationCriteria withFormulas(String newFormula1, String newFormula2) {
        return new ValidationCriteria(operator, newFormula1, newFormula2, explicitValues, allowBlank,
                suppressDropDown, showPrompt, promptTitle, promptText, showError, errorStyle,
                errorTitle, errorText);
    }
}
