package com.example.excelops.service.grid;

import com.example.excelops.service.reference.CellRange;

public record ValidationRule(CellRange range, ValidationKind kind, ValidationCriteria criteria)
        implements RangedEntity<ValidationRule> {

    @Override
    public ValidationRule withRange(CellRange newRange) {
        return new ValidationRule(newRange, kind, criteria);
    }

    public ValidationRule withCriteria(ValidationCriteria newCriteria) {
        return new ValidationRule(range, kind, newCriteria);
    }
}
