package com.example.excelops.service.grid;

import com.example.excelops.service.reference.CellAddress;
import com.example.excelops.service.reference.CellRange;

import java.util.List;
import java.util.Optional;

/**
 * Data-validation rules of one sheet. Rules may overlap; the last one covering a cell wins.
 */
public class ValidationRegistry extends RangedRegistry<ValidationRule> {

    public void add(ValidationRule rule) {
        entries.add(rule);
    }

    public List<ValidationRule> listForSheet() {
        return list();
    }

    public Optional<ValidationRule> applicableTo(CellAddress address) {
        List<ValidationRule> covering = covering(address);
        return covering.isEmpty() ? Optional.empty() : Optional.of(covering.get(covering.size() - 1));
    }

    @Override
    protected boolean accepts(CellRange range) {
        return true;
    }
}
