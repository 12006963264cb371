package com.example.excelops.service;

import com.example.excelops.service.formula.FormulaReference;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FormulaValidatorTest {

    private static final List<String> SHEETS = List.of("Sheet1", "Data Set");

    private final FormulaValidator validator = new FormulaValidator();

    private ErrorKind failure(String formula) {
        return assertThrows(SheetOperationException.class, () -> validator.validate(formula, SHEETS)).kind();
    }

    @Test
    void acceptsWellFormedFormulas() {
        List<FormulaReference> refs = validator.validate("=SUM(A1:B2)+'Data Set'!C3*2", SHEETS);
        assertEquals(2, refs.size());
        assertDoesNotThrow(() -> validator.validate("=IF(A1>0,\"(\",\")\")", SHEETS));
        assertDoesNotThrow(() -> validator.validate("=sheet1!A1", SHEETS));
    }

    @Test
    void requiresLeadingEqualsAndABody() {
        assertEquals(ErrorKind.INVALID_FORMULA, failure("SUM(A1)"));
        assertEquals(ErrorKind.INVALID_FORMULA, failure("="));
        assertEquals(ErrorKind.INVALID_FORMULA, failure(""));
        assertEquals(ErrorKind.INVALID_FORMULA, failure(null));
    }

    @Test
    void rejectsUnbalancedParenthesesAndOpenQuotes() {
        assertEquals(ErrorKind.INVALID_FORMULA, failure("=SUM(A1"));
        assertEquals(ErrorKind.INVALID_FORMULA, failure("=SUM(A1))"));
        assertEquals(ErrorKind.INVALID_FORMULA, failure("=\"open"));
    }

    @Test
    void rejectsUnsafeFunctions() {
        assertEquals(ErrorKind.INVALID_FORMULA, failure("=INDIRECT(\"A1\")"));
        assertEquals(ErrorKind.INVALID_FORMULA, failure("=hyperlink(\"http://x\")"));
        assertEquals(ErrorKind.INVALID_FORMULA, failure("=WEBSERVICE(A1)"));
        assertDoesNotThrow(() -> validator.validate("=\"INDIRECT(\"&A1", SHEETS));
    }

    @Test
    void rejectsReferencesOutsideTheSheet() {
        assertEquals(ErrorKind.OUT_OF_BOUNDS, failure("=A1048577"));
        assertEquals(ErrorKind.OUT_OF_BOUNDS, failure("=B0+1"));
    }

    @Test
    void rejectsReferencesToMissingSheets() {
        assertEquals(ErrorKind.SHEET_NOT_FOUND, failure("=Other!A1"));
        assertEquals(ErrorKind.SHEET_NOT_FOUND, failure("='No Such'!A1"));
        assertEquals(ErrorKind.SHEET_NOT_FOUND, failure("=数据!B5"));
        assertEquals(1, validator.validate("=数据!B5*2", List.of("数据")).size());
    }
}
