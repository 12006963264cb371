package com.example.excelops.service.formula;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FormulaTokenizerTest {

    private static List<String> tokens(String formula) {
        return FormulaTokenizer.scan(formula).stream()
                .map(ref -> formula.substring(ref.startIndex(), ref.endIndex()))
                .toList();
    }

    @Test
    void findsCellsAreasAndQualifiedReferences() {
        String formula = "=SUM(A1:B2)+Sheet2!$C$3+'My Sheet'!D4";
        List<FormulaReference> refs = FormulaTokenizer.scan(formula);

        assertEquals(List.of("A1:B2", "Sheet2!$C$3", "'My Sheet'!D4"), tokens(formula));
        assertEquals(FormulaReference.Shape.AREA, refs.get(0).shape());
        assertEquals("Sheet2", refs.get(1).sheetName());
        assertTrue(refs.get(1).columnAbsolute());
        assertTrue(refs.get(1).rowAbsolute());
        assertEquals("My Sheet", refs.get(2).sheetName());
    }

    @Test
    void unquotedSheetNamesMayUseAnyLetters() {
        List<FormulaReference> refs = FormulaTokenizer.scan("=数据!B5+Données!A1:A3");

        assertEquals(List.of("数据!B5", "Données!A1:A3"), tokens("=数据!B5+Données!A1:A3"));
        assertEquals("数据", refs.get(0).sheetName());
        assertEquals("Données", refs.get(1).sheetName());
        assertTrue(tokens("=数据B5").isEmpty());
    }

    @Test
    void skipsStringLiterals() {
        assertEquals(List.of("B2"), tokens("=\"A1\"&B2"));
        assertEquals(List.of("C3"), tokens("=\"say \"\"A1\"\"\"&C3"));
    }

    @Test
    void functionNamesAndOversizedTokensAreNotReferences() {
        assertEquals(List.of("A1"), tokens("=LOG10(A1)"));
        assertEquals(List.of("A1"), tokens("=XFE1+A1"));
    }

    @Test
    void readsAbsoluteFlagsPerAxis() {
        FormulaReference mixed = FormulaTokenizer.scan("=$A1+B$2").get(0);
        assertTrue(mixed.columnAbsolute());
        assertFalse(mixed.rowAbsolute());

        FormulaReference other = FormulaTokenizer.scan("=$A1+B$2").get(1);
        assertFalse(other.columnAbsolute());
        assertTrue(other.rowAbsolute());
    }

    @Test
    void recognizesWholeColumnsAndRows() {
        List<FormulaReference> refs = FormulaTokenizer.scan("=SUM(A:C)+SUM($2:4)");
        assertEquals(FormulaReference.Shape.COLUMNS, refs.get(0).shape());
        assertEquals("A:C", refs.get(0).encode());
        assertEquals(FormulaReference.Shape.ROWS, refs.get(1).shape());
        assertEquals("$2:4", refs.get(1).encode());
    }

    @Test
    void handlesEscapedQuotesInSheetNamesAndExternalBooks() {
        FormulaReference quoted = FormulaTokenizer.scan("='O''Brien'!A1").get(0);
        assertEquals("O'Brien", quoted.sheetName());

        FormulaReference external = FormulaTokenizer.scan("=[Book.xlsx]Sheet1!A1").get(0);
        assertTrue(external.isExternal());
        assertFalse(external.pointsInto("Sheet1", "Sheet1"));
    }

    @Test
    void detectsUnterminatedQuotes() {
        assertTrue(FormulaTokenizer.hasUnterminatedQuote("=\"abc"));
        assertTrue(FormulaTokenizer.hasUnterminatedQuote("='My Sheet!A1"));
        assertFalse(FormulaTokenizer.hasUnterminatedQuote("='My Sheet'!A1"));
        assertFalse(FormulaTokenizer.hasUnterminatedQuote("=\"a\"\"b\""));
    }

    @Test
    void maskingKeepsPositions() {
        String formula = "=\"x\"&A1";
        String masked = FormulaTokenizer.maskLiterals(formula);
        assertEquals(formula.length(), masked.length());
        assertEquals("=   &A1", masked);
    }
}
