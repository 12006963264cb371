package com.example.excelops.service.formula;

import com.example.excelops.service.reference.Axis;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FormulaReferenceRewriterTest {

    private static final String SHEET = "Sheet1";

    private final FormulaReferenceRewriter rewriter = new FormulaReferenceRewriter();

    private String shifted(String formula, StructuralShift shift) {
        return rewriter.shiftStructural(formula, SHEET, shift).formula();
    }

    @Test
    void insertionShiftsAbsoluteAndRelativeAxes() {
        StructuralShift shift = StructuralShift.insert(SHEET, Axis.COLUMN, 1, 1);
        assertEquals("=B1+$C$1", shifted("=A1+$B$1", shift));
    }

    @Test
    void absoluteAxesStayWhenConfigured() {
        FormulaReferenceRewriter anchored = new FormulaReferenceRewriter(false);
        StructuralShift shift = StructuralShift.insert(SHEET, Axis.COLUMN, 1, 1);
        assertEquals("B1+$B$1", anchored.shiftStructural("A1+$B$1", SHEET, shift).formula());
    }

    @Test
    void deletionBreaksReferencesIntoTheBandAndPullsLaterOnesBack() {
        StructuralShift shift = StructuralShift.delete(SHEET, Axis.ROW, 2, 2);

        FormulaRewrite broken = rewriter.shiftStructural("B3*2", SHEET, shift);
        assertTrue(broken.isBroken());
        assertEquals("#REF!*2", broken.formula());
        assertEquals("B3*2", broken.broken().originalFormula());

        FormulaRewrite moved = rewriter.shiftStructural("B5*2", SHEET, shift);
        assertFalse(moved.isBroken());
        assertEquals("B3*2", moved.formula());

        assertEquals("B1", shifted("B1", shift));
    }

    @Test
    void areasStraddlingADeletionShrink() {
        StructuralShift shift = StructuralShift.delete(SHEET, Axis.ROW, 2, 2);
        assertEquals("SUM(A1:A8)", shifted("SUM(A1:A10)", shift));
        assertEquals("SUM($A$1:$A$8)", shifted("SUM($A$1:$A$10)", shift));
    }

    @Test
    void areasStraddlingAnInsertionGrow() {
        StructuralShift shift = StructuralShift.insert(SHEET, Axis.ROW, 5, 3);
        assertEquals("SUM(A1:A13)", shifted("SUM(A1:A10)", shift));
    }

    @Test
    void onlyReferencesIntoTheShiftedSheetMove() {
        StructuralShift shift = StructuralShift.insert(SHEET, Axis.ROW, 1, 1);
        assertEquals("Sheet2!A1+A2+Sheet1!A2", shifted("Sheet2!A1+A1+Sheet1!A1", shift));
    }

    @Test
    void dependentSheetsFollowQualifiedReferences() {
        StructuralShift shift = StructuralShift.delete("Data", Axis.ROW, 2, 2);
        FormulaRewrite result = rewriter.shiftStructural("Data!B5+B5+'Data'!B3", "Summary", shift);
        assertEquals("Data!B3+B5+#REF!", result.formula());
        assertTrue(result.isBroken());
    }

    @Test
    void stringLiteralsAreNeverRewritten() {
        StructuralShift shift = StructuralShift.insert(SHEET, Axis.ROW, 1, 1);
        assertEquals("\"A1\"&A2", shifted("\"A1\"&A1", shift));
    }

    @Test
    void wholeColumnAndRowReferencesShiftAlongTheirAxis() {
        assertEquals("SUM(D:D)", shifted("SUM(C:C)", StructuralShift.insert(SHEET, Axis.COLUMN, 2, 1)));
        assertEquals("SUM(C:C)", shifted("SUM(C:C)", StructuralShift.insert(SHEET, Axis.ROW, 1, 5)));
        assertEquals("SUM(2:4)", shifted("SUM(3:5)", StructuralShift.delete(SHEET, Axis.ROW, 1, 1)));
    }

    @Test
    void insertionPushingAReferenceOffTheSheetBreaksIt() {
        FormulaRewrite result = rewriter.shiftStructural("A1048576", SHEET,
                StructuralShift.insert(SHEET, Axis.ROW, 1, 1));
        assertEquals("#REF!", result.formula());
        assertTrue(result.isBroken());
    }

    @Test
    void bandedDeletionOnlyMovesReferencesInsideTheBand() {
        StructuralShift shift = StructuralShift.deleteWithinBand(SHEET, Axis.ROW, 2, 2, 1, 2);
        assertEquals("A3+D5", shifted("A5+D5", shift));
        assertEquals("#REF!+D3", shifted("B2+D3", shift));
    }

    @Test
    void copyTranslationMovesRelativeAxesOnly() {
        assertEquals("=C1", rewriter.translate("=A1", SHEET, 2, 0).formula());
        assertEquals("$A$1+B$1+$A2", rewriter.translate("$A$1+A$1+$A1", SHEET, 1, 1).formula());
        assertEquals("Other!A1+B2", rewriter.translate("Other!A1+A1", SHEET, 1, 1).formula());
    }

    @Test
    void copyTranslationFollowsReferencesQualifiedWithTheDestinationSheet() {
        assertEquals("Src!A1+Dst!C1+C1", rewriter.translate("Src!A1+Dst!A1+A1", "Dst", 2, 0).formula());
        assertEquals("'dst'!B2", rewriter.translate("'dst'!A1", "Dst", 1, 1).formula());
    }

    @Test
    void renamingASheetRequalifiesOnlyItsReferences() {
        FormulaRewrite result = rewriter.renameSheet("Data!A1+'data'!B2:C3+A1+Other!A1", "Data", "Q1 Sales");
        assertEquals("'Q1 Sales'!A1+'Q1 Sales'!B2:C3+A1+Other!A1", result.formula());
        assertFalse(result.isBroken());
        assertEquals("Totals!$A$1", rewriter.renameSheet("'Data'!$A$1", "Data", "Totals").formula());
        assertEquals("'O''Brien'!A1", rewriter.renameSheet("Data!A1", "Data", "O'Brien").formula());
        assertFalse(rewriter.renameSheet("Other!A1", "Data", "Totals").changed());
    }

    @Test
    void droppingASheetBreaksEveryReferenceIntoIt() {
        FormulaRewrite result = rewriter.dropSheet("SUM(Gone!A1:A3)+A1+Kept!B1", "gone");
        assertEquals("SUM(#REF!)+A1+Kept!B1", result.formula());
        assertTrue(result.isBroken());
        assertTrue(result.broken().reason().contains("Gone!A1:A3"));
        assertFalse(rewriter.dropSheet("A1*2", "Gone").changed());
    }

    @Test
    void copyTranslationOffTheSheetBreaksTheReference() {
        FormulaRewrite result = rewriter.translate("A1+B1", SHEET, -1, 0);
        assertEquals("#REF!+A1", result.formula());
        assertTrue(result.isBroken());
    }

    @Test
    void nullFormulaHasNoRewrite() {
        assertNull(rewriter.shiftStructural(null, SHEET, StructuralShift.insert(SHEET, Axis.ROW, 1, 1)));
        assertNull(rewriter.translate(null, SHEET, 1, 1));
    }
}
