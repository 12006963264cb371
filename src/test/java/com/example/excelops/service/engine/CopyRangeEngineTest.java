package com.example.excelops.service.engine;

import com.example.excelops.service.ErrorKind;
import com.example.excelops.service.SheetOperationException;
import com.example.excelops.service.formula.FormulaReferenceRewriter;
import com.example.excelops.service.grid.CellContent;
import com.example.excelops.service.grid.SheetGrid;
import com.example.excelops.service.reference.CellAddress;
import com.example.excelops.service.reference.CellRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CopyRangeEngineTest {

    private CopyRangeEngine engine;
    private SheetGrid grid;

    @BeforeEach
    void setUp() {
        engine = new CopyRangeEngine(new FormulaReferenceRewriter());
        grid = new SheetGrid("Sheet1");
    }

    private static CellAddress at(String address) {
        return CellAddress.parse(address);
    }

    private Object valueAt(SheetGrid sheet, String address) {
        return sheet.get(at(address)).map(CellContent::value).orElse(null);
    }

    @Test
    void translatesRelativeReferencesByTheCopyOffset() {
        grid.put(at("B1"), CellContent.ofFormula("=A1"));

        CopyReport report = engine.copy(grid, CellRange.parse("B1:B1"), grid, at("D1"));

        assertEquals("=C1", grid.get(at("D1")).orElseThrow().formulaText());
        assertEquals("=A1", grid.get(at("B1")).orElseThrow().formulaText());
        assertEquals(1, report.formulasTranslated());
    }

    @Test
    void overlappingCopyReadsTheWholeSourceFirst() {
        grid.put(at("A1"), CellContent.ofValue("one"));
        grid.put(at("A2"), CellContent.ofValue("two"));
        grid.put(at("A3"), CellContent.ofValue("three"));

        engine.copy(grid, CellRange.parse("A1:A3"), grid, at("A2"));

        assertEquals("one", valueAt(grid, "A1"));
        assertEquals("one", valueAt(grid, "A2"));
        assertEquals("two", valueAt(grid, "A3"));
        assertEquals("three", valueAt(grid, "A4"));
    }

    @Test
    void emptySourceCellsClearTheDestination() {
        grid.put(at("A1"), CellContent.ofValue("src"));
        grid.put(at("D2"), CellContent.ofValue("old"));

        engine.copy(grid, CellRange.parse("A1:A2"), grid, at("D1"));

        assertEquals("src", valueAt(grid, "D1"));
        assertNull(valueAt(grid, "D2"));
    }

    @Test
    void copyingToAnotherSheetKeepsMergesAndValidationsThere() {
        SheetGrid target = new SheetGrid("Target");
        target.merges().register(CellRange.parse("C3:D4"));
        grid.put(at("A1"), new CellContent(42.0, null, (short) 3));

        CopyReport report = engine.copy(grid, CellRange.parse("A1"), target, at("C3"));

        assertEquals(42.0, valueAt(target, "C3"));
        assertEquals(Short.valueOf((short) 3), target.get(at("C3")).orElseThrow().styleIndex());
        assertEquals(1, target.merges().size());
        assertEquals(1, report.cellsWritten());
        assertTrue(grid.get(at("C3")).isEmpty());
    }

    @Test
    void crossSheetCopyTranslatesReferencesIntoTheDestinationSheet() {
        SheetGrid source = new SheetGrid("Src");
        SheetGrid target = new SheetGrid("Dst");
        source.put(at("B1"), CellContent.ofFormula("=Src!A1+Dst!A1+A1"));

        engine.copy(source, CellRange.parse("B1"), target, at("D1"));

        assertEquals("=Src!A1+Dst!C1+C1", target.get(at("D1")).orElseThrow().formulaText());
    }

    @Test
    void anchoredAxesAreKept() {
        grid.put(at("B2"), CellContent.ofFormula("=$A$1+A$1+$A1"));

        engine.copy(grid, CellRange.parse("B2"), grid, at("C4"));

        assertEquals("=$A$1+B$1+$A3", grid.get(at("C4")).orElseThrow().formulaText());
    }

    @Test
    void referencesPushedOffTheSheetAreReportedBroken() {
        grid.put(at("C1"), CellContent.ofFormula("=B1"));

        CopyReport report = engine.copy(grid, CellRange.parse("C1"), grid, at("A1"));

        assertEquals("=#REF!", grid.get(at("A1")).orElseThrow().formulaText());
        assertEquals(1, report.brokenFormulas().size());
    }

    @Test
    void destinationPastTheSheetLimitFailsBeforeWriting() {
        grid.put(at("A1"), CellContent.ofValue("x"));

        SheetOperationException e = assertThrows(SheetOperationException.class,
                () -> engine.copy(grid, CellRange.parse("A1:A3"), grid, at("A1048575")));

        assertEquals(ErrorKind.OUT_OF_BOUNDS, e.kind());
        assertEquals(1, grid.cells().size());
    }
}
