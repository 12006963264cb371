package com.example.excelops.service.grid;

import com.example.excelops.service.reference.Axis;
import com.example.excelops.service.reference.CellRange;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RangeShifterTest {

    private static Optional<String> shift(String range, Axis axis, int start, int delta) {
        return RangeShifter.shift(CellRange.parse(range), axis, start, delta).map(CellRange::encode);
    }

    @Test
    void insertionBeforeMovesWholeRange() {
        assertEquals(Optional.of("A5:B6"), shift("A3:B4", Axis.ROW, 2, 2));
        assertEquals(Optional.of("A5:B6"), shift("A3:B4", Axis.ROW, 3, 2));
    }

    @Test
    void insertionAfterLeavesRangeAlone() {
        assertEquals(Optional.of("A3:B4"), shift("A3:B4", Axis.ROW, 5, 2));
    }

    @Test
    void insertionInsideWidensFarEdge() {
        assertEquals(Optional.of("A3:B6"), shift("A3:B4", Axis.ROW, 4, 2));
        assertEquals(Optional.of("B1:E2"), shift("B1:C2", Axis.COLUMN, 3, 2));
    }

    @Test
    void insertionPushingRangeOffSheetDropsIt() {
        assertEquals(Optional.empty(), shift("A1048575:A1048576", Axis.ROW, 1048570, 10));
        assertEquals(Optional.of("A1:A1048576"), shift("A1:A1048570", Axis.ROW, 5, 10));
    }

    @Test
    void deletionBeforeMovesBack() {
        assertEquals(Optional.of("A3:B4"), shift("A5:B6", Axis.ROW, 2, -2));
    }

    @Test
    void deletionOfWholeRangeDropsIt() {
        assertEquals(Optional.empty(), shift("A3:B4", Axis.ROW, 3, -2));
        assertEquals(Optional.empty(), shift("A3:B4", Axis.ROW, 2, -5));
    }

    @Test
    void deletionStraddlingClips() {
        // rows 4..5 removed from 3..6
        assertEquals(Optional.of("A3:B4"), shift("A3:B6", Axis.ROW, 4, -2));
        // rows 2..3 removed, range 3..6 keeps 4..6 which becomes 2..4
        assertEquals(Optional.of("A2:B4"), shift("A3:B6", Axis.ROW, 2, -2));
        // rows 5..8 removed, range 3..6 keeps 3..4
        assertEquals(Optional.of("A3:B4"), shift("A3:B6", Axis.ROW, 5, -4));
    }

    @Test
    void shiftBoundsReportsVanishedIntervals() {
        assertNull(RangeShifter.shiftBounds(3, 4, 3, -2, 100));
        assertArrayEquals(new int[]{1, 2}, RangeShifter.shiftBounds(1, 2, 3, -2, 100));
        assertArrayEquals(new int[]{3, 3}, RangeShifter.shiftBounds(5, 5, 3, -2, 100));
    }
}
