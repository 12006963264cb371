package com.example.excelops.service.reference;

import com.example.excelops.service.ErrorKind;
import com.example.excelops.service.SheetOperationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CellAddressTest {

    @Test
    void parsesLettersThenDigits() {
        assertEquals(CellAddress.of(1, 1), CellAddress.parse("A1"));
        assertEquals(CellAddress.of(27, 10), CellAddress.parse("AA10"));
        assertEquals(CellAddress.of(16_384, 1_048_576), CellAddress.parse("XFD1048576"));
    }

    @Test
    void parsingIsCaseInsensitiveAndEncodingIsCanonical() {
        CellAddress address = CellAddress.parse("ab12");
        assertEquals("AB12", address.encode());
        assertEquals("C7", CellAddress.parse("c007").encode());
    }

    @Test
    void encodeThenParseRoundTrips() {
        int[] columns = {1, 26, 27, 52, 702, 703, 16_384};
        for (int column : columns) {
            CellAddress address = CellAddress.of(column, 42);
            assertEquals(address, CellAddress.parse(address.encode()));
        }
    }

    @Test
    void rejectsMalformedText() {
        for (String text : new String[]{"", "  ", "1A", "A", "12", "A1B", "A-1", "A0", "XFE1", "A1048577"}) {
            SheetOperationException e = assertThrows(SheetOperationException.class, () -> CellAddress.parse(text),
                    "expected failure for '" + text + "'");
            assertEquals(ErrorKind.MALFORMED_REFERENCE, e.kind());
        }
        assertEquals(ErrorKind.MALFORMED_REFERENCE,
                assertThrows(SheetOperationException.class, () -> CellAddress.parse(null)).kind());
    }

    @Test
    void shiftNeverClamps() {
        assertEquals(CellAddress.parse("C5"), CellAddress.parse("A2").shift(2, 3));

        SheetOperationException e = assertThrows(SheetOperationException.class,
                () -> CellAddress.parse("B2").shift(-2, 0));
        assertEquals(ErrorKind.OUT_OF_BOUNDS, e.kind());
        assertThrows(SheetOperationException.class, () -> CellAddress.parse("A1048576").shift(0, 1));
    }

    @Test
    void columnLettersUseBijectiveBase26() {
        assertEquals("A", CellAddress.columnLetters(1));
        assertEquals("Z", CellAddress.columnLetters(26));
        assertEquals("AA", CellAddress.columnLetters(27));
        assertEquals("AZ", CellAddress.columnLetters(52));
        assertEquals("ZZ", CellAddress.columnLetters(702));
        assertEquals("AAA", CellAddress.columnLetters(703));
        assertEquals(-1, CellAddress.columnNumber("XFE"));
        assertEquals(-1, CellAddress.columnNumber("ABCD"));
    }

    @Test
    void columnNumbersRoundTripAtTheSheetEdge() {
        assertEquals(1, CellAddress.columnNumber("a"));
        assertEquals(16_384, CellAddress.columnNumber("XFD"));
        assertEquals("XFD", CellAddress.columnLetters(CellAddress.MAX_COLUMNS));
        assertEquals(-1, CellAddress.columnNumber("A1"));
        assertEquals(-1, CellAddress.columnNumber("$A"));
    }

    @Test
    void ordersRowMajor() {
        assertTrue(CellAddress.parse("Z1").compareTo(CellAddress.parse("A2")) < 0);
        assertTrue(CellAddress.parse("A2").compareTo(CellAddress.parse("B2")) < 0);
        assertEquals(0, CellAddress.parse("C3").compareTo(CellAddress.of(3, 3)));
    }
}
