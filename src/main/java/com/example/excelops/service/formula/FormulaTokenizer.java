package com.example.excelops.service.formula;

import com.example.excelops.service.reference.CellAddress;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds references in formula text. String literals are skipped; quoted sheet names are kept
 * whole so that quotes or spaces inside them cannot start a literal. Unquoted sheet names may
 * use any Unicode letter, as Excel allows.
 */
public final class FormulaTokenizer {

    private static final Pattern REFERENCE_PATTERN = Pattern.compile(
            "(?<![\\p{L}\\p{N}_.$!'\\]\\\\])"
                    + "(?:(?<sheet>'(?:[^']|'')+'|\\[[^\\]]*\\][\\p{L}\\p{N}_.]+|[\\p{L}_\\\\][\\p{L}\\p{N}_.]*)!)?"
                    + "(?:"
                    + "(?<c1>\\$?)(?<col1>[A-Za-z]{1,3})(?<r1>\\$?)(?<row1>[0-9]+)"
                    + "(?::(?<c2>\\$?)(?<col2>[A-Za-z]{1,3})(?<r2>\\$?)(?<row2>[0-9]+))?"
                    + "|(?<cc1>\\$?)(?<ccol1>[A-Za-z]{1,3}):(?<cc2>\\$?)(?<ccol2>[A-Za-z]{1,3})"
                    + "|(?<rr1>\\$?)(?<rrow1>[0-9]+):(?<rr2>\\$?)(?<rrow2>[0-9]+)"
                    + ")"
                    + "(?![\\p{L}\\p{N}_(!.\\['])");

    private FormulaTokenizer() {
    }

    /**
     * Every in-bounds reference outside string literals, in text order. Tokens that look like
     * references but exceed the sheet limits (for example {@code ABCD1}) are names, not
     * references, and are skipped.
     */
    public static List<FormulaReference> scan(String formula) {
        List<FormulaReference> refs = new ArrayList<>();
        if (formula == null || formula.isEmpty()) {
            return refs;
        }
        Matcher m = REFERENCE_PATTERN.matcher(maskLiterals(formula));
        while (m.find()) {
            FormulaReference ref = toReference(m);
            if (ref != null) {
                refs.add(ref);
            }
        }
        return refs;
    }

    /**
     * Same text with the contents of every string literal, quotes included, blanked out.
     * Positions are preserved.
     */
    public static String maskLiterals(String formula) {
        char[] chars = formula.toCharArray();
        int i = 0;
        while (i < chars.length) {
            char c = chars[i];
            if (c == '"') {
                int endExclusive = literalEnd(formula, i);
                for (int k = i; k < endExclusive; k++) {
                    chars[k] = ' ';
                }
                i = endExclusive;
            } else if (c == '\'') {
                i = quotedNameEnd(formula, i);
            } else {
                i++;
            }
        }
        return new String(chars);
    }

    /**
     * Whether a string literal or quoted sheet name is left open at the end of the text.
     */
    public static boolean hasUnterminatedQuote(String formula) {
        int i = 0;
        while (i < formula.length()) {
            char c = formula.charAt(i);
            if (c == '"' || c == '\'') {
                int end = closingQuote(formula, i, c);
                if (end < 0) {
                    return true;
                }
                i = end;
            } else {
                i++;
            }
        }
        return false;
    }

    private static int literalEnd(String formula, int openIndex) {
        int end = closingQuote(formula, openIndex, '"');
        return end < 0 ? formula.length() : end;
    }

    private static int quotedNameEnd(String formula, int openIndex) {
        int end = closingQuote(formula, openIndex, '\'');
        return end < 0 ? formula.length() : end;
    }

    // index just past the closing quote, or -1 when the quote never closes; doubled quotes are escapes
    private static int closingQuote(String formula, int openIndex, char quote) {
        int i = openIndex + 1;
        while (i < formula.length()) {
            if (formula.charAt(i) == quote) {
                if (i + 1 < formula.length() && formula.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return -1;
    }

    private static FormulaReference toReference(Matcher m) {
        String sheet = m.group("sheet");
        if (m.group("col1") != null) {
            FormulaReference.Corner first = cellCorner(m.group("c1"), m.group("col1"), m.group("r1"), m.group("row1"));
            if (first == null) {
                return null;
            }
            if (m.group("col2") == null) {
                return new FormulaReference(sheet, FormulaReference.Shape.CELL, first, null, m.start(), m.end());
            }
            FormulaReference.Corner second = cellCorner(m.group("c2"), m.group("col2"), m.group("r2"), m.group("row2"));
            if (second == null) {
                return null;
            }
            return new FormulaReference(sheet, FormulaReference.Shape.AREA, first, second, m.start(), m.end());
        }
        if (m.group("ccol1") != null) {
            int a = CellAddress.columnNumber(m.group("ccol1"));
            int b = CellAddress.columnNumber(m.group("ccol2"));
            if (a < 1 || b < 1) {
                return null;
            }
            return new FormulaReference(sheet, FormulaReference.Shape.COLUMNS,
                    new FormulaReference.Corner(a, !m.group("cc1").isEmpty(), 0, false),
                    new FormulaReference.Corner(b, !m.group("cc2").isEmpty(), 0, false),
                    m.start(), m.end());
        }
        int a = rowNumber(m.group("rrow1"));
        int b = rowNumber(m.group("rrow2"));
        if (a < 1 || b < 1) {
            return null;
        }
        return new FormulaReference(sheet, FormulaReference.Shape.ROWS,
                new FormulaReference.Corner(0, false, a, !m.group("rr1").isEmpty()),
                new FormulaReference.Corner(0, false, b, !m.group("rr2").isEmpty()),
                m.start(), m.end());
    }

    private static FormulaReference.Corner cellCorner(String colMarker, String letters, String rowMarker, String digits) {
        int column = CellAddress.columnNumber(letters);
        int row = rowNumber(digits);
        if (column < 1 || row < 1) {
            return null;
        }
        return new FormulaReference.Corner(column, !colMarker.isEmpty(), row, !rowMarker.isEmpty());
    }

    private static int rowNumber(String digits) {
        if (digits.length() > 7) {
            return -1;
        }
        int row = Integer.parseInt(digits);
        return row > CellAddress.MAX_ROWS ? -1 : row;
    }
}
