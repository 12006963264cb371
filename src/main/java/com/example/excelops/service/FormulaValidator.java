package com.example.excelops.service;

import com.example.excelops.service.formula.FormulaReference;
import com.example.excelops.service.formula.FormulaTokenizer;
import com.example.excelops.service.reference.CellAddress;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Syntax and safety checks run before a formula is written to a cell.
 */
@Component
public class FormulaValidator {

    private static final Pattern UNSAFE_FUNCTION_PATTERN = Pattern.compile(
            "(?<![\\p{L}\\p{N}_.])(INDIRECT|HYPERLINK|WEBSERVICE|DGET|RTD)\\s*\\(", Pattern.CASE_INSENSITIVE);
    private static final Pattern CELL_TOKEN_PATTERN = Pattern.compile(
            "(?<![\\p{L}\\p{N}_.$!])\\$?([A-Za-z]{1,3})\\$?([0-9]+)(?![\\p{L}\\p{N}_(!.])");

    /**
     * Checks {@code formula} and returns the references it contains. {@code sheetNames} are the
     * sheets of the workbook the formula will live in; qualified references must name one of them.
     */
    public List<FormulaReference> validate(String formula, Collection<String> sheetNames) {
        if (formula == null || formula.isBlank()) {
            throw invalid("Formula is empty");
        }
        String text = formula.trim();
        if (!text.startsWith("=")) {
            throw invalid("Formula must start with '=': " + formula);
        }
        if (text.substring(1).isBlank()) {
            throw invalid("Formula has no expression after '='");
        }
        if (FormulaTokenizer.hasUnterminatedQuote(text)) {
            throw invalid("Formula has an unterminated quote: " + formula);
        }

        String code = blankQuotedNames(FormulaTokenizer.maskLiterals(text));
        checkParentheses(code, formula);

        Matcher unsafe = UNSAFE_FUNCTION_PATTERN.matcher(code);
        if (unsafe.find()) {
            throw invalid("Unsafe function " + unsafe.group(1).toUpperCase(Locale.ROOT) + " is not allowed");
        }

        Matcher cells = CELL_TOKEN_PATTERN.matcher(code);
        while (cells.find()) {
            int column = CellAddress.columnNumber(cells.group(1));
            String digits = cells.group(2);
            boolean rowInBounds = digits.length() <= 7 && Integer.parseInt(digits) >= 1
                    && Integer.parseInt(digits) <= CellAddress.MAX_ROWS;
            if (column >= 1 && !rowInBounds) {
                throw new SheetOperationException(ErrorKind.OUT_OF_BOUNDS,
                        "Reference " + cells.group() + " is outside the sheet limits");
            }
        }

        List<FormulaReference> refs = FormulaTokenizer.scan(text);
        for (FormulaReference ref : refs) {
            if (ref.sheetQualifier() == null || ref.isExternal()) {
                continue;
            }
            boolean known = sheetNames.stream().anyMatch(s -> s.equalsIgnoreCase(ref.sheetName()));
            if (!known) {
                throw new SheetOperationException(ErrorKind.SHEET_NOT_FOUND,
                        "Formula refers to missing sheet '" + ref.sheetName() + "'");
            }
        }
        return refs;
    }

    private static void checkParentheses(String code, String formula) {
        int depth = 0;
        for (int i = 0; i < code.length(); i++) {
            char c = code.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth < 0) {
                    throw invalid("Unbalanced parentheses in formula: " + formula);
                }
            }
        }
        if (depth != 0) {
            throw invalid("Unbalanced parentheses in formula: " + formula);
        }
    }

    private static String blankQuotedNames(String code) {
        char[] chars = code.toCharArray();
        boolean inName = false;
        for (int i = 0; i < chars.length; i++) {
            if (chars[i] == '\'') {
                inName = !inName;
                chars[i] = ' ';
            } else if (inName) {
                chars[i] = ' ';
            }
        }
        return new String(chars);
    }

    private static SheetOperationException invalid(String message) {
        return new SheetOperationException(ErrorKind.INVALID_FORMULA, message);
    }
}
