package com.example.excelops.service;

import java.util.List;

public record RangeReadout(String sheetName, String range, List<CellReadout> cells, boolean truncated,
                           String message) {
}
