package com.example.excelops.web;

import com.example.excelops.service.FormulaCheck;
import com.example.excelops.service.OperationResult;
import com.example.excelops.service.RangeCheck;
import com.example.excelops.service.RangeFormat;
import com.example.excelops.service.RangeReadout;
import com.example.excelops.service.SheetOperationsService;
import com.example.excelops.service.ValidationListing;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/sheets")
@RequiredArgsConstructor
public class SheetOperationsController {

    private final SheetOperationsService sheetOperationsService;

    public record FormulaRequest(String filePath, String sheetName, String cell, String formula) {
    }

    public record RangeRequest(String filePath, String sheetName, String startCell, String endCell) {
    }

    public record CopyRequest(String filePath, String sheetName, String sourceStart, String sourceEnd,
                              String targetStart, String targetSheet) {
    }

    public record DeleteRangeRequest(String filePath, String sheetName, String startCell, String endCell,
                                     String shiftDirection) {
    }

    public record LinesRequest(String filePath, String sheetName, int start, Integer count) {

        int countOrDefault() {
            return count == null ? 1 : count;
        }
    }

    public record ReadRequest(String filePath, String sheetName, String startCell, String endCell,
                              boolean previewOnly) {
    }

    public record WriteRequest(String filePath, String sheetName, String startCell, List<List<Object>> data) {
    }

    public record FormatRequest(String filePath, String sheetName, String startCell, String endCell,
                                RangeFormat format) {
    }

    public record WorkbookRequest(String filePath) {
    }

    public record SheetRequest(String filePath, String sheetName) {
    }

    public record SheetCopyRequest(String filePath, String sourceSheet, String targetSheet) {
    }

    public record SheetRenameRequest(String filePath, String oldName, String newName) {
    }

    public record TableRequest(String filePath, String sheetName, String startCell, String endCell,
                               String tableName, String tableStyle) {
    }

    @PostMapping("/workbooks")
    public OperationResult createWorkbook(@RequestBody WorkbookRequest request) {
        return sheetOperationsService.createWorkbook(request.filePath());
    }

    @PostMapping("/worksheets")
    public OperationResult createWorksheet(@RequestBody SheetRequest request) {
        return sheetOperationsService.createWorksheet(request.filePath(), request.sheetName());
    }

    @PostMapping("/worksheets/copy")
    public OperationResult copyWorksheet(@RequestBody SheetCopyRequest request) {
        return sheetOperationsService.copyWorksheet(request.filePath(), request.sourceSheet(), request.targetSheet());
    }

    @PostMapping("/worksheets/rename")
    public OperationResult renameWorksheet(@RequestBody SheetRenameRequest request) {
        return sheetOperationsService.renameWorksheet(request.filePath(), request.oldName(), request.newName());
    }

    @PostMapping("/worksheets/delete")
    public OperationResult deleteWorksheet(@RequestBody SheetRequest request) {
        return sheetOperationsService.deleteWorksheet(request.filePath(), request.sheetName());
    }

    @PostMapping("/tables")
    public OperationResult createTable(@RequestBody TableRequest request) {
        return sheetOperationsService.createTable(request.filePath(), request.sheetName(), request.startCell(),
                request.endCell(), request.tableName(), request.tableStyle());
    }

    @PostMapping("/formula/apply")
    public OperationResult applyFormula(@RequestBody FormulaRequest request) {
        return sheetOperationsService.applyFormula(request.filePath(), request.sheetName(), request.cell(),
                request.formula());
    }

    @PostMapping("/formula/validate")
    public FormulaCheck validateFormula(@RequestBody FormulaRequest request) {
        return sheetOperationsService.validateFormula(request.filePath(), request.sheetName(), request.cell(),
                request.formula());
    }

    @PostMapping("/range/copy")
    public OperationResult copyRange(@RequestBody CopyRequest request) {
        return sheetOperationsService.copyRange(request.filePath(), request.sheetName(), request.sourceStart(),
                request.sourceEnd(), request.targetStart(), request.targetSheet());
    }

    @PostMapping("/range/delete")
    public OperationResult deleteRange(@RequestBody DeleteRangeRequest request) {
        String direction = request.shiftDirection() == null ? "up" : request.shiftDirection();
        return sheetOperationsService.deleteRange(request.filePath(), request.sheetName(), request.startCell(),
                request.endCell(), direction);
    }

    @PostMapping("/range/validate")
    public RangeCheck validateRange(@RequestBody RangeRequest request) {
        return sheetOperationsService.validateRange(request.filePath(), request.sheetName(), request.startCell(),
                request.endCell());
    }

    @PostMapping("/range/format")
    public OperationResult formatRange(@RequestBody FormatRequest request) {
        return sheetOperationsService.formatRange(request.filePath(), request.sheetName(), request.startCell(),
                request.endCell(), request.format());
    }

    @PostMapping("/rows/insert")
    public OperationResult insertRows(@RequestBody LinesRequest request) {
        return sheetOperationsService.insertRows(request.filePath(), request.sheetName(), request.start(),
                request.countOrDefault());
    }

    @PostMapping("/rows/delete")
    public OperationResult deleteRows(@RequestBody LinesRequest request) {
        return sheetOperationsService.deleteRows(request.filePath(), request.sheetName(), request.start(),
                request.countOrDefault());
    }

    @PostMapping("/columns/insert")
    public OperationResult insertColumns(@RequestBody LinesRequest request) {
        return sheetOperationsService.insertColumns(request.filePath(), request.sheetName(), request.start(),
                request.countOrDefault());
    }

    @PostMapping("/columns/delete")
    public OperationResult deleteColumns(@RequestBody LinesRequest request) {
        return sheetOperationsService.deleteColumns(request.filePath(), request.sheetName(), request.start(),
                request.countOrDefault());
    }

    @PostMapping("/merges")
    public OperationResult mergeCells(@RequestBody RangeRequest request) {
        return sheetOperationsService.mergeCells(request.filePath(), request.sheetName(), request.startCell(),
                request.endCell());
    }

    @PostMapping("/merges/remove")
    public OperationResult unmergeCells(@RequestBody RangeRequest request) {
        return sheetOperationsService.unmergeCells(request.filePath(), request.sheetName(), request.startCell(),
                request.endCell());
    }

    @GetMapping("/merges")
    public List<String> listMerges(@RequestParam("filePath") String filePath,
                                   @RequestParam("sheetName") String sheetName) {
        return sheetOperationsService.listMerges(filePath, sheetName);
    }

    @GetMapping("/validations")
    public ValidationListing listValidations(@RequestParam("filePath") String filePath,
                                             @RequestParam("sheetName") String sheetName) {
        return sheetOperationsService.listValidations(filePath, sheetName);
    }

    @PostMapping("/data/read")
    public RangeReadout readData(@RequestBody ReadRequest request) {
        return sheetOperationsService.readData(request.filePath(), request.sheetName(), request.startCell(),
                request.endCell(), request.previewOnly());
    }

    @PostMapping("/data/write")
    public OperationResult writeData(@RequestBody WriteRequest request) {
        return sheetOperationsService.writeData(request.filePath(), request.sheetName(), request.data(),
                request.startCell());
    }
}
