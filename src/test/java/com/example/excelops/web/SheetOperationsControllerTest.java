package com.example.excelops.web;

import com.example.excelops.service.BrokenCell;
import com.example.excelops.service.ErrorKind;
import com.example.excelops.service.OperationResult;
import com.example.excelops.service.SheetOperationException;
import com.example.excelops.service.SheetOperationsService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.NoSuchFileException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class SheetOperationsControllerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private SheetOperationsService service;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        service = mock(SheetOperationsService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new SheetOperationsController(service))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    private String json(Object body) throws Exception {
        return objectMapper.writeValueAsString(body);
    }

    @Test
    void insertRowsDefaultsCountToOne() throws Exception {
        when(service.insertRows("/data/book.xlsx", "Sheet1", 3, 1))
                .thenReturn(OperationResult.of("Inserted 1 row starting at row 3 in sheet 'Sheet1'"));

        mockMvc.perform(post("/api/sheets/rows/insert")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("filePath", "/data/book.xlsx", "sheetName", "Sheet1", "start", 3))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Inserted 1 row starting at row 3 in sheet 'Sheet1'"))
                .andExpect(jsonPath("$.brokenFormulas").isEmpty());
    }

    @Test
    void brokenFormulasAreReturned() throws Exception {
        when(service.deleteRows("/data/book.xlsx", "Sheet1", 2, 2)).thenReturn(new OperationResult("Deleted",
                List.of(new BrokenCell("Sheet1", "D1", "=#REF!", "Reference B3 deleted by the removal of 2 rows"))));

        mockMvc.perform(post("/api/sheets/rows/delete")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("filePath", "/data/book.xlsx", "sheetName", "Sheet1",
                                "start", 2, "count", 2))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.brokenFormulas[0].cell").value("D1"))
                .andExpect(jsonPath("$.brokenFormulas[0].formula").value("=#REF!"));
    }

    @Test
    void deleteRangeDefaultsToShiftingUp() throws Exception {
        when(service.deleteRange("/b.xlsx", "S", "A1", "B2", "up")).thenReturn(OperationResult.of("ok"));

        mockMvc.perform(post("/api/sheets/range/delete")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("filePath", "/b.xlsx", "sheetName", "S",
                                "startCell", "A1", "endCell", "B2"))))
                .andExpect(status().isOk());

        verify(service).deleteRange("/b.xlsx", "S", "A1", "B2", "up");
    }

    @Test
    void listMergesTakesQueryParameters() throws Exception {
        when(service.listMerges("/b.xlsx", "S")).thenReturn(List.of("A1:B2"));

        mockMvc.perform(get("/api/sheets/merges").param("filePath", "/b.xlsx").param("sheetName", "S"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0]").value("A1:B2"));
    }

    @Test
    void userErrorsMapToClientStatuses() throws Exception {
        when(service.mergeCells("/b.xlsx", "S", "B2", "C3"))
                .thenThrow(new SheetOperationException(ErrorKind.OVERLAP, "Range B2:C3 overlaps merged region A1:B2"));
        when(service.mergeCells("/b.xlsx", "Missing", "D4", "E5"))
                .thenThrow(new SheetOperationException(ErrorKind.SHEET_NOT_FOUND, "Sheet 'Missing' not found"));
        when(service.mergeCells("/b.xlsx", "S", "A1", "A1"))
                .thenThrow(new SheetOperationException(ErrorKind.DEGENERATE_RANGE, "Cannot merge a single cell: A1"));

        mockMvc.perform(post("/api/sheets/merges")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("filePath", "/b.xlsx", "sheetName", "S", "startCell", "B2", "endCell", "C3"))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.kind").value("OVERLAP"));

        mockMvc.perform(post("/api/sheets/merges")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("filePath", "/b.xlsx", "sheetName", "Missing", "startCell", "D4", "endCell", "E5"))))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.kind").value("SHEET_NOT_FOUND"));

        mockMvc.perform(post("/api/sheets/merges")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("filePath", "/b.xlsx", "sheetName", "S", "startCell", "A1", "endCell", "A1"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Cannot merge a single cell: A1"));
    }

    @Test
    void environmentFailuresAreServerErrors() throws Exception {
        when(service.listMerges("/b.xlsx", "S"))
                .thenThrow(new UncheckedIOException("Failed to read workbook /b.xlsx", new IOException("disk")));

        mockMvc.perform(get("/api/sheets/merges").param("filePath", "/b.xlsx").param("sheetName", "S"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.kind").value("ENVIRONMENT"));
    }

    @Test
    void missingWorkbookIsAServerError() throws Exception {
        when(service.insertRows("/gone.xlsx", "S", 1, 1)).thenThrow(new UncheckedIOException(
                "Workbook not found: /gone.xlsx", new NoSuchFileException("/gone.xlsx")));

        mockMvc.perform(post("/api/sheets/rows/insert")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("filePath", "/gone.xlsx", "sheetName", "S", "start", 1))))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.kind").value("ENVIRONMENT"))
                .andExpect(jsonPath("$.message").value("Workbook not found: /gone.xlsx"));
    }

    @Test
    void existingWorksheetIsAConflict() throws Exception {
        when(service.createWorksheet("/b.xlsx", "Data"))
                .thenThrow(new SheetOperationException(ErrorKind.ALREADY_EXISTS, "Sheet 'Data' already exists"));

        mockMvc.perform(post("/api/sheets/worksheets")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("filePath", "/b.xlsx", "sheetName", "Data"))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.kind").value("ALREADY_EXISTS"));
    }

    @Test
    void worksheetAndTableRequestsReachTheService() throws Exception {
        when(service.renameWorksheet("/b.xlsx", "Old", "New")).thenReturn(OperationResult.of("renamed"));
        when(service.deleteWorksheet("/b.xlsx", "Old")).thenReturn(new OperationResult("deleted",
                List.of(new BrokenCell("Summary", "A1", "=#REF!*2", "Reference Old!B5 points into the deleted sheet 'Old'"))));
        when(service.createTable("/b.xlsx", "S", "A1", "C9", "Sales", null)).thenReturn(OperationResult.of("table"));

        mockMvc.perform(post("/api/sheets/worksheets/rename")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("filePath", "/b.xlsx", "oldName", "Old", "newName", "New"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("renamed"));

        mockMvc.perform(post("/api/sheets/worksheets/delete")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("filePath", "/b.xlsx", "sheetName", "Old"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.brokenFormulas[0].sheetName").value("Summary"));

        mockMvc.perform(post("/api/sheets/tables")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("filePath", "/b.xlsx", "sheetName", "S", "startCell", "A1",
                                "endCell", "C9", "tableName", "Sales"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("table"));
    }

    @Test
    void everyErrorKindHasAStatus() {
        assertEquals(HttpStatus.NOT_FOUND, ApiExceptionHandler.statusFor(ErrorKind.NOT_FOUND));
        assertEquals(HttpStatus.NOT_FOUND, ApiExceptionHandler.statusFor(ErrorKind.SHEET_NOT_FOUND));
        assertEquals(HttpStatus.CONFLICT, ApiExceptionHandler.statusFor(ErrorKind.ALREADY_EXISTS));
        assertEquals(HttpStatus.CONFLICT, ApiExceptionHandler.statusFor(ErrorKind.OVERLAP));
        assertEquals(HttpStatus.BAD_REQUEST, ApiExceptionHandler.statusFor(ErrorKind.INVALID_FORMULA));
        assertEquals(HttpStatus.BAD_REQUEST, ApiExceptionHandler.statusFor(ErrorKind.OUT_OF_BOUNDS));
    }

    @Test
    void unreadableBodiesAreBadRequests() throws Exception {
        mockMvc.perform(post("/api/sheets/rows/insert")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("INVALID_ARGUMENT"));
    }
}
