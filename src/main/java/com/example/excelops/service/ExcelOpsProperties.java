package com.example.excelops.service;

/**
 * Settings threaded into the service and engine at construction time.
 *
 * @param filesPath               base directory for relative file paths; blank means callers must
 *                                pass absolute paths
 * @param shiftAbsoluteReferences whether {@code $}-anchored axes move when rows or columns are
 *                                inserted or deleted before them
 * @param readPreviewLimit        maximum number of cells returned by a preview read
 */
public record ExcelOpsProperties(String filesPath, boolean shiftAbsoluteReferences, int readPreviewLimit) {
}
