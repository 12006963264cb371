package com.example.excelops.service.engine;

import com.example.excelops.service.SheetOperationException;
import com.example.excelops.service.formula.FormulaReferenceRewriter;
import com.example.excelops.service.formula.FormulaRewrite;
import com.example.excelops.service.grid.CellContent;
import com.example.excelops.service.grid.SheetGrid;
import com.example.excelops.service.reference.CellAddress;
import com.example.excelops.service.reference.CellRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Duplicates the values and formulas of a range at another position, translating relative
 * formula references by the copy offset. Merged regions and validation rules are not copied
 * and are left as they are at the destination.
 */
public class CopyRangeEngine {

    private static final Logger log = LoggerFactory.getLogger(CopyRangeEngine.class);

    private final FormulaReferenceRewriter rewriter;

    public CopyRangeEngine(FormulaReferenceRewriter rewriter) {
        this.rewriter = rewriter;
    }

    /**
     * Copies {@code source} from {@code sourceGrid} so that its top-left cell lands on
     * {@code target} in {@code targetGrid}. Both grids may be the same object; the source is
     * read completely before anything is written. Destination cells whose source is empty are
     * cleared.
     */
    public CopyReport copy(SheetGrid sourceGrid, CellRange source, SheetGrid targetGrid, CellAddress target) {
        int columnDelta = target.column() - source.firstColumn();
        int rowDelta = target.row() - source.firstRow();
        if ((long) target.column() + source.width() - 1 > CellAddress.MAX_COLUMNS
                || (long) target.row() + source.height() - 1 > CellAddress.MAX_ROWS) {
            throw SheetOperationException.outOfBounds("Copying " + source.encode() + " to " + target.encode()
                    + " would run past the sheet limits");
        }

        CellRange destination = CellRange.of(target, target.shift(source.width() - 1, source.height() - 1));

        Map<CellAddress, CellContent> buffer = new LinkedHashMap<>();
        for (Map.Entry<CellAddress, CellContent> entry : sourceGrid.cells().entrySet()) {
            if (source.contains(entry.getKey())) {
                buffer.put(entry.getKey(), entry.getValue());
            }
        }

        Map<CellAddress, CellContent> staged = new LinkedHashMap<>();
        List<BrokenFormula> broken = new ArrayList<>();
        int translated = 0;
        for (Map.Entry<CellAddress, CellContent> entry : buffer.entrySet()) {
            CellAddress to = entry.getKey().shift(columnDelta, rowDelta);
            CellContent content = entry.getValue();
            if (content.isFormula()) {
                FormulaRewrite result = rewriter.translate(content.formula(), targetGrid.sheetName(), columnDelta, rowDelta);
                if (result.changed()) {
                    translated++;
                }
                if (result.isBroken()) {
                    broken.add(new BrokenFormula(targetGrid.sheetName(), to, "=" + result.formula(), result.broken()));
                }
                content = content.withFormula(result.formula());
            }
            staged.put(to, content);
        }

        List<CellAddress> cleared = new ArrayList<>();
        for (CellAddress address : targetGrid.cells().keySet()) {
            if (destination.contains(address)) {
                cleared.add(address);
            }
        }
        cleared.forEach(targetGrid::remove);
        staged.forEach(targetGrid::put);
        log.debug("Copied {} from '{}' to {} on '{}' ({} formulas translated)",
                source.encode(), sourceGrid.sheetName(), target.encode(), targetGrid.sheetName(), translated);
        return new CopyReport(staged.size(), translated, broken);
    }
}
