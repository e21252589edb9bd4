package com.interpolar.medicationreview.service.io;

import com.interpolar.medicationreview.model.RawTable;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads rater sheets of an .xlsx/.xls workbook
 *
 * Sheet title = rater label. With explicit sheet titles only those are read,
 * in the given order; otherwise every sheet from firstSheetIndex on.
 * Cell values are rendered as displayed (DataFormatter), formulas evaluated.
 */
@Slf4j
public class WorkbookTableSource implements TableSource {

    private final Path workbookPath;
    private final List<String> sheetTitles;
    private final int firstSheetIndex;
    private final boolean headerRow;

    public WorkbookTableSource(Path workbookPath, List<String> sheetTitles, int firstSheetIndex, boolean headerRow) {
        this.workbookPath = workbookPath;
        this.sheetTitles = sheetTitles != null ? sheetTitles : new ArrayList<>();
        this.firstSheetIndex = firstSheetIndex;
        this.headerRow = headerRow;
    }

    @Override
    public List<RawTable> readTables() throws IOException {
        if (workbookPath == null) {
            throw new IOException("input workbook is not configured");
        }
        if (!Files.exists(workbookPath)) {
            throw new IOException("input workbook not found: " + workbookPath);
        }

        List<RawTable> tables = new ArrayList<>();
        try (InputStream in = Files.newInputStream(workbookPath);
             Workbook workbook = WorkbookFactory.create(in)) {
            DataFormatter formatter = new DataFormatter();
            FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();

            for (Sheet sheet : selectSheets(workbook)) {
                RawTable table = new RawTable(sheet.getSheetName(), readRows(sheet, formatter, evaluator, headerRow));
                log.info("[WorkbookSource] -> sheet [{}] read, rows={}", table.getRaterLabel(), table.getRowCount());
                tables.add(table);
            }
        }
        return tables;
    }

    private List<Sheet> selectSheets(Workbook workbook) {
        List<Sheet> sheets = new ArrayList<>();
        if (!sheetTitles.isEmpty()) {
            for (String title : sheetTitles) {
                Sheet sheet = workbook.getSheet(title);
                if (sheet == null) {
                    log.warn("[WorkbookSource] -> sheet [{}] not found in {}, skipped", title, workbookPath);
                    continue;
                }
                sheets.add(sheet);
            }
            return sheets;
        }
        for (int i = Math.max(firstSheetIndex, 0); i < workbook.getNumberOfSheets(); i++) {
            sheets.add(workbook.getSheetAt(i));
        }
        return sheets;
    }

    static List<List<String>> readRows(Sheet sheet, DataFormatter formatter, FormulaEvaluator evaluator,
                                       boolean skipHeader) {
        List<List<String>> rows = new ArrayList<>();
        int firstRow = skipHeader ? 1 : 0;
        for (int r = firstRow; r <= sheet.getLastRowNum(); r++) {
            Row row = sheet.getRow(r);
            List<String> cells = new ArrayList<>();
            if (row != null) {
                for (int c = 0; c < row.getLastCellNum(); c++) {
                    Cell cell = row.getCell(c, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
                    cells.add(cell == null ? "" : formatter.formatCellValue(cell, evaluator));
                }
            }
            rows.add(cells);
        }
        return rows;
    }
}
