package com.interpolar.medicationreview.service.io;

import com.interpolar.medicationreview.constants.TripleConstants;
import com.interpolar.medicationreview.service.NodeReferenceTable;
import com.interpolar.medicationreview.util.CellNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Loads the EPA node reference table from .csv or .xlsx/.xls
 *
 * Columns are located by header name. Names go through the cell normalizer
 * so they compare equal to normalized targets.
 */
@Slf4j
public final class NodeReferenceLoader {

    private NodeReferenceLoader() {
    }

    public static NodeReferenceTable load(Path path, String nameColumn, String flagColumn) throws IOException {
        if (path == null || !Files.exists(path)) {
            throw new IOException("node reference table not found: " + path);
        }
        String fileName = path.getFileName().toString().toLowerCase();
        NodeReferenceTable table = fileName.endsWith(".csv")
                ? loadCsv(path, nameColumn, flagColumn)
                : loadWorkbook(path, nameColumn, flagColumn);
        log.info("[NodeReference] -> loaded {} nodes from {}", table.size(), path);
        return table;
    }

    static NodeReferenceTable loadCsv(Path path, String nameColumn, String flagColumn) throws IOException {
        NodeReferenceTable.Builder builder = NodeReferenceTable.builder();
        try (CSVParser parser = CSVParser.parse(path, StandardCharsets.UTF_8, CSVFormat.DEFAULT)) {
            int nameIndex = -1;
            int flagIndex = -1;
            boolean header = true;
            for (CSVRecord record : parser) {
                if (header) {
                    nameIndex = indexOf(record, nameColumn);
                    flagIndex = indexOf(record, flagColumn);
                    requireColumn(nameIndex, nameColumn, path);
                    requireColumn(flagIndex, flagColumn, path);
                    header = false;
                    continue;
                }
                String name = nameIndex < record.size() ? record.get(nameIndex) : "";
                String flag = flagIndex < record.size() ? record.get(flagIndex) : "";
                addEntry(builder, name, flag);
            }
        }
        return builder.build();
    }

    static NodeReferenceTable loadWorkbook(Path path, String nameColumn, String flagColumn) throws IOException {
        NodeReferenceTable.Builder builder = NodeReferenceTable.builder();
        try (InputStream in = Files.newInputStream(path);
             Workbook workbook = WorkbookFactory.create(in)) {
            Sheet sheet = workbook.getSheet(TripleConstants.Output.NODES_SHEET);
            if (sheet == null) {
                sheet = workbook.getSheetAt(0);
            }
            DataFormatter formatter = new DataFormatter();
            FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();
            List<List<String>> rows = WorkbookTableSource.readRows(sheet, formatter, evaluator, false);
            if (rows.isEmpty()) {
                return builder.build();
            }
            List<String> headerRow = rows.get(0);
            int nameIndex = headerRow.indexOf(nameColumn);
            int flagIndex = headerRow.indexOf(flagColumn);
            requireColumn(nameIndex, nameColumn, path);
            requireColumn(flagIndex, flagColumn, path);
            for (List<String> row : rows.subList(1, rows.size())) {
                String name = nameIndex < row.size() ? row.get(nameIndex) : "";
                String flag = flagIndex < row.size() ? row.get(flagIndex) : "";
                addEntry(builder, name, flag);
            }
        }
        return builder.build();
    }

    private static void addEntry(NodeReferenceTable.Builder builder, String name, String flag) {
        String normalized = CellNormalizer.normalize(name);
        if (normalized.isEmpty()) {
            return;
        }
        builder.add(normalized, flag == null ? "" : flag.trim());
    }

    private static int indexOf(CSVRecord header, String column) {
        for (int i = 0; i < header.size(); i++) {
            if (column.equals(header.get(i).trim())) {
                return i;
            }
        }
        return -1;
    }

    private static void requireColumn(int index, String column, Path path) throws IOException {
        if (index < 0) {
            throw new IOException("column [" + column + "] missing in node reference table " + path);
        }
    }
}
