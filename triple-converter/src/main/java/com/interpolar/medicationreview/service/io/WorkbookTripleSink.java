package com.interpolar.medicationreview.service.io;

import com.interpolar.medicationreview.constants.TripleConstants;
import com.interpolar.medicationreview.model.OutcomeComparisonRow;
import com.interpolar.medicationreview.model.Triple;
import com.interpolar.medicationreview.service.ConversionResult;
import com.interpolar.medicationreview.service.OutcomeComparator;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.ss.util.WorkbookUtil;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes the triple tables into an .xlsx workbook
 *
 * Sheets: one per rater, Total, Nodes and Outcome_Comparison. An existing
 * workbook is updated in place, sheets with the same title are replaced.
 * Rater labels that clash as sheet titles are suffixed, never overwritten.
 */
@Slf4j
public class WorkbookTripleSink implements TripleSink {

    private static final int MAX_SHEET_TITLE_LENGTH = 31;

    private final Path workbookPath;

    public WorkbookTripleSink(Path workbookPath) {
        this.workbookPath = workbookPath;
    }

    @Override
    public String getName() {
        return "workbook";
    }

    @Override
    public boolean isEnabled() {
        return workbookPath != null;
    }

    @Override
    public void write(ConversionResult result) throws IOException {
        try (Workbook workbook = openOrCreate()) {
            Map<String, String> titles = assignSheetTitles(result.getRaterLabels());
            for (Map.Entry<String, String> entry : titles.entrySet()) {
                writeTriples(replaceSheet(workbook, entry.getValue()), result.getTriples(entry.getKey()));
            }
            writeTriples(replaceSheet(workbook, TripleConstants.Output.TOTAL_SHEET), result.getTotal());
            writeNodes(replaceSheet(workbook, TripleConstants.Output.NODES_SHEET), result.getNodes());

            List<OutcomeComparisonRow> outcomes = OutcomeComparator.compare(result.getTotal(), result.getRaterLabels());
            writeOutcomes(replaceSheet(workbook, TripleConstants.Output.OUTCOME_SHEET), outcomes, result.getRaterLabels());

            Path parent = workbookPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(workbookPath)) {
                workbook.write(out);
            }
        }
        log.info("[WorkbookSink] -> wrote {} rater sheets, {} total triples, {} nodes to {}",
                result.getRaterLabels().size(), result.getTotal().size(), result.getNodes().size(), workbookPath);
    }

    private Workbook openOrCreate() throws IOException {
        if (Files.exists(workbookPath)) {
            // loaded fully into memory so the same file can be rewritten
            try (InputStream in = Files.newInputStream(workbookPath)) {
                return WorkbookFactory.create(in);
            }
        }
        return new XSSFWorkbook();
    }

    /**
     * Rater label -> sheet title, unique among raters and the summary sheets
     *
     * Excel titles are at most 31 characters and compared case-insensitively,
     * so distinct labels may collide; those get a numeric suffix.
     */
    static Map<String, String> assignSheetTitles(List<String> raterLabels) {
        Set<String> used = new HashSet<>();
        used.add(TripleConstants.Output.TOTAL_SHEET.toLowerCase());
        used.add(TripleConstants.Output.NODES_SHEET.toLowerCase());
        used.add(TripleConstants.Output.OUTCOME_SHEET.toLowerCase());

        Map<String, String> titles = new LinkedHashMap<>();
        for (String rater : raterLabels) {
            String title = WorkbookUtil.createSafeSheetName(rater);
            if (used.contains(title.toLowerCase())) {
                String base = title;
                int n = 2;
                do {
                    String suffix = "_" + n++;
                    int keep = Math.min(base.length(), MAX_SHEET_TITLE_LENGTH - suffix.length());
                    title = base.substring(0, keep) + suffix;
                } while (used.contains(title.toLowerCase()));
                log.warn("[WorkbookSink] -> sheet title for rater [{}] already taken, written to sheet [{}]",
                        rater, title);
            }
            used.add(title.toLowerCase());
            titles.put(rater, title);
        }
        return titles;
    }

    static Sheet replaceSheet(Workbook workbook, String title) {
        String safeTitle = WorkbookUtil.createSafeSheetName(title);
        int index = workbook.getSheetIndex(safeTitle);
        if (index >= 0) {
            workbook.removeSheetAt(index);
        }
        return workbook.createSheet(safeTitle);
    }

    private static void writeTriples(Sheet sheet, List<Triple> triples) {
        writeRow(sheet, 0, TripleConstants.Output.TRIPLE_COLUMNS);
        int r = 1;
        for (Triple triple : triples) {
            Row row = sheet.createRow(r++);
            row.createCell(0).setCellValue(triple.getSource());
            row.createCell(1).setCellValue(triple.getEdge());
            row.createCell(2).setCellValue(triple.getTarget());
            row.createCell(3).setCellValue(triple.getRowNumber());
            row.createCell(4).setCellValue(triple.getSequenceNumber());
            row.createCell(5).setCellValue(triple.getRaterLabel());
        }
    }

    private static void writeNodes(Sheet sheet, List<String> nodes) {
        writeRow(sheet, 0, List.of(TripleConstants.Output.NODES_HEADER));
        int r = 1;
        for (String node : nodes) {
            sheet.createRow(r++).createCell(0).setCellValue(node);
        }
    }

    private static void writeOutcomes(Sheet sheet, List<OutcomeComparisonRow> outcomes, List<String> raters) {
        List<String> header = new ArrayList<>();
        header.add(TripleConstants.Output.SOURCE_NODE);
        header.add(TripleConstants.Output.RELATIONSHIP);
        header.add(TripleConstants.Output.TARGET_NODE);
        header.addAll(raters);
        header.add(TripleConstants.Output.COUNT);
        writeRow(sheet, 0, header);

        int r = 1;
        for (OutcomeComparisonRow outcome : outcomes) {
            Row row = sheet.createRow(r++);
            int c = 0;
            row.createCell(c++).setCellValue(outcome.getSource());
            row.createCell(c++).setCellValue(outcome.getEdge());
            row.createCell(c++).setCellValue(outcome.getTarget());
            for (String rater : raters) {
                row.createCell(c++).setCellValue(outcome.getRows(rater).toString());
            }
            row.createCell(c).setCellValue(outcome.getCount());
        }
    }

    private static void writeRow(Sheet sheet, int index, List<String> values) {
        Row row = sheet.createRow(index);
        for (int c = 0; c < values.size(); c++) {
            row.createCell(c).setCellValue(values.get(c));
        }
    }
}
