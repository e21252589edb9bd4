package com.interpolar.medicationreview.service;

import com.interpolar.medicationreview.model.RawTable;
import com.interpolar.medicationreview.model.Triple;
import com.interpolar.medicationreview.util.CellNormalizer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the row conversion engine over every row of a rater's table
 *
 * Cells are normalized first. Row numbers are the 1-based positions in the
 * table; fully blank rows are skipped but keep their position.
 */
@Slf4j
public class TableConversionDriver {

    private final RowConversionEngine engine;

    public TableConversionDriver(RowConversionEngine engine) {
        this.engine = engine;
    }

    public List<Triple> convertTable(RawTable table) {
        RawTable normalized = CellNormalizer.normalizeTable(table);
        String raterLabel = normalized.getRaterLabel();
        List<Triple> output = new ArrayList<>();

        int rowNumber = 0;
        int skipped = 0;
        for (List<String> row : normalized.getRows()) {
            rowNumber++;
            if (CellNormalizer.isBlankRow(row)) {
                skipped++;
                continue;
            }
            List<Triple> rowTriples = engine.convertRow(row, rowNumber, raterLabel);
            log.debug("[TableConversion] -> {} row {}: {} triples", raterLabel, rowNumber, rowTriples.size());
            output.addAll(rowTriples);
        }

        log.info("[TableConversion] -> rater {} converted, rows={}, blank={}, triples={}",
                raterLabel, rowNumber, skipped, output.size());
        return output;
    }

    /**
     * Converts the table and appends its triples to the run result
     */
    public List<Triple> convertInto(RawTable table, ConversionResult result) {
        List<Triple> triples = convertTable(table);
        result.addRaterTriples(table.getRaterLabel(), triples);
        return triples;
    }
}
