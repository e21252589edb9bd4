package com.interpolar.medicationreview.service.io;

import com.interpolar.medicationreview.model.RawTable;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads one adjacency list per CSV file, file base name = rater label
 */
@Slf4j
public class CsvTableSource implements TableSource {

    private static final String CSV_EXTENSION = ".csv";

    private final List<Path> files;
    private final boolean headerRow;

    public CsvTableSource(List<Path> files, boolean headerRow) {
        this.files = files;
        this.headerRow = headerRow;
    }

    /**
     * All *.csv files of a directory, sorted by name
     */
    public static CsvTableSource fromDirectory(Path directory, boolean headerRow) throws IOException {
        try (Stream<Path> stream = Files.list(directory)) {
            List<Path> files = stream
                    .filter(p -> p.getFileName().toString().toLowerCase().endsWith(CSV_EXTENSION))
                    .sorted()
                    .collect(Collectors.toList());
            return new CsvTableSource(files, headerRow);
        }
    }

    @Override
    public List<RawTable> readTables() throws IOException {
        List<RawTable> tables = new ArrayList<>();
        for (Path file : files) {
            RawTable table = new RawTable(raterLabelOf(file), readRows(file, headerRow));
            log.info("[CsvSource] -> file [{}] read, rows={}", file.getFileName(), table.getRowCount());
            tables.add(table);
        }
        return tables;
    }

    static List<List<String>> readRows(Path file, boolean skipHeader) throws IOException {
        List<List<String>> rows = new ArrayList<>();
        try (CSVParser parser = CSVParser.parse(file, StandardCharsets.UTF_8, CSVFormat.DEFAULT)) {
            boolean first = true;
            for (CSVRecord record : parser) {
                if (first && skipHeader) {
                    first = false;
                    continue;
                }
                first = false;
                List<String> cells = new ArrayList<>();
                for (int i = 0; i < record.size(); i++) {
                    cells.add(record.get(i));
                }
                rows.add(cells);
            }
        }
        return rows;
    }

    static String raterLabelOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
