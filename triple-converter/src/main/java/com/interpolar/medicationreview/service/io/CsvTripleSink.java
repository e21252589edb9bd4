package com.interpolar.medicationreview.service.io;

import com.interpolar.medicationreview.constants.TripleConstants;
import com.interpolar.medicationreview.model.Triple;
import com.interpolar.medicationreview.service.ConversionResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes &lt;rater&gt;.csv, Total.csv and Nodes.csv for graph database bulk import
 */
@Slf4j
public class CsvTripleSink implements TripleSink {

    private static final CSVFormat TRIPLE_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader(TripleConstants.Output.TRIPLE_COLUMNS.toArray(new String[0]))
            .setQuote('"')
            .build();

    private static final CSVFormat NODE_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader(TripleConstants.Output.NODES_HEADER)
            .setQuote('"')
            .build();

    private final Path outputDir;

    public CsvTripleSink(Path outputDir) {
        this.outputDir = outputDir;
    }

    @Override
    public String getName() {
        return "csv";
    }

    @Override
    public boolean isEnabled() {
        return outputDir != null;
    }

    @Override
    public void write(ConversionResult result) throws IOException {
        Files.createDirectories(outputDir);
        for (String rater : result.getRaterLabels()) {
            writeTriples(outputDir.resolve(rater + ".csv"), result.getTriples(rater));
        }
        writeTriples(outputDir.resolve(TripleConstants.Output.TOTAL_SHEET + ".csv"), result.getTotal());
        writeNodes(outputDir.resolve(TripleConstants.Output.NODES_SHEET + ".csv"), result.getNodes());
        log.info("[CsvSink] -> wrote {} rater files to {}", result.getRaterLabels().size(), outputDir);
    }

    static void writeTriples(Path file, List<Triple> triples) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, TRIPLE_FORMAT)) {
            for (Triple t : triples) {
                printer.printRecord(t.getSource(), t.getEdge(), t.getTarget(),
                        t.getRowNumber(), t.getSequenceNumber(), t.getRaterLabel());
            }
        }
    }

    static void writeNodes(Path file, List<String> nodes) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, NODE_FORMAT)) {
            for (String node : nodes) {
                printer.printRecord(node);
            }
        }
    }
}
