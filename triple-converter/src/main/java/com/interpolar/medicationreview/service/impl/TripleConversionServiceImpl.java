package com.interpolar.medicationreview.service.impl;

import com.interpolar.medicationreview.config.TripleConverterConfig;
import com.interpolar.medicationreview.model.OutcomeComparisonRow;
import com.interpolar.medicationreview.model.PipelineRunSummary;
import com.interpolar.medicationreview.model.RawTable;
import com.interpolar.medicationreview.service.*;
import com.interpolar.medicationreview.service.io.TableSource;
import com.interpolar.medicationreview.service.io.TripleSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;

/**
 * Triple conversion service
 * Converts rater tables, collects nodes and drives the configured sinks.
 */
@Slf4j
@Service
public class TripleConversionServiceImpl {

    @Autowired
    private TripleConverterConfig config;

    @Autowired
    private NodeReferenceTable nodeReferenceTable;

    @Autowired
    private TableSource tableSource;

    @Autowired
    private List<TripleSink> tripleSinks;

    /**
     * Converts every rater table with one engine
     * A failing table is logged and recorded, the remaining tables are still converted.
     *
     * @param tables rater tables in output order
     * @param mode engine preset, null for the configured one
     * @return per-rater triples, aggregate and node list
     */
    public ConversionResult convert(List<RawTable> tables, ConversionMode mode) {
        ConversionMode effectiveMode = resolveMode(mode);
        ConversionResult result = new ConversionResult(effectiveMode);

        if (tables == null || tables.isEmpty()) {
            log.error("[TripleConversion] -> no rater tables to convert");
            return result;
        }

        log.info("[TripleConversion] -> converting {} rater tables, mode={}", tables.size(), effectiveMode);
        long startTime = System.currentTimeMillis();

        RowConversionEngine engine = new RowConversionEngine(effectiveMode, nodeReferenceTable);
        TableConversionDriver driver = new TableConversionDriver(engine);

        int successCount = 0;
        int failureCount = 0;
        for (RawTable table : tables) {
            String raterLabel = table != null ? table.getRaterLabel() : null;
            if (raterLabel == null || raterLabel.trim().isEmpty()) {
                log.warn("[TripleConversion] -> table without rater label, skipped");
                result.addFailedRater(String.valueOf(raterLabel));
                failureCount++;
                continue;
            }
            try {
                driver.convertInto(table, result);
                successCount++;
            } catch (Exception e) {
                log.error("[TripleConversion] -> rater [{}] failed: {}", raterLabel, e.getMessage(), e);
                result.addFailedRater(raterLabel);
                failureCount++;
            }
        }

        result.setNodes(NodeCollector.collect(result.getTriplesByRater().values()));

        log.info("[TripleConversion] -> done in {}ms, success={}, failed={}, triples={}, nodes={}",
                System.currentTimeMillis() - startTime, successCount, failureCount,
                result.getTotal().size(), result.getNodes().size());
        return result;
    }

    /**
     * Cross-rater comparison of outcome triples
     */
    public List<OutcomeComparisonRow> compareOutcomes(ConversionResult result) {
        return OutcomeComparator.compare(result.getTotal(), result.getRaterLabels());
    }

    /**
     * RDF/XML of all tables, plain conversion
     */
    public String exportRdf(List<RawTable> tables) {
        return new RdfExporter(config.getRdfUriPrefix()).toRdfXml(tables);
    }

    /**
     * Reads the configured workbook, converts it and writes every enabled sink
     */
    public PipelineRunSummary runPipeline() throws IOException {
        long startTime = System.currentTimeMillis();
        PipelineRunSummary summary = new PipelineRunSummary();

        List<RawTable> tables = tableSource.readTables();
        ConversionResult result = convert(tables, config.getMode());

        summary.setMode(result.getMode().name());
        summary.setRaters(result.getRaterLabels());
        summary.setFailedRaters(result.getFailedRaters());
        summary.setTripleCount(result.getTotal().size());
        summary.setNodeCount(result.getNodes().size());

        for (TripleSink sink : tripleSinks) {
            if (!sink.isEnabled()) {
                log.debug("[Pipeline] -> sink {} not configured, skipped", sink.getName());
                continue;
            }
            try {
                sink.write(result);
                summary.getWrittenSinks().add(sink.getName());
            } catch (IOException e) {
                log.error("[Pipeline] -> sink {} failed: {}", sink.getName(), e.getMessage(), e);
                summary.getFailedSinks().add(sink.getName());
            }
        }

        String rdfOutputDir = config.getRdfOutputDir();
        if (rdfOutputDir != null && !rdfOutputDir.trim().isEmpty()) {
            RdfExporter exporter = new RdfExporter(config.getRdfUriPrefix());
            for (Path file : exporter.writeFiles(tables, Paths.get(rdfOutputDir.trim()))) {
                summary.getRdfFiles().add(file.toString());
            }
        }

        summary.setElapsedMillis(System.currentTimeMillis() - startTime);
        log.info("[Pipeline] -> finished: raters={}, triples={}, sinks={}, elapsed={}ms",
                summary.getRaters().size(), summary.getTripleCount(), summary.getWrittenSinks(), summary.getElapsedMillis());
        return summary;
    }

    private ConversionMode resolveMode(ConversionMode mode) {
        if (mode != null) {
            return mode;
        }
        if (config != null && config.getMode() != null) {
            return config.getMode();
        }
        return ConversionMode.NORMAL;
    }
}
