package com.interpolar.medicationreview.controller;

import com.interpolar.medicationreview.model.OutcomeComparisonRow;
import com.interpolar.medicationreview.model.PipelineRunSummary;
import com.interpolar.medicationreview.model.RawTable;
import com.interpolar.medicationreview.service.ConversionMode;
import com.interpolar.medicationreview.service.ConversionResult;
import com.interpolar.medicationreview.service.impl.TripleConversionServiceImpl;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.util.List;

/**
 * Adjacency list to triple conversion REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/triples")
public class TripleConverterController {

    private static final MediaType RDF_XML = MediaType.parseMediaType("application/rdf+xml");

    @Autowired
    private TripleConversionServiceImpl conversionService;

    /**
     * Converts posted rater tables
     *
     * @param request mode and rater tables
     * @return per-rater triples, aggregate and node list
     */
    @PostMapping("/convert")
    public ConversionResult convert(@RequestBody ConversionRequest request) {
        if (!isValid(request)) {
            return null;
        }
        log.info("[API] -> convert request: tables={}, mode={}", request.getTables().size(), request.getMode());
        return conversionService.convert(request.getTables(), request.getMode());
    }

    /**
     * RDF/XML of the posted tables
     */
    @PostMapping("/rdf")
    public ResponseEntity<String> exportRdf(@RequestBody ConversionRequest request) {
        if (!isValid(request)) {
            return ResponseEntity.badRequest().build();
        }
        log.info("[API] -> rdf export request: tables={}", request.getTables().size());
        return ResponseEntity.ok()
                .contentType(RDF_XML)
                .body(conversionService.exportRdf(request.getTables()));
    }

    /**
     * Outcome triples shared across the posted raters
     */
    @PostMapping("/outcome-comparison")
    public List<OutcomeComparisonRow> compareOutcomes(@RequestBody ConversionRequest request) {
        if (!isValid(request)) {
            return null;
        }
        ConversionResult result = conversionService.convert(request.getTables(), request.getMode());
        return conversionService.compareOutcomes(result);
    }

    /**
     * Runs the configured workbook pipeline
     */
    @PostMapping("/workbook/run")
    public PipelineRunSummary runWorkbookPipeline() throws IOException {
        log.info("[API] -> workbook pipeline run requested");
        return conversionService.runPipeline();
    }

    private boolean isValid(ConversionRequest request) {
        if (request == null) {
            log.error("[API] -> validation failed: request body is empty");
            return false;
        }
        if (request.getTables() == null || request.getTables().isEmpty()) {
            log.error("[API] -> validation failed: no rater tables");
            return false;
        }
        return true;
    }

    /**
     * Conversion request body
     */
    public static class ConversionRequest {
        private ConversionMode mode;
        private List<RawTable> tables;

        public ConversionMode getMode() {
            return mode;
        }

        public void setMode(ConversionMode mode) {
            this.mode = mode;
        }

        public List<RawTable> getTables() {
            return tables;
        }

        public void setTables(List<RawTable> tables) {
            this.tables = tables;
        }
    }
}
