package com.interpolar.medicationreview.config;

import com.interpolar.medicationreview.constants.TripleConstants;
import com.interpolar.medicationreview.service.ConversionMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Triple converter configuration
 */
@Configuration
@ConfigurationProperties(prefix = "triple-converter")
public class TripleConverterConfig {

    /**
     * Adjacency list workbook (.xlsx/.xls)
     */
    private String inputWorkbook;

    /**
     * Rater sheet titles; empty means every sheet from firstSheetIndex on
     */
    private List<String> inputSheets = new ArrayList<>();

    private int firstSheetIndex = 0;

    /**
     * First row of each sheet is a column header
     */
    private boolean headerRow = true;

    private ConversionMode mode = ConversionMode.NORMAL;

    /**
     * Triple workbook, updated in place
     */
    private String outputWorkbook;

    private String csvOutputDir;

    private String rdfOutputDir;

    private String rdfUriPrefix = TripleConstants.Rdf.DEFAULT_URI_PREFIX;

    /**
     * EPA node reference table (.csv/.xlsx)
     */
    private String nodeReferencePath;

    private String nodeReferenceNameColumn = TripleConstants.NodeReference.DEFAULT_NAME_COLUMN;

    private String nodeReferenceFlagColumn = TripleConstants.NodeReference.DEFAULT_FLAG_COLUMN;

    // Getters and Setters
    public String getInputWorkbook() {
        return inputWorkbook;
    }

    public void setInputWorkbook(String inputWorkbook) {
        this.inputWorkbook = inputWorkbook;
    }

    public List<String> getInputSheets() {
        return inputSheets;
    }

    public void setInputSheets(List<String> inputSheets) {
        this.inputSheets = inputSheets;
    }

    public int getFirstSheetIndex() {
        return firstSheetIndex;
    }

    public void setFirstSheetIndex(int firstSheetIndex) {
        this.firstSheetIndex = firstSheetIndex;
    }

    public boolean isHeaderRow() {
        return headerRow;
    }

    public void setHeaderRow(boolean headerRow) {
        this.headerRow = headerRow;
    }

    public ConversionMode getMode() {
        return mode;
    }

    public void setMode(ConversionMode mode) {
        this.mode = mode;
    }

    public String getOutputWorkbook() {
        return outputWorkbook;
    }

    public void setOutputWorkbook(String outputWorkbook) {
        this.outputWorkbook = outputWorkbook;
    }

    public String getCsvOutputDir() {
        return csvOutputDir;
    }

    public void setCsvOutputDir(String csvOutputDir) {
        this.csvOutputDir = csvOutputDir;
    }

    public String getRdfOutputDir() {
        return rdfOutputDir;
    }

    public void setRdfOutputDir(String rdfOutputDir) {
        this.rdfOutputDir = rdfOutputDir;
    }

    public String getRdfUriPrefix() {
        return rdfUriPrefix;
    }

    public void setRdfUriPrefix(String rdfUriPrefix) {
        this.rdfUriPrefix = rdfUriPrefix;
    }

    public String getNodeReferencePath() {
        return nodeReferencePath;
    }

    public void setNodeReferencePath(String nodeReferencePath) {
        this.nodeReferencePath = nodeReferencePath;
    }

    public String getNodeReferenceNameColumn() {
        return nodeReferenceNameColumn;
    }

    public void setNodeReferenceNameColumn(String nodeReferenceNameColumn) {
        this.nodeReferenceNameColumn = nodeReferenceNameColumn;
    }

    public String getNodeReferenceFlagColumn() {
        return nodeReferenceFlagColumn;
    }

    public void setNodeReferenceFlagColumn(String nodeReferenceFlagColumn) {
        this.nodeReferenceFlagColumn = nodeReferenceFlagColumn;
    }
}
