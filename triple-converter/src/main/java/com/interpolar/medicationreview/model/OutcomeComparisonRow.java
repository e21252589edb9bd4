package com.interpolar.medicationreview.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome triple shared across raters
 */
public class OutcomeComparisonRow {
    private String source;
    private String edge;
    private String target;

    /**
     * rater label -> row numbers (Subprocess) where the rater produced this triple
     */
    private Map<String, List<Integer>> rowsByRater = new LinkedHashMap<>();

    public OutcomeComparisonRow() {
    }

    public OutcomeComparisonRow(String source, String edge, String target) {
        this.source = source;
        this.edge = edge;
        this.target = target;
    }

    public void addOccurrence(String raterLabel, int rowNumber) {
        rowsByRater.computeIfAbsent(raterLabel, k -> new ArrayList<>()).add(rowNumber);
    }

    public List<Integer> getRows(String raterLabel) {
        List<Integer> rows = rowsByRater.get(raterLabel);
        return rows != null ? rows : new ArrayList<>();
    }

    /**
     * Number of raters with at least one occurrence
     */
    public int getCount() {
        int count = 0;
        for (List<Integer> rows : rowsByRater.values()) {
            if (!rows.isEmpty()) {
                count++;
            }
        }
        return count;
    }

    // Getters and Setters

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public String getEdge() {
        return edge;
    }

    public void setEdge(String edge) {
        this.edge = edge;
    }

    public String getTarget() {
        return target;
    }

    public void setTarget(String target) {
        this.target = target;
    }

    public Map<String, List<Integer>> getRowsByRater() {
        return rowsByRater;
    }

    public void setRowsByRater(Map<String, List<Integer>> rowsByRater) {
        this.rowsByRater = rowsByRater;
    }
}
