package com.interpolar.medicationreview.model;

import java.util.ArrayList;
import java.util.List;

/**
 * One rater's adjacency list as read from a worksheet or CSV file
 * Row cell 0 is the first node, followed by alternating edge / target cells.
 */
public class RawTable {
    /**
     * Worksheet title or file name identifying the rater
     */
    private String raterLabel;

    /**
     * Process rows, header already removed
     */
    private List<List<String>> rows;

    public RawTable() {
        this.rows = new ArrayList<>();
    }

    public RawTable(String raterLabel, List<List<String>> rows) {
        this.raterLabel = raterLabel;
        this.rows = rows != null ? rows : new ArrayList<>();
    }

    // Getters and Setters

    public String getRaterLabel() {
        return raterLabel;
    }

    public void setRaterLabel(String raterLabel) {
        this.raterLabel = raterLabel;
    }

    public List<List<String>> getRows() {
        return rows;
    }

    public void setRows(List<List<String>> rows) {
        this.rows = rows;
    }

    public int getRowCount() {
        return rows == null ? 0 : rows.size();
    }

    @Override
    public String toString() {
        return "RawTable{raterLabel='" + raterLabel + "', rows=" + getRowCount() + "}";
    }
}
