package com.interpolar.medicationreview.model;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one file pipeline run
 */
@Getter
@Setter
public class PipelineRunSummary {
    private String mode;
    private List<String> raters = new ArrayList<>();
    private List<String> failedRaters = new ArrayList<>();
    private int tripleCount;
    private int nodeCount;
    private List<String> writtenSinks = new ArrayList<>();
    private List<String> failedSinks = new ArrayList<>();
    private List<String> rdfFiles = new ArrayList<>();
    private long elapsedMillis;
}
