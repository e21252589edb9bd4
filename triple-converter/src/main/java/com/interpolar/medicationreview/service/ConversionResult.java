package com.interpolar.medicationreview.service;

import com.interpolar.medicationreview.model.Triple;
import lombok.Getter;
import lombok.Setter;

import java.util.*;

/**
 * Output of one conversion run
 * Per-rater triple tables in input order, the cross-rater aggregate and the node list.
 */
@Getter
@Setter
public class ConversionResult {
    private ConversionMode mode;

    // rater label -> triples of that rater
    private Map<String, List<Triple>> triplesByRater = new LinkedHashMap<>();

    // all raters, appended in conversion order
    private List<Triple> total = new ArrayList<>();

    // distinct source/target values over all raters
    private List<String> nodes = new ArrayList<>();

    // raters whose table could not be read or converted
    private List<String> failedRaters = new ArrayList<>();

    public ConversionResult() {
    }

    public ConversionResult(ConversionMode mode) {
        this.mode = mode;
    }

    /**
     * Appends one rater's output to its table and to the aggregate
     */
    public void addRaterTriples(String raterLabel, List<Triple> triples) {
        triplesByRater.computeIfAbsent(raterLabel, k -> new ArrayList<>()).addAll(triples);
        total.addAll(triples);
    }

    public void addFailedRater(String raterLabel) {
        failedRaters.add(raterLabel);
    }

    public List<String> getRaterLabels() {
        return new ArrayList<>(triplesByRater.keySet());
    }

    public List<Triple> getTriples(String raterLabel) {
        List<Triple> triples = triplesByRater.get(raterLabel);
        return triples != null ? triples : Collections.emptyList();
    }

    public int getSuccessCount() {
        return triplesByRater.size();
    }

    public int getFailureCount() {
        return failedRaters.size();
    }
}
