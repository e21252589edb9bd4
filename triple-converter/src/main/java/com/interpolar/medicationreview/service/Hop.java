package com.interpolar.medicationreview.service;

import com.interpolar.medicationreview.util.CellNormalizer;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * One (edge, target) column pair of a row
 */
@Getter
@AllArgsConstructor
public class Hop {
    private final String edge;
    private final String target;

    /**
     * A hop with an empty edge or target marks the end of the row's content
     *
     * @param effectiveEdge edge after relabeling of a carried-over hop
     */
    public boolean isTerminal(String effectiveEdge) {
        return CellNormalizer.isEmpty(effectiveEdge) || CellNormalizer.isEmpty(target);
    }
}
