package com.interpolar.medicationreview.service;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Switches of the row conversion engine
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class ConversionOptions {
    /** start/end nodes around every row */
    private final boolean insertSentinels;

    /** drop targets that are not of interest (outcome edges bypass) */
    private final boolean applyEpaFilter;

    /** hops starting from a carried source become connectedTo (outcome edges keep their label) */
    private final boolean relabelCarriedEdges;
}
