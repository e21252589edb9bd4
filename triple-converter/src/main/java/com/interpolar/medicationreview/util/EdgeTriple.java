package com.interpolar.medicationreview.util;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Atomic (source, edge, target) without positional metadata
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class EdgeTriple {
    private String source;
    private String edge;
    private String target;
}
