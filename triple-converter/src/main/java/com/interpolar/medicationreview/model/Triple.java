package com.interpolar.medicationreview.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One emitted statement of a process row
 *
 * source/edge/target are always atomic (multi-value cells are already expanded).
 * rowNumber is the 1-based row of the originating table, sequenceNumber the
 * 1-based position of this triple inside its row, sentinels included.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class Triple {
    private final String source;
    private final String edge;
    private final String target;
    private final int rowNumber;
    private final int sequenceNumber;
    private final String raterLabel;
}
