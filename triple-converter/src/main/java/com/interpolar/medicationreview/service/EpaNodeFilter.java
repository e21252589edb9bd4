package com.interpolar.medicationreview.service;

import com.interpolar.medicationreview.util.MultiValueExpander;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps only target nodes flagged as "of interest" in the node reference table
 *
 * Unknown names, unset flags and failed lookups all mean "not of interest":
 * the node is dropped and conversion continues.
 */
@Slf4j
public class EpaNodeFilter {

    private final NodeReferenceTable referenceTable;

    public EpaNodeFilter(NodeReferenceTable referenceTable) {
        this.referenceTable = referenceTable != null ? referenceTable : NodeReferenceTable.empty();
    }

    public boolean isOfInterest(String nodeName) {
        try {
            if (!referenceTable.contains(nodeName)) {
                log.warn("[EpaFilter] -> node [{}] not found in node reference table, dropped", nodeName);
                return false;
            }
            return NodeReferenceTable.isFlagSet(referenceTable.getFlag(nodeName));
        } catch (RuntimeException e) {
            log.error("[EpaFilter] -> lookup of node [{}] failed: {}", nodeName, e.getMessage(), e);
            return false;
        }
    }

    /**
     * Filters every atom of a multi-value cell; "" when nothing survives
     */
    public String filterTarget(String targetCell) {
        List<String> kept = new ArrayList<>();
        for (String atom : MultiValueExpander.split(targetCell)) {
            if (isOfInterest(atom)) {
                kept.add(atom);
            }
        }
        return MultiValueExpander.join(kept);
    }
}
