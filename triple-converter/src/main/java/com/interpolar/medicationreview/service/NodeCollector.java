package com.interpolar.medicationreview.service;

import com.interpolar.medicationreview.model.Triple;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Distinct node names of one or more triple tables
 * Per table all sources, then all targets; first occurrence wins.
 */
public final class NodeCollector {

    private NodeCollector() {
    }

    public static List<String> collect(Collection<List<Triple>> tables) {
        Set<String> nodes = new LinkedHashSet<>();
        for (List<Triple> table : tables) {
            for (Triple triple : table) {
                nodes.add(triple.getSource());
            }
            for (Triple triple : table) {
                nodes.add(triple.getTarget());
            }
        }
        return new ArrayList<>(nodes);
    }
}
