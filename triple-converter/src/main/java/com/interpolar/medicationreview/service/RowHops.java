package com.interpolar.medicationreview.service;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A row parsed into its first node and the ordered list of hops
 *
 * Cells 1..N are read pairwise as (edge, target). A trailing edge without a
 * target cell becomes a hop with an empty target.
 */
@Getter
public class RowHops {
    private final String firstNode;
    private final List<Hop> hops;

    private RowHops(String firstNode, List<Hop> hops) {
        this.firstNode = firstNode;
        this.hops = Collections.unmodifiableList(hops);
    }

    public static RowHops parse(List<String> row) {
        if (row == null || row.isEmpty()) {
            return new RowHops("", new ArrayList<>());
        }
        String first = valueOrEmpty(row.get(0));
        List<Hop> hops = new ArrayList<>();
        for (int col = 1; col < row.size(); col += 2) {
            String edge = valueOrEmpty(row.get(col));
            String target = col + 1 < row.size() ? valueOrEmpty(row.get(col + 1)) : "";
            hops.add(new Hop(edge, target));
        }
        return new RowHops(first, hops);
    }

    private static String valueOrEmpty(String cell) {
        return cell == null ? "" : cell;
    }
}
