package com.interpolar.medicationreview.util;

import com.interpolar.medicationreview.constants.TripleConstants;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits ";" separated cells and expands source x target combinations
 */
public class MultiValueExpander {

    private static final Pattern SEPARATOR = Pattern.compile(Pattern.quote(TripleConstants.Cell.MULTI_VALUE_SEPARATOR));

    private MultiValueExpander() {
    }

    /**
     * "A;B" -> [A, B], "A" -> [A], "" -> [""]
     * Empty pieces are kept, "A;;B" yields three atoms.
     */
    public static List<String> split(String cell) {
        if (cell == null) {
            return new ArrayList<>(Arrays.asList(""));
        }
        return new ArrayList<>(Arrays.asList(SEPARATOR.split(cell, -1)));
    }

    /**
     * Cartesian product of both cells, outer loop over source atoms, inner loop over target atoms
     */
    public static List<EdgeTriple> expandPair(String sourceCell, String targetCell, String edge) {
        List<EdgeTriple> result = new ArrayList<>();
        List<String> targets = split(targetCell);
        for (String source : split(sourceCell)) {
            for (String target : targets) {
                result.add(new EdgeTriple(source, edge, target));
            }
        }
        return result;
    }

    public static String join(List<String> atoms) {
        return String.join(TripleConstants.Cell.MULTI_VALUE_SEPARATOR, atoms);
    }
}
