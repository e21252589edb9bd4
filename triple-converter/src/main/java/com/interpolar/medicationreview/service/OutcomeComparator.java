package com.interpolar.medicationreview.service;

import com.interpolar.medicationreview.constants.TripleConstants;
import com.interpolar.medicationreview.model.OutcomeComparisonRow;
import com.interpolar.medicationreview.model.Triple;
import com.interpolar.medicationreview.util.EdgeTriple;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups identical outcome triples across raters
 *
 * needsRequestOf is compared on edge and target only, its source is blanked.
 */
@Slf4j
public final class OutcomeComparator {

    private OutcomeComparator() {
    }

    public static List<OutcomeComparisonRow> compare(List<Triple> total, List<String> raterLabels) {
        Map<EdgeTriple, OutcomeComparisonRow> organizer = new LinkedHashMap<>();

        for (Triple triple : total) {
            if (!TripleConstants.Edge.isOutcome(triple.getEdge())) {
                continue;
            }
            String source = TripleConstants.Edge.NEEDS_REQUEST_OF.equals(triple.getEdge()) ? "" : triple.getSource();
            EdgeTriple key = new EdgeTriple(source, triple.getEdge(), triple.getTarget());

            OutcomeComparisonRow row = organizer.computeIfAbsent(key, k -> newRow(k, raterLabels));
            row.addOccurrence(triple.getRaterLabel(), triple.getRowNumber());
        }

        List<OutcomeComparisonRow> rows = new ArrayList<>(organizer.values());
        log.info("[OutcomeComparison] -> {} triples in, {} distinct outcome triples", total.size(), rows.size());
        return rows;
    }

    private static OutcomeComparisonRow newRow(EdgeTriple key, List<String> raterLabels) {
        OutcomeComparisonRow row = new OutcomeComparisonRow(key.getSource(), key.getEdge(), key.getTarget());
        // fixed rater column order, empty until the rater produces the triple
        for (String rater : raterLabels) {
            row.getRowsByRater().put(rater, new ArrayList<>());
        }
        return row;
    }
}
