package com.interpolar.medicationreview.service;

import com.interpolar.medicationreview.model.OutcomeComparisonRow;
import com.interpolar.medicationreview.model.Triple;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class OutcomeComparatorTest {

    @Test
    @DisplayName("identical outcome triples are grouped, needsRequestOf ignores its source")
    public void testCompare() {
        List<Triple> total = Arrays.asList(
                new Triple("Assess", "needs", "Labs", 1, 2, "P1"),
                new Triple("Doc", "needsRequestOf", "Physician", 2, 2, "P1"),
                new Triple("A", "checks", "B", 2, 3, "P1"),
                new Triple("Assess", "needs", "Labs", 3, 2, "P2"),
                new Triple("Other", "needsRequestOf", "Physician", 1, 4, "P2"));

        List<OutcomeComparisonRow> rows = OutcomeComparator.compare(total, Arrays.asList("P1", "P2", "P3"));

        assertEquals(2, rows.size());

        OutcomeComparisonRow needs = rows.get(0);
        assertEquals("Assess", needs.getSource());
        assertEquals("needs", needs.getEdge());
        assertEquals(Collections.singletonList(1), needs.getRows("P1"));
        assertEquals(Collections.singletonList(3), needs.getRows("P2"));
        assertTrue(needs.getRows("P3").isEmpty());
        assertEquals(2, needs.getCount());

        OutcomeComparisonRow request = rows.get(1);
        assertEquals("", request.getSource());
        assertEquals("Physician", request.getTarget());
        assertEquals(Collections.singletonList(2), request.getRows("P1"));
        assertEquals(Collections.singletonList(1), request.getRows("P2"));
        assertEquals(Arrays.asList("P1", "P2", "P3"), Arrays.asList(request.getRowsByRater().keySet().toArray()));
    }

    @Test
    public void testSameRaterSeveralRows() {
        List<Triple> total = Arrays.asList(
                new Triple("Assess", "hasOutcome", "Stop", 1, 2, "P1"),
                new Triple("Assess", "hasOutcome", "Stop", 4, 2, "P1"));

        List<OutcomeComparisonRow> rows = OutcomeComparator.compare(total, Collections.singletonList("P1"));

        assertEquals(1, rows.size());
        assertEquals(Arrays.asList(1, 4), rows.get(0).getRows("P1"));
        assertEquals(1, rows.get(0).getCount());
    }

    @Test
    public void testNoOutcomeTriples() {
        List<Triple> total = Collections.singletonList(new Triple("start", "is", "A", 1, 1, "P1"));
        assertTrue(OutcomeComparator.compare(total, Collections.singletonList("P1")).isEmpty());
    }
}
