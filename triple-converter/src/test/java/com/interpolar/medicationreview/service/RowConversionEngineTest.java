package com.interpolar.medicationreview.service;

import com.interpolar.medicationreview.model.Triple;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Row conversion in normal, EPA and plain mode
 */
public class RowConversionEngineTest {

    private static final String RATER = "Pharmacist_1";

    private NodeReferenceTable referenceTable;

    @BeforeEach
    public void setUp() {
        // FooNode and BarNode are deliberately absent
        referenceTable = NodeReferenceTable.builder()
                .add("Labs", "x")
                .add("Vitals", "")
                .add("Physician", "x")
                .add("Discharge", "false")
                .build();
    }

    @Test
    @DisplayName("normal: multi-value target fans out and every atom is closed with end")
    public void testNormalMultiValueTarget() {
        List<Triple> triples = normal().convertRow(row("Assess", "needs", "Labs;Vitals"), 1, RATER);

        assertEquals(Arrays.asList(
                "start|is|Assess",
                "Assess|needs|Labs",
                "Assess|needs|Vitals",
                "Labs|is|end",
                "Vitals|is|end"
        ), render(triples));
        assertEquals(Arrays.asList(1, 2, 3, 4, 5),
                triples.stream().map(Triple::getSequenceNumber).collect(Collectors.toList()));
        assertTrue(triples.stream().allMatch(t -> t.getRowNumber() == 1 && RATER.equals(t.getRaterLabel())));
    }

    @Test
    @DisplayName("normal: row with only a start node")
    public void testNormalOnlyStart() {
        List<Triple> triples = normal().convertRow(row("OnlyStart", "", ""), 7, RATER);

        assertEquals(Arrays.asList("start|is|OnlyStart", "OnlyStart|is|end"), render(triples));
        assertEquals(7, triples.get(1).getRowNumber());
    }

    @Test
    @DisplayName("normal: first empty edge ends the row, later cells are ignored")
    public void testNormalStopsAtFirstEmptyHop() {
        List<Triple> triples = normal().convertRow(row("A", "e1", "B", "", "", "f", "C"), 1, RATER);

        assertEquals(Arrays.asList("start|is|A", "A|e1|B", "B|is|end"), render(triples));
    }

    @Test
    @DisplayName("normal: empty target with non-empty edge also ends the row")
    public void testNormalStopsAtEmptyTarget() {
        List<Triple> triples = normal().convertRow(row("A", "e1", "B", "e2", ""), 1, RATER);

        assertEquals(Arrays.asList("start|is|A", "A|e1|B", "B|is|end"), render(triples));
    }

    @Test
    @DisplayName("normal: a row with no hops is closed from cell 0")
    public void testNormalSingleCellRow() {
        List<Triple> triples = normal().convertRow(row("Alone"), 1, RATER);

        assertEquals(Arrays.asList("start|is|Alone", "Alone|is|end"), render(triples));
    }

    @Test
    @DisplayName("normal: empty first node is still closed with end")
    public void testNormalEmptyFirstNode() {
        List<Triple> triples = normal().convertRow(row("", "", "Z"), 1, RATER);

        assertEquals(Arrays.asList("start|is|", "|is|end"), render(triples));
        assertEquals(2, triples.get(1).getSequenceNumber());
    }

    @Test
    @DisplayName("normal: multi-value start node gives one start triple per atom")
    public void testNormalMultiValueStart() {
        List<Triple> triples = normal().convertRow(row("A;B", "e", "C", ""), 1, RATER);

        assertEquals(Arrays.asList(
                "start|is|A",
                "start|is|B",
                "A|e|C",
                "B|e|C",
                "C|is|end"
        ), render(triples));
    }

    @Test
    @DisplayName("\"0\" is a value, not an empty cell")
    public void testZeroIsNotEmpty() {
        List<Triple> triples = normal().convertRow(row("0", "e", "0"), 1, RATER);

        assertEquals(Arrays.asList("start|is|0", "0|e|0", "0|is|end"), render(triples));
    }

    @Test
    @DisplayName("normal mode never filters, unknown nodes pass through")
    public void testNormalDoesNotFilter() {
        List<Triple> triples = normal().convertRow(row("Assess", "checks", "FooNode"), 1, RATER);

        assertEquals(Arrays.asList("start|is|Assess", "Assess|checks|FooNode", "FooNode|is|end"), render(triples));
    }

    @Test
    @DisplayName("EPA: filtered hop carries its source, next hop becomes connectedTo")
    public void testEpaCarryOverRelabelsEdge() {
        List<Triple> triples = epa().convertRow(row("Assess", "checks", "FooNode", "reviews", "Labs"), 1, RATER);

        assertEquals(Arrays.asList(
                "start|is|Assess",
                "Assess|connectedTo|Labs",
                "Labs|is|end"
        ), render(triples));
        assertEquals(Arrays.asList(1, 2, 3),
                triples.stream().map(Triple::getSequenceNumber).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("EPA: outcome edges are neither filtered nor relabeled")
    public void testEpaOutcomeEdgeBypassesFilter() {
        List<Triple> triples = epa().convertRow(row("Assess", "checks", "FooNode", "needs", "BarNode"), 1, RATER);

        assertEquals(Arrays.asList(
                "start|is|Assess",
                "Assess|needs|BarNode",
                "BarNode|is|end"
        ), render(triples));
    }

    @Test
    @DisplayName("EPA: partially filtered target keeps the surviving atoms")
    public void testEpaPartialFilter() {
        List<Triple> triples = epa().convertRow(
                row("Assess", "reviews", "Labs;Vitals", "orders", "Physician"), 1, RATER);

        assertEquals(Arrays.asList(
                "start|is|Assess",
                "Assess|reviews|Labs",
                "Labs|orders|Physician",
                "Physician|is|end"
        ), render(triples));
    }

    @Test
    @DisplayName("EPA: final hop filtered away, end comes from the carried source")
    public void testEpaFinalHopFiltered() {
        List<Triple> triples = epa().convertRow(row("Assess", "reviews", "Labs", "checks", "FooNode"), 1, RATER);

        assertEquals(Arrays.asList("start|is|Assess", "Assess|reviews|Labs", "Labs|is|end"), render(triples));
    }

    @Test
    @DisplayName("EPA: consecutive filtered hops keep the first carried source")
    public void testEpaConsecutiveFilteredHops() {
        List<Triple> triples = epa().convertRow(
                row("Assess", "checks", "FooNode", "checks", "BarNode", "", ""), 1, RATER);

        assertEquals(Arrays.asList("start|is|Assess", "Assess|is|end"), render(triples));
    }

    @Test
    @DisplayName("EPA: carried hop with an empty edge cell continues as connectedTo")
    public void testEpaCarriedHopWithEmptyEdge() {
        List<String> row = row("Assess", "checks", "FooNode", "", "Labs");

        assertEquals(Arrays.asList(
                "start|is|Assess",
                "Assess|connectedTo|Labs",
                "Labs|is|end"
        ), render(epa().convertRow(row, 1, RATER)));
        assertEquals(Arrays.asList(
                "start|is|Assess",
                "Assess|checks|FooNode",
                "FooNode|is|end"
        ), render(normal().convertRow(row, 1, RATER)), "normal mode ends at the empty edge");
    }

    @Test
    @DisplayName("EPA: empty edge without a carried source ends the row")
    public void testEpaEmptyEdgeWithoutCarry() {
        List<Triple> triples = epa().convertRow(row("Assess", "", "Labs", "reviews", "Physician"), 1, RATER);

        assertEquals(Arrays.asList("start|is|Assess", "Assess|is|end"), render(triples));
    }

    @Test
    @DisplayName("EPA: flag values meaning false drop the node")
    public void testEpaFalseFlag() {
        List<Triple> triples = epa().convertRow(
                row("Assess", "plans", "Discharge", "orders", "Physician"), 1, RATER);

        assertEquals(Arrays.asList(
                "start|is|Assess",
                "Assess|connectedTo|Physician",
                "Physician|is|end"
        ), render(triples));
    }

    @Test
    @DisplayName("EPA without a reference table drops every non-outcome target")
    public void testEpaWithEmptyReferenceTable() {
        RowConversionEngine engine = new RowConversionEngine(ConversionMode.EPA_STYLE, NodeReferenceTable.empty());

        List<Triple> triples = engine.convertRow(row("Assess", "reviews", "Labs"), 1, RATER);

        assertEquals(Arrays.asList("start|is|Assess", "Assess|is|end"), render(triples));
    }

    @Test
    @DisplayName("plain: no sentinels, empty rows produce nothing")
    public void testPlainMode() {
        RowConversionEngine engine = new RowConversionEngine(ConversionMode.PLAIN, referenceTable);

        assertEquals(Arrays.asList("A|e|B", "B|f|C"), render(engine.convertRow(row("A", "e", "B", "f", "C"), 1, RATER)));
        assertTrue(engine.convertRow(row("A", "", ""), 2, RATER).isEmpty());
    }

    @Test
    public void testEpaOptionsRequireFilter() {
        ConversionOptions options = ConversionMode.EPA_STYLE.getOptions();
        assertThrows(IllegalArgumentException.class, () -> new RowConversionEngine(options, null));
    }

    private RowConversionEngine normal() {
        return new RowConversionEngine(ConversionMode.NORMAL, referenceTable);
    }

    private RowConversionEngine epa() {
        return new RowConversionEngine(ConversionMode.EPA_STYLE, referenceTable);
    }

    private static List<String> row(String... cells) {
        return Arrays.asList(cells);
    }

    private static List<String> render(List<Triple> triples) {
        return triples.stream()
                .map(t -> t.getSource() + "|" + t.getEdge() + "|" + t.getTarget())
                .collect(Collectors.toList());
    }
}
