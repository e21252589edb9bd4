package com.interpolar.medicationreview.service;

import com.interpolar.medicationreview.constants.TripleConstants;
import com.interpolar.medicationreview.model.Triple;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Structural checks over randomly generated rows
 */
public class RowConversionPropertiesTest {

    private static final Logger log = LoggerFactory.getLogger(RowConversionPropertiesTest.class);

    private static final List<String> INTERESTING = Arrays.asList("Labs", "Physician", "Dose", "Allergy");
    private static final List<String> UNINTERESTING = Arrays.asList("FooNode", "BarNode", "Vitals");
    private static final List<String> PLAIN_EDGES = Arrays.asList("checks", "reviews", "orders", "ispartof");
    private static final List<String> OUTCOME_EDGES = new ArrayList<>(TripleConstants.Edge.OUTCOME_EDGES);

    private static final NodeReferenceTable REFERENCE = NodeReferenceTable.builder()
            .add("Labs", "x").add("Physician", "x").add("Dose", "yes").add("Allergy", "1")
            .add("Vitals", "").build();

    static IntStream seeds() {
        return IntStream.range(0, 60);
    }

    @ParameterizedTest
    @MethodSource("seeds")
    public void testSentinelsAndSequence(int seed) {
        List<String> row = randomRow(new Random(seed));
        for (ConversionMode mode : Arrays.asList(ConversionMode.NORMAL, ConversionMode.EPA_STYLE)) {
            List<Triple> triples = new RowConversionEngine(mode, REFERENCE).convertRow(row, 4, "P1");
            log.debug("seed {} mode {} row {} -> {} triples", seed, mode, row, triples.size());

            assertFalse(triples.isEmpty());
            Triple first = triples.get(0);
            assertEquals(TripleConstants.Sentinel.START, first.getSource(), "row " + row);
            assertEquals(TripleConstants.Sentinel.IS, first.getEdge());
            Triple last = triples.get(triples.size() - 1);
            assertEquals(TripleConstants.Sentinel.IS, last.getEdge(), "row " + row);
            assertEquals(TripleConstants.Sentinel.END, last.getTarget(), "row " + row);

            for (int i = 0; i < triples.size(); i++) {
                Triple t = triples.get(i);
                assertEquals(i + 1, t.getSequenceNumber());
                assertEquals(4, t.getRowNumber());
                assertFalse(t.getSource().contains(";") || t.getTarget().contains(";"), "unexpanded cell in " + t);
            }
        }
    }

    @ParameterizedTest
    @MethodSource("seeds")
    public void testEpaKeepsOnlyNodesOfInterest(int seed) {
        List<String> row = randomRow(new Random(seed));
        List<Triple> triples = new RowConversionEngine(ConversionMode.EPA_STYLE, REFERENCE).convertRow(row, 1, "P1");

        for (Triple t : triples) {
            if (isSentinel(t) || TripleConstants.Edge.isOutcome(t.getEdge())) {
                continue;
            }
            assertTrue(INTERESTING.contains(t.getTarget()), "filtered node leaked: " + t + " row " + row);
        }
    }

    /**
     * EPA reads at least as far into a row as normal mode, so every outcome
     * target of the normal conversion must survive
     */
    @ParameterizedTest
    @MethodSource("seeds")
    public void testEpaNeverDropsOutcomeTargets(int seed) {
        List<String> row = randomRow(new Random(seed));
        List<Triple> normal = new RowConversionEngine(ConversionMode.NORMAL, REFERENCE).convertRow(row, 1, "P1");
        List<Triple> epa = new RowConversionEngine(ConversionMode.EPA_STYLE, REFERENCE).convertRow(row, 1, "P1");

        Set<String> epaTargets = outcomeTargets(epa);
        assertTrue(epaTargets.containsAll(outcomeTargets(normal)), "row " + row + " epa " + epaTargets);
    }

    @ParameterizedTest
    @MethodSource("seeds")
    public void testPlainHasNoSentinels(int seed) {
        List<String> row = randomRow(new Random(seed));
        List<Triple> triples = new RowConversionEngine(ConversionMode.PLAIN, REFERENCE).convertRow(row, 1, "P1");

        assertTrue(triples.stream().noneMatch(RowConversionPropertiesTest::isSentinel), "row " + row);
    }

    private static Set<String> outcomeTargets(List<Triple> triples) {
        return triples.stream()
                .filter(t -> TripleConstants.Edge.isOutcome(t.getEdge()))
                .map(t -> t.getEdge() + "|" + t.getTarget())
                .collect(Collectors.toCollection(TreeSet::new));
    }

    private static boolean isSentinel(Triple t) {
        return TripleConstants.Sentinel.START.equals(t.getSource())
                || TripleConstants.Sentinel.END.equals(t.getTarget());
    }

    private static List<String> randomRow(Random random) {
        List<String> row = new ArrayList<>();
        // empty first node and empty cells inside the row are malformed but allowed
        row.add(random.nextInt(8) == 0 ? "" : randomCell(random, 1 + random.nextInt(2)));
        int hops = random.nextInt(6);
        for (int i = 0; i < hops; i++) {
            List<String> edges = random.nextInt(3) == 0 ? OUTCOME_EDGES : PLAIN_EDGES;
            row.add(random.nextInt(8) == 0 ? "" : edges.get(random.nextInt(edges.size())));
            row.add(random.nextInt(10) == 0 ? "" : randomCell(random, 1 + random.nextInt(3)));
        }
        int padding = random.nextInt(3);
        for (int i = 0; i < padding * 2; i++) {
            row.add("");
        }
        return row;
    }

    private static String randomCell(Random random, int atoms) {
        List<String> values = new ArrayList<>();
        for (int i = 0; i < atoms; i++) {
            List<String> pool = random.nextBoolean() ? INTERESTING : UNINTERESTING;
            values.add(pool.get(random.nextInt(pool.size())));
        }
        return String.join(";", values);
    }
}
