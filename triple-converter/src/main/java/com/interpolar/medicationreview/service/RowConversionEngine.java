package com.interpolar.medicationreview.service;

import com.interpolar.medicationreview.constants.TripleConstants;
import com.interpolar.medicationreview.model.Triple;
import com.interpolar.medicationreview.util.CellNormalizer;
import com.interpolar.medicationreview.util.EdgeTriple;
import com.interpolar.medicationreview.util.MultiValueExpander;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Row conversion engine
 *
 * Walks one normalized row hop by hop and emits its triples:
 * 1. start -> is -> first node (one triple per atom of cell 0)
 * 2. source -> edge -> target for every hop, expanded over multi-value cells
 * 3. last node -> is -> end, either at the first empty edge/target or after the last hop;
 *    an empty last node still gets its end triple
 *
 * With the EPA filter on, targets that are not of interest are dropped. A hop
 * whose target disappears completely emits nothing and its source is carried
 * to the next hop, which is then relabeled connectedTo unless it is an
 * outcome edge. The end-of-row test runs on the relabeled edge, so a carried
 * hop with an empty edge cell continues as connectedTo. Outcome edges are
 * never filtered.
 *
 * Stateless between rows; one instance may serve any number of tables.
 */
@Slf4j
public class RowConversionEngine {

    private final ConversionOptions options;
    private final EpaNodeFilter epaNodeFilter;

    public RowConversionEngine(ConversionOptions options, EpaNodeFilter epaNodeFilter) {
        if (options == null) {
            throw new IllegalArgumentException("conversion options must not be null");
        }
        if (options.isApplyEpaFilter() && epaNodeFilter == null) {
            throw new IllegalArgumentException("EPA filtering requires a node filter");
        }
        this.options = options;
        this.epaNodeFilter = epaNodeFilter;
    }

    public RowConversionEngine(ConversionMode mode, NodeReferenceTable referenceTable) {
        this(mode.getOptions(), mode.getOptions().isApplyEpaFilter() ? new EpaNodeFilter(referenceTable) : null);
    }

    public ConversionOptions getOptions() {
        return options;
    }

    /**
     * @param row normalized cells of one process row
     * @param rowNumber 1-based row position within its table
     * @param raterLabel rater the row belongs to
     * @return triples in emission order, sequence numbers starting at 1
     */
    public List<Triple> convertRow(List<String> row, int rowNumber, String raterLabel) {
        RowHops parsed = RowHops.parse(row);
        RowEmitter emitter = new RowEmitter(rowNumber, raterLabel);

        if (options.isInsertSentinels()) {
            emitter.emit(TripleConstants.Sentinel.START, TripleConstants.Sentinel.IS, parsed.getFirstNode());
        }

        String source = parsed.getFirstNode();
        // source of the last hop whose target was filtered away, null when none is pending
        String carriedSource = null;

        for (Hop hop : parsed.getHops()) {
            String hopSource = carriedSource != null ? carriedSource : source;

            String edge = hop.getEdge();
            boolean outcome = TripleConstants.Edge.isOutcome(edge);
            if (carriedSource != null && options.isRelabelCarriedEdges() && !outcome) {
                edge = TripleConstants.Edge.CONNECTED_TO;
            }

            if (hop.isTerminal(edge)) {
                emitEnd(emitter, hopSource);
                return emitter.getTriples();
            }

            String target = hop.getTarget();
            if (options.isApplyEpaFilter() && !outcome) {
                target = epaNodeFilter.filterTarget(target);
            }

            if (!CellNormalizer.isEmpty(target)) {
                emitter.emit(hopSource, edge, target);
                source = target;
                carriedSource = null;
            } else {
                log.debug("[RowConversion] -> row {} of {}: target [{}] filtered out, carrying source [{}]",
                        rowNumber, raterLabel, hop.getTarget(), hopSource);
                if (carriedSource == null) {
                    carriedSource = hopSource;
                }
            }
        }

        // row as wide as the table: no trailing empty marker, close from the last node
        emitEnd(emitter, carriedSource != null ? carriedSource : source);
        return emitter.getTriples();
    }

    private void emitEnd(RowEmitter emitter, String source) {
        if (!options.isInsertSentinels()) {
            return;
        }
        if (CellNormalizer.isEmpty(source)) {
            log.warn("[RowConversion] -> row {} of {} has no node before end, closing with an empty source",
                    emitter.rowNumber, emitter.raterLabel);
        }
        emitter.emit(source, TripleConstants.Sentinel.IS, TripleConstants.Sentinel.END);
    }

    /**
     * Collects the triples of one row and numbers them
     */
    private static class RowEmitter {
        private final int rowNumber;
        private final String raterLabel;
        private final List<Triple> triples = new ArrayList<>();
        private int sequenceNumber = 0;

        RowEmitter(int rowNumber, String raterLabel) {
            this.rowNumber = rowNumber;
            this.raterLabel = raterLabel;
        }

        void emit(String sourceCell, String edge, String targetCell) {
            for (EdgeTriple t : MultiValueExpander.expandPair(sourceCell, targetCell, edge)) {
                sequenceNumber++;
                triples.add(new Triple(t.getSource(), t.getEdge(), t.getTarget(),
                        rowNumber, sequenceNumber, raterLabel));
            }
        }

        List<Triple> getTriples() {
            return triples;
        }
    }
}
