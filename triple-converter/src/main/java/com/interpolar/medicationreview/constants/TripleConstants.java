package com.interpolar.medicationreview.constants;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Triple conversion constants
 */
public final class TripleConstants {

    private TripleConstants() {
    }

    /**
     * Synthetic nodes bounding one process row
     */
    public static final class Sentinel {
        private Sentinel() {}

        public static final String START = "start";
        public static final String END = "end";

        /** Edge used by every sentinel triple */
        public static final String IS = "is";
    }

    /**
     * Edge labels
     */
    public static final class Edge {
        private Edge() {}

        /** Replaces the edge of a hop whose source was carried over a filtered node */
        public static final String CONNECTED_TO = "connectedTo";

        public static final String NEEDS = "needs";
        public static final String NEEDS_REQUEST_OF = "needsRequestOf";
        public static final String NEEDS_CLARIFICATION_OF = "needsClarificationOf";
        public static final String HAS_OUTCOME = "hasOutcome";
        public static final String GIVE_PROPOSAL_OF = "giveProposalOf";
        public static final String NEEDS_RESEARCH_IN = "needsResearchIn";

        /**
         * Clinical outcome edges. Never filtered, never relabeled,
         * and the only edges the outcome comparison looks at.
         */
        public static final Set<String> OUTCOME_EDGES = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(
            NEEDS,
            NEEDS_REQUEST_OF,
            NEEDS_CLARIFICATION_OF,
            HAS_OUTCOME,
            GIVE_PROPOSAL_OF,
            NEEDS_RESEARCH_IN
        )));

        public static boolean isOutcome(String edge) {
            return edge != null && OUTCOME_EDGES.contains(edge);
        }
    }

    /**
     * Cell encoding
     */
    public static final class Cell {
        private Cell() {}

        /** Separator of atomic values inside one cell */
        public static final String MULTI_VALUE_SEPARATOR = ";";

        /** Characters removed from every cell before parsing */
        public static final char[] STRIPPED_CHARS = {' ', ',', ':'};
    }

    /**
     * Column and sheet names of the persisted tables
     */
    public static final class Output {
        private Output() {}

        public static final String SOURCE_NODE = "Source_Node";
        public static final String RELATIONSHIP = "Relationship";
        public static final String TARGET_NODE = "Target_Node";
        public static final String SUBPROCESS = "Subprocess";
        public static final String STEP = "Step";
        public static final String RATER_LABEL = "Pharmacists_Label";
        public static final String COUNT = "Count";

        public static final List<String> TRIPLE_COLUMNS = Collections.unmodifiableList(Arrays.asList(
            SOURCE_NODE, RELATIONSHIP, TARGET_NODE, SUBPROCESS, STEP, RATER_LABEL
        ));

        public static final String NODES_HEADER = "Node";

        public static final String TOTAL_SHEET = "Total";
        public static final String NODES_SHEET = "Nodes";
        public static final String OUTCOME_SHEET = "Outcome_Comparison";
    }

    /**
     * Node reference table defaults
     */
    public static final class NodeReference {
        private NodeReference() {}

        public static final String DEFAULT_NAME_COLUMN = "Name";
        public static final String DEFAULT_FLAG_COLUMN = "node_of_interest";

        /** Flag values that count as unset besides the blank cell */
        public static final Set<String> FALSE_FLAGS = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(
            "false", "no", "0", "n"
        )));
    }

    /**
     * RDF export
     */
    public static final class Rdf {
        private Rdf() {}

        public static final String DEFAULT_URI_PREFIX = "https://interpolar.com/";
        public static final String FILE_EXTENSION = ".rdf";
    }
}
