package com.interpolar.medicationreview.service;

import com.interpolar.medicationreview.constants.TripleConstants;
import org.eclipse.rdf4j.model.ValueFactory;
import org.eclipse.rdf4j.model.impl.SimpleValueFactory;

/**
 * Statement mappers for RDF export
 */
public final class RdfConverters {

    private RdfConverters() {}

    /**
     * Subject, predicate and object all become IRIs under the default prefix
     */
    public static final StatementMapper STATEMENT_MAPPER = uriMapper(TripleConstants.Rdf.DEFAULT_URI_PREFIX);

    public static StatementMapper uriMapper(String uriPrefix) {
        ValueFactory vf = SimpleValueFactory.getInstance();
        return triple -> vf.createStatement(
                vf.createIRI(uriPrefix + triple.getSource()),
                vf.createIRI(uriPrefix + triple.getEdge()),
                vf.createIRI(uriPrefix + triple.getTarget()));
    }
}
