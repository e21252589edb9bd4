package com.interpolar.medicationreview.service;

import com.interpolar.medicationreview.model.Triple;
import org.eclipse.rdf4j.model.Statement;

/**
 * Maps a converted triple to an RDF statement
 */
public interface StatementMapper {
    /**
     * @param triple atomic triple from the conversion engine
     * @return subject/predicate/object statement
     */
    Statement toStatement(Triple triple);
}
