package com.interpolar.medicationreview.service.io;

import com.interpolar.medicationreview.model.RawTable;

import java.io.IOException;
import java.util.List;

/**
 * Source of rater adjacency lists
 * Implementations hand over fully materialized tables, one per rater.
 */
public interface TableSource {

    /**
     * @return one table per rater in source order
     */
    List<RawTable> readTables() throws IOException;
}
