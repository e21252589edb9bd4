package com.interpolar.medicationreview.service.io;

import com.interpolar.medicationreview.service.ConversionResult;

import java.io.IOException;

/**
 * Destination of converted triple tables
 */
public interface TripleSink {

    /**
     * Persists per-rater tables, the aggregate and the node list
     */
    void write(ConversionResult result) throws IOException;

    /**
     * false when no destination is configured
     */
    boolean isEnabled();

    String getName();
}
