package com.interpolar.medicationreview.service;

/**
 * Named engine presets
 */
public enum ConversionMode {
    NORMAL(new ConversionOptions(true, false, false)),       // start/end bounded triples
    EPA_STYLE(new ConversionOptions(true, true, true)),      // bounded, filtered to EPA nodes
    PLAIN(new ConversionOptions(false, false, false));       // raw triples, also used for RDF

    private final ConversionOptions options;

    ConversionMode(ConversionOptions options) {
        this.options = options;
    }

    public ConversionOptions getOptions() {
        return options;
    }
}
