package com.interpolar.medicationreview.config;

import com.interpolar.medicationreview.service.NodeReferenceTable;
import com.interpolar.medicationreview.service.io.NodeReferenceLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Paths;

/**
 * EPA node reference table, loaded once at startup
 */
@Slf4j
@Configuration
public class NodeReferenceConfig {

    @Value("${triple-converter.node-reference-path:}")
    private String path;

    @Value("${triple-converter.node-reference-name-column:Name}")
    private String nameColumn;

    @Value("${triple-converter.node-reference-flag-column:node_of_interest}")
    private String flagColumn;

    @Bean
    public NodeReferenceTable nodeReferenceTable() {
        if (path == null || path.trim().isEmpty()) {
            log.warn("[NodeReference] -> no node reference table configured, EPA filtering drops every non-outcome target");
            return NodeReferenceTable.empty();
        }
        try {
            return NodeReferenceLoader.load(Paths.get(path.trim()), nameColumn, flagColumn);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot load node reference table " + path, e);
        }
    }
}
