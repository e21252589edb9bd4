package com.interpolar.medicationreview.service;

import com.interpolar.medicationreview.constants.TripleConstants;
import com.interpolar.medicationreview.model.RawTable;
import com.interpolar.medicationreview.model.Triple;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.rdf4j.model.Model;
import org.eclipse.rdf4j.model.impl.LinkedHashModel;
import org.eclipse.rdf4j.rio.RDFFormat;
import org.eclipse.rdf4j.rio.Rio;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * RDF/XML export of rater tables
 *
 * Uses the plain conversion: same normalization and multi-value expansion,
 * no start/end nodes and no EPA filtering.
 */
@Slf4j
public class RdfExporter {

    private final TableConversionDriver driver;
    private final StatementMapper statementMapper;

    public RdfExporter(String uriPrefix) {
        this(RdfConverters.uriMapper(uriPrefix != null ? uriPrefix : TripleConstants.Rdf.DEFAULT_URI_PREFIX));
    }

    public RdfExporter(StatementMapper statementMapper) {
        this.driver = new TableConversionDriver(new RowConversionEngine(ConversionMode.PLAIN, null));
        this.statementMapper = statementMapper;
    }

    public Model buildModel(RawTable table) {
        Model model = new LinkedHashModel();
        addToModel(model, table);
        return model;
    }

    public Model buildModel(List<RawTable> tables) {
        Model model = new LinkedHashModel();
        for (RawTable table : tables) {
            addToModel(model, table);
        }
        return model;
    }

    public String toRdfXml(List<RawTable> tables) {
        StringWriter writer = new StringWriter();
        write(buildModel(tables), writer);
        return writer.toString();
    }

    public void write(Model model, Writer writer) {
        Rio.write(model, writer, RDFFormat.RDFXML);
    }

    /**
     * One &lt;rater&gt;.rdf file per table
     */
    public List<Path> writeFiles(List<RawTable> tables, Path outputDir) throws IOException {
        Files.createDirectories(outputDir);
        List<Path> written = new ArrayList<>();
        for (RawTable table : tables) {
            Path file = outputDir.resolve(table.getRaterLabel() + TripleConstants.Rdf.FILE_EXTENSION);
            Model model = buildModel(table);
            try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                write(model, writer);
            }
            log.info("[RdfExport] -> {} statements of {} written to {}", model.size(), table.getRaterLabel(), file);
            written.add(file);
        }
        return written;
    }

    private void addToModel(Model model, RawTable table) {
        for (Triple triple : driver.convertTable(table)) {
            model.add(statementMapper.toStatement(triple));
        }
    }
}
