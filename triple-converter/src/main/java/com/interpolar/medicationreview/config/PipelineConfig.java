package com.interpolar.medicationreview.config;

import com.interpolar.medicationreview.service.io.CsvTripleSink;
import com.interpolar.medicationreview.service.io.TableSource;
import com.interpolar.medicationreview.service.io.WorkbookTableSource;
import com.interpolar.medicationreview.service.io.WorkbookTripleSink;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * File pipeline: workbook in, workbook and CSV out
 */
@Configuration
public class PipelineConfig {

    @Bean
    public TableSource tableSource(TripleConverterConfig config) {
        return new WorkbookTableSource(
            toPath(config.getInputWorkbook()),
            config.getInputSheets(),
            config.getFirstSheetIndex(),
            config.isHeaderRow()
        );
    }

    @Bean
    public WorkbookTripleSink workbookTripleSink(TripleConverterConfig config) {
        return new WorkbookTripleSink(toPath(config.getOutputWorkbook()));
    }

    @Bean
    public CsvTripleSink csvTripleSink(TripleConverterConfig config) {
        return new CsvTripleSink(toPath(config.getCsvOutputDir()));
    }

    static Path toPath(String value) {
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        return Paths.get(value.trim());
    }
}
