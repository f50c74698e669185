package com.example.nfse.retrieval.support;

import com.example.nfse.retrieval.model.ManifestEntry;
import com.univocity.parsers.csv.CsvParser;
import com.univocity.parsers.csv.CsvParserSettings;
import com.univocity.parsers.csv.CsvWriterSettings;
import lombok.extern.slf4j.Slf4j;
import org.apache.camel.dataformat.univocity.UniVocityCsvDataFormat;
import org.springframework.stereotype.Component;

/** Parser and writer settings for run manifests. */
@Slf4j
@Component
public class CamelCsvParserFactory extends UniVocityCsvDataFormat {

    private static final int MAX_CHARS_PER_COLUMN = 4096;

    public CamelCsvParserFactory() {
        setHeaderExtractionEnabled(false);
        setSkipEmptyLines(true);
        setIgnoreLeadingWhitespaces(true);
        setIgnoreTrailingWhitespaces(true);
        setLineSeparator("\n");
        setLazyLoad(true);
        setAsMap(false);
    }

    public CsvParser newParser() {
        CsvParserSettings settings = createParserSettings();
        configureParserSettings(settings);
        settings.setColumnReorderingEnabled(false);
        settings.setMaxCharsPerColumn(MAX_CHARS_PER_COLUMN);
        settings.setMaxColumns(ManifestEntry.HEADERS.length + 4);
        settings.setNullValue("");
        settings.getFormat().setLineSeparator("\n");
        log.debug("Created manifest CsvParser maxCharsPerColumn={} lazyLoad={}",
                settings.getMaxCharsPerColumn(), isLazyLoad());
        return createParser(settings);
    }

    public CsvWriterSettings newWriterSettings() {
        CsvWriterSettings settings = new CsvWriterSettings();
        settings.setNullValue("");
        settings.getFormat().setLineSeparator("\n");
        return settings;
    }
}
