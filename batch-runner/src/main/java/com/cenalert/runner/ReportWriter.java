package com.cenalert.runner;

import com.cenalert.core.model.AnnotatedRecord;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes a {@link SeriesReport} as three headed CSV files.
 *
 * <ul>
 * <li>{@value #ANNOTATED_FILE}: one row per input point</li>
 * <li>{@value #ANOMALIES_FILE}: every episode with its nearest event</li>
 * <li>{@value #EXPLAINABLE_FILE}: episodes close to an event</li>
 * </ul>
 *
 * <p>
 * Undefined statistics are written as {@code NaN}, unbounded ones as
 * {@code Infinity}. Dates are ISO-8601.
 * </p>
 *
 * @since 1.0.0
 */
public final class ReportWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ReportWriter.class);

    public static final String ANNOTATED_FILE = "annotated.csv";
    public static final String ANOMALIES_FILE = "anomalies.csv";
    public static final String EXPLAINABLE_FILE = "explainable.csv";

    private final CsvSchema recordSchema;
    private final CsvSchema episodeSchema;
    private final ObjectWriter recordWriter;
    private final ObjectWriter episodeWriter;

    public ReportWriter() {
        CsvMapper mapper = new CsvMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        this.recordSchema = mapper.schemaFor(AnnotatedRecord.class).withHeader();
        this.episodeSchema = mapper.schemaFor(MatchedEpisode.class).withHeader();
        this.recordWriter = mapper.writerFor(AnnotatedRecord.class).with(recordSchema);
        this.episodeWriter = mapper.writerFor(MatchedEpisode.class).with(episodeSchema);
    }

    /**
     * Write all three files into {@code directory}, creating it if needed.
     *
     * @param report    the report to write
     * @param directory target directory
     * @throws IOException if the directory or a file cannot be written
     */
    public void write(SeriesReport report, Path directory) throws IOException {
        Files.createDirectories(directory);
        writeAll(recordWriter, recordSchema, report.getRecords(), directory.resolve(ANNOTATED_FILE));
        writeAll(episodeWriter, episodeSchema, report.getAnomalies(), directory.resolve(ANOMALIES_FILE));
        writeAll(episodeWriter, episodeSchema, report.getExplainable(), directory.resolve(EXPLAINABLE_FILE));
        LOG.info("Wrote report for [{}] to {}", report.getName(), directory);
    }

    private static void writeAll(ObjectWriter writer, CsvSchema schema, List<?> rows, Path file)
            throws IOException {
        if (rows.isEmpty()) {
            // the encoder only emits the header in front of a first row
            Files.writeString(file, header(schema), StandardCharsets.UTF_8);
            return;
        }
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                SequenceWriter sequence = writer.writeValues(out)) {
            sequence.writeAll(rows);
        }
    }

    private static String header(CsvSchema schema) {
        List<String> names = new ArrayList<>(schema.size());
        for (CsvSchema.Column column : schema) {
            names.add(column.getName());
        }
        return String.join(String.valueOf(schema.getColumnSeparator()), names)
                + new String(schema.getLineSeparator());
    }
}
