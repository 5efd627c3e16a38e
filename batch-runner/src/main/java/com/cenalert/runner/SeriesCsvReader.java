package com.cenalert.runner;

import com.cenalert.core.model.SeriesPoint;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Reads series and event tables from headed CSV files.
 *
 * <p>
 * A series file has the columns {@code date} ({@code yyyy-MM-dd}) and
 * {@code value}, one row per time step in strictly increasing date order.
 * Extra columns are ignored.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeriesCsvReader {

    private static final Logger LOG = LoggerFactory.getLogger(SeriesCsvReader.class);

    private final ObjectReader seriesReader;
    private final ObjectReader eventReader;

    public SeriesCsvReader() {
        CsvMapper mapper = new CsvMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        CsvSchema headed = CsvSchema.emptySchema().withHeader();
        this.seriesReader = mapper.readerFor(SeriesPoint.class).with(headed);
        this.eventReader = mapper.readerFor(KnownEvent.class).with(headed);
    }

    /**
     * @param path series CSV; must not be {@code null}
     * @return points in file order
     * @throws IllegalArgumentException if the file does not exist, a row has
     *                                  no date, or dates do not strictly
     *                                  increase
     * @throws IOException              if the file cannot be read or parsed
     */
    public List<SeriesPoint> readSeries(Path path) throws IOException {
        List<SeriesPoint> points = readAll(seriesReader, path, "Series");
        for (int i = 0; i < points.size(); i++) {
            SeriesPoint point = points.get(i);
            if (point.getDate() == null) {
                throw new IllegalArgumentException("Row " + i + " of " + path + " has no date");
            }
            if (i > 0 && !point.getDate().isAfter(points.get(i - 1).getDate())) {
                throw new IllegalArgumentException("Series dates must strictly increase in " + path
                        + ": " + points.get(i - 1).getDate() + " then " + point.getDate());
            }
        }
        LOG.debug("Read {} point(s) from {}", points.size(), path);
        return points;
    }

    /**
     * @param path events CSV; must not be {@code null}
     * @return events in file order
     * @throws IllegalArgumentException if the file does not exist
     * @throws IOException              if the file cannot be read or parsed
     */
    public List<KnownEvent> readEvents(Path path) throws IOException {
        List<KnownEvent> events = readAll(eventReader, path, "Events");
        LOG.debug("Read {} event(s) from {}", events.size(), path);
        return events;
    }

    private static <T> List<T> readAll(ObjectReader reader, Path path, String what) throws IOException {
        Objects.requireNonNull(path, what + " path must not be null");
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException(what + " file not found: " + path);
        }
        try (MappingIterator<T> rows = reader.readValues(path.toFile())) {
            return rows.readAll();
        }
    }
}
