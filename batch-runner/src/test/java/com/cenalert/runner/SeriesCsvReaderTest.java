package com.cenalert.runner;

import com.cenalert.core.model.SeriesPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SeriesCsvReader}.
 */
class SeriesCsvReaderTest {

    private final SeriesCsvReader reader = new SeriesCsvReader();

    @Test
    @DisplayName("Should read a series with ISO dates")
    void shouldReadSeries() throws IOException, URISyntaxException {
        List<SeriesPoint> series = reader.readSeries(resource("series.csv"));

        assertThat(series).hasSize(41);
        assertThat(series.get(0)).isEqualTo(new SeriesPoint(LocalDate.of(2023, 1, 1), 0));
        assertThat(series.get(20)).isEqualTo(new SeriesPoint(LocalDate.of(2023, 1, 21), 5));
    }

    @Test
    @DisplayName("Should read events, ignoring extra columns")
    void shouldReadEvents() throws IOException, URISyntaxException {
        List<KnownEvent> events = reader.readEvents(resource("events.csv"));

        assertThat(events).containsExactly(
                new KnownEvent(LocalDate.of(2022, 11, 1), "Power", "ops-log"),
                new KnownEvent(LocalDate.of(2023, 1, 19), "Mobile data", "press"));
    }

    @Test
    @DisplayName("Should reject out-of-order dates")
    void shouldRejectUnorderedSeries(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("unordered.csv");
        Files.writeString(file, "date,value\n2023-01-02,1\n2023-01-01,2\n");

        assertThatThrownBy(() -> reader.readSeries(file))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("strictly increase");
    }

    @Test
    @DisplayName("Should reject a missing file")
    void shouldRejectMissingFile(@TempDir Path dir) {
        assertThatThrownBy(() -> reader.readSeries(dir.resolve("none.csv")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    static Path resource(String name) throws URISyntaxException {
        return Path.of(SeriesCsvReaderTest.class.getClassLoader().getResource(name).toURI());
    }
}
