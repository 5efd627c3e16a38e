package com.cenalert.core.episode;

import com.cenalert.core.model.AnnotatedRecord;
import com.cenalert.core.model.AnomalyEpisode;
import com.cenalert.core.model.DemandPattern;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link EpisodeExtractor}.
 */
class EpisodeExtractorTest {

    private static final LocalDate START = LocalDate.of(2023, 6, 1);

    @Test
    @DisplayName("No anomalous records yield no episodes")
    void shouldReturnEmptyWithoutAnomalies() {
        List<AnnotatedRecord> records = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            records.add(normal(i, 3));
        }

        assertThat(EpisodeExtractor.extract(records)).isEmpty();
        assertThat(EpisodeExtractor.extract(List.of())).isEmpty();
    }

    @Test
    @DisplayName("Each maximal run of anomalous records becomes one episode")
    void shouldSplitOnNormalRecords() {
        List<AnnotatedRecord> records = List.of(
                normal(0, 5),
                anomalous(1, 50, 20, 4.0),
                anomalous(2, 80, 20, 4.0),
                anomalous(3, 60, 20, 4.0),
                normal(4, 5),
                anomalous(5, 30, 10, 2.5),
                normal(6, 5));

        List<AnomalyEpisode> episodes = EpisodeExtractor.extract(records);

        assertThat(episodes).hasSize(2);

        AnomalyEpisode first = episodes.get(0);
        assertThat(first.getStart()).isEqualTo(START.plusDays(1));
        assertThat(first.getEnd()).isEqualTo(START.plusDays(3));
        assertThat(first.getPeak()).isEqualTo(START.plusDays(2));
        assertThat(first.getScore()).isEqualTo(4.0);
        assertThat(first.getImpact()).isCloseTo(190 - 60, within(1e-12));
        assertThat(first.length()).isEqualTo(3);

        AnomalyEpisode second = episodes.get(1);
        assertThat(second.getStart()).isEqualTo(second.getEnd());
        assertThat(second.getImpact()).isCloseTo(20, within(1e-12));
    }

    @Test
    @DisplayName("A gap in indices splits a run even without a normal record between")
    void shouldSplitOnIndexGap() {
        List<AnnotatedRecord> records = List.of(anomalous(3, 10, 1, 1), anomalous(5, 10, 1, 1));

        assertThat(EpisodeExtractor.extract(records)).hasSize(2);
    }

    @Test
    @DisplayName("The earliest of equal maxima is the peak")
    void shouldPickFirstPeak() {
        List<AnnotatedRecord> records = List.of(
                anomalous(0, 9, 1, 1), anomalous(1, 12, 1, 1), anomalous(2, 12, 1, 1));

        assertThat(EpisodeExtractor.extract(records).get(0).getPeak()).isEqualTo(START.plusDays(1));
    }

    @Test
    @DisplayName("Extraction is a pure function of its input")
    void shouldBeIdempotent() {
        List<AnnotatedRecord> records = List.of(
                anomalous(0, 9, 1, 1), normal(1, 1), anomalous(2, 12, 1, 1));

        assertThat(EpisodeExtractor.extract(records)).isEqualTo(EpisodeExtractor.extract(records));
        assertThatThrownBy(() -> EpisodeExtractor.extract(records).clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }

    private static AnnotatedRecord normal(int index, double value) {
        return AnnotatedRecord.builder()
                .index(index)
                .date(START.plusDays(index))
                .value(value)
                .score(0)
                .residual(0)
                .demandPattern(DemandPattern.SMOOTH)
                .build();
    }

    private static AnnotatedRecord anomalous(int index, double value, double threshold, double score) {
        return AnnotatedRecord.builder()
                .index(index)
                .date(START.plusDays(index))
                .value(value)
                .anomaly(true)
                .score(score)
                .residual(0)
                .threshold(threshold)
                .minScore(3)
                .demandPattern(DemandPattern.SMOOTH)
                .build();
    }
}
