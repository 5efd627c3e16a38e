package com.cenalert.core.episode;

import com.cenalert.core.model.AnnotatedRecord;
import com.cenalert.core.model.AnomalyEpisode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Groups consecutive anomalous records into {@link AnomalyEpisode}s.
 *
 * <p>
 * Records are expected in the order a lifecycle emits them; consecutive means
 * consecutive {@code index} values, so a single non-anomalous record between
 * two anomalous ones splits them into two episodes. The extraction is a pure
 * function of its input.
 * </p>
 *
 * @since 1.0.0
 */
public final class EpisodeExtractor {

    private EpisodeExtractor() {
        // utility class, not instantiable
    }

    /**
     * @param records annotated records of one run; must not be {@code null}
     * @return unmodifiable list of episodes in order of onset
     */
    public static List<AnomalyEpisode> extract(List<AnnotatedRecord> records) {
        Objects.requireNonNull(records, "records must not be null");

        List<AnomalyEpisode> episodes = new ArrayList<>();
        List<AnnotatedRecord> run = new ArrayList<>();
        for (AnnotatedRecord record : records) {
            if (!record.isAnomaly()) {
                continue;
            }
            if (!run.isEmpty() && record.getIndex() != run.get(run.size() - 1).getIndex() + 1) {
                episodes.add(summarize(run));
                run.clear();
            }
            run.add(record);
        }
        if (!run.isEmpty()) {
            episodes.add(summarize(run));
        }
        return Collections.unmodifiableList(episodes);
    }

    static AnomalyEpisode summarize(List<AnnotatedRecord> run) {
        AnnotatedRecord first = run.get(0);
        AnnotatedRecord last = run.get(run.size() - 1);

        AnnotatedRecord peak = first;
        double valueSum = 0;
        double thresholdSum = 0;
        for (AnnotatedRecord record : run) {
            if (record.getValue() > peak.getValue()) {
                peak = record;
            }
            valueSum += record.getValue();
            thresholdSum += record.getThreshold();
        }

        return new AnomalyEpisode(first.getIndex(), last.getIndex(), first.getDate(), last.getDate(),
                peak.getDate(), first.getScore(), first.getResidual(), valueSum - thresholdSum);
    }
}
