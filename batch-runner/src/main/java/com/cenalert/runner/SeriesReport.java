package com.cenalert.runner;

import com.cenalert.core.model.AnnotatedRecord;

import java.util.List;
import java.util.Objects;

/**
 * Everything one series run produces: the annotated audit trail, the matched
 * episodes ordered by impact, and the subset explainable by a nearby event.
 *
 * @since 1.0.0
 */
public final class SeriesReport {

    private final String name;
    private final List<AnnotatedRecord> records;
    private final List<MatchedEpisode> anomalies;
    private final List<MatchedEpisode> explainable;

    SeriesReport(String name, List<AnnotatedRecord> records, List<MatchedEpisode> anomalies,
            List<MatchedEpisode> explainable) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.records = List.copyOf(records);
        this.anomalies = List.copyOf(anomalies);
        this.explainable = List.copyOf(explainable);
    }

    public String getName() {
        return name;
    }

    public List<AnnotatedRecord> getRecords() {
        return records;
    }

    /**
     * @return matched episodes, ascending by impact
     */
    public List<MatchedEpisode> getAnomalies() {
        return anomalies;
    }

    /**
     * @return matched episodes within {@value EventMatcher#EXPLAINABLE_DAYS}
     *         days of an event, ascending by impact
     */
    public List<MatchedEpisode> getExplainable() {
        return explainable;
    }

    public double totalImpact() {
        return anomalies.stream().mapToDouble(MatchedEpisode::getImpact).sum();
    }

    @Override
    public String toString() {
        return "SeriesReport{name='" + name + "', records=" + records.size() + ", anomalies=" + anomalies.size()
                + ", explainable=" + explainable.size() + '}';
    }
}
