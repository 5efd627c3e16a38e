package com.cenalert.runner;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A known real-world event (outage, disruption, maintenance) that may
 * explain an anomaly.
 *
 * <p>
 * Read from an events CSV with at least the columns {@code start_date},
 * {@code affected_services} and {@code source}; other columns are ignored.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class KnownEvent {

    @JsonProperty("start_date")
    private LocalDate startDate;

    @JsonProperty("affected_services")
    private String affectedServices;

    private String source;

    /** No-arg constructor required by Jackson. */
    public KnownEvent() {
    }

    public KnownEvent(LocalDate startDate, String affectedServices, String source) {
        this.startDate = startDate;
        this.affectedServices = affectedServices;
        this.source = source;
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public void setStartDate(LocalDate startDate) {
        this.startDate = startDate;
    }

    public String getAffectedServices() {
        return affectedServices;
    }

    public void setAffectedServices(String affectedServices) {
        this.affectedServices = affectedServices;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof KnownEvent that))
            return false;
        return Objects.equals(startDate, that.startDate)
                && Objects.equals(affectedServices, that.affectedServices)
                && Objects.equals(source, that.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(startDate, affectedServices, source);
    }

    @Override
    public String toString() {
        return "KnownEvent{startDate=" + startDate + ", affectedServices='" + affectedServices
                + "', source='" + source + "'}";
    }
}
