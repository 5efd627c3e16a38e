package com.cenalert.runner;

import com.cenalert.core.model.AnomalyEpisode;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.LocalDate;
import java.util.Objects;

/**
 * An {@link AnomalyEpisode} tagged with the nearest {@link KnownEvent}.
 *
 * <p>
 * {@code proximity} is the episode start minus the event start, in days:
 * positive when the event preceded the episode. It is +∞ when there were no
 * events to match against.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "start", "end", "peak", "score", "residual", "impact", "proximity", "cause", "who" })
public final class MatchedEpisode {

    private final AnomalyEpisode episode;
    private final double proximity;
    private final String cause;
    private final String who;

    /**
     * @param episode   the episode; must not be {@code null}
     * @param proximity signed distance in days to the matched event
     * @param cause     services affected by the matched event
     * @param who       source that reported the matched event
     */
    public MatchedEpisode(AnomalyEpisode episode, double proximity, String cause, String who) {
        this.episode = Objects.requireNonNull(episode, "episode must not be null");
        this.proximity = proximity;
        this.cause = cause;
        this.who = who;
    }

    /**
     * @param window maximum distance in days, inclusive
     * @return {@code true} if the matched event lies within {@code window}
     *         days of the episode start
     */
    public boolean isWithin(int window) {
        return Math.abs(proximity) <= window;
    }

    @JsonIgnore
    public AnomalyEpisode getEpisode() {
        return episode;
    }

    public LocalDate getStart() {
        return episode.getStart();
    }

    public LocalDate getEnd() {
        return episode.getEnd();
    }

    public LocalDate getPeak() {
        return episode.getPeak();
    }

    public double getScore() {
        return episode.getScore();
    }

    public double getResidual() {
        return episode.getResidual();
    }

    public double getImpact() {
        return episode.getImpact();
    }

    public double getProximity() {
        return proximity;
    }

    public String getCause() {
        return cause;
    }

    public String getWho() {
        return who;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MatchedEpisode that))
            return false;
        return Double.compare(proximity, that.proximity) == 0
                && episode.equals(that.episode)
                && Objects.equals(cause, that.cause)
                && Objects.equals(who, that.who);
    }

    @Override
    public int hashCode() {
        return Objects.hash(episode, proximity, cause, who);
    }

    @Override
    public String toString() {
        return "MatchedEpisode{start=" + getStart() + ", end=" + getEnd() + ", impact=" + getImpact()
                + ", proximity=" + proximity + ", cause='" + cause + "', who='" + who + "'}";
    }
}
