package com.cenalert.runner;

import com.cenalert.core.model.AnomalyEpisode;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Tags anomaly episodes with the nearest known event.
 *
 * <p>
 * Each episode's start date is joined to the closest event start date in
 * either direction. When two events are equally close the earlier one wins.
 * With no events at all every episode gets proximity +∞ and the cause
 * {@value #NO_EVENTS_CAUSE}.
 * </p>
 *
 * @since 1.0.0
 */
public final class EventMatcher {

    public static final String NO_EVENTS_CAUSE = "No known events for this country";

    /** Episodes within this many days of an event count as explainable. */
    public static final int EXPLAINABLE_DAYS = 6;

    private final List<KnownEvent> events;

    /**
     * @param events known events in any order; must not be {@code null}
     * @throws IllegalArgumentException if an event has no start date
     */
    public EventMatcher(List<KnownEvent> events) {
        Objects.requireNonNull(events, "events must not be null");
        for (KnownEvent event : events) {
            if (event.getStartDate() == null) {
                throw new IllegalArgumentException("Event without start_date: " + event);
            }
        }
        this.events = new ArrayList<>(events);
        this.events.sort(Comparator.comparing(KnownEvent::getStartDate));
    }

    /**
     * @param episodes episodes to tag
     * @return one matched episode per input episode, in input order
     */
    public List<MatchedEpisode> matchAll(List<AnomalyEpisode> episodes) {
        List<MatchedEpisode> matched = new ArrayList<>(episodes.size());
        for (AnomalyEpisode episode : episodes) {
            matched.add(match(episode));
        }
        return matched;
    }

    /**
     * @param episode the episode to tag
     * @return the episode with its nearest event
     */
    public MatchedEpisode match(AnomalyEpisode episode) {
        if (events.isEmpty()) {
            return new MatchedEpisode(episode, Double.POSITIVE_INFINITY, NO_EVENTS_CAUSE, "");
        }
        KnownEvent nearest = nearest(episode.getStart());
        long proximity = ChronoUnit.DAYS.between(nearest.getStartDate(), episode.getStart());
        return new MatchedEpisode(episode, proximity, nearest.getAffectedServices(), nearest.getSource());
    }

    private KnownEvent nearest(LocalDate date) {
        // last event on or before date, first event after it
        int low = 0;
        int high = events.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (events.get(mid).getStartDate().isAfter(date)) {
                high = mid;
            } else {
                low = mid + 1;
            }
        }
        KnownEvent before = low > 0 ? events.get(low - 1) : null;
        KnownEvent after = low < events.size() ? events.get(low) : null;
        if (before == null) {
            return after;
        }
        if (after == null) {
            return before;
        }
        long toBefore = ChronoUnit.DAYS.between(before.getStartDate(), date);
        long toAfter = ChronoUnit.DAYS.between(date, after.getStartDate());
        return toBefore <= toAfter ? before : after;
    }
}
