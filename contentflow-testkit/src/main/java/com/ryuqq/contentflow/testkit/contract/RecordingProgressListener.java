package com.ryuqq.contentflow.testkit.contract;

import com.ryuqq.contentflow.core.spi.ProgressListener;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * ProgressListener that records every event in delivery order.
 *
 * @author Contentflow Team
 * @since 1.0.0
 */
public class RecordingProgressListener implements ProgressListener {

    /**
     * One delivered progress event.
     *
     * @param phase progress phase value (e.g. "research_complete")
     * @param message human-readable message
     */
    public record Event(String phase, String message) {
    }

    private final List<Event> events = new CopyOnWriteArrayList<>();

    @Override
    public void onProgress(String phase, String message) {
        events.add(new Event(phase, message));
    }

    public List<Event> events() {
        return List.copyOf(events);
    }

    public List<String> phases() {
        return events.stream().map(Event::phase).toList();
    }

    public boolean hasPhase(String phase) {
        return events.stream().anyMatch(event -> event.phase().equals(phase));
    }

    public boolean anyMessageContains(String fragment) {
        return events.stream().anyMatch(event -> event.message() != null && event.message().contains(fragment));
    }

    public void clear() {
        events.clear();
    }
}
