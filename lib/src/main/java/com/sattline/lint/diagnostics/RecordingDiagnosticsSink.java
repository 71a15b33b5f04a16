package com.sattline.lint.diagnostics;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/** Collects trace events in memory. Not thread-safe. */
public final class RecordingDiagnosticsSink implements DiagnosticsSink {

    private final List<TraceEvent> events = new ArrayList<>();
    private final boolean debugEnabled;

    public RecordingDiagnosticsSink() {
        this(false);
    }

    public RecordingDiagnosticsSink(boolean debugEnabled) {
        this.debugEnabled = debugEnabled;
    }

    @Override
    public void trace(TraceEvent event) {
        events.add(event);
    }

    @Override
    public boolean isDebugEnabled() {
        return debugEnabled;
    }

    public List<TraceEvent> getEvents() {
        return List.copyOf(events);
    }

    public List<TraceEvent> getEvents(TraceEvent.Stage stage) {
        return events.stream().filter(event -> event.getStage() == stage).collect(Collectors.toList());
    }

    public List<TraceEvent> drain() {
        List<TraceEvent> drained = new ArrayList<>(events);
        events.clear();
        return drained;
    }
}
