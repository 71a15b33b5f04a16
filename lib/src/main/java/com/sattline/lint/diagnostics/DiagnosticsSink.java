package com.sattline.lint.diagnostics;

/**
 * Receives trace events from parsing, resolution, merging and analysis. A sink is passed into each
 * component explicitly so that runs stay independent of process-wide switches and can be inspected
 * in tests without capturing console output.
 */
@FunctionalInterface
public interface DiagnosticsSink {

    /** Sink that discards every event. */
    DiagnosticsSink NONE = event -> {};

    void trace(TraceEvent event);

    /**
     * Whether events at {@link TraceEvent.Level#DEBUG} are wanted. Producers use this to skip
     * building expensive debug payloads such as token dumps.
     */
    default boolean isDebugEnabled() {
        return false;
    }
}
