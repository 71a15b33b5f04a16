package com.sattline.lint.diagnostics;

import java.util.Objects;

/**
 * Structured trace event emitted by the loader pipeline. Events carry enough identity (stage, source
 * name, line) for a front end to print them, but never contain pre-formatted user text beyond the
 * message itself.
 */
public final class TraceEvent {

    public enum Stage {
        PARSE,
        BUILD,
        RESOLVE,
        MERGE,
        ANALYZE
    }

    public enum Level {
        DEBUG,
        INFO,
        WARNING,
        ERROR
    }

    private final Stage stage;
    private final Level level;
    private final String message;
    private final String sourceName;
    private final int line;

    public TraceEvent(Stage stage, Level level, String message, String sourceName, int line) {
        this.stage = Objects.requireNonNull(stage, "stage");
        this.level = Objects.requireNonNull(level, "level");
        this.message = Objects.requireNonNull(message, "message");
        this.sourceName = sourceName == null ? "" : sourceName;
        this.line = line;
    }

    public static TraceEvent debug(Stage stage, String message, String sourceName) {
        return new TraceEvent(stage, Level.DEBUG, message, sourceName, 0);
    }

    public static TraceEvent info(Stage stage, String message, String sourceName) {
        return new TraceEvent(stage, Level.INFO, message, sourceName, 0);
    }

    public static TraceEvent warning(Stage stage, String message, String sourceName, int line) {
        return new TraceEvent(stage, Level.WARNING, message, sourceName, line);
    }

    public static TraceEvent error(Stage stage, String message, String sourceName, int line) {
        return new TraceEvent(stage, Level.ERROR, message, sourceName, line);
    }

    public Stage getStage() {
        return stage;
    }

    public Level getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    public String getSourceName() {
        return sourceName;
    }

    public int getLine() {
        return line;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append('[').append(stage).append("] ").append(message);
        if (!sourceName.isEmpty()) {
            builder.append(" (").append(sourceName);
            if (line > 0) {
                builder.append(':').append(line);
            }
            builder.append(')');
        }
        return builder.toString();
    }
}
