package com.sattline.lint.diagnostics;

import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/** Forwards trace events to {@code java.util.logging}, one logger per pipeline stage. */
public final class LoggingDiagnosticsSink implements DiagnosticsSink {

    private static final String LOGGER_PREFIX = "com.sattline.lint.";

    @Override
    public void trace(TraceEvent event) {
        Logger logger = loggerFor(event.getStage());
        Level level = toLevel(event.getLevel());
        if (logger.isLoggable(level)) {
            logger.log(level, event.toString());
        }
    }

    @Override
    public boolean isDebugEnabled() {
        return Logger.getLogger(LOGGER_PREFIX + "parse").isLoggable(Level.FINE);
    }

    private static Logger loggerFor(TraceEvent.Stage stage) {
        return Logger.getLogger(LOGGER_PREFIX + stage.name().toLowerCase(Locale.ROOT));
    }

    private static Level toLevel(TraceEvent.Level level) {
        return switch (level) {
            case DEBUG -> Level.FINE;
            case INFO -> Level.INFO;
            case WARNING -> Level.WARNING;
            case ERROR -> Level.SEVERE;
        };
    }
}
