package com.sattline.lint.loader;

import com.sattline.lint.diagnostics.DiagnosticsSink;
import com.sattline.lint.diagnostics.TraceEvent;
import java.util.BitSet;
import org.antlr.v4.runtime.DiagnosticErrorListener;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.atn.ATNConfigSet;
import org.antlr.v4.runtime.dfa.DFA;
import org.antlr.v4.runtime.misc.Interval;

/**
 * Diagnostic listener that records parser ambiguity reports without turning them into errors.
 *
 * <p>ANTLR's {@link DiagnosticErrorListener} reports through {@link Parser#notifyErrorListeners(String)},
 * which would reach {@link ThrowingErrorListener} and abort the parse. This subclass keeps the same
 * formatting but sends the text to a {@link DiagnosticsSink} instead.</p>
 */
final class TracingDiagnosticErrorListener extends DiagnosticErrorListener {

    private final DiagnosticsSink diagnostics;
    private final String sourceName;

    TracingDiagnosticErrorListener(DiagnosticsSink diagnostics, String sourceName) {
        super(true);
        this.diagnostics = diagnostics;
        this.sourceName = sourceName;
    }

    @Override
    public void reportAmbiguity(
            Parser recognizer,
            DFA dfa,
            int startIndex,
            int stopIndex,
            boolean exact,
            BitSet ambigAlts,
            ATNConfigSet configs) {
        if (exactOnly && !exact) {
            return;
        }
        String decision = getDecisionDescription(recognizer, dfa);
        BitSet conflicting = getConflictingAlts(ambigAlts, configs);
        String input = recognizer.getTokenStream().getText(Interval.of(startIndex, stopIndex));
        record(String.format("reportAmbiguity d=%s: ambigAlts=%s, input='%s'", decision, conflicting, input));
    }

    @Override
    public void reportAttemptingFullContext(
            Parser recognizer,
            DFA dfa,
            int startIndex,
            int stopIndex,
            BitSet conflictingAlts,
            ATNConfigSet configs) {
        String decision = getDecisionDescription(recognizer, dfa);
        String input = recognizer.getTokenStream().getText(Interval.of(startIndex, stopIndex));
        record(String.format("reportAttemptingFullContext d=%s, input='%s'", decision, input));
    }

    @Override
    public void reportContextSensitivity(
            Parser recognizer,
            DFA dfa,
            int startIndex,
            int stopIndex,
            int prediction,
            ATNConfigSet configs) {
        String decision = getDecisionDescription(recognizer, dfa);
        String input = recognizer.getTokenStream().getText(Interval.of(startIndex, stopIndex));
        record(String.format("reportContextSensitivity d=%s, input='%s'", decision, input));
    }

    private void record(String message) {
        diagnostics.trace(TraceEvent.debug(TraceEvent.Stage.PARSE, "[diagnostic] " + message, sourceName));
    }
}
