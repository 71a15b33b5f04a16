package com.sattline.lint.loader;

import com.sattline.lint.diagnostics.DiagnosticsSink;
import com.sattline.lint.diagnostics.TraceEvent;
import com.sattline.lint.loader.ast.SourceLocation;
import com.sattline.lint.loader.grammar.SattLineLexer;
import com.sattline.lint.loader.grammar.SattLineParser;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.Vocabulary;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.antlr.v4.runtime.tree.ErrorNode;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

/** {@link SourceParser} backed by the generated ANTLR lexer and parser for {@code SattLine.g4}. */
public final class AntlrSourceParser implements SourceParser {

    private final DiagnosticsSink diagnostics;

    public AntlrSourceParser() {
        this(DiagnosticsSink.NONE);
    }

    public AntlrSourceParser(DiagnosticsSink diagnostics) {
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    @Override
    public ParseNode parse(String sourceName, String text) throws SattLineParseException {
        Objects.requireNonNull(sourceName, "sourceName");
        Objects.requireNonNull(text, "text");
        CharStream input = CharStreams.fromString(text, sourceName);

        SattLineLexer lexer = new SattLineLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);
        CommonTokenStream tokens = new CommonTokenStream(lexer);

        SattLineParser parser = new SattLineParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(ThrowingErrorListener.INSTANCE);
        boolean tracing = diagnostics.isDebugEnabled();
        if (tracing) {
            parser.addErrorListener(new TracingDiagnosticErrorListener(diagnostics, sourceName));
        }

        try {
            if (tracing) {
                tokens.fill();
                traceTokens(sourceName, tokens, lexer.getVocabulary());
                tokens.seek(0);
            }
            SattLineParser.SourceFileContext context = parser.sourceFile();
            return convert(context, parser.getRuleNames(), parser.getVocabulary(), sourceName);
        } catch (ThrowingErrorListener.SyntaxErrorCancellation ex) {
            throw new SattLineParseException(
                    ex.getMessage(), new SourceLocation(sourceName, ex.getLine(), ex.getColumn()), ex);
        } catch (ParseCancellationException ex) {
            throw new SattLineParseException(String.valueOf(ex.getMessage()), SourceLocation.of(sourceName, 0), ex);
        }
    }

    private ParseNode convert(ParseTree tree, String[] ruleNames, Vocabulary vocabulary, String sourceName)
            throws SattLineParseException {
        if (tree instanceof ErrorNode error) {
            Token symbol = error.getSymbol();
            throw new SattLineParseException(
                    "Unexpected input '" + symbol.getText() + "'",
                    new SourceLocation(sourceName, symbol.getLine(), symbol.getCharPositionInLine() + 1));
        }
        if (tree instanceof TerminalNode terminal) {
            Token symbol = terminal.getSymbol();
            return ParseNode.token(
                    symbolicName(vocabulary, symbol.getType()),
                    symbol.getText(),
                    symbol.getLine(),
                    symbol.getCharPositionInLine() + 1);
        }
        ParserRuleContext context = (ParserRuleContext) tree;
        List<ParseNode> children = new ArrayList<>(context.getChildCount());
        for (int i = 0; i < context.getChildCount(); i++) {
            ParseTree child = context.getChild(i);
            if (child instanceof TerminalNode terminal && terminal.getSymbol().getType() == Token.EOF) {
                continue;
            }
            children.add(convert(child, ruleNames, vocabulary, sourceName));
        }
        Token start = context.getStart();
        return ParseNode.rule(
                ruleNames[context.getRuleIndex()],
                start.getLine(),
                start.getCharPositionInLine() + 1,
                children);
    }

    private void traceTokens(String sourceName, CommonTokenStream tokens, Vocabulary vocabulary) {
        for (Token token : tokens.getTokens()) {
            String line =
                    String.format(
                            Locale.ROOT,
                            "%-20s @ %4d:%-3d -> %s",
                            symbolicName(vocabulary, token.getType()),
                            token.getLine(),
                            token.getCharPositionInLine(),
                            token.getText());
            diagnostics.trace(TraceEvent.debug(TraceEvent.Stage.PARSE, "[tokens] " + line, sourceName));
        }
    }

    private static String symbolicName(Vocabulary vocabulary, int type) {
        String symbolic = vocabulary.getSymbolicName(type);
        if (symbolic == null) {
            symbolic = String.format(Locale.ROOT, "#%d", type);
        }
        return symbolic;
    }
}
