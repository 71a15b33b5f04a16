package com.sattline.lint.loader;

/** Turns the raw text of one source file into a {@link ParseNode} tree. */
public interface SourceParser {

    /**
     * @param sourceName Logical name or path used to tag locations in errors.
     * @param text Full file contents.
     * @return The root of the parse tree, tagged {@code sourceFile}.
     * @throws SattLineParseException if the text does not conform to the grammar.
     */
    ParseNode parse(String sourceName, String text) throws SattLineParseException;
}
