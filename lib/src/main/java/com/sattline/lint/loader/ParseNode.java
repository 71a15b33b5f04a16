package com.sattline.lint.loader;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Parser-independent concrete syntax tree. Rule nodes are tagged with the grammar rule name and
 * have children; token nodes are tagged with the token's symbolic name and carry its text.
 */
public final class ParseNode {
    private final String tag;
    private final String text;
    private final int line;
    private final int column;
    private final List<ParseNode> children;

    private ParseNode(String tag, String text, int line, int column, List<ParseNode> children) {
        this.tag = Objects.requireNonNull(tag, "tag");
        this.text = text;
        this.line = line;
        this.column = column;
        this.children = List.copyOf(children);
    }

    public static ParseNode rule(String tag, int line, int column, List<ParseNode> children) {
        return new ParseNode(tag, null, line, column, children);
    }

    /** Rule node positioned at its first child, or at line 0 when it has none. */
    public static ParseNode rule(String tag, List<ParseNode> children) {
        if (children.isEmpty()) {
            return new ParseNode(tag, null, 0, 0, children);
        }
        ParseNode first = children.get(0);
        return new ParseNode(tag, null, first.line, first.column, children);
    }

    public static ParseNode token(String tag, String text, int line, int column) {
        return new ParseNode(tag, Objects.requireNonNull(text, "text"), line, column, List.of());
    }

    public String getTag() {
        return tag;
    }

    public boolean isToken() {
        return text != null;
    }

    /** Token text; for rule nodes the concatenated text of all tokens below. */
    public String getText() {
        if (text != null) {
            return text;
        }
        StringBuilder builder = new StringBuilder();
        for (ParseNode child : children) {
            builder.append(child.getText());
        }
        return builder.toString();
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public List<ParseNode> getChildren() {
        return children;
    }

    public List<ParseNode> getChildren(String childTag) {
        List<ParseNode> matches = new ArrayList<>();
        for (ParseNode child : children) {
            if (child.tag.equals(childTag)) {
                matches.add(child);
            }
        }
        return matches;
    }

    public Optional<ParseNode> findChild(String childTag) {
        for (ParseNode child : children) {
            if (child.tag.equals(childTag)) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    public boolean hasChild(String childTag) {
        return findChild(childTag).isPresent();
    }

    /** Indented multi-line rendering, one node per line. */
    public String pretty() {
        StringBuilder builder = new StringBuilder();
        appendPretty(builder, 0);
        return builder.toString();
    }

    private void appendPretty(StringBuilder builder, int depth) {
        builder.append("  ".repeat(depth)).append(tag);
        if (text != null) {
            builder.append(" '").append(text).append('\'');
        }
        builder.append('\n');
        for (ParseNode child : children) {
            child.appendPretty(builder, depth + 1);
        }
    }

    @Override
    public String toString() {
        return text != null ? tag + "'" + text + "'" : tag + children;
    }
}
