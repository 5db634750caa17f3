package org.helena.ast.error;

import org.helena.ast.grammar.NodeKind;
import org.helena.ast.tree.Position;

import java.util.Objects;
import java.util.Optional;

/**
 * Thrown when the text proposed for a node does not match the pattern of its kind.
 * The candidate node is never created; enclosing expectations let it propagate unchanged.
 *
 * <p>Factories take the position the rejected node would have started at, or {@code null} when the text was
 * validated outside of a tree.
 */
public final class PatternMismatch extends Exception {
    private static final long serialVersionUID = 1L;

    private final NodeKind kind;
    private final String text;
    private final Position position;

    private PatternMismatch(NodeKind kind, String text, Position position, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.text = Objects.requireNonNull(text, "text");
        this.position = position;
    }

    /**
     * Identifier expected but nothing was given.
     */
    public static PatternMismatch emptyIdentifier(Position position) {
        return new PatternMismatch(NodeKind.IDENTIFIER, "", position, "Expected an identifier.");
    }

    /**
     * Identifier containing characters outside its charset.
     */
    public static PatternMismatch invalidIdentifier(String text, Position position) {
        return new PatternMismatch(NodeKind.IDENTIFIER,
                                   text,
                                   position,
                                   text + " is invalid. An identifier can only contain letters A–Z and digits.");
    }

    public static PatternMismatch emptyTypeName(Position position) {
        return new PatternMismatch(NodeKind.TYPE_NAME, "", position, "Expected a type name.");
    }

    /**
     * Generic mismatch between a text and the pattern expected in its place.
     */
    public static PatternMismatch unmatched(NodeKind kind, String text, String pattern, Position position) {
        return new PatternMismatch(kind,
                                   text,
                                   position,
                                   "Textual representation of node (\"" + escape(text) + "\") does not match \""
                                   + escape(pattern) + "\".");
    }

    public NodeKind kind() {
        return kind;
    }

    public String text() {
        return text;
    }

    /**
     * Position the rejected node would have started at, when known.
     */
    public Optional<Position> position() {
        return Optional.ofNullable(position);
    }

    private static String escape(String value) {
        return value.replace("\r", "\\r")
                    .replace("\n", "\\n")
                    .replace("\t", "\\t");
    }
}
