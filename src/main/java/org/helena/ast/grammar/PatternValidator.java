package org.helena.ast.grammar;

import org.helena.ast.error.PatternMismatch;
import org.helena.ast.tree.Position;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Table of the patterns each {@link NodeKind} has to match.
 */
public final class PatternValidator {
    private PatternValidator() {}

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9]+");
    private static final Pattern TYPE_NAME = Pattern.compile("[A-Za-z0-9_]+(\\.[A-Za-z0-9_]+)*(\\[])*");
    private static final Pattern OPERATION = Pattern.compile("\\w+");

    /**
     * Validate {@code text} against the pattern of {@code kind}.
     *
     * @return the text itself when it matches
     * @throws PatternMismatch when it does not
     */
    public static String validate(NodeKind kind, String text) throws PatternMismatch {
        return check(kind, text, null);
    }

    /**
     * Same as {@link #validate(NodeKind, String)}, reporting {@code position} on mismatch.
     */
    public static String validate(NodeKind kind, String text, Position position) throws PatternMismatch {
        return check(kind, text, Objects.requireNonNull(position, "position"));
    }

    public static String validateIdentifier(String text) throws PatternMismatch {
        return validate(NodeKind.IDENTIFIER, text);
    }

    /**
     * Validate {@code text} against the exact literal a rule expects at this point.
     */
    public static String validateLiteral(String literal, String text) throws PatternMismatch {
        return literal(literal, text, null);
    }

    /**
     * Same as {@link #validateLiteral(String, String)}, reporting {@code position} on mismatch.
     */
    public static String validateLiteral(String literal, String text, Position position) throws PatternMismatch {
        return literal(literal, text, Objects.requireNonNull(position, "position"));
    }

    /**
     * Check {@code text} against its kind without raising.
     */
    public static boolean matches(NodeKind kind, String text) {
        try {
            validate(kind, text);
            return true;
        } catch (PatternMismatch mismatch) {
            return false;
        }
    }

    // === Checks ===

    private static String literal(String literal, String text, Position position) throws PatternMismatch {
        requireEqual(literal, NodeKind.KEYWORD, text, position);
        return check(NodeKind.KEYWORD, text, position);
    }

    private static String check(NodeKind kind, String text, Position position) throws PatternMismatch {
        switch (kind) {
            case KEYWORD -> {
                if (!Literals.KEYWORDS.contains(text)) {
                    throw PatternMismatch.unmatched(kind, text, String.join(" | ", Literals.KEYWORDS), position);
                }
            }
            case IDENTIFIER -> {
                if (text.isEmpty()) {
                    throw PatternMismatch.emptyIdentifier(position);
                }
                if (!IDENTIFIER.matcher(text).matches()) {
                    throw PatternMismatch.invalidIdentifier(text, position);
                }
            }
            case TYPE_NAME -> {
                if (text.isEmpty()) {
                    throw PatternMismatch.emptyTypeName(position);
                }
                requireMatch(TYPE_NAME, kind, text, position);
            }
            case SPACING -> requireEqual(Literals.SPACE, kind, text, position);
            case NEWLINE -> requireEqual(Literals.NEWLINE, kind, text, position);
            case LIST_SEPARATOR -> requireEqual(Literals.LIST_SEPARATOR, kind, text, position);
            case OPERATION -> requireMatch(OPERATION, kind, text, position);
        }
        return text;
    }

    private static void requireEqual(String expected, NodeKind kind, String text, Position position)
            throws PatternMismatch {
        if (!expected.equals(text)) {
            throw PatternMismatch.unmatched(kind, text, expected, position);
        }
    }

    private static void requireMatch(Pattern pattern, NodeKind kind, String text, Position position)
            throws PatternMismatch {
        if (!pattern.matcher(text).matches()) {
            throw PatternMismatch.unmatched(kind, text, pattern.pattern(), position);
        }
    }
}
