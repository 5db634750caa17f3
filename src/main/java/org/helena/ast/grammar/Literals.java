package org.helena.ast.grammar;

import java.util.List;

/**
 * Fixed texts of the Helena grammar.
 */
public final class Literals {
    private Literals() {}

    public static final String FUNC = "func";
    public static final String OPENING_PARENTHESIS = "(";
    public static final String CLOSING_PARENTHESIS = ")";
    public static final String SCOPE_DELIMITER = ":";
    public static final String COMMA = ",";

    public static final String SPACE = " ";
    public static final String LIST_SEPARATOR = ", ";

    /**
     * Line terminator of the platform the compiler runs on. Chosen once, never per node.
     */
    public static final String NEWLINE = System.lineSeparator();

    /**
     * Literals a {@link NodeKind#KEYWORD} node may hold.
     */
    public static final List<String> KEYWORDS = List.of(FUNC,
                                                        OPENING_PARENTHESIS,
                                                        CLOSING_PARENTHESIS,
                                                        SCOPE_DELIMITER,
                                                        COMMA);
}
