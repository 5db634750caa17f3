package org.helena.ast.grammar;

/**
 * Grammar-rule identity of a node. Decides which pattern the text of a node has to match.
 */
public enum NodeKind {
    KEYWORD("Keyword"),
    IDENTIFIER("Identifier"),
    TYPE_NAME("TypeName"),
    SPACING("Spacing"),
    NEWLINE("Newline"),
    LIST_SEPARATOR("ListSeparator"),
    OPERATION("Operation");

    private final String displayName;

    NodeKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
