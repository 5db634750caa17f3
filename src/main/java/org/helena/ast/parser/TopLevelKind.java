package org.helena.ast.parser;

/**
 * Productions the generator may find standing on their own at the top level of a source file,
 * in the order they are attempted.
 */
public enum TopLevelKind {
    FUNCTION("Function"),
    NEWLINE("Newline");

    private final String displayName;

    TopLevelKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
