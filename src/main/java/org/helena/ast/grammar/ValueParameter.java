package org.helena.ast.grammar;

import java.util.Objects;

/**
 * Declaration of a parameter passed into a function as a value.
 *
 * @param typeName   name of the type of the value as written by the user, qualified or not
 * @param spacing    text between the type and the identifier
 * @param identifier name given to the parameter
 */
public record ValueParameter(String typeName, String spacing, String identifier) {
    public ValueParameter {
        Objects.requireNonNull(typeName, "typeName");
        Objects.requireNonNull(spacing, "spacing");
        Objects.requireNonNull(identifier, "identifier");
    }

    public static ValueParameter of(String typeName, String identifier) {
        return new ValueParameter(typeName, Literals.SPACE, identifier);
    }

    /**
     * Source text covered by this parameter.
     */
    public String text() {
        return typeName + spacing + identifier;
    }
}
