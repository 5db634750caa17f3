package org.helena.ast.grammar;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Texts making up the declaration of a function, as sliced from the source.
 *
 * @param keyword            text in place of {@code func}
 * @param spacing            text between the keyword and the name
 * @param name               identifier of the function
 * @param openingParenthesis text in place of {@code (}
 * @param parameters         value parameters, in declaration order
 * @param separators         texts between consecutive parameters; one fewer than the parameters
 * @param closingParenthesis text in place of {@code )}
 * @param scopeDelimiter     text in place of {@code :}
 * @param body               single-line body following the scope delimiter, if any
 */
public record FunctionDeclaration(String keyword,
                                  String spacing,
                                  String name,
                                  String openingParenthesis,
                                  List<ValueParameter> parameters,
                                  List<String> separators,
                                  String closingParenthesis,
                                  String scopeDelimiter,
                                  Optional<FunctionBody> body) {
    public FunctionDeclaration {
        Objects.requireNonNull(keyword, "keyword");
        Objects.requireNonNull(spacing, "spacing");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(openingParenthesis, "openingParenthesis");
        Objects.requireNonNull(closingParenthesis, "closingParenthesis");
        Objects.requireNonNull(scopeDelimiter, "scopeDelimiter");
        Objects.requireNonNull(body, "body");
        parameters = List.copyOf(parameters);
        separators = List.copyOf(separators);
        if (separators.size() != Math.max(0, parameters.size() - 1)) {
            throw new IllegalArgumentException("Expected " + Math.max(0, parameters.size() - 1)
                                               + " separators for " + parameters.size() + " parameters, got "
                                               + separators.size());
        }
    }

    /**
     * Declaration written in canonical form: {@code func name(type identifier, ...):}.
     */
    public static FunctionDeclaration of(String name, List<ValueParameter> parameters) {
        return new FunctionDeclaration(Literals.FUNC,
                                       Literals.SPACE,
                                       name,
                                       Literals.OPENING_PARENTHESIS,
                                       parameters,
                                       Collections.nCopies(Math.max(0, parameters.size() - 1), Literals.LIST_SEPARATOR),
                                       Literals.CLOSING_PARENTHESIS,
                                       Literals.SCOPE_DELIMITER,
                                       Optional.empty());
    }

    /**
     * Same declaration followed by a single-line body.
     */
    public FunctionDeclaration withBody(FunctionBody body) {
        return new FunctionDeclaration(keyword,
                                       spacing,
                                       name,
                                       openingParenthesis,
                                       parameters,
                                       separators,
                                       closingParenthesis,
                                       scopeDelimiter,
                                       Optional.of(body));
    }

    /**
     * Source text covered by the whole declaration.
     */
    public String text() {
        var sb = new StringBuilder().append(keyword)
                                    .append(spacing)
                                    .append(name)
                                    .append(openingParenthesis);
        for (int i = 0; i < parameters.size(); i++) {
            if (i > 0) {
                sb.append(separators.get(i - 1));
            }
            sb.append(parameters.get(i).text());
        }
        sb.append(closingParenthesis)
          .append(scopeDelimiter);
        body.ifPresent(b -> sb.append(b.text()));
        return sb.toString();
    }

    /**
     * Statement or expression written on the same line as the declaration.
     *
     * @param spacing   text between the scope delimiter and the operation
     * @param operation the operation itself
     */
    public record FunctionBody(String spacing, String operation) {
        public FunctionBody {
            Objects.requireNonNull(spacing, "spacing");
            Objects.requireNonNull(operation, "operation");
        }

        public static FunctionBody of(String operation) {
            return new FunctionBody(Literals.SPACE, operation);
        }

        public String text() {
            return spacing + operation;
        }
    }
}
