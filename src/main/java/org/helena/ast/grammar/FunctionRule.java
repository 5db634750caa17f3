package org.helena.ast.grammar;

import org.helena.ast.error.PatternMismatch;
import org.helena.ast.tree.Chain;
import org.helena.ast.tree.Node;
import org.helena.ast.tree.Position;

import java.util.List;

/**
 * Production of a function declaration.
 *
 * <pre>
 * func name(type identifier, type identifier):
 * </pre>
 *
 * <p>The parameter list is folded right to left over the chain that closes the declaration, so the last
 * parameter connects directly to {@code )} and each earlier one connects to the next through a list separator.
 * Without parameters, {@code (} is followed by {@code )} straight away.
 */
public final class FunctionRule {
    private FunctionRule() {}

    /**
     * Build the declaration of a function named {@code name}, written in canonical form.
     */
    public static Node declare(Position position, String name, List<ValueParameter> parameters) throws PatternMismatch {
        return declare(position, FunctionDeclaration.of(name, parameters));
    }

    /**
     * Build the declaration described by {@code declaration}, starting at {@code position}.
     *
     * @return the {@code func} keyword node heading the production
     * @throws PatternMismatch if any text of the declaration does not match its pattern
     */
    public static Node declare(Position position, FunctionDeclaration declaration) throws PatternMismatch {
        var parameterList = parameterList(declaration);
        return Node.beginKeyword(Literals.FUNC,
                                 declaration.keyword(),
                                 position,
                                 keyword -> keyword.expectSpacing(declaration.spacing(),
                                                                  spacing -> spacing.expectIdentifier(declaration.name(),
                                                                                                      name -> name.expectKeyword(Literals.OPENING_PARENTHESIS,
                                                                                                                                 declaration.openingParenthesis(),
                                                                                                                                 parameterList))));
    }

    private static Chain parameterList(FunctionDeclaration declaration) {
        var parameters = declaration.parameters();
        var chain = closing(declaration);
        for (int i = parameters.size() - 1; i >= 0; i--) {
            var following = i == parameters.size() - 1
                            ? chain
                            : separated(declaration.separators().get(i), chain);
            chain = parameter(parameters.get(i), following);
        }
        return chain;
    }

    private static Chain parameter(ValueParameter parameter, Chain following) {
        return node -> node.expectTypeName(parameter.typeName(),
                                           type -> type.expectSpacing(parameter.spacing(),
                                                                      spacing -> spacing.expectIdentifier(parameter.identifier(),
                                                                                                          following)));
    }

    private static Chain separated(String separator, Chain following) {
        return node -> node.expectListSeparator(separator, following);
    }

    private static Chain closing(FunctionDeclaration declaration) {
        return node -> node.expectKeyword(Literals.CLOSING_PARENTHESIS,
                                          declaration.closingParenthesis(),
                                          scope(declaration));
    }

    private static Chain scope(FunctionDeclaration declaration) {
        return node -> node.expectKeyword(Literals.SCOPE_DELIMITER, declaration.scopeDelimiter(), delimiter -> {
            if (declaration.body().isEmpty()) {
                return delimiter.leaf();
            }
            var body = declaration.body().get();
            return delimiter.expectSpacing(body.spacing(),
                                           spacing -> spacing.expectOperation(body.operation(), Chain.leaf()))
                            .leaf();
        });
    }
}
