package org.helena.ast.grammar;

import org.helena.ast.error.PatternMismatch;
import org.helena.ast.tree.Chain;
import org.helena.ast.tree.Node;
import org.helena.ast.tree.Position;

/**
 * Single-token productions. Each builds one node that may end its production.
 * Composite rules reach the same tokens through the {@code expect} methods of {@link Node}.
 */
public final class CommonRules {
    private CommonRules() {}

    public static Node identifier(Position position, String text) throws PatternMismatch {
        return Node.begin(NodeKind.IDENTIFIER, text, position, Chain.leaf());
    }

    public static Node typeName(Position position, String text) throws PatternMismatch {
        return Node.begin(NodeKind.TYPE_NAME, text, position, Chain.leaf());
    }

    public static Node spacing(Position position) throws PatternMismatch {
        return spacing(position, Literals.SPACE);
    }

    public static Node spacing(Position position, String text) throws PatternMismatch {
        return Node.begin(NodeKind.SPACING, text, position, Chain.leaf());
    }

    public static Node newline(Position position) throws PatternMismatch {
        return newline(position, Literals.NEWLINE);
    }

    public static Node newline(Position position, String text) throws PatternMismatch {
        return Node.begin(NodeKind.NEWLINE, text, position, Chain.leaf());
    }

    public static Node listSeparator(Position position) throws PatternMismatch {
        return listSeparator(position, Literals.LIST_SEPARATOR);
    }

    public static Node listSeparator(Position position, String text) throws PatternMismatch {
        return Node.begin(NodeKind.LIST_SEPARATOR, text, position, Chain.leaf());
    }

    /**
     * Placeholder for statements and expressions until their grammar exists.
     */
    public static Node operation(Position position, String text) throws PatternMismatch {
        return Node.begin(NodeKind.OPERATION, text, position, Chain.leaf());
    }
}
