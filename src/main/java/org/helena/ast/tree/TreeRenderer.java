package org.helena.ast.tree;

/**
 * Formats a node and its continuations as an indented ASCII tree, one line per node.
 *
 * <pre>
 * ├─ Keyword "func"
 *    ├─ Spacing
 *       ├─ Identifier "main"
 * </pre>
 *
 * <p>Meant for humans reading logs and test failures; the layout is not a stable format.
 */
public final class TreeRenderer {
    private TreeRenderer() {}

    static final int INDENT = 3;
    static final String BRANCH = "├─ ";

    public static String render(Node root) {
        var sb = new StringBuilder();
        render(root, 0, sb);
        return sb.toString();
    }

    private static void render(Node node, int depth, StringBuilder sb) {
        sb.append(" ".repeat(INDENT * depth))
          .append(BRANCH)
          .append(label(node))
          .append('\n');
        for (var continuation : node.continuations()) {
            // A leaf closes the list: continuations after it are not shown
            if (!(continuation instanceof Continuation.Next next)) {
                return;
            }
            render(next.node(), depth + 1, sb);
        }
    }

    static String label(Node node) {
        var kind = node.kind()
                       .displayName();
        if (kind.equals(node.text()) || node.text().isBlank()) {
            return kind;
        }
        return kind + " \"" + node.text() + "\"";
    }
}
