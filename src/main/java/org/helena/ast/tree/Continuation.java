package org.helena.ast.tree;

import java.util.Objects;

/**
 * What may follow a node in a production: either nothing, or a fully-built successor subtree.
 */
public sealed interface Continuation {

    Leaf LEAF = new Leaf();

    static Continuation leaf() {
        return LEAF;
    }

    static Continuation next(Node node) {
        return new Next(node);
    }

    /**
     * The production may legally end at the node holding this continuation.
     */
    record Leaf() implements Continuation {}

    /**
     * The node holding this continuation may be followed by {@code node}.
     */
    record Next(Node node) implements Continuation {
        public Next {
            Objects.requireNonNull(node, "node");
        }
    }
}
