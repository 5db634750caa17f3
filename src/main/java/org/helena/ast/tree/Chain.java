package org.helena.ast.tree;

import org.helena.ast.error.PatternMismatch;

/**
 * Describes what follows a candidate node: receives the freshly created candidate and returns it
 * extended with its own continuations.
 */
@FunctionalInterface
public interface Chain {

    Node apply(Node candidate) throws PatternMismatch;

    /**
     * Chain ending the production right after the candidate.
     */
    static Chain leaf() {
        return Node::leaf;
    }
}
