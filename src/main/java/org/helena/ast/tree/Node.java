package org.helena.ast.tree;

import org.helena.ast.error.PatternMismatch;
import org.helena.ast.grammar.Literals;
import org.helena.ast.grammar.NodeKind;
import org.helena.ast.grammar.PatternValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A node (token) of the AST.
 *
 * <p>Nodes are immutable: growing a production through {@link #expect(NodeKind, String, Chain)} or
 * {@link #leaf()} returns a new node holding one more continuation, so a node handed back by a rule is frozen
 * and a failed expectation leaves the node it was called on exactly as it was.
 *
 * <p>The text of every node matches the pattern of its kind. Nodes are only created through
 * {@link #of(NodeKind, String, Position)}, {@link #begin(NodeKind, String, Position, Chain)} and the
 * {@code expect} family, all of which validate before constructing.
 */
public final class Node {
    static final Logger logger = LoggerFactory.getLogger(Node.class);

    private final NodeKind kind;
    private final String text;
    private final Position position;
    private final List<Continuation> continuations;

    private Node(NodeKind kind, String text, Position position, List<Continuation> continuations) {
        this.kind = kind;
        this.text = text;
        this.position = position;
        this.continuations = List.copyOf(continuations);
    }

    /**
     * Create a node without continuations.
     *
     * @throws PatternMismatch if {@code text} does not match the pattern of {@code kind}
     */
    public static Node of(NodeKind kind, String text, Position position) throws PatternMismatch {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(position, "position");
        PatternValidator.validate(kind, text, position);
        return new Node(kind, text, position, List.of());
    }

    /**
     * Start a production with a node that has no predecessor.
     *
     * @return the first node of the production, extended by {@code chain}
     */
    public static Node begin(NodeKind kind, String text, Position position, Chain chain) throws PatternMismatch {
        return chain.apply(of(kind, text, position));
    }

    /**
     * Start a production with the exact keyword {@code literal}, written as {@code text} in the source.
     */
    public static Node beginKeyword(String literal, String text, Position position, Chain chain) throws PatternMismatch {
        PatternValidator.validateLiteral(literal, text, position);
        return begin(NodeKind.KEYWORD, text, position, chain);
    }

    public NodeKind kind() {
        return kind;
    }

    public String text() {
        return text;
    }

    public Position position() {
        return position;
    }

    public List<Continuation> continuations() {
        return continuations;
    }

    // === Expectations ===

    /**
     * Denote that a node of {@code kind} holding {@code text} may follow this one, followed in turn by whatever
     * {@code chain} expects.
     *
     * @return this node with the built candidate appended to its continuations
     * @throws PatternMismatch if the candidate, or anything expected after it, does not match; this node is then
     *                         left as it was
     */
    public Node expect(NodeKind kind, String text, Chain chain) throws PatternMismatch {
        var candidatePosition = successorPosition(text);
        Node candidate;
        try {
            candidate = of(kind, text, candidatePosition);
        } catch (PatternMismatch mismatch) {
            logger.trace("{} rejected at {}: {}", kind, candidatePosition, mismatch.getMessage());
            throw mismatch;
        }
        return append(Continuation.next(chain.apply(candidate)));
    }

    /**
     * Denote that the exact keyword {@code literal} may follow this node.
     */
    public Node expectKeyword(String literal, Chain chain) throws PatternMismatch {
        return expectKeyword(literal, literal, chain);
    }

    /**
     * Denote that the exact keyword {@code literal}, written as {@code text} in the source, may follow this node.
     */
    public Node expectKeyword(String literal, String text, Chain chain) throws PatternMismatch {
        PatternValidator.validateLiteral(literal, text, successorPosition(text));
        return expect(NodeKind.KEYWORD, text, chain);
    }

    public Node expectSpacing(Chain chain) throws PatternMismatch {
        return expectSpacing(Literals.SPACE, chain);
    }

    public Node expectSpacing(String text, Chain chain) throws PatternMismatch {
        return expect(NodeKind.SPACING, text, chain);
    }

    public Node expectIdentifier(String text, Chain chain) throws PatternMismatch {
        return expect(NodeKind.IDENTIFIER, text, chain);
    }

    public Node expectTypeName(String text, Chain chain) throws PatternMismatch {
        return expect(NodeKind.TYPE_NAME, text, chain);
    }

    public Node expectNewline(Chain chain) throws PatternMismatch {
        return expectNewline(Literals.NEWLINE, chain);
    }

    public Node expectNewline(String text, Chain chain) throws PatternMismatch {
        return expect(NodeKind.NEWLINE, text, chain);
    }

    public Node expectListSeparator(Chain chain) throws PatternMismatch {
        return expectListSeparator(Literals.LIST_SEPARATOR, chain);
    }

    public Node expectListSeparator(String text, Chain chain) throws PatternMismatch {
        return expect(NodeKind.LIST_SEPARATOR, text, chain);
    }

    /**
     * Denote that a statement or expression may follow this node.
     */
    public Node expectOperation(String text, Chain chain) throws PatternMismatch {
        return expect(NodeKind.OPERATION, text, chain);
    }

    /**
     * Denote that the production may end at this node. Calling it again has no further effect.
     */
    public Node leaf() {
        return isTerminable()
               ? this
               : append(Continuation.leaf());
    }

    // === Inspection ===

    /**
     * Whether the production may end at this node.
     */
    public boolean isTerminable() {
        return continuations.contains(Continuation.LEAF);
    }

    /**
     * Nodes this one may be followed by, in the order they were expected.
     */
    public List<Node> successors() {
        var successors = new ArrayList<Node>();
        for (var continuation : continuations) {
            if (continuation instanceof Continuation.Next next) {
                successors.add(next.node());
            }
        }
        return List.copyOf(successors);
    }

    /**
     * Position of a node holding {@code candidateText} that follows this one.
     */
    public Position successorPosition(String candidateText) {
        return position.next(candidateText);
    }

    private Node append(Continuation continuation) {
        var extended = new ArrayList<>(continuations);
        extended.add(continuation);
        return new Node(kind, text, position, extended);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Node other)) {
            return false;
        }
        return kind == other.kind
               && text.equals(other.text)
               && position.equals(other.position)
               && continuations.equals(other.continuations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text, position, continuations);
    }

    @Override
    public String toString() {
        return kind + "(\"" + text + "\" at " + position + ")";
    }
}
