package org.helena.ast.parser;

import org.helena.ast.error.AstGenerationException;
import org.helena.ast.error.PatternMismatch;
import org.helena.ast.grammar.CommonRules;
import org.helena.ast.grammar.FunctionRule;
import org.helena.ast.tree.Node;
import org.helena.ast.tree.Position;
import org.helena.ast.tree.TreeRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Objects;

/**
 * Generates the AST of a whole source by repeatedly building top-level productions from its unconsumed input.
 *
 * <p>At each offset every {@link TopLevelKind} is attempted in order and the first one to build wins. Generation
 * fails as a whole when no kind builds, or when a kind appears more often than its max leafing allows.
 */
public final class AstGenerator {
    static final Logger logger = LoggerFactory.getLogger(AstGenerator.class);

    private static final int SNIPPET_LIMIT = 40;

    private final GeneratorConfig config;

    private AstGenerator(GeneratorConfig config) {
        this.config = config;
    }

    public static AstGenerator create(GeneratorConfig config) {
        return new AstGenerator(Objects.requireNonNull(config, "config"));
    }

    public GeneratorConfig config() {
        return config;
    }

    /**
     * Generate the top-level nodes of {@code source}, in source order.
     *
     * @throws AstGenerationException if any part of the source cannot be built
     */
    public List<Node> generate(String source) throws AstGenerationException {
        Objects.requireNonNull(source, "source");
        var roots = new ArrayList<Node>();
        var occurrences = new EnumMap<TopLevelKind, Integer>(TopLevelKind.class);
        var position = Position.START;
        var offset = 0;

        while (offset < source.length()) {
            var production = attempt(source, offset, position);
            var kind = production.kind();
            int count = occurrences.merge(kind, 1, Integer::sum);
            int limit = config.maxLeafing(kind);
            if (count > limit) {
                logger.debug("{} at {} exceeds max leafing of {}", kind.displayName(), position, limit);
                throw AstGenerationException.leafingLimitExceeded(kind, limit, position, offset);
            }
            if (logger.isDebugEnabled()) {
                logger.debug("{} at {}:\n{}", kind.displayName(), position, TreeRenderer.render(production.root()));
            }
            roots.add(production.root());
            position = position.next(production.text());
            offset += production.text().length();
        }
        logger.debug("Generated {} top-level node(s) from {} character(s)", roots.size(), source.length());
        return List.copyOf(roots);
    }

    private Production attempt(String source, int offset, Position position) throws AstGenerationException {
        var mismatches = new ArrayList<PatternMismatch>();
        for (var kind : TopLevelKind.values()) {
            try {
                return build(kind, source, offset, position);
            } catch (PatternMismatch mismatch) {
                logger.trace("{} does not build at {}: {}", kind.displayName(), position, mismatch.getMessage());
                mismatches.add(mismatch);
            }
        }
        throw AstGenerationException.unmatchedInput(snippet(source, offset), position, offset, mismatches);
    }

    private static Production build(TopLevelKind kind, String source, int offset, Position position)
            throws PatternMismatch {
        return switch (kind) {
            case FUNCTION -> {
                var declaration = DeclarationScanner.function(source, offset);
                yield new Production(kind, FunctionRule.declare(position, declaration), declaration.text());
            }
            case NEWLINE -> {
                var text = DeclarationScanner.newline(source, offset);
                yield new Production(kind, CommonRules.newline(position, text), text);
            }
        };
    }

    private static String snippet(String source, int offset) {
        var end = Math.min(DeclarationScanner.lineEnd(source, offset), offset + SNIPPET_LIMIT);
        if (end == offset) {
            end = Math.min(offset + 2, source.length());
        }
        return source.substring(offset, end)
                     .replace("\r", "\\r")
                     .replace("\n", "\\n");
    }

    /**
     * A built top-level production and the source text it consumed.
     */
    private record Production(TopLevelKind kind, Node root, String text) {}
}
