package org.helena.ast;

import org.helena.ast.error.AstGenerationException;
import org.helena.ast.parser.AstGenerator;
import org.helena.ast.parser.GeneratorConfig;
import org.helena.ast.parser.TopLevelKind;
import org.helena.ast.tree.Node;
import org.helena.ast.tree.TreeRenderer;

import java.util.EnumMap;
import java.util.List;

/**
 * Entry point for generating ASTs of Helena sources.
 *
 * <p>Example usage:
 * <pre>{@code
 * var roots = HelenaAst.generate("func main(string[] args):\n");
 * roots.forEach(root -> System.out.print(HelenaAst.render(root)));
 * }</pre>
 */
public final class HelenaAst {
    private HelenaAst() {}

    /**
     * Generate the top-level nodes of {@code source} with the default configuration.
     */
    public static List<Node> generate(String source) throws AstGenerationException {
        return generate(source, GeneratorConfig.DEFAULT);
    }

    /**
     * Generate the top-level nodes of {@code source} with a custom configuration.
     */
    public static List<Node> generate(String source, GeneratorConfig config) throws AstGenerationException {
        return AstGenerator.create(config)
                           .generate(source);
    }

    /**
     * Render {@code root} and its continuations as an indented tree.
     */
    public static String render(Node root) {
        return TreeRenderer.render(root);
    }

    /**
     * Create a builder for the generator configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final EnumMap<TopLevelKind, Integer> maxLeafing = new EnumMap<>(TopLevelKind.class);

        private Builder() {}

        /**
         * Allow {@code kind} at most {@code limit} times at the top level; 0 forbids it there.
         */
        public Builder maxLeafing(TopLevelKind kind, int limit) {
            maxLeafing.put(kind, limit);
            return this;
        }

        public GeneratorConfig config() {
            return new GeneratorConfig(maxLeafing);
        }

        public AstGenerator build() {
            return AstGenerator.create(config());
        }
    }
}
