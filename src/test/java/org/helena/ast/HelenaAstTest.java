package org.helena.ast;

import org.helena.ast.error.AstGenerationException;
import org.helena.ast.grammar.Literals;
import org.helena.ast.grammar.NodeKind;
import org.helena.ast.parser.TopLevelKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class HelenaAstTest {

    @Test
    void generate_withDefaultConfig_acceptsNewlines() throws AstGenerationException {
        var roots = HelenaAst.generate("func main():" + Literals.NEWLINE);

        assertEquals(2, roots.size());
        assertEquals(NodeKind.NEWLINE, roots.get(1).kind());
    }

    @Test
    void builder_appliesMaxLeafing() {
        var config = HelenaAst.builder()
                              .maxLeafing(TopLevelKind.NEWLINE, 0)
                              .config();

        var exception = assertThrows(AstGenerationException.class, () -> HelenaAst.generate(Literals.NEWLINE, config));

        assertEquals(AstGenerationException.Reason.LEAFING_LIMIT_EXCEEDED, exception.reason());
    }

    @Test
    void builder_buildsGenerator() throws AstGenerationException {
        var generator = HelenaAst.builder()
                                 .maxLeafing(TopLevelKind.FUNCTION, 1)
                                 .build();

        assertEquals(1, generator.config().maxLeafing(TopLevelKind.FUNCTION));
        assertEquals(1, generator.generate("func main():").size());
    }

    @Test
    void render_showsGeneratedTree() throws AstGenerationException {
        var root = HelenaAst.generate("func main(string[] args): run").get(0);

        assertThat(HelenaAst.render(root)).startsWith("├─ Keyword \"func\"\n")
                                          .contains("├─ TypeName \"string[]\"")
                                          .contains("├─ Operation \"run\"");
    }
}
