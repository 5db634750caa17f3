package org.helena.ast.grammar;

import org.helena.ast.error.PatternMismatch;
import org.helena.ast.tree.Continuation;
import org.helena.ast.tree.Position;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommonRulesTest {

    private static final Position AT = Position.at(2, 7);

    @Test
    void identifier_buildsLeafNode() throws PatternMismatch {
        var node = CommonRules.identifier(AT, "main");

        assertEquals(NodeKind.IDENTIFIER, node.kind());
        assertEquals("main", node.text());
        assertEquals(AT, node.position());
        assertEquals(List.of(Continuation.leaf()), node.continuations());
    }

    @Test
    void identifier_empty_expectsAnIdentifier() {
        var mismatch = assertThrows(PatternMismatch.class, () -> CommonRules.identifier(AT, ""));

        assertEquals("Expected an identifier.", mismatch.getMessage());
    }

    @Test
    void typeName_buildsLeafNode() throws PatternMismatch {
        var node = CommonRules.typeName(AT, "string[]");

        assertEquals(NodeKind.TYPE_NAME, node.kind());
        assertTrue(node.isTerminable());
    }

    @Test
    void spacing_defaultsToSingleSpace() throws PatternMismatch {
        var node = CommonRules.spacing(AT);

        assertEquals(NodeKind.SPACING, node.kind());
        assertEquals(" ", node.text());
        assertTrue(node.isTerminable());
        assertThrows(PatternMismatch.class, () -> CommonRules.spacing(AT, "\t"));
    }

    @Test
    void newline_usesPlatformSeparator() throws PatternMismatch {
        var node = CommonRules.newline(AT);

        assertEquals(NodeKind.NEWLINE, node.kind());
        assertEquals(Literals.NEWLINE, node.text());
        assertTrue(node.isTerminable());
        assertThrows(PatternMismatch.class, () -> CommonRules.newline(AT, ";"));
    }

    @Test
    void listSeparator_isCommaSpace() throws PatternMismatch {
        var node = CommonRules.listSeparator(AT);

        assertEquals(NodeKind.LIST_SEPARATOR, node.kind());
        assertEquals(", ", node.text());
        assertThrows(PatternMismatch.class, () -> CommonRules.listSeparator(AT, " ,"));
    }

    @Test
    void operation_acceptsWords() throws PatternMismatch {
        var node = CommonRules.operation(AT, "print");

        assertEquals(NodeKind.OPERATION, node.kind());
        assertTrue(node.isTerminable());
        assertThrows(PatternMismatch.class, () -> CommonRules.operation(AT, "print()"));
    }
}
