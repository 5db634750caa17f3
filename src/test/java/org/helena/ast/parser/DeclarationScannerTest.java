package org.helena.ast.parser;

import org.helena.ast.grammar.FunctionDeclaration;
import org.helena.ast.grammar.FunctionDeclaration.FunctionBody;
import org.helena.ast.grammar.Literals;
import org.helena.ast.grammar.ValueParameter;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DeclarationScannerTest {

    @Test
    void function_canonicalDeclaration_matchesCanonicalSlices() {
        var declaration = DeclarationScanner.function("func main(string[] args):", 0);

        assertEquals(FunctionDeclaration.of("main", List.of(ValueParameter.of("string[]", "args"))), declaration);
    }

    @Test
    void function_withoutParameters() {
        var declaration = DeclarationScanner.function("func main():", 0);

        assertEquals(FunctionDeclaration.of("main", List.of()), declaration);
    }

    @Test
    void function_slicesFromOffsetAndStopsAtLineEnd() {
        var source = "func a():\nfunc b(int x, int y):\n";

        var declaration = DeclarationScanner.function(source, 10);

        assertEquals("b", declaration.name());
        assertEquals(List.of(", "), declaration.separators());
        assertEquals("func b(int x, int y):", declaration.text());
    }

    @Test
    void function_keepsIrregularTextsForValidation() {
        var declaration = DeclarationScanner.function("fun  main(int a,int b) :", 0);

        assertEquals("fun", declaration.keyword());
        assertEquals("  ", declaration.spacing());
        assertEquals(List.of(","), declaration.separators());
        assertEquals(")", declaration.closingParenthesis());
        assertEquals("", declaration.scopeDelimiter());
    }

    @Test
    void function_missingParenthesis_yieldsEmptySlice() {
        var declaration = DeclarationScanner.function("func main:", 0);

        assertEquals("main:", declaration.name());
        assertEquals("", declaration.openingParenthesis());
        assertTrue(declaration.parameters().isEmpty());
    }

    @Test
    void function_body_takesRestOfLine() {
        var declaration = DeclarationScanner.function("func main(): run\n", 0);

        assertEquals(Optional.of(FunctionBody.of("run")), declaration.body());
        assertEquals("func main(): run", declaration.text());
    }

    @Test
    void function_consumedText_equalsSlicedSource() {
        var source = "func f(a.B[] x, int  y): go";

        assertEquals(source, DeclarationScanner.function(source, 0).text());
    }

    @Test
    void newline_slicesSeparatorLength() {
        var source = "x" + Literals.NEWLINE + "y";

        assertEquals(Literals.NEWLINE, DeclarationScanner.newline(source, 1));
        assertEquals("y", DeclarationScanner.newline(source, source.length() - 1));
    }

    @Test
    void lineEnd_findsFirstTerminator() {
        assertEquals(3, DeclarationScanner.lineEnd("abc\ndef", 0));
        assertEquals(3, DeclarationScanner.lineEnd("abc\r\ndef", 1));
        assertEquals(7, DeclarationScanner.lineEnd("abc\ndef", 4));
    }
}
