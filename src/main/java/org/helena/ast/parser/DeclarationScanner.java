package org.helena.ast.parser;

import org.helena.ast.grammar.FunctionDeclaration;
import org.helena.ast.grammar.FunctionDeclaration.FunctionBody;
import org.helena.ast.grammar.Literals;
import org.helena.ast.grammar.ValueParameter;

import java.util.ArrayList;
import java.util.Optional;

/**
 * Slices a line of source into the texts of a top-level production.
 *
 * <p>Slicing never judges the texts: punctuation that is missing yields an empty slice and a wrong word is
 * sliced as is, leaving the pattern checks, and their messages, to the grammar rules.
 */
final class DeclarationScanner {
    private final String source;
    private final int lineEnd;
    private int pos;

    private DeclarationScanner(String source, int offset) {
        this.source = source;
        this.pos = offset;
        this.lineEnd = lineEnd(source, offset);
    }

    /**
     * Slice the function declaration starting at {@code offset}.
     */
    static FunctionDeclaration function(String source, int offset) {
        return new DeclarationScanner(source, offset).function();
    }

    /**
     * Slice the text standing where a line terminator is expected.
     */
    static String newline(String source, int offset) {
        return source.substring(offset, Math.min(offset + Literals.NEWLINE.length(), source.length()));
    }

    /**
     * Index of the first line terminator at or after {@code offset}, or the source length.
     */
    static int lineEnd(String source, int offset) {
        for (int i = offset; i < source.length(); i++) {
            var c = source.charAt(i);
            if (c == '\n' || c == '\r') {
                return i;
            }
        }
        return source.length();
    }

    private FunctionDeclaration function() {
        var keyword = takeUntil(" (");
        var spacing = takeWhile(' ');
        var name = takeUntil("(");
        var opening = takeIf('(');

        var parameters = new ArrayList<ValueParameter>();
        var separators = new ArrayList<String>();
        if (!opening.isEmpty() && !isAtEnd() && peek() != ')') {
            while (true) {
                var type = takeUntil(" ,)");
                var parameterSpacing = takeWhile(' ');
                var identifier = takeUntil(" ,)");
                parameters.add(new ValueParameter(type, parameterSpacing, identifier));
                if (isAtEnd() || peek() != ',') {
                    break;
                }
                separators.add(takeIf(',') + takeWhile(' '));
            }
        }

        var closing = takeIf(')');
        var delimiter = takeIf(':');
        Optional<FunctionBody> body = Optional.empty();
        if (!delimiter.isEmpty() && !isAtEnd()) {
            var bodySpacing = takeWhile(' ');
            body = Optional.of(new FunctionBody(bodySpacing, takeUntil("")));
        }
        return new FunctionDeclaration(keyword,
                                       spacing,
                                       name,
                                       opening,
                                       parameters,
                                       separators,
                                       closing,
                                       delimiter,
                                       body);
    }

    // === Character Access ===

    private boolean isAtEnd() {
        return pos >= lineEnd;
    }

    private char peek() {
        return source.charAt(pos);
    }

    private String takeIf(char expected) {
        if (!isAtEnd() && peek() == expected) {
            pos++;
            return String.valueOf(expected);
        }
        return "";
    }

    private String takeWhile(char expected) {
        var start = pos;
        while (!isAtEnd() && peek() == expected) {
            pos++;
        }
        return source.substring(start, pos);
    }

    private String takeUntil(String stops) {
        var start = pos;
        while (!isAtEnd() && stops.indexOf(peek()) < 0) {
            pos++;
        }
        return source.substring(start, pos);
    }
}
