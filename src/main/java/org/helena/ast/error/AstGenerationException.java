package org.helena.ast.error;

import org.helena.ast.parser.TopLevelKind;
import org.helena.ast.tree.Position;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Generation of the AST of a source stopped. No partial tree is returned alongside it.
 */
public final class AstGenerationException extends Exception {
    private static final long serialVersionUID = 1L;

    /**
     * Why generation stopped.
     */
    public enum Reason {
        /**
         * A kind appeared at top level more times than its max leafing allows.
         */
        LEAFING_LIMIT_EXCEEDED,

        /**
         * No top-level production could be built from the remaining input.
         */
        UNMATCHED_INPUT
    }

    private final Reason reason;
    private final Position position;
    private final int offset;

    private AstGenerationException(Reason reason, Position position, int offset, String message) {
        super(message);
        this.reason = reason;
        this.position = position;
        this.offset = offset;
    }

    public static AstGenerationException leafingLimitExceeded(TopLevelKind kind, int limit, Position position, int offset) {
        return new AstGenerationException(Reason.LEAFING_LIMIT_EXCEEDED,
                                          position,
                                          offset,
                                          kind.displayName() + " may appear at most " + limit
                                          + " time(s) as a top-level production, found another at " + position);
    }

    /**
     * Nothing matched at {@code offset}. The first mismatch becomes the cause, the others are suppressed.
     */
    public static AstGenerationException unmatchedInput(String remainder,
                                                        Position position,
                                                        int offset,
                                                        List<PatternMismatch> mismatches) {
        var reasons = mismatches.stream()
                                .map(Throwable::getMessage)
                                .collect(Collectors.joining(" "));
        var exception = new AstGenerationException(Reason.UNMATCHED_INPUT,
                                                   position,
                                                   offset,
                                                   "No top-level production matches \"" + remainder + "\" at " + position
                                                   + " (offset " + offset + "). " + reasons);
        for (int i = 0; i < mismatches.size(); i++) {
            if (i == 0) {
                exception.initCause(mismatches.get(i));
            } else {
                exception.addSuppressed(mismatches.get(i));
            }
        }
        return exception;
    }

    public Reason reason() {
        return reason;
    }

    public Position position() {
        return position;
    }

    /**
     * Character offset in the source where generation stopped.
     */
    public int offset() {
        return offset;
    }
}
