// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hygiene.syntax;

import hygiene.sexp.Sexp;
import hygiene.sexp.Sexps;
import hygiene.sexp.SourceLocation;
import hygiene.sexp.Syntax;
import hygiene.util.condition.Condition;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The base type of conditions signaled when syntax doesn't have the shape an operation requires.
 * <p>
 * The offending syntax object is kept as is, so that a handler can report the location the user wrote it at.
 */
public abstract class SyntaxErrorCondition extends Condition {
    SyntaxErrorCondition(final String message, final Sexp offender) {
        super(message);
        this.offender = offender;
    }

    /**
     * Returns the syntax object that caused this condition.
     */
    public final Sexp offender() {
        return offender;
    }

    /**
     * Returns the most specific source location attached to the offending syntax, or {@code null} if it carries none.
     */
    public final @Nullable SourceLocation location() {
        Sexp current = offender;
        while (current instanceof Syntax syntax) {
            final var source = syntax.source();
            if (source != null) {
                return source;
            }
            current = syntax.content();
        }
        return null;
    }

    @Override
    public String detailedMessage() {
        final var builder = new StringBuilder(message());
        builder.append("\nOffending syntax: ").append(Sexps.prettyPrint(offender));
        final var location = location();
        if (location != null) {
            builder.append("\nAt ").append(location);
        }
        return builder.toString();
    }

    private final Sexp offender;
}
