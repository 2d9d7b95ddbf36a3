// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hygiene.sexp;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Syntax originating from a template inside a macro definition, frozen together with the definition-site context it
 * must be resolved in.
 * <p>
 * A sealed quote is terminal for the hygiene algorithm: applying a mark to it returns it unchanged, and unwrapping
 * stops at it, discarding any marks pending from above.
 */
public final class SealedQuote implements Syntax {
    private SealedQuote(
        final Sexp content,
        final @Nullable SourceLocation source,
        final @Nullable Sexp context,
        final Marks marks
    ) {
        this.content = content;
        this.source = source;
        this.context = context;
        this.marks = marks;
    }

    /**
     * Returns a sealed quote of {@code content}, capturing the given definition-site context and marks.
     */
    public static SealedQuote of(
        final Sexp content,
        final @Nullable SourceLocation source,
        final @Nullable Sexp context,
        final Marks marks
    ) {
        return new SealedQuote(content, source, context, marks);
    }

    /**
     * Returns the definition-site context captured when this quote was created, or {@code null} if there's none.
     */
    public @Nullable Sexp context() {
        return context;
    }

    /**
     * Returns the definition-site marks captured when this quote was created.
     */
    public Marks marks() {
        return marks;
    }

    @Override
    public Sexp content() {
        return content;
    }

    @Override
    public @Nullable SourceLocation source() {
        return source;
    }

    @Override
    public boolean equals(final @Nullable Object object) {
        return object instanceof SealedQuote quote
            && content.equals(quote.content)
            && Objects.equals(source, quote.source)
            && context == quote.context
            && marks.equals(quote.marks);
    }

    @Override
    public int hashCode() {
        return Objects.hash(content, source, System.identityHashCode(context), marks);
    }

    @Override
    public java.lang.String toString() {
        return Sexps.prettyPrint(this);
    }

    private final Sexp content;
    private final @Nullable SourceLocation source;
    private final @Nullable Sexp context;
    private final Marks marks;
}
