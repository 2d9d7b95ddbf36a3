// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hygiene.sexp;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A mark that has been applied to a subtree, but not yet pushed down to the identifiers inside it.
 * <p>
 * Wrapping is constant-time regardless of the size of the subtree; the mark reaches the identifiers one layer at a
 * time as the subtree is unwrapped with {@link Hygiene#stxUnwrap(Sexp)}.
 * <p>
 * Only {@link Hygiene} creates these. The content is never an {@link Identifier} (marks are folded straight into
 * identifiers) nor a {@link SealedQuote} (which marks don't affect).
 */
public final class DeferredWrap implements Syntax {
    DeferredWrap(final Sexp content, final @Nullable SourceLocation source, final Mark mark) {
        assert !(content instanceof Identifier) && !(content instanceof SealedQuote)
            : "Deferred wrap around an identifier or a sealed quote";
        this.content = content;
        this.source = source;
        this.mark = mark;
    }

    /**
     * Returns the mark pending application to the content.
     */
    public Mark mark() {
        return mark;
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
        return object instanceof DeferredWrap wrap
            && mark == wrap.mark
            && content.equals(wrap.content)
            && Objects.equals(source, wrap.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(content, source, System.identityHashCode(mark));
    }

    @Override
    public java.lang.String toString() {
        return Sexps.prettyPrint(this);
    }

    private final Sexp content;
    private final @Nullable SourceLocation source;
    private final Mark mark;
}
