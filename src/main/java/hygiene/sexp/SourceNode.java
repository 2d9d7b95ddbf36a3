// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hygiene.sexp;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A syntax object that adds a source location, and nothing else, to an S-expression.
 * <p>
 * The reader produces one of these for every datum it reads.
 */
public final class SourceNode implements Syntax {
    private SourceNode(final Sexp content, final @Nullable SourceLocation source) {
        this.content = content;
        this.source = source;
    }

    /**
     * Returns a syntax object tagging {@code content} with the given source location.
     */
    public static SourceNode of(final Sexp content, final @Nullable SourceLocation source) {
        return new SourceNode(content, source);
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
        return object instanceof SourceNode node
            && content.equals(node.content)
            && Objects.equals(source, node.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(content, source);
    }

    @Override
    public java.lang.String toString() {
        return Sexps.prettyPrint(this);
    }

    private final Sexp content;
    private final @Nullable SourceLocation source;
}
