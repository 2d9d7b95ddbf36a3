// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hygiene.sexp;

import java.util.Objects;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A symbol together with its hygiene context: the sequence of marks applied to it so far.
 * <p>
 * Two identifiers denote the same binding occurrence iff they have the same symbol and equal mark sequences.
 */
public final class Identifier implements Syntax {
    private Identifier(final Sexp.Symbol symbol, final @Nullable SourceLocation source, final Marks marks) {
        this.symbol = symbol;
        this.source = source;
        this.marks = marks;
    }

    /**
     * Returns an identifier with the given symbol, location and marks.
     */
    public static Identifier of(final Sexp.Symbol symbol, final @Nullable SourceLocation source, final Marks marks) {
        return new Identifier(symbol, source, marks);
    }

    /**
     * Returns the symbol of this identifier.
     */
    public Sexp.Symbol symbol() {
        return symbol;
    }

    /**
     * Returns the marks of this identifier, the most recently applied one first.
     */
    public Marks marks() {
        return marks;
    }

    /**
     * Returns an identifier with the same symbol and location as this one, but the given marks.
     */
    @CheckReturnValue
    public Identifier withMarks(final Marks newMarks) {
        return new Identifier(symbol, source, newMarks);
    }

    /**
     * Returns the symbol of this identifier.
     */
    @Override
    public Sexp content() {
        return symbol;
    }

    @Override
    public @Nullable SourceLocation source() {
        return source;
    }

    @Override
    public boolean equals(final @Nullable Object object) {
        return object instanceof Identifier identifier
            && symbol == identifier.symbol
            && marks.equals(identifier.marks)
            && Objects.equals(source, identifier.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(symbol), marks, source);
    }

    @Override
    public java.lang.String toString() {
        return Sexps.prettyPrint(this);
    }

    private final Sexp.Symbol symbol;
    private final @Nullable SourceLocation source;
    private final Marks marks;
}
