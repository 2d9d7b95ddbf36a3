// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hygiene.sexp;

import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The mark algorithm that implements hygiene.
 * <p>
 * Every expansion step mints a fresh {@link Mark} and applies it both to the macro use before the transformer sees it
 * and to the transformer's output. Applying a mark to syntax that already carries that very mark on top cancels it, so
 * pieces of the input that the transformer passes through unchanged come out exactly as the user wrote them, while
 * identifiers the transformer introduced come out with the new mark, distinct from everything else.
 * <p>
 * Marks are applied according to a {@link MarkingMode}; unwrapping works the same way for syntax produced in either
 * mode.
 */
public final class Hygiene {
    /**
     * Initializes a new instance applying marks in the given mode.
     */
    public Hygiene(final MarkingMode mode) {
        this.mode = mode;
    }

    /**
     * Returns an instance applying marks lazily, with {@link MarkingMode#DEFERRED}.
     */
    public static Hygiene deferred() {
        return deferredInstance;
    }

    /**
     * Returns the marking mode of this instance.
     */
    public MarkingMode mode() {
        return mode;
    }

    /**
     * Applies {@code mark} to the mark sequence {@code marks}.
     * <p>
     * If {@code marks} starts with {@code mark}, the two applications cancel out and the rest of the sequence is
     * returned. Otherwise {@code mark} is prepended. Applying the same mark twice is therefore the identity.
     */
    @CheckReturnValue
    public static Marks applyMark(final Mark mark, final Marks marks) {
        if (!marks.isEmpty() && marks.first() == mark) {
            return marks.rest();
        }
        return marks.prepended(mark);
    }

    /**
     * Applies a single mark to an arbitrary S-expression.
     * <p>
     * A {@link SealedQuote} is returned unchanged. A deferred wrap carrying the same mark is peeled off instead of
     * being wrapped again.
     */
    @CheckReturnValue
    public Sexp stxApplyMark(final Sexp sexp, final Mark mark) {
        return mode.applyMark(sexp, mark);
    }

    /**
     * Applies the given marks one by one, in sequence order.
     */
    @CheckReturnValue
    public Sexp stxWrap(final Sexp sexp, final Marks marks) {
        var result = sexp;
        for (final var mark : marks) {
            result = stxApplyMark(result, mark);
        }
        return result;
    }

    /**
     * Applies the given marks one by one, in reverse sequence order.
     * <p>
     * Since mark sequences list the most recently applied mark first, this gives {@code sexp} the context the marks
     * describe: rewrapping a datum with an identifier's marks makes its symbols look like they were introduced together
     * with that identifier.
     */
    @CheckReturnValue
    public Sexp stxRewrap(final Sexp sexp, final Marks marks) {
        return stxWrap(sexp, marks.reversed());
    }

    /**
     * Fully unwraps the outermost layer of the given S-expression.
     * <p>
     * Equivalent to {@code stxUnwrap(sexp, Marks.empty())}.
     */
    public static Sexp stxUnwrap(final Sexp sexp) {
        return stxUnwrap(sexp, Marks.empty());
    }

    /**
     * Peels off all source nodes and deferred wraps on top of {@code sexp}, applying the pending marks to what is found
     * underneath. {@code marks} are additional marks pending application, in application order.
     * <p>
     * The result is one of the following:
     * <ul>
     * <li>an {@link Identifier} carrying every applicable mark (a bare symbol becomes one too);
     * <li>a {@link SealedQuote}, unchanged, discarding all pending marks;
     * <li>a plain datum, with any pending marks pushed down as deferred wraps onto the immediate elements of a pair,
     * vector or box.
     * </ul>
     * Never a structure with marks still pending above it. Identifiers created from bare symbols take the most specific
     * source location seen on the way down.
     */
    public static Sexp stxUnwrap(final Sexp sexp, final Marks marks) {
        var current = sexp;
        var pending = marks;
        var source = stxSource(sexp);
        while (true) {
            if (current instanceof DeferredWrap wrap) {
                pending = applyMark(wrap.mark(), pending);
                source = moreSpecific(wrap.source(), source);
                current = wrap.content();
            } else if (current instanceof SourceNode node) {
                source = moreSpecific(node.source(), source);
                current = node.content();
            } else if (current instanceof Identifier identifier) {
                return pending.isEmpty() ? identifier : identifier.withMarks(foldMarks(identifier.marks(), pending));
            } else if (current instanceof SealedQuote) {
                return current;
            } else if (current instanceof Sexp.Symbol symbol) {
                return Identifier.of(symbol, source, pending.reversed());
            } else if (pending.isEmpty()) {
                return current;
            } else {
                return pushDown(current, pending);
            }
        }
    }

    /**
     * Returns the immediate datum of the given S-expression: for identifiers the symbol, for sealed quotes the quoted
     * datum, for anything else the unwrapped structure, whose elements carry every mark that was pending over it.
     * <p>
     * This is the shallow view the syntax-list operations use to walk a syntax list one pair at a time.
     */
    public static Sexp syntaxE(final Sexp sexp) {
        var current = stxUnwrap(sexp);
        while (current instanceof Syntax syntax) {
            current = (syntax instanceof SealedQuote) ? stxUnwrap(syntax.content()) : syntax.content();
        }
        return current;
    }

    /**
     * Returns the innermost datum of the given S-expression, peeling every syntax layer without resolving any marks.
     * <p>
     * This is the cheap view for comparing symbols and literal values.
     */
    public static Sexp stxE(final Sexp sexp) {
        var current = sexp;
        while (current instanceof Syntax syntax) {
            current = syntax.content();
        }
        return current;
    }

    /**
     * Returns the source location of the outermost layer of the given S-expression, or {@code null} if it has none.
     */
    public static @Nullable SourceLocation stxSource(final Sexp sexp) {
        return (sexp instanceof Syntax syntax) ? syntax.source() : null;
    }

    private static Marks foldMarks(final Marks marks, final Marks pending) {
        var result = marks;
        for (final var mark : pending) {
            result = applyMark(mark, result);
        }
        return result;
    }

    private static Sexp pushDown(final Sexp datum, final Marks pending) {
        if (datum instanceof Sexp.Pair pair) {
            return new Sexp.Pair(wrapDeferred(pair.car(), pending), wrapDeferred(pair.cdr(), pending));
        } else if (datum instanceof Sexp.Vector vector) {
            final var elements = vector.toArray();
            for (int i = 0; i < elements.length; i += 1) {
                elements[i] = wrapDeferred(elements[i], pending);
            }
            return new Sexp.Vector(elements);
        } else if (datum instanceof Sexp.Box box) {
            return new Sexp.Box(wrapDeferred(box.value(), pending));
        } else {
            // Scalars have nothing for the marks to attach to.
            return datum;
        }
    }

    private static Sexp wrapDeferred(final Sexp sexp, final Marks pending) {
        var result = sexp;
        for (final var mark : pending) {
            result = MarkingMode.DEFERRED.applyMark(result, mark);
        }
        return result;
    }

    private static @Nullable SourceLocation moreSpecific(
        final @Nullable SourceLocation inner,
        final @Nullable SourceLocation outer
    ) {
        return (inner != null) ? inner : outer;
    }

    private static final Hygiene deferredInstance = new Hygiene(MarkingMode.DEFERRED);

    private final MarkingMode mode;
}
