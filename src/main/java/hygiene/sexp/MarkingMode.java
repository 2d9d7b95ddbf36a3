// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hygiene.sexp;

import java.util.ArrayList;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The ways a mark can be applied to a syntax tree.
 * <p>
 * Both modes are observably equivalent: unwrapping, datum extraction and identifier mark queries give the same
 * answers no matter which mode produced the tree. They differ only in cost.
 */
public enum MarkingMode {
    /**
     * Applies a mark in constant time by recording it in a {@link DeferredWrap} over the whole subtree. The mark reaches
     * the identifiers inside only when the subtree is unwrapped.
     */
    DEFERRED {
        @Override
        Sexp applyMark(final Sexp sexp, final Mark mark) {
            if (sexp instanceof SealedQuote) {
                return sexp;
            } else if (sexp instanceof DeferredWrap wrap && wrap.mark() == mark) {
                return wrap.content();
            } else if (sexp instanceof Identifier identifier) {
                return identifier.withMarks(Hygiene.applyMark(mark, identifier.marks()));
            } else {
                return new DeferredWrap(sexp, Hygiene.stxSource(sexp), mark);
            }
        }
    },

    /**
     * Applies a mark by rebuilding the subtree with the mark applied to every identifier in it. Costs time proportional
     * to the size of the subtree, but never creates deferred wraps.
     */
    EAGER {
        @Override
        Sexp applyMark(final Sexp sexp, final Mark mark) {
            return pushMark(sexp, mark, Hygiene.stxSource(sexp));
        }
    };

    abstract Sexp applyMark(Sexp sexp, Mark mark);

    private static Sexp pushMark(final Sexp sexp, final Mark mark, final @Nullable SourceLocation source) {
        if (sexp instanceof SealedQuote) {
            return sexp;
        } else if (sexp instanceof Identifier identifier) {
            return identifier.withMarks(Hygiene.applyMark(mark, identifier.marks()));
        } else if (sexp instanceof DeferredWrap wrap) {
            // Only reachable for trees built in deferred mode; resolve the pending marks first.
            final var pushed = pushMark(Hygiene.stxUnwrap(wrap), mark, wrap.source());
            return (wrap.source() != null && Hygiene.stxSource(pushed) == null)
                ? SourceNode.of(pushed, wrap.source())
                : pushed;
        } else if (sexp instanceof SourceNode node) {
            final var location = (node.source() != null) ? node.source() : source;
            return SourceNode.of(pushMark(node.content(), mark, location), node.source());
        } else if (sexp instanceof Sexp.Symbol symbol) {
            return Identifier.of(symbol, source, Marks.of(mark));
        } else if (sexp instanceof Sexp.Pair pair) {
            return pushMarkIntoList(pair, mark);
        } else if (sexp instanceof Sexp.Vector vector) {
            final var elements = vector.toArray();
            for (int i = 0; i < elements.length; i += 1) {
                elements[i] = pushMark(elements[i], mark, null);
            }
            return new Sexp.Vector(elements);
        } else if (sexp instanceof Sexp.Box box) {
            return new Sexp.Box(pushMark(box.value(), mark, null));
        } else {
            return sexp;
        }
    }

    // Walks the cdr chain iteratively, so that long lists don't exhaust the stack.
    private static Sexp pushMarkIntoList(final Sexp.Pair list, final Mark mark) {
        final var cars = new ArrayList<Sexp>();
        Sexp rest = list;
        while (rest instanceof Sexp.Pair pair) {
            cars.add(pushMark(pair.car(), mark, null));
            rest = pair.cdr();
        }
        var result = pushMark(rest, mark, null);
        for (int i = cars.size() - 1; i >= 0; i -= 1) {
            result = new Sexp.Pair(cars.get(i), result);
        }
        return result;
    }
}
