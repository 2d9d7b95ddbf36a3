// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hygiene.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import hygiene.sexp.Sexp;
import hygiene.util.condition.ConditionContext;
import hygiene.util.condition.UnhandledErrorError;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Operations treating a syntax object as a list, without normalizing the whole tree first.
 * <p>
 * Each step shallow-unwraps the current node with {@link Stx#syntaxE(Sexp)}, so the operations see through source
 * nodes and deferred wraps one layer at a time, and the elements they hand out carry every mark that was pending over
 * the list. Lists are walked with loops over the {@code cdr} chain.
 * <p>
 * Unless stated otherwise, the list arguments have to be proper lists; an improper tail causes a fatal
 * {@link MalformedSyntaxListCondition} to be signaled, carrying the offending syntax. Nothing is ever silently
 * truncated.
 */
public final class StxLists {
    private StxLists() {
    }

    /**
     * Applies {@code function} to every element of the syntax list {@code stx}, from left to right, and returns the
     * results as an unmodifiable Java list.
     */
    public static <T> List<T> map(final Sexp stx, final Function<? super Sexp, ? extends T> function) {
        final var result = new ArrayList<T>();
        var rest = Stx.syntaxE(stx);
        while (rest instanceof Sexp.Pair pair) {
            result.add(function.apply(pair.car()));
            rest = Stx.syntaxE(pair.cdr());
        }
        checkEnd(rest, stx);
        return Collections.unmodifiableList(result);
    }

    /**
     * Applies {@code function} to the corresponding elements of two syntax lists, from left to right, and returns the
     * results as an unmodifiable Java list.
     * <p>
     * If the lists have different lengths, a fatal {@link MalformedSyntaxListCondition} is signaled.
     */
    public static <T> List<T> map2(
        final Sexp left,
        final Sexp right,
        final BiFunction<? super Sexp, ? super Sexp, ? extends T> function
    ) {
        final var result = new ArrayList<T>();
        forEach2(left, right, (leftElement, rightElement) -> result.add(function.apply(leftElement, rightElement)));
        return Collections.unmodifiableList(result);
    }

    /**
     * Calls {@code consumer} on every element of the syntax list {@code stx}, from left to right.
     */
    public static void forEach(final Sexp stx, final Consumer<? super Sexp> consumer) {
        var rest = Stx.syntaxE(stx);
        while (rest instanceof Sexp.Pair pair) {
            consumer.accept(pair.car());
            rest = Stx.syntaxE(pair.cdr());
        }
        checkEnd(rest, stx);
    }

    /**
     * Calls {@code consumer} on the corresponding elements of two syntax lists, from left to right.
     * <p>
     * If the lists have different lengths, a fatal {@link MalformedSyntaxListCondition} is signaled once the shorter
     * one runs out; the elements before that point have already been consumed by then.
     */
    public static void forEach2(final Sexp left, final Sexp right, final BiConsumer<? super Sexp, ? super Sexp> consumer) {
        var leftRest = Stx.syntaxE(left);
        var rightRest = Stx.syntaxE(right);
        while (leftRest instanceof Sexp.Pair leftPair && rightRest instanceof Sexp.Pair rightPair) {
            consumer.accept(leftPair.car(), rightPair.car());
            leftRest = Stx.syntaxE(leftPair.cdr());
            rightRest = Stx.syntaxE(rightPair.cdr());
        }
        if (leftRest instanceof Sexp.Pair || rightRest instanceof Sexp.Pair) {
            throw signalError("Syntax lists of different lengths", (leftRest instanceof Sexp.Pair) ? left : right);
        }
        checkEnd(leftRest, left);
        checkEnd(rightRest, right);
    }

    /**
     * Returns {@code true} iff {@code predicate} holds for every element of the syntax list {@code stx}. Stops at the
     * first element it doesn't hold for, in which case the rest of the list isn't examined.
     */
    public static boolean andMap(final Sexp stx, final Predicate<? super Sexp> predicate) {
        var rest = Stx.syntaxE(stx);
        while (rest instanceof Sexp.Pair pair) {
            if (!predicate.test(pair.car())) {
                return false;
            }
            rest = Stx.syntaxE(pair.cdr());
        }
        checkEnd(rest, stx);
        return true;
    }

    /**
     * Returns {@code true} iff {@code predicate} holds for some element of the syntax list {@code stx}. Stops at the
     * first element it holds for, in which case the rest of the list isn't examined.
     */
    public static boolean orMap(final Sexp stx, final Predicate<? super Sexp> predicate) {
        var rest = Stx.syntaxE(stx);
        while (rest instanceof Sexp.Pair pair) {
            if (predicate.test(pair.car())) {
                return true;
            }
            rest = Stx.syntaxE(pair.cdr());
        }
        checkEnd(rest, stx);
        return false;
    }

    /**
     * Folds the syntax list {@code stx} from the head: {@code function} is called with each element and the
     * accumulator so far, starting from {@code initial}.
     */
    public static <T> T foldl(
        final Sexp stx,
        final T initial,
        final BiFunction<? super Sexp, ? super T, ? extends T> function
    ) {
        T accumulator = initial;
        var rest = Stx.syntaxE(stx);
        while (rest instanceof Sexp.Pair pair) {
            accumulator = function.apply(pair.car(), accumulator);
            rest = Stx.syntaxE(pair.cdr());
        }
        checkEnd(rest, stx);
        return accumulator;
    }

    /**
     * Folds the syntax list {@code stx} from the tail: {@code function} is called with each element and the result of
     * folding everything after it, the last element seeing {@code initial}.
     */
    public static <T> T foldr(
        final Sexp stx,
        final T initial,
        final BiFunction<? super Sexp, ? super T, ? extends T> function
    ) {
        final var elements = map(stx, Function.identity());
        T accumulator = initial;
        for (int i = elements.size() - 1; i >= 0; i -= 1) {
            accumulator = function.apply(elements.get(i), accumulator);
        }
        return accumulator;
    }

    /**
     * Returns a plain list of the elements of the syntax list {@code stx}, in reverse order. The elements themselves
     * are not modified.
     */
    public static Sexp reverse(final Sexp stx) {
        return foldl(stx, (Sexp) Sexp.Null.INSTANCE, Sexp.Pair::new);
    }

    /**
     * Returns the number of elements of the syntax list {@code stx}.
     */
    public static int length(final Sexp stx) {
        return foldl(stx, 0, (element, count) -> count + 1);
    }

    /**
     * Returns the last element of the syntax list {@code stx}.
     * <p>
     * If the list is empty, a fatal {@link MalformedSyntaxListCondition} is signaled.
     */
    public static Sexp last(final Sexp stx) {
        if (!(Stx.syntaxE(stx) instanceof Sexp.Pair)) {
            throw signalError("Expected a non-empty syntax list", stx);
        }
        return lastPair(stx).car();
    }

    /**
     * Returns the last pair of the syntax list {@code stx}, as its shallow unwrapping.
     * <p>
     * Dotted lists are accepted: the last pair of {@code (a b . c)} is {@code (b . c)}. If {@code stx} isn't a pair, a
     * fatal {@link MalformedSyntaxListCondition} is signaled.
     */
    public static Sexp.Pair lastPair(final Sexp stx) {
        if (!(Stx.syntaxE(stx) instanceof Sexp.Pair first)) {
            throw signalError("Expected a syntax pair", stx);
        }
        var current = first;
        while (Stx.syntaxE(current.cdr()) instanceof Sexp.Pair next) {
            current = next;
        }
        return current;
    }

    /**
     * Returns the syntax list {@code stx} without its first {@code count} elements.
     * <p>
     * If the list has fewer than {@code count} elements, a fatal {@link MalformedSyntaxListCondition} is signaled.
     *
     * @throws IllegalArgumentException if {@code count} is negative
     */
    public static Sexp listTail(final Sexp stx, final int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Negative list position " + count);
        }
        var rest = stx;
        for (int i = 0; i < count; i += 1) {
            if (!(Stx.syntaxE(rest) instanceof Sexp.Pair pair)) {
                throw signalError("Syntax list too short for position " + count, stx);
            }
            rest = pair.cdr();
        }
        return rest;
    }

    /**
     * Returns the element of the syntax list {@code stx} at the given zero-based position.
     * <p>
     * If the list has no such element, a fatal {@link MalformedSyntaxListCondition} is signaled.
     *
     * @throws IllegalArgumentException if {@code index} is negative
     */
    public static Sexp listRef(final Sexp stx, final int index) {
        if (Stx.syntaxE(listTail(stx, index)) instanceof Sexp.Pair pair) {
            return pair.car();
        }
        throw signalError("Syntax list too short for position " + index, stx);
    }

    /**
     * Equivalent to {@code getq(key, plist, Stx::stxEq)}.
     */
    public static @Nullable Sexp getq(final Sexp key, final Sexp plist) {
        return getq(key, plist, Stx::stxEq);
    }

    /**
     * Looks {@code key} up in the flat property list {@code (k1 v1 k2 v2 ...)}, returning the value following the first
     * key equal to it, or {@code null} if there's none.
     * <p>
     * {@code keyEquality} is called with each key of the list and {@code key}, in that order. A key without a value,
     * or an improper tail reached before the key is found, causes a fatal {@link MalformedSyntaxListCondition} to be
     * signaled.
     */
    public static @Nullable Sexp getq(
        final Sexp key,
        final Sexp plist,
        final BiPredicate<? super Sexp, ? super Sexp> keyEquality
    ) {
        var rest = Stx.syntaxE(plist);
        while (rest instanceof Sexp.Pair keyPair) {
            if (!(Stx.syntaxE(keyPair.cdr()) instanceof Sexp.Pair valuePair)) {
                throw signalError("Property list key without a value", plist);
            }
            if (keyEquality.test(keyPair.car(), key)) {
                return valuePair.car();
            }
            rest = Stx.syntaxE(valuePair.cdr());
        }
        checkEnd(rest, plist);
        return null;
    }

    /**
     * Equivalent to {@code isPlist(stx, Stx::isKeyword)}.
     */
    public static boolean isPlist(final Sexp stx) {
        return isPlist(stx, Stx::isKeyword);
    }

    /**
     * Returns {@code true} iff {@code stx} is a proper list of an even number of elements, where every element at an
     * even position satisfies {@code isKey}. Never signals anything.
     */
    public static boolean isPlist(final Sexp stx, final Predicate<? super Sexp> isKey) {
        var rest = Stx.syntaxE(stx);
        while (rest instanceof Sexp.Pair keyPair) {
            if (!isKey.test(keyPair.car()) || !(Stx.syntaxE(keyPair.cdr()) instanceof Sexp.Pair valuePair)) {
                return false;
            }
            rest = Stx.syntaxE(valuePair.cdr());
        }
        return rest == Sexp.Null.INSTANCE;
    }

    /**
     * Returns the elements of the syntax list {@code stx} as an unmodifiable Java list of syntax objects.
     */
    public static List<Sexp> syntaxToList(final Sexp stx) {
        return map(stx, Function.identity());
    }

    private static void checkEnd(final Sexp end, final Sexp list) {
        if (end != Sexp.Null.INSTANCE) {
            throw signalError("Expected a proper syntax list", list);
        }
    }

    private static UnhandledErrorError signalError(final String message, final Sexp offender) {
        return ConditionContext.error(new MalformedSyntaxListCondition(message, offender));
    }
}
