// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hygiene.sexp;

import java.math.BigInteger;
import java.util.Arrays;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The base type of everything a macro expander manipulates: plain data as produced by a transformer, and the
 * {@link Syntax} objects that additionally carry provenance and hygiene context.
 * <p>
 * S-expression objects are guaranteed to be immutable once constructed, so subtrees can be shared freely between
 * expansion attempts.
 */
public sealed interface Sexp permits
    Sexp.Boolean,
    Sexp.Character,
    Sexp.Integer,
    Sexp.Real,
    Sexp.String,
    Sexp.Symbol,
    Sexp.Keyword,
    Sexp.Void,
    Sexp.Null,
    Sexp.Pair,
    Sexp.Vector,
    Sexp.Box,
    Sexp.HostValue,
    Syntax {
    /**
     * The two boolean objects.
     */
    enum Boolean implements Sexp {
        FALSE,
        TRUE;

        /**
         * Returns the boolean object representing the given Java boolean.
         */
        public static Boolean of(final boolean value) {
            return value ? TRUE : FALSE;
        }
    }

    /**
     * The empty list.
     */
    enum Null implements Sexp {
        INSTANCE
    }

    /**
     * The unspecified value, produced by forms evaluated for effect.
     */
    enum Void implements Sexp {
        INSTANCE
    }

    /**
     * A character, represented by its Unicode code point.
     */
    record Character(int codePoint) implements Sexp {
    }

    /**
     * An exact integer.
     */
    record Integer(BigInteger value) implements Sexp {
    }

    /**
     * An inexact real number.
     */
    record Real(double value) implements Sexp {
    }

    /**
     * An immutable string.
     */
    record String(java.lang.String value) implements Sexp {
    }

    /**
     * A cons cell. Proper lists are chains of pairs terminated by {@link Null#INSTANCE}.
     * <p>
     * The components may themselves be syntax objects: a transformer commonly builds a raw list out of pieces of its
     * input.
     */
    record Pair(Sexp car, Sexp cdr) implements Sexp {
    }

    /**
     * A box holding a single value. Unlike boxes of a running program, boxes appearing in syntax are never mutated.
     */
    record Box(Sexp value) implements Sexp {
    }

    /**
     * A vector of S-expressions.
     */
    final class Vector implements Sexp {
        /**
         * Initializes a new vector containing a copy of the given elements.
         */
        public Vector(final Sexp... elements) {
            this.elements = elements.clone();
        }

        /**
         * Returns the number of elements of this vector.
         */
        public int length() {
            return elements.length;
        }

        /**
         * Returns the element at the given index.
         *
         * @throws IndexOutOfBoundsException if the index is out of bounds
         */
        public Sexp get(final int index) {
            return elements[index];
        }

        /**
         * Returns a copy of the elements of this vector.
         */
        public Sexp[] toArray() {
            return elements.clone();
        }

        @Override
        public boolean equals(final @Nullable Object object) {
            return object instanceof Vector vector && Arrays.equals(elements, vector.elements);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(elements);
        }

        @Override
        public java.lang.String toString() {
            return "Vector" + Arrays.toString(elements);
        }

        private final Sexp[] elements;
    }

    /**
     * Base interface for Lisp symbols.
     * <p>
     * Symbol equality is guaranteed to be the same as object identity.
     */
    sealed interface Symbol extends Sexp {
        /**
         * Retrieves the name of this symbol.
         */
        java.lang.String symbolName();
    }

    /**
     * A regular Lisp symbol, not directly used by Java code.
     */
    final class RegularSymbol implements Sexp.Symbol {
        /**
         * Initializes a new, <em>uninterned</em> symbol.
         * <p>
         * Direct use of this constructor is reserved for generated names that must never be equal to anything read from
         * source; prefer {@link SymbolTable#intern(java.lang.String)} instead.
         */
        public RegularSymbol(final java.lang.String name) {
            this.name = name;
        }

        @Override
        public java.lang.String symbolName() {
            return name;
        }

        @Override
        public java.lang.String toString() {
            return name;
        }

        private final java.lang.String name;
    }

    /**
     * Lisp symbols directly used by Java code.
     */
    enum KnownSymbol implements Sexp.Symbol {
        QUOTE("quote"),
        QUASIQUOTE("quasiquote"),
        UNQUOTE("unquote"),
        UNQUOTE_SPLICING("unquote-splicing"),
        SYNTAX("syntax"),
        QUASISYNTAX("quasisyntax"),
        UNSYNTAX("unsyntax"),
        UNSYNTAX_SPLICING("unsyntax-splicing");

        KnownSymbol(final java.lang.String name) {
            this.name = name;
        }

        /**
         * Returns the known symbol with the given name, or {@code null} if there's none.
         */
        public static @Nullable KnownSymbol byName(final java.lang.String name) {
            for (final var symbol : values()) {
                if (symbol.name.equals(name)) {
                    return symbol;
                }
            }
            return null;
        }

        @Override
        public java.lang.String symbolName() {
            return name;
        }

        @Override
        public java.lang.String toString() {
            return name;
        }

        private final java.lang.String name;
    }

    /**
     * A keyword, such as {@code :transparent}. Keywords are self-quoting, and like symbols, they're interned in a
     * {@link SymbolTable} and compared by identity.
     */
    final class Keyword implements Sexp {
        Keyword(final java.lang.String name) {
            this.name = name;
        }

        /**
         * Retrieves the name of this keyword, without the leading colon.
         */
        public java.lang.String keywordName() {
            return name;
        }

        @Override
        public java.lang.String toString() {
            return ":" + name;
        }

        private final java.lang.String name;
    }

    /**
     * The extension point for host literal kinds defined outside this library, such as byte vectors or compiled
     * regular expressions embedded by a reader extension.
     * <p>
     * Host values are leaves: marks never apply to anything inside them.
     */
    non-sealed interface HostValue extends Sexp {
        /**
         * Returns {@code true} iff this value evaluates to itself, and so counts as a literal datum.
         */
        boolean isSelfQuoting();
    }
}
