// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hygiene.sexp;

import java.math.BigInteger;
import java.util.List;

/**
 * A utility class containing constructors for plain data and a printer for S-expressions of any kind.
 */
public final class Sexps {
    private Sexps() {
    }

    /**
     * Returns the proper list of the given elements.
     */
    public static Sexp list(final Sexp... elements) {
        return listWithTail(Sexp.Null.INSTANCE, elements);
    }

    /**
     * Returns the proper list of the given elements.
     */
    public static Sexp list(final List<? extends Sexp> elements) {
        Sexp result = Sexp.Null.INSTANCE;
        for (int i = elements.size() - 1; i >= 0; i -= 1) {
            result = new Sexp.Pair(elements.get(i), result);
        }
        return result;
    }

    /**
     * Returns the list of the given elements, terminated by {@code tail} instead of the empty list. If {@code tail}
     * isn't a list, the result is a dotted list.
     */
    public static Sexp listWithTail(final Sexp tail, final Sexp... elements) {
        var result = tail;
        for (int i = elements.length - 1; i >= 0; i -= 1) {
            result = new Sexp.Pair(elements[i], result);
        }
        return result;
    }

    /**
     * Returns a new pair.
     */
    public static Sexp.Pair cons(final Sexp car, final Sexp cdr) {
        return new Sexp.Pair(car, cdr);
    }

    /**
     * Returns a new vector of the given elements.
     */
    public static Sexp.Vector vector(final Sexp... elements) {
        return new Sexp.Vector(elements);
    }

    /**
     * Returns a new box holding the given value.
     */
    public static Sexp.Box box(final Sexp value) {
        return new Sexp.Box(value);
    }

    /**
     * Returns the string object of the given Java string.
     */
    public static Sexp.String string(final String value) {
        return new Sexp.String(value);
    }

    /**
     * Returns the exact integer of the given value.
     */
    public static Sexp.Integer integer(final long value) {
        return new Sexp.Integer(BigInteger.valueOf(value));
    }

    /**
     * Returns the character of the given code point.
     */
    public static Sexp.Character character(final int codePoint) {
        return new Sexp.Character(codePoint);
    }

    /**
     * Prints the given S-expression into a string, on a single line. Intended primarily for diagnostics.
     * <p>
     * Syntax objects are printed in the {@code #<...>} notation that cannot be read back, showing their marks:
     * {@code #<identifier tmp [m3]>}, {@code #<syntax (a b)>}, {@code #<syntax-wrap m3 (a b)>},
     * {@code #<syntax-quote x>}.
     */
    public static String prettyPrint(final Sexp sexp) {
        final var prettyPrinter = new PrettyPrinter();
        prettyPrinter.appendDispatch(sexp);
        return prettyPrinter.builder.toString();
    }

    private static final class PrettyPrinter {
        private void appendDispatch(final Sexp sexp) {
            if (sexp instanceof Syntax syntax) {
                appendSyntax(syntax);
            } else if (sexp instanceof Sexp.Pair pair) {
                append(pair);
            } else if (sexp instanceof Sexp.Vector vector) {
                append(vector);
            } else if (sexp instanceof Sexp.Box box) {
                builder.append("#&");
                appendDispatch(box.value());
            } else if (sexp instanceof Sexp.String string) {
                append(string.value());
            } else if (sexp instanceof Sexp.Character character) {
                append(character);
            } else if (sexp instanceof Sexp.Integer integer) {
                builder.append(integer.value());
            } else if (sexp instanceof Sexp.Real real) {
                builder.append(real.value());
            } else if (sexp instanceof Sexp.Symbol symbol) {
                builder.append(symbol.symbolName());
            } else if (sexp instanceof Sexp.Keyword keyword) {
                builder.append(':').append(keyword.keywordName());
            } else if (sexp instanceof Sexp.Boolean bool) {
                builder.append((bool == Sexp.Boolean.TRUE) ? "#t" : "#f");
            } else if (sexp == Sexp.Null.INSTANCE) {
                builder.append("()");
            } else if (sexp == Sexp.Void.INSTANCE) {
                builder.append("#!void");
            } else {
                builder.append("#<host ").append(sexp).append('>');
            }
        }

        private void appendSyntax(final Syntax syntax) {
            if (syntax instanceof Identifier identifier) {
                builder.append("#<identifier ").append(identifier.symbol().symbolName());
                builder.append(' ').append(identifier.marks()).append('>');
                return;
            }
            if (syntax instanceof DeferredWrap wrap) {
                builder.append("#<syntax-wrap ").append(wrap.mark()).append(' ');
            } else if (syntax instanceof SealedQuote) {
                builder.append("#<syntax-quote ");
            } else {
                builder.append("#<syntax ");
            }
            appendDispatch(syntax.content());
            builder.append('>');
        }

        private void append(final String string) {
            final var replaced = string.replace("\\", "\\\\").replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\t", "\\t");
            builder.append('"');
            builder.append(replaced);
            builder.append('"');
        }

        private void append(final Sexp.Character character) {
            builder.append("#\\");
            switch (character.codePoint()) {
                case ' ' -> builder.append("space");
                case '\n' -> builder.append("newline");
                case '\t' -> builder.append("tab");
                case '\r' -> builder.append("return");
                case 0 -> builder.append("nul");
                default -> builder.appendCodePoint(character.codePoint());
            }
        }

        private void append(final Sexp.Pair list) {
            builder.append('(');
            appendDispatch(list.car());
            var rest = list.cdr();
            while (rest instanceof Sexp.Pair pair) {
                builder.append(' ');
                appendDispatch(pair.car());
                rest = pair.cdr();
            }
            if (rest != Sexp.Null.INSTANCE) {
                builder.append(" . ");
                appendDispatch(rest);
            }
            builder.append(')');
        }

        private void append(final Sexp.Vector vector) {
            builder.append("#(");
            for (int i = 0; i < vector.length(); i += 1) {
                if (i != 0) {
                    builder.append(' ');
                }
                appendDispatch(vector.get(i));
            }
            builder.append(')');
        }

        private final StringBuilder builder = new StringBuilder();
    }
}
