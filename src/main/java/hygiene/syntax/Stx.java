// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hygiene.syntax;

import java.util.ArrayList;
import hygiene.sexp.Hygiene;
import hygiene.sexp.Identifier;
import hygiene.sexp.InvalidStructureError;
import hygiene.sexp.Marks;
import hygiene.sexp.SealedQuote;
import hygiene.sexp.Sexp;
import hygiene.sexp.SourceLocation;
import hygiene.sexp.SourceNode;
import hygiene.sexp.Syntax;
import hygiene.util.condition.ConditionContext;
import hygiene.util.condition.UnhandledErrorError;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Accessors and predicates for syntax objects.
 * <p>
 * Every operation accepts plain data as well as syntax, and treats plain data as syntax with no context. None of them
 * mutate anything.
 */
public final class Stx {
    private Stx() {
    }

    /**
     * Returns the innermost datum of {@code stx}, peeling every syntax layer. For an identifier, that's its symbol.
     *
     * @see Hygiene#stxE(Sexp)
     */
    public static Sexp stxE(final Sexp stx) {
        return Hygiene.stxE(stx);
    }

    /**
     * Returns the immediate datum of {@code stx}, with pending marks pushed onto its elements.
     *
     * @see Hygiene#syntaxE(Sexp)
     */
    public static Sexp syntaxE(final Sexp stx) {
        return Hygiene.syntaxE(stx);
    }

    /**
     * Returns the source location of {@code stx}, or {@code null} if it has none.
     */
    public static @Nullable SourceLocation stxSource(final Sexp stx) {
        return Hygiene.stxSource(stx);
    }

    /**
     * Returns the first element of the syntax pair {@code stx}.
     * <p>
     * If {@code stx} isn't a pair, a fatal {@link MalformedSyntaxListCondition} is signaled.
     */
    public static Sexp stxCar(final Sexp stx) {
        if (syntaxE(stx) instanceof Sexp.Pair pair) {
            return pair.car();
        }
        throw signalNotPair(stx);
    }

    /**
     * Returns the rest of the syntax pair {@code stx}.
     * <p>
     * If {@code stx} isn't a pair, a fatal {@link MalformedSyntaxListCondition} is signaled.
     */
    public static Sexp stxCdr(final Sexp stx) {
        if (syntaxE(stx) instanceof Sexp.Pair pair) {
            return pair.cdr();
        }
        throw signalNotPair(stx);
    }

    /**
     * Returns {@code true} iff {@code stx} is a boolean.
     */
    public static boolean isBoolean(final Sexp stx) {
        return stxE(stx) instanceof Sexp.Boolean;
    }

    /**
     * Returns {@code true} iff {@code stx} is a character.
     */
    public static boolean isChar(final Sexp stx) {
        return stxE(stx) instanceof Sexp.Character;
    }

    /**
     * Returns {@code true} iff {@code stx} is a number, exact or not.
     */
    public static boolean isNumber(final Sexp stx) {
        final var datum = stxE(stx);
        return datum instanceof Sexp.Integer || datum instanceof Sexp.Real;
    }

    /**
     * Returns {@code true} iff {@code stx} is a keyword.
     */
    public static boolean isKeyword(final Sexp stx) {
        return stxE(stx) instanceof Sexp.Keyword;
    }

    /**
     * Returns {@code true} iff {@code stx} is a string.
     */
    public static boolean isString(final Sexp stx) {
        return stxE(stx) instanceof Sexp.String;
    }

    /**
     * Returns {@code true} iff {@code stx} is the unspecified value.
     */
    public static boolean isVoid(final Sexp stx) {
        return stxE(stx) == Sexp.Void.INSTANCE;
    }

    /**
     * Returns {@code true} iff the plain datum {@code datum} evaluates to itself: booleans, characters, numbers,
     * keywords, strings, the unspecified value, and host values that declare themselves self-quoting.
     */
    public static boolean isSelfQuoting(final Sexp datum) {
        if (datum instanceof Sexp.HostValue hostValue) {
            return hostValue.isSelfQuoting();
        }
        return datum instanceof Sexp.Boolean
            || datum instanceof Sexp.Character
            || datum instanceof Sexp.Integer
            || datum instanceof Sexp.Real
            || datum instanceof Sexp.Keyword
            || datum instanceof Sexp.String
            || datum == Sexp.Void.INSTANCE;
    }

    /**
     * Returns {@code true} iff {@code stx} is a literal datum that needs no quoting.
     */
    public static boolean isDatum(final Sexp stx) {
        return isSelfQuoting(stxE(stx));
    }

    /**
     * Returns {@code true} iff {@code stx} is a pair.
     */
    public static boolean isPair(final Sexp stx) {
        return syntaxE(stx) instanceof Sexp.Pair;
    }

    /**
     * Returns {@code true} iff {@code stx} is the empty list.
     */
    public static boolean isNull(final Sexp stx) {
        return syntaxE(stx) == Sexp.Null.INSTANCE;
    }

    /**
     * Returns {@code true} iff {@code stx} is a pair or the empty list.
     */
    public static boolean isPairOrNull(final Sexp stx) {
        final var datum = syntaxE(stx);
        return datum instanceof Sexp.Pair || datum == Sexp.Null.INSTANCE;
    }

    /**
     * Returns {@code true} iff {@code stx} is a proper list, possibly wrapped at any depth.
     */
    public static boolean isList(final Sexp stx) {
        var datum = syntaxE(stx);
        while (datum instanceof Sexp.Pair pair) {
            datum = syntaxE(pair.cdr());
        }
        return datum == Sexp.Null.INSTANCE;
    }

    /**
     * Returns {@code true} iff {@code stx} is a vector.
     */
    public static boolean isVector(final Sexp stx) {
        return syntaxE(stx) instanceof Sexp.Vector;
    }

    /**
     * Returns {@code true} iff {@code stx} is a box.
     */
    public static boolean isBox(final Sexp stx) {
        return syntaxE(stx) instanceof Sexp.Box;
    }

    /**
     * Returns {@code true} iff the innermost data of both syntax objects are the same object.
     * <p>
     * Symbols, keywords, booleans, the empty list and the unspecified value are unique, so this is the right test for
     * them. Identifiers compare equal whenever their symbols do, regardless of marks; use
     * {@link #boundIdentifierEquals(Sexp, Sexp)} to take hygiene into account.
     */
    public static boolean stxEq(final Sexp left, final Sexp right) {
        return stxE(left) == stxE(right);
    }

    /**
     * Returns {@code true} iff {@link #stxEq(Sexp, Sexp)} does, or both innermost data are equal numbers of the same
     * exactness, or equal characters.
     */
    public static boolean stxEqv(final Sexp left, final Sexp right) {
        final var leftDatum = stxE(left);
        final var rightDatum = stxE(right);
        if (leftDatum == rightDatum) {
            return true;
        }
        return (leftDatum instanceof Sexp.Integer || leftDatum instanceof Sexp.Real || leftDatum instanceof Sexp.Character)
            && leftDatum.equals(rightDatum);
    }

    /**
     * Returns {@code true} iff both syntax objects represent structurally equal data once all syntax is stripped.
     *
     * @see #syntaxToDatum(Sexp)
     */
    public static boolean stxEqual(final Sexp left, final Sexp right) {
        return syntaxToDatum(left).equals(syntaxToDatum(right));
    }

    /**
     * Returns {@code true} iff {@code stx} is the false boolean.
     */
    public static boolean isFalse(final Sexp stx) {
        return stxE(stx) == Sexp.Boolean.FALSE;
    }

    /**
     * Returns {@code true} iff {@code stx} is an identifier: a symbol, possibly wrapped at any depth, including one
     * sealed in a quote.
     */
    public static boolean isIdentifier(final Sexp stx) {
        return stxE(stx) instanceof Sexp.Symbol;
    }

    /**
     * Returns {@code true} iff {@code stx} is a sealed quote of a bare symbol.
     */
    public static boolean isIdentifierQuote(final Sexp stx) {
        return stx instanceof SealedQuote quote && quote.content() instanceof Sexp.Symbol;
    }

    /**
     * Returns {@code true} iff {@code stx} is a sealed quote, possibly underneath source nodes or deferred wraps (which
     * don't affect it).
     */
    public static boolean isSealedSyntax(final Sexp stx) {
        Sexp current = stx;
        while (current instanceof Syntax syntax) {
            if (syntax instanceof SealedQuote) {
                return true;
            }
            if (syntax instanceof Identifier) {
                return false;
            }
            current = syntax.content();
        }
        return false;
    }

    /**
     * Returns {@code true} iff {@code stx} is a proper list, possibly wrapped at any depth, of identifiers only.
     */
    public static boolean isIdentifierList(final Sexp stx) {
        return isList(stx) && StxLists.andMap(stx, Stx::isIdentifier);
    }

    /**
     * Returns the marks of the identifier {@code stx} after applying everything pending over it, or {@code null} if
     * {@code stx} isn't an identifier.
     * <p>
     * For a quote-sealed identifier, these are the definition-site marks captured by the quote.
     */
    public static @Nullable Marks identifierMarks(final Sexp stx) {
        final var unwrapped = Hygiene.stxUnwrap(stx);
        if (unwrapped instanceof Identifier identifier) {
            return identifier.marks();
        } else if (unwrapped instanceof SealedQuote quote && quotedSymbol(quote) != null) {
            return quote.marks();
        } else {
            return null;
        }
    }

    /**
     * Returns the definition-site context captured by the sealed quote {@code stx}, or {@code null} if {@code stx}
     * isn't a sealed quote or captured no context.
     */
    public static @Nullable Sexp quoteContext(final Sexp stx) {
        return (Hygiene.stxUnwrap(stx) instanceof SealedQuote quote) ? quote.context() : null;
    }

    /**
     * Returns the definition-site marks captured by the sealed quote {@code stx}, or {@code null} if {@code stx} isn't
     * a sealed quote.
     */
    public static @Nullable Marks quoteMarks(final Sexp stx) {
        return (Hygiene.stxUnwrap(stx) instanceof SealedQuote quote) ? quote.marks() : null;
    }

    /**
     * Returns {@code true} iff both arguments are identifiers denoting the same binding occurrence: the same symbol with
     * the same marks. Quote-sealed identifiers additionally need the same captured context, and are never equal to
     * identifiers that aren't sealed.
     * <p>
     * Two expansions of the same macro introducing {@code tmp} produce identifiers this method tells apart, even
     * though {@link #stxEq(Sexp, Sexp)} considers them equal.
     */
    public static boolean boundIdentifierEquals(final Sexp left, final Sexp right) {
        final var leftUnwrapped = Hygiene.stxUnwrap(left);
        final var rightUnwrapped = Hygiene.stxUnwrap(right);
        if (leftUnwrapped instanceof Identifier leftIdentifier
            && rightUnwrapped instanceof Identifier rightIdentifier) {
            return leftIdentifier.symbol() == rightIdentifier.symbol()
                && leftIdentifier.marks().equals(rightIdentifier.marks());
        }
        if (leftUnwrapped instanceof SealedQuote leftQuote && rightUnwrapped instanceof SealedQuote rightQuote) {
            final var leftSymbol = quotedSymbol(leftQuote);
            return leftSymbol != null
                && leftSymbol == quotedSymbol(rightQuote)
                && leftQuote.context() == rightQuote.context()
                && leftQuote.marks().equals(rightQuote.marks());
        }
        return false;
    }

    // The symbol sealed in the quote, seen through any source nodes the reader put around it.
    private static Sexp.@Nullable Symbol quotedSymbol(final SealedQuote quote) {
        return (stxE(quote.content()) instanceof Sexp.Symbol symbol) ? symbol : null;
    }

    /**
     * Returns the plain datum {@code stx} represents, with all syntax stripped at every depth.
     */
    public static Sexp syntaxToDatum(final Sexp stx) {
        final var datum = stxE(stx);
        if (datum instanceof Sexp.Pair) {
            final var cars = new ArrayList<Sexp>();
            var rest = datum;
            while (rest instanceof Sexp.Pair pair) {
                cars.add(syntaxToDatum(pair.car()));
                rest = stxE(pair.cdr());
            }
            var result = syntaxToDatum(rest);
            for (int i = cars.size() - 1; i >= 0; i -= 1) {
                result = new Sexp.Pair(cars.get(i), result);
            }
            return result;
        } else if (datum instanceof Sexp.Vector vector) {
            final var elements = vector.toArray();
            for (int i = 0; i < elements.length; i += 1) {
                elements[i] = syntaxToDatum(elements[i]);
            }
            return new Sexp.Vector(elements);
        } else if (datum instanceof Sexp.Box box) {
            return new Sexp.Box(syntaxToDatum(box.value()));
        } else {
            return datum;
        }
    }

    /**
     * Returns {@code stx} itself if it's already a syntax object, or a source node tagging the plain datum with the
     * given location otherwise.
     */
    public static Syntax wrapSource(final Sexp stx, final @Nullable SourceLocation source) {
        return (stx instanceof Syntax syntax) ? syntax : SourceNode.of(stx, source);
    }

    /**
     * Returns a sealed quote of {@code datum}: syntax frozen with the given definition-site context and marks, immune to
     * any mark applied later.
     */
    public static SealedQuote quoteSyntax(
        final Sexp datum,
        final @Nullable SourceLocation source,
        final @Nullable Sexp context,
        final Marks marks
    ) {
        return SealedQuote.of(datum, source, context, marks);
    }

    /**
     * Equivalent to {@code datumToSyntax(template, datum, null)}.
     */
    public static Sexp datumToSyntax(final @Nullable Sexp template, final Sexp datum) {
        return datumToSyntax(template, datum, null);
    }

    /**
     * Promotes a plain datum, typically produced by a transformer, into syntax.
     * <ul>
     * <li>If {@code datum} is already a syntax object, it's returned unchanged.
     * <li>If there's no template, {@code datum} is tagged with {@code source}.
     * <li>If the template is a quote-sealed identifier, the result is a sealed quote of {@code datum} carrying the
     * template's definition-site context and marks.
     * <li>Otherwise every symbol in {@code datum}, inside pairs, vectors and boxes, becomes an identifier carrying the
     * template's marks, as if it appeared in the source next to the template.
     * </ul>
     * The location defaults to that of the template.
     * <p>
     * If the template isn't an identifier, a fatal {@link MalformedTemplateCondition} is signaled.
     */
    public static Sexp datumToSyntax(
        final @Nullable Sexp template,
        final Sexp datum,
        final @Nullable SourceLocation source
    ) {
        if (datum instanceof Syntax) {
            return datum;
        }
        if (template == null) {
            return SourceNode.of(datum, source);
        }
        if (!isIdentifier(template)) {
            throw ConditionContext.error(new MalformedTemplateCondition(template));
        }
        final var location = (source != null) ? source : stxSource(template);
        final var unwrapped = Hygiene.stxUnwrap(template);
        if (unwrapped instanceof SealedQuote quote) {
            return SealedQuote.of(datum, location, quote.context(), quote.marks());
        } else if (unwrapped instanceof Identifier identifier) {
            return SourceNode.of(wrapSymbols(datum, identifier.marks(), location), location);
        } else {
            throw new InvalidStructureError("Identifier template didn't unwrap to an identifier", template);
        }
    }

    private static Sexp wrapSymbols(final Sexp datum, final Marks marks, final @Nullable SourceLocation source) {
        if (datum instanceof Sexp.Symbol symbol) {
            return Identifier.of(symbol, source, marks);
        } else if (datum instanceof Sexp.Pair) {
            final var cars = new ArrayList<Sexp>();
            var rest = datum;
            while (rest instanceof Sexp.Pair pair) {
                cars.add(wrapSymbols(pair.car(), marks, source));
                rest = pair.cdr();
            }
            var result = wrapSymbols(rest, marks, source);
            for (int i = cars.size() - 1; i >= 0; i -= 1) {
                result = new Sexp.Pair(cars.get(i), result);
            }
            return result;
        } else if (datum instanceof Sexp.Vector vector) {
            final var elements = vector.toArray();
            for (int i = 0; i < elements.length; i += 1) {
                elements[i] = wrapSymbols(elements[i], marks, source);
            }
            return new Sexp.Vector(elements);
        } else if (datum instanceof Sexp.Box box) {
            return new Sexp.Box(wrapSymbols(box.value(), marks, source));
        } else {
            // Syntax objects embedded in the datum already have their context.
            return datum;
        }
    }

    private static UnhandledErrorError signalNotPair(final Sexp stx) {
        return ConditionContext.error(new MalformedSyntaxListCondition("Expected a syntax pair", stx));
    }
}
