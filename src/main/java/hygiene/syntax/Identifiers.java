// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hygiene.syntax;

import java.util.List;
import hygiene.sexp.Identifier;
import hygiene.sexp.Marks;
import hygiene.sexp.Sexp;
import hygiene.sexp.Sexps;
import hygiene.sexp.SourceLocation;
import hygiene.sexp.SymbolTable;
import hygiene.sexp.TokenAllocator;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Creation of new identifiers: fresh ones that can't clash with anything, and ones built from pieces of existing
 * syntax.
 */
public final class Identifiers {
    /**
     * Initializes a new instance drawing serial numbers from {@code tokenAllocator} and interning the names of built
     * identifiers in {@code symbolTable}.
     */
    public Identifiers(final TokenAllocator tokenAllocator, final SymbolTable symbolTable) {
        this.tokenAllocator = tokenAllocator;
        this.symbolTable = symbolTable;
    }

    /**
     * Equivalent to {@code genident(null, null)}.
     */
    public Identifier genident() {
        return genident(null, null);
    }

    /**
     * Equivalent to {@code genident(template, null)}.
     */
    public Identifier genident(final @Nullable Sexp template) {
        return genident(template, null);
    }

    /**
     * Returns a fresh identifier, distinct from every other identifier in existence.
     * <p>
     * Its symbol is uninterned, named {@code stem%n} where {@code n} is a serial number, and the stem is the name of
     * {@code template} if it's an identifier or a string, or {@code g} otherwise. It has no marks. Its location is that
     * of the template, if the template carries one, or {@code source} otherwise.
     */
    public Identifier genident(final @Nullable Sexp template, final @Nullable SourceLocation source) {
        final var stem = (template != null) ? stemOf(Stx.stxE(template)) : DEFAULT_STEM;
        final var symbol = new Sexp.RegularSymbol(stem + '%' + tokenAllocator.nextSerial());
        final var templateSource = (template != null) ? Stx.stxSource(template) : null;
        return Identifier.of(symbol, (templateSource != null) ? templateSource : source, Marks.empty());
    }

    /**
     * Returns a fresh identifier for every element of the syntax list {@code templates}, in order, named after the
     * element.
     */
    public List<Identifier> gentemps(final Sexp templates) {
        return StxLists.map(templates, template -> genident(template));
    }

    /**
     * Builds an identifier whose name is the concatenation of the displayed deep data of {@code parts}, in the context
     * and at the location of {@code template}.
     * <p>
     * Symbols and keywords contribute their names, strings their contents, characters themselves, and numbers their
     * decimal notation; anything else contributes its printed form. With the parts {@code make-}, {@code point}, the
     * result is the identifier {@code make-point} with the marks of {@code template}, so it's visible wherever
     * {@code template} is.
     * <p>
     * If {@code template} isn't an identifier, a fatal {@link MalformedTemplateCondition} is signaled.
     */
    public Sexp stxIdentifier(final Sexp template, final Sexp... parts) {
        final var builder = new StringBuilder();
        for (final var part : parts) {
            appendDisplay(builder, Stx.stxE(part));
        }
        final var symbol = symbolTable.intern(builder.toString());
        return Stx.datumToSyntax(template, symbol, Stx.stxSource(template));
    }

    private static String stemOf(final Sexp datum) {
        if (datum instanceof Sexp.Symbol symbol) {
            return symbol.symbolName();
        } else if (datum instanceof Sexp.String string) {
            return string.value();
        } else {
            return DEFAULT_STEM;
        }
    }

    private static void appendDisplay(final StringBuilder builder, final Sexp datum) {
        if (datum instanceof Sexp.Symbol symbol) {
            builder.append(symbol.symbolName());
        } else if (datum instanceof Sexp.Keyword keyword) {
            builder.append(keyword.keywordName());
        } else if (datum instanceof Sexp.String string) {
            builder.append(string.value());
        } else if (datum instanceof Sexp.Character character) {
            builder.appendCodePoint(character.codePoint());
        } else if (datum instanceof Sexp.Integer integer) {
            builder.append(integer.value());
        } else if (datum instanceof Sexp.Real real) {
            builder.append(real.value());
        } else {
            builder.append(Sexps.prettyPrint(Stx.syntaxToDatum(datum)));
        }
    }

    private static final String DEFAULT_STEM = "g";

    private final TokenAllocator tokenAllocator;
    private final SymbolTable symbolTable;
}
