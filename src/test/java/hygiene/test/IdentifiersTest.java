// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hygiene.test;

import hygiene.sexp.Hygiene;
import hygiene.sexp.Marks;
import hygiene.sexp.SealedQuote;
import hygiene.sexp.Sexp;
import hygiene.sexp.Sexps;
import hygiene.sexp.SourceLocation;
import hygiene.sexp.SymbolTable;
import hygiene.sexp.TokenAllocator;
import hygiene.syntax.Identifiers;
import hygiene.syntax.MalformedTemplateCondition;
import hygiene.syntax.Stx;
import hygiene.util.condition.UnhandledErrorError;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import org.junit.jupiter.api.Test;

final class IdentifiersTest {
    @Test
    void genidentProducesUninternedNames() {
        final var identifier = identifiers.genident();
        final var name = identifier.symbol().symbolName();
        assertThat(name).startsWith("g%");
        assertThat(identifier.symbol()).isNotSameAs(symbols.intern(name));
        assertThat(identifier.marks()).isEqualTo(Marks.empty());
    }

    @Test
    void genidentIsFreshEveryTime() {
        final var template = TestSyntax.read(symbols, "tmp");
        final var first = identifiers.genident(template);
        final var second = identifiers.genident(template);
        assertThat(first.symbol().symbolName()).startsWith("tmp%");
        assertThat(second.symbol().symbolName()).startsWith("tmp%");
        assertThat(first.symbol()).isNotSameAs(second.symbol());
        assertThat(Stx.stxEq(first, second)).isFalse();
        assertThat(Stx.boundIdentifierEquals(first, second)).isFalse();
    }

    @Test
    void genidentPrefersTemplateLocation() {
        final var explicit = new SourceLocation("elsewhere", 9, 9);
        assertThat(identifiers.genident(TestSyntax.read(symbols, "tmp"), explicit).source())
            .isEqualTo(new SourceLocation("test", 1, 1));
        assertThat(identifiers.genident(symbols.intern("tmp"), explicit).source()).isEqualTo(explicit);
        assertThat(identifiers.genident(Sexps.string("str"), explicit).symbol().symbolName()).startsWith("str%");
        assertThat(identifiers.genident(Sexps.integer(1)).symbol().symbolName()).startsWith("g%");
    }

    @Test
    void gentempsNamesEachAfterItsTemplate() {
        final var temps = identifiers.gentemps(TestSyntax.read(symbols, "(x y)"));
        assertThat(temps).hasSize(2);
        assertThat(temps.get(0).symbol().symbolName()).startsWith("x%");
        assertThat(temps.get(1).symbol().symbolName()).startsWith("y%");
    }

    @Test
    void stxIdentifierConcatenatesPartsInTemplateContext() {
        final var mark = tokens.newMark();
        final var template = Hygiene.deferred().stxApplyMark(TestSyntax.read(symbols, "point"), mark);
        final var result = identifiers.stxIdentifier(
            template,
            Sexps.string("make-"),
            template,
            symbols.internKeyword("-"),
            Sexps.integer(3),
            Sexps.character('d')
        );
        assertThat(Stx.stxE(result)).isSameAs(symbols.intern("make-point-3d"));
        assertThat(Stx.identifierMarks(result)).isEqualTo(Marks.of(mark));
        assertThat(Stx.stxSource(result)).isEqualTo(new SourceLocation("test", 1, 1));
    }

    @Test
    void stxIdentifierWithSealedTemplateIsSealed() {
        final var template = SealedQuote.of(symbols.intern("point"), null, null, Marks.empty());
        final Sexp result = identifiers.stxIdentifier(template, template, Sexps.string("?"));
        assertThat(Stx.isIdentifierQuote(result)).isTrue();
        assertThat(Stx.stxE(result)).isSameAs(symbols.intern("point?"));
    }

    @Test
    void stxIdentifierRejectsNonIdentifierTemplate() {
        assertThatExceptionOfType(UnhandledErrorError.class)
            .isThrownBy(() -> identifiers.stxIdentifier(Sexps.integer(1), Sexps.string("x")))
            .extracting(UnhandledErrorError::condition)
            .isInstanceOf(MalformedTemplateCondition.class);
    }

    private final TokenAllocator tokens = new TokenAllocator();
    private final SymbolTable symbols = new SymbolTable();
    private final Identifiers identifiers = new Identifiers(tokens, symbols);
}
