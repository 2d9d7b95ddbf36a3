// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hygiene.test;

import hygiene.sexp.DeferredWrap;
import hygiene.sexp.Hygiene;
import hygiene.sexp.Identifier;
import hygiene.sexp.MarkingMode;
import hygiene.sexp.Marks;
import hygiene.sexp.SealedQuote;
import hygiene.sexp.Sexp;
import hygiene.sexp.Sexps;
import hygiene.sexp.SourceLocation;
import hygiene.sexp.SourceNode;
import hygiene.sexp.SymbolTable;
import hygiene.sexp.TokenAllocator;
import hygiene.syntax.Stx;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;

final class HygieneTest {
    @Test
    void applyMarkPrependsOrCancels() {
        final var a = tokens.newMark();
        final var b = tokens.newMark();
        assertThat(Hygiene.applyMark(a, Marks.empty())).isEqualTo(Marks.of(a));
        assertThat(Hygiene.applyMark(a, Marks.of(a))).isEqualTo(Marks.empty());
        assertThat(Hygiene.applyMark(a, Marks.of(b))).isEqualTo(Marks.of(a, b));
        assertThat(Hygiene.applyMark(a, Marks.of(b, a))).isEqualTo(Marks.of(a, b, a));
    }

    @Test
    void applyingMarkTwiceIsIdentity() {
        final var a = tokens.newMark();
        final var b = tokens.newMark();
        for (final var marks : new Marks[]{Marks.empty(), Marks.of(a), Marks.of(b), Marks.of(b, a), Marks.of(a, b)}) {
            assertThat(Hygiene.applyMark(a, Hygiene.applyMark(a, marks))).isEqualTo(marks);
            assertThat(Hygiene.applyMark(a, marks)).isNotEqualTo(marks);
        }
    }

    @Test
    void sealedQuoteIgnoresMarks() {
        final var quote = SealedQuote.of(symbols.intern("x"), null, null, Marks.empty());
        final var mark = tokens.newMark();
        for (final var mode : MarkingMode.values()) {
            assertThat(new Hygiene(mode).stxApplyMark(quote, mark)).isSameAs(quote);
        }
    }

    @Test
    void deferredWrapWithSameMarkIsPeeled() {
        final var hygiene = Hygiene.deferred();
        final var list = Sexps.list(symbols.intern("x"), symbols.intern("y"));
        final var mark = tokens.newMark();
        final var wrapped = hygiene.stxApplyMark(list, mark);
        assertThat(wrapped).isInstanceOf(DeferredWrap.class);
        assertThat(hygiene.stxApplyMark(wrapped, mark)).isSameAs(list);
    }

    @Test
    void markingIdentifierFoldsMarkIntoIt() {
        final var mark = tokens.newMark();
        final var identifier = Identifier.of(symbols.intern("x"), null, Marks.empty());
        final var marked = Hygiene.deferred().stxApplyMark(identifier, mark);
        assertThat(marked).isInstanceOf(Identifier.class);
        assertThat(((Identifier) marked).marks()).isEqualTo(Marks.of(mark));
        assertThat(Hygiene.deferred().stxApplyMark(marked, mark)).isEqualTo(identifier);
    }

    @Test
    void unwrapTurnsSymbolIntoIdentifierWithMarksMostRecentFirst() {
        final var a = tokens.newMark();
        final var b = tokens.newMark();
        final var x = symbols.intern("x");
        final var wrapped = Hygiene.deferred().stxWrap(x, Marks.of(a, b));
        final var unwrapped = Hygiene.stxUnwrap(wrapped);
        assertThat(unwrapped).isInstanceOf(Identifier.class);
        final var identifier = (Identifier) unwrapped;
        assertThat(identifier.symbol()).isSameAs(x);
        assertThat(identifier.marks()).isEqualTo(Marks.of(b, a));
    }

    @Test
    void rewrapReproducesIdentifierContext() {
        final var a = tokens.newMark();
        final var b = tokens.newMark();
        final var context = Marks.of(b, a);
        final var rewrapped = Hygiene.deferred().stxRewrap(symbols.intern("y"), context);
        assertThat(Stx.identifierMarks(rewrapped)).isEqualTo(context);
    }

    @Test
    void unwrapPushesPendingMarksOntoElements() {
        final var mark = tokens.newMark();
        final var list = Sexps.list(symbols.intern("x"), Sexps.integer(1));
        final var datum = Hygiene.syntaxE(Hygiene.deferred().stxApplyMark(list, mark));
        assertThat(datum).isInstanceOf(Sexp.Pair.class);
        final var first = ((Sexp.Pair) datum).car();
        assertThat(Stx.identifierMarks(first)).isEqualTo(Marks.of(mark));
        assertThat(Stx.syntaxToDatum(datum)).isEqualTo(list);
    }

    @Test
    void unwrapKeepsMostSpecificLocation() {
        final var outer = new SourceLocation("test", 1, 1);
        final var inner = new SourceLocation("test", 1, 5);
        final var mark = tokens.newMark();
        final var node = SourceNode.of(SourceNode.of(symbols.intern("x"), inner), outer);
        final var unwrapped = Hygiene.stxUnwrap(Hygiene.deferred().stxApplyMark(node, mark));
        assertThat(unwrapped.toString()).startsWith("#<identifier x");
        assertThat(((Identifier) unwrapped).source()).isEqualTo(inner);
    }

    @Test
    void unwrapOfQuoteDiscardsPendingMarks() {
        final var quote = SealedQuote.of(symbols.intern("x"), null, null, Marks.empty());
        assertThat(Hygiene.stxUnwrap(quote, Marks.of(tokens.newMark()))).isSameAs(quote);
    }

    @Test
    void datumToSyntaxTakesTemplateMarks() {
        final var a = tokens.newMark();
        final var template = Identifier.of(symbols.intern("x"), null, Marks.of(a));
        final var foo = symbols.intern("foo");
        final var result = Stx.datumToSyntax(template, foo);
        assertThat(Stx.stxE(result)).isSameAs(foo);
        assertThat(Stx.identifierMarks(result)).isEqualTo(Marks.of(a));
    }

    private final TokenAllocator tokens = new TokenAllocator();
    private final SymbolTable symbols = new SymbolTable();
}
