// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hygiene.test;

import hygiene.sexp.DeferredWrap;
import hygiene.sexp.Hygiene;
import hygiene.sexp.MarkingMode;
import hygiene.sexp.Marks;
import hygiene.sexp.SealedQuote;
import hygiene.sexp.Sexp;
import hygiene.sexp.Sexps;
import hygiene.sexp.SymbolTable;
import hygiene.sexp.TokenAllocator;
import hygiene.syntax.Stx;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

final class MarkingModeTest {
    @ParameterizedTest
    @EnumSource(MarkingMode.class)
    void wrappingPreservesDatum(final MarkingMode mode) {
        final var hygiene = new Hygiene(mode);
        final var tree = TestSyntax.read(symbols, sampleText);
        final var wrapped = hygiene.stxWrap(tree, Marks.of(tokens.newMark(), tokens.newMark()));
        assertThat(Stx.syntaxToDatum(Hygiene.stxUnwrap(wrapped))).isEqualTo(Stx.syntaxToDatum(tree));
    }

    @ParameterizedTest
    @EnumSource(MarkingMode.class)
    void identifiersCarryNetMarks(final MarkingMode mode) {
        final var hygiene = new Hygiene(mode);
        final var a = tokens.newMark();
        final var b = tokens.newMark();
        final var tree = TestSyntax.read(symbols, "(f #(x) #&y . z)");
        // b is applied twice, so only a remains.
        final var wrapped = hygiene.stxWrap(tree, Marks.of(a, b, b));
        assertThat(TestSyntax.identifiers(wrapped))
            .extracting(TestSyntax.NamedMarks::name, TestSyntax.NamedMarks::marks)
            .containsExactly(
                tuple("f", Marks.of(a)),
                tuple("x", Marks.of(a)),
                tuple("y", Marks.of(a)),
                tuple("z", Marks.of(a)));
    }

    @ParameterizedTest
    @EnumSource(MarkingMode.class)
    void sealedQuoteInsideTreeIsUntouched(final MarkingMode mode) {
        final var hygiene = new Hygiene(mode);
        final var captured = Marks.of(tokens.newMark());
        final var quote = SealedQuote.of(symbols.intern("q"), null, null, captured);
        final var tree = Sexps.list(symbols.intern("f"), quote);
        final var marked = hygiene.stxApplyMark(tree, tokens.newMark());
        final var elements = Stx.syntaxE(marked);
        final var second = ((Sexp.Pair) Stx.syntaxE(((Sexp.Pair) elements).cdr())).car();
        assertThat(second).isSameAs(quote);
        assertThat(Stx.identifierMarks(second)).isEqualTo(captured);
    }

    @Test
    void modesAreObservablyEquivalent() {
        final var deferred = new Hygiene(MarkingMode.DEFERRED);
        final var eager = new Hygiene(MarkingMode.EAGER);
        final var tree = TestSyntax.read(symbols, sampleText);
        final var first = tokens.newMark();
        final var second = tokens.newMark();
        final var third = tokens.newMark();
        final var deferredResult = deferred.stxApplyMark(
            deferred.stxApplyMark(deferred.stxApplyMark(deferred.stxApplyMark(tree, first), second), second), third);
        final var eagerResult = eager.stxApplyMark(
            eager.stxApplyMark(eager.stxApplyMark(eager.stxApplyMark(tree, first), second), second), third);
        assertThat(TestSyntax.identifiers(deferredResult)).isEqualTo(TestSyntax.identifiers(eagerResult));
        assertThat(Stx.syntaxToDatum(deferredResult)).isEqualTo(Stx.syntaxToDatum(eagerResult));
    }

    @Test
    void eagerModeCreatesNoDeferredWraps() {
        final var eager = new Hygiene(MarkingMode.EAGER);
        final var tree = TestSyntax.read(symbols, "(a (b c))");
        final var marked = eager.stxApplyMark(tree, tokens.newMark());
        assertThat(marked).isNotInstanceOf(DeferredWrap.class);
        assertThat(Stx.identifierMarks(Stx.stxCar(marked))).hasSize(1);
    }

    @Test
    void modesCanBeMixed() {
        final var mark = tokens.newMark();
        final var tree = TestSyntax.read(symbols, "(a b)");
        final var deferredMarked = Hygiene.deferred().stxApplyMark(tree, mark);
        final var unmarked = new Hygiene(MarkingMode.EAGER).stxApplyMark(deferredMarked, mark);
        assertThat(TestSyntax.identifiers(unmarked))
            .extracting(TestSyntax.NamedMarks::marks)
            .containsOnly(Marks.empty());
        assertThat(Stx.stxSource(unmarked)).isNotNull().isEqualTo(Stx.stxSource(tree));
    }

    private static final String sampleText = "(let ((tmp 1)) (f #(a \"s\" 2.5) #&c :kw #\\x . d))";

    private final TokenAllocator tokens = new TokenAllocator();
    private final SymbolTable symbols = new SymbolTable();
}
