// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hygiene.test;

import java.util.Objects;
import hygiene.expander.MacroStep;
import hygiene.expander.Transformer;
import hygiene.sexp.Hygiene;
import hygiene.sexp.MarkingMode;
import hygiene.sexp.Marks;
import hygiene.sexp.Sexp;
import hygiene.sexp.Sexps;
import hygiene.sexp.SourceLocation;
import hygiene.sexp.SymbolTable;
import hygiene.sexp.TokenAllocator;
import hygiene.syntax.MalformedSyntaxListCondition;
import hygiene.syntax.Stx;
import hygiene.syntax.StxLists;
import hygiene.util.condition.Condition;
import hygiene.util.condition.ConditionContext;
import hygiene.util.condition.UnhandledErrorError;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

final class MacroStepTest {
    @ParameterizedTest
    @EnumSource(MarkingMode.class)
    void userIdentifiersLoseTheMarkWhileIntroducedOnesKeepIt(final MarkingMode mode) {
        final var step = new MacroStep(new Hygiene(mode), tokens);
        final var expansion = Objects.requireNonNull(step.expand(read("(swap! tmp y)"), swap()));
        final var introducedTmp = bindingName(expansion);
        final var userTmp = StxLists.listRef(StxLists.listRef(expansion, 2), 1);
        assertThat(Stx.stxEq(introducedTmp, userTmp)).isTrue();
        assertThat(Stx.boundIdentifierEquals(introducedTmp, userTmp)).isFalse();
        assertThat(Stx.identifierMarks(userTmp)).isEqualTo(Marks.empty());
        assertThat(Stx.identifierMarks(introducedTmp)).hasSize(1);
        assertThat(Stx.stxSource(userTmp)).isEqualTo(new SourceLocation("test", 1, 8));
        assertThat(step.diagnostics()).isEmpty();
    }

    @ParameterizedTest
    @EnumSource(MarkingMode.class)
    void eachExpansionIntroducesDistinctIdentifiers(final MarkingMode mode) {
        final var step = new MacroStep(new Hygiene(mode), tokens);
        final var first = Objects.requireNonNull(step.expand(read("(swap! a b)"), swap()));
        final var second = Objects.requireNonNull(step.expand(read("(swap! a b)"), swap()));
        final var firstTmp = bindingName(first);
        final var secondTmp = bindingName(second);
        assertThat(Stx.stxEq(firstTmp, secondTmp)).isTrue();
        assertThat(Stx.boundIdentifierEquals(firstTmp, secondTmp)).isFalse();
        assertThat(Stx.identifierMarks(firstTmp)).isNotEqualTo(Stx.identifierMarks(secondTmp));
    }

    @ParameterizedTest
    @EnumSource(MarkingMode.class)
    void malformedUseIsSkippedWithDiagnostic(final MarkingMode mode) {
        final var step = new MacroStep(new Hygiene(mode), tokens);
        assertThat(step.expand(read("(swap! a)"), swap())).isNull();
        assertThat(step.diagnostics()).hasSize(1);
        final var diagnostic = step.diagnostics().get(0);
        assertThat(diagnostic.conditionType()).isEqualTo(MalformedSyntaxListCondition.class.getName());
        assertThat(diagnostic.location()).isEqualTo(new SourceLocation("test", 1, 1));
        assertThat(diagnostic.traces()).containsExactly("Expanding macro use (swap! a) at test:1:1");
        assertThat(diagnostic.format()).contains("Offending syntax:", " - Expanding macro use (swap! a)");

        // The restart and handler are gone, later uses expand normally.
        assertThat(step.expand(read("(swap! a b)"), swap())).isNotNull();
        assertThat(step.diagnostics()).hasSize(1);
        assertThat(ConditionContext.restarts()).isEmpty();
    }

    @ParameterizedTest
    @EnumSource(MarkingMode.class)
    void otherConditionsAreLeftToTheCaller(final MarkingMode mode) {
        final var step = new MacroStep(new Hygiene(mode), tokens);
        final Transformer failing = use -> {
            throw ConditionContext.error(new Condition("Transformer failed") {
            });
        };
        assertThatExceptionOfType(UnhandledErrorError.class)
            .isThrownBy(() -> step.expand(read("(m)"), failing))
            .withMessageContaining("Transformer failed");
        assertThat(step.diagnostics()).isEmpty();
    }

    // (swap! a b) => (let ((tmp a)) (set! a b) (set! b tmp))
    private Transformer swap() {
        return use -> {
            final var a = StxLists.listRef(use, 1);
            final var b = StxLists.listRef(use, 2);
            final var tmp = symbols.intern("tmp");
            final var set = symbols.intern("set!");
            return Sexps.list(
                symbols.intern("let"),
                Sexps.list(Sexps.list(tmp, a)),
                Sexps.list(set, a, b),
                Sexps.list(set, b, tmp));
        };
    }

    private static Sexp bindingName(final Sexp expansion) {
        return Stx.stxCar(Stx.stxCar(StxLists.listRef(expansion, 1)));
    }

    private Sexp read(final String text) {
        return TestSyntax.read(symbols, text);
    }

    private final TokenAllocator tokens = new TokenAllocator();
    private final SymbolTable symbols = new SymbolTable();
}
