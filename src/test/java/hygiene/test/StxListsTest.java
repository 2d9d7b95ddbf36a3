// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hygiene.test;

import java.util.ArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import hygiene.sexp.Hygiene;
import hygiene.sexp.Marks;
import hygiene.sexp.Sexp;
import hygiene.sexp.Sexps;
import hygiene.sexp.SymbolTable;
import hygiene.sexp.Syntax;
import hygiene.sexp.TokenAllocator;
import hygiene.syntax.MalformedSyntaxListCondition;
import hygiene.syntax.Stx;
import hygiene.syntax.StxLists;
import hygiene.util.condition.ConditionContext;
import hygiene.util.condition.Handler;
import hygiene.util.condition.UnhandledErrorError;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.Test;

final class StxListsTest {
    @Test
    void mapVisitsElementsInOrderExactlyOnce() {
        final var visited = new ArrayList<String>();
        final var result = StxLists.map(read("(a b c)"), element -> {
            visited.add(nameOf(element));
            return nameOf(element).toUpperCase();
        });
        assertThat(visited).containsExactly("a", "b", "c");
        assertThat(result).containsExactly("A", "B", "C");
    }

    @Test
    void mapHandsOutElementsCarryingPendingMarks() {
        final var mark = tokens.newMark();
        final var marked = Hygiene.deferred().stxApplyMark(read("(a b)"), mark);
        assertThat(StxLists.map(marked, Stx::identifierMarks)).containsExactly(Marks.of(mark), Marks.of(mark));
    }

    @Test
    void map2PairsElements() {
        final var result = StxLists.map2(
            read("(a b)"),
            read("(1 2)"),
            (name, value) -> nameOf(name) + ((Sexp.Integer) Stx.stxE(value)).value()
        );
        assertThat(result).containsExactly("a1", "b2");
    }

    @Test
    void twoListOperationsRejectDifferentLengths() {
        assertSignalsMalformedList(() -> StxLists.map2(read("(a b)"), read("(1)"), (left, right) -> left));
        assertSignalsMalformedList(() -> StxLists.forEach2(read("(a)"), read("(1 2)"), (left, right) -> {
        }));
    }

    @Test
    void improperTailsAreRejected() {
        final var improper = read("(a b . c)");
        assertSignalsMalformedList(() -> StxLists.map(improper, element -> element));
        assertSignalsMalformedList(() -> StxLists.forEach(improper, element -> {
        }));
        assertSignalsMalformedList(() -> StxLists.length(improper));
        assertSignalsMalformedList(() -> StxLists.foldr(improper, 0, (element, count) -> count + 1));
        assertSignalsMalformedList(() -> StxLists.syntaxToList(read("a")));
    }

    @Test
    void malformedListCanBeRecoveredFrom() {
        final var improper = read("(a . b)");
        final var result = ConditionContext.withRestart("use-default", restart -> {
            try (final var handler = new Handler(condition -> restart.unwindTo())) {
                handler.use();
                return StxLists.length(improper);
            }
        });
        assertThat(result).isNull();
    }

    @Test
    void foldsGoInOppositeDirections() {
        final var list = read("(a b c)");
        assertThat(StxLists.foldl(list, "", (element, accumulator) -> accumulator + nameOf(element)))
            .isEqualTo("abc");
        assertThat(StxLists.foldr(list, "", (element, accumulator) -> accumulator + nameOf(element)))
            .isEqualTo("cba");
        assertThat(StxLists.foldl(read("()"), "init", (element, accumulator) -> "changed")).isEqualTo("init");
    }

    @Test
    void andMapAndOrMapShortCircuit() {
        final var calls = new AtomicInteger();
        assertThat(StxLists.andMap(read("(1 a 2)"), element -> {
            calls.incrementAndGet();
            return Stx.isNumber(element);
        })).isFalse();
        assertThat(calls).hasValue(2);
        calls.set(0);
        assertThat(StxLists.orMap(read("(a 1 b)"), element -> {
            calls.incrementAndGet();
            return Stx.isNumber(element);
        })).isTrue();
        assertThat(calls).hasValue(2);
        assertThat(StxLists.andMap(read("()"), element -> false)).isTrue();
        assertThat(StxLists.orMap(read("()"), element -> true)).isFalse();
    }

    @Test
    void navigationWorks() {
        final var list = read("(a b c)");
        assertThat(StxLists.length(list)).isEqualTo(3);
        assertThat(StxLists.length(read("()"))).isZero();
        assertThat(Stx.syntaxToDatum(StxLists.reverse(list)))
            .isEqualTo(Sexps.list(symbols.intern("c"), symbols.intern("b"), symbols.intern("a")));
        assertThat(nameOf(StxLists.last(list))).isEqualTo("c");
        assertThat(Stx.syntaxToDatum(StxLists.listTail(list, 1)))
            .isEqualTo(Sexps.list(symbols.intern("b"), symbols.intern("c")));
        assertThat(StxLists.listTail(list, 0)).isSameAs(list);
        assertThat(nameOf(StxLists.listRef(list, 2))).isEqualTo("c");
        assertThat(StxLists.syntaxToList(list)).hasSize(3);
    }

    @Test
    void lastPairAcceptsDottedLists() {
        final var lastPair = StxLists.lastPair(read("(a b . c)"));
        assertThat(nameOf(lastPair.car())).isEqualTo("b");
        assertThat(nameOf(lastPair.cdr())).isEqualTo("c");
    }

    @Test
    void navigationPastTheEndIsRejected() {
        final var list = read("(a b c)");
        assertSignalsMalformedList(() -> StxLists.listRef(list, 3));
        assertSignalsMalformedList(() -> StxLists.listTail(list, 4));
        assertSignalsMalformedList(() -> StxLists.last(read("()")));
        assertSignalsMalformedList(() -> StxLists.lastPair(read("()")));
        assertThatExceptionOfType(IllegalArgumentException.class).isThrownBy(() -> StxLists.listRef(list, -1));
    }

    @Test
    void getqFindsValuesByKey() {
        final var plist = read("(:a 1 :b 2)");
        final var value = StxLists.getq(symbols.internKeyword("b"), plist);
        assertThat(value).isNotNull();
        assertThat(Stx.stxE(value)).isEqualTo(Sexps.integer(2));
        assertThat(StxLists.getq(symbols.internKeyword("c"), plist)).isNull();
        assertThat(StxLists.getq(Sexps.string("a"), read("(\"a\" 1)"), Stx::stxEqual)).isNotNull();
        assertSignalsMalformedList(() -> StxLists.getq(symbols.internKeyword("c"), read("(:a 1 :b)")));
    }

    @Test
    void getqSeesThroughMarks() {
        final var marked = Hygiene.deferred().stxApplyMark(read("(:a x)"), tokens.newMark());
        final var value = StxLists.getq(symbols.internKeyword("a"), marked);
        assertThat(value).isNotNull();
        assertThat(Stx.identifierMarks(value)).hasSize(1);
    }

    @Test
    void isPlistChecksShape() {
        assertThat(StxLists.isPlist(read("(:a 1 :b 2)"))).isTrue();
        assertThat(StxLists.isPlist(read("()"))).isTrue();
        assertThat(StxLists.isPlist(read("(:a 1 :b)"))).isFalse();
        assertThat(StxLists.isPlist(read("(a 1)"))).isFalse();
        assertThat(StxLists.isPlist(read("(:a 1 . :b)"))).isFalse();
        assertThat(StxLists.isPlist(read("(a 1)"), Stx::isIdentifier)).isTrue();
    }

    private Syntax read(final String text) {
        return TestSyntax.read(symbols, text);
    }

    private static String nameOf(final Sexp stx) {
        return ((Sexp.Symbol) Stx.stxE(stx)).symbolName();
    }

    private static void assertSignalsMalformedList(final ThrowingCallable callable) {
        assertThatExceptionOfType(UnhandledErrorError.class)
            .isThrownBy(callable)
            .extracting(UnhandledErrorError::condition)
            .isInstanceOf(MalformedSyntaxListCondition.class);
    }

    private final TokenAllocator tokens = new TokenAllocator();
    private final SymbolTable symbols = new SymbolTable();
}
