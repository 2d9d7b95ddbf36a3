// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hygiene.expander;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import hygiene.sexp.Hygiene;
import hygiene.sexp.Sexp;
import hygiene.sexp.Sexps;
import hygiene.sexp.TokenAllocator;
import hygiene.syntax.Stx;
import hygiene.syntax.SyntaxErrorCondition;
import hygiene.util.Trace;
import hygiene.util.condition.ConditionContext;
import hygiene.util.condition.Handler;
import hygiene.util.condition.Restart;
import hygiene.util.condition.SignaledCondition;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Runs macro transformers hygienically, one macro use at a time.
 * <p>
 * Each expansion mints a fresh mark and applies it to the macro use before the transformer sees it, and again to the
 * transformer's output. Whatever the transformer copied from its input thus loses the mark, while whatever it
 * introduced keeps it, and can't be confused with identifiers written by the user.
 * <p>
 * A fatal {@link SyntaxErrorCondition} signaled while the transformer runs, and not handled by anything established
 * inside it, abandons that macro use only: it's recorded as an {@link ExpansionDiagnostic} and {@link #expand} returns
 * {@code null}. Other conditions are left to the handlers established by the caller.
 * <p>
 * Instances are not thread-safe.
 */
public final class MacroStep {
    /**
     * Initializes a new instance applying marks with {@code hygiene} and minting them from {@code tokenAllocator}.
     */
    public MacroStep(final Hygiene hygiene, final TokenAllocator tokenAllocator) {
        this.hygiene = hygiene;
        this.tokenAllocator = tokenAllocator;
    }

    /**
     * Expands a single macro use with the given transformer.
     *
     * @return The marked expansion, or {@code null} if the macro use was abandoned because of malformed syntax.
     */
    public @Nullable Sexp expand(final Sexp macroUse, final Transformer transformer) {
        return ConditionContext.withRestart("skip-macro-use", restart -> {
            try (final var handler = new Handler(condition -> recordAndSkip(condition, restart))) {
                handler.use();
                try (final var trace = new Trace(() -> "Expanding macro use " + describe(macroUse))) {
                    trace.use();
                    final var mark = tokenAllocator.newMark();
                    final var input = hygiene.stxApplyMark(macroUse, mark);
                    final var output = transformer.transform(input);
                    return hygiene.stxApplyMark(output, mark);
                }
            }
        });
    }

    /**
     * Returns the diagnostics of all macro uses abandoned so far, oldest first.
     */
    public List<ExpansionDiagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    private void recordAndSkip(final SignaledCondition signaled, final Restart restart) {
        if (!signaled.isFatal() || !(signaled.condition() instanceof SyntaxErrorCondition condition)) {
            return;
        }
        diagnostics.add(new ExpansionDiagnostic(
            condition.getClass().getName(),
            condition.detailedMessage(),
            condition.location(),
            Trace.activeTraces()
        ));
        restart.unwindTo();
    }

    private static String describe(final Sexp macroUse) {
        final var location = Stx.stxSource(macroUse);
        final var printed = Sexps.prettyPrint(Stx.syntaxToDatum(macroUse));
        return (location != null) ? (printed + " at " + location) : printed;
    }

    private final Hygiene hygiene;
    private final TokenAllocator tokenAllocator;
    private final List<ExpansionDiagnostic> diagnostics = new ArrayList<>();
}
