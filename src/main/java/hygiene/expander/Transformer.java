// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hygiene.expander;

import hygiene.sexp.Sexp;

/**
 * A macro transformer: a function from the syntax of a macro use to its expansion.
 * <p>
 * Transformers report malformed input by signaling a
 * {@link hygiene.syntax.SyntaxErrorCondition SyntaxErrorCondition}, typically through the syntax accessors.
 */
@FunctionalInterface
public interface Transformer {
    /**
     * Returns the expansion of the given macro use.
     */
    Sexp transform(Sexp macroUse);
}
