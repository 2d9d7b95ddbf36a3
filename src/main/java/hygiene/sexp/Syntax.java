// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hygiene.sexp;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Base type of syntax objects: S-expressions carrying provenance or hygiene context on top of a plain datum.
 * <p>
 * The variants are an implementation detail of the hygiene algorithm. Code outside this library should inspect syntax
 * through {@code hygiene.syntax.Stx} and {@code hygiene.syntax.StxLists}, which resolve the wrapping correctly, rather
 * than by testing for the variant classes.
 */
public sealed interface Syntax extends Sexp permits SourceNode, Identifier, DeferredWrap, SealedQuote {
    /**
     * Returns the wrapped S-expression, one layer down.
     */
    Sexp content();

    /**
     * Returns the source location attached to this layer, or {@code null} if there's none.
     */
    @Nullable SourceLocation source();
}
