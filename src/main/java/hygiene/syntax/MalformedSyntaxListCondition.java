// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hygiene.syntax;

import hygiene.sexp.Sexp;

/**
 * A condition type indicating that a syntax-list operation was given syntax that isn't a list of the expected shape:
 * an improper list, lists of different lengths where they have to match, or a list too short for the requested
 * position.
 */
public final class MalformedSyntaxListCondition extends SyntaxErrorCondition {
    MalformedSyntaxListCondition(final String message, final Sexp offender) {
        super(message, offender);
    }
}
