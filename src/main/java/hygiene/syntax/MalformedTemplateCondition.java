// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hygiene.syntax;

import hygiene.sexp.Sexp;

/**
 * A condition type indicating that syntax was requested to be built after a template that isn't an identifier.
 */
public final class MalformedTemplateCondition extends SyntaxErrorCondition {
    MalformedTemplateCondition(final Sexp template) {
        super("Bad template syntax; expected an identifier", template);
    }
}
