// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Common Lisp-inspired condition and restart system.
 * <p>
 * Malformed syntax is reported by signaling a condition: handlers established by the expansion driver run
 * <em>before</em> the stack is unwound, so they can still see which macro use is being expanded and pick the restart
 * that abandons just that use.
 */
@NonNullByDefault
package hygiene.util.condition;

import hygiene.util.annotation.NonNullByDefault;
