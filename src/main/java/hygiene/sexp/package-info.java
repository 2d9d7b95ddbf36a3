// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Representation of S-expressions and syntax objects as Java objects, and the mark algorithm that keeps them hygienic.
 */
@NonNullByDefault
package hygiene.sexp;

import hygiene.util.annotation.NonNullByDefault;
