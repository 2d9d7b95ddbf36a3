// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The sanctioned way to inspect and build syntax: accessors, predicates, syntax-list operations and identifier
 * utilities that resolve hygiene wrapping lazily, one layer at a time.
 */
@NonNullByDefault
package hygiene.syntax;

import hygiene.util.annotation.NonNullByDefault;
