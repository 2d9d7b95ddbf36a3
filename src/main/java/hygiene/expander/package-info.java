// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The boundary with the expansion driver: running a single transformer hygienically.
 */
@NonNullByDefault
package hygiene.expander;

import hygiene.util.annotation.NonNullByDefault;
