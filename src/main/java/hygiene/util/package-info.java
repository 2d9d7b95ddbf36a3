// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Small utilities shared by every other package: traces and escape hatches for the checked exception mechanism.
 */
@NonNullByDefault
package hygiene.util;

import hygiene.util.annotation.NonNullByDefault;
