// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The S-expression reader, turning source text into source-tagged syntax.
 */
@NonNullByDefault
package hygiene.sexp.reader;

import hygiene.util.annotation.NonNullByDefault;
