// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hygiene.util;

/**
 * A lazily evaluated {@link Trace} message.
 * <p>
 * Printing a syntax tree is not free, so trace messages mentioning syntax are built only if something asks for them.
 */
@FunctionalInterface
public interface MessageSupplier {
    String get();
}
