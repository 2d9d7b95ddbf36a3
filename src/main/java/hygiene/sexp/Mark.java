// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hygiene.sexp;

/**
 * A hygiene mark: an opaque token representing a single macro expansion step.
 * <p>
 * Marks are compared by identity only. The serial number exists purely so that marks can be told apart in printed
 * output; two marks minted by different {@link TokenAllocator}s may share a serial number, yet they never compare
 * equal.
 */
public final class Mark {
    Mark(final long serial) {
        this.serial = serial;
    }

    @Override
    public String toString() {
        return "m" + serial;
    }

    private final long serial;
}
