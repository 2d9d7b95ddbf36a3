// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hygiene.util.condition;

/**
 * Throwable type used internally by the restart mechanism for transferring control flow to a given restart point.
 * <p>
 * Exposed so that functions can be marked as throwing {@code Unwind}. Catching or throwing objects of this type
 * manually is strongly discouraged.
 * <p>
 * It represents neither an exceptional situation nor an unrecoverable error, so it extends {@link Throwable}
 * directly rather than {@link Exception} or {@link Error}.
 */
@SuppressWarnings("ExtendsThrowable")
public final class Unwind extends Throwable {
    Unwind(final Restart target) {
        super("Unwinding to a restart point", null, false, false);
        this.target = target;
    }

    Restart target() {
        return target;
    }

    private final transient Restart target;
}
