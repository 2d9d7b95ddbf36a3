// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hygiene.util;

/**
 * Facilities for bypassing the checked exception mechanism.
 * <p>
 * The only throwable this library throws sneakily is {@link hygiene.util.condition.Unwind}, which has to travel
 * through transformer code that has no business declaring it.
 */
public final class SneakyThrow {
    private SneakyThrow() {
    }

    /**
     * Throws the given throwable as an <em>unchecked exception</em>, no matter its static nor dynamic type.
     * <p>
     * Since this method never returns normally, it's declared to return {@link UnreachableCodeReachedError} that can
     * be "thrown" at call sites to help the compiler's control flow analysis.
     */
    public static UnreachableCodeReachedError doThrow(final Throwable throwable) {
        throw SneakyThrow.<RuntimeException>doThrowImpl(throwable);
    }

    // E is erased to Throwable, so the cast doesn't exist in bytecode, while the compiler sees only a RuntimeException.
    @SuppressWarnings("unchecked")
    private static <E extends Throwable> UnreachableCodeReachedError doThrowImpl(final Throwable throwable) throws E {
        throw (E) throwable;
    }
}
