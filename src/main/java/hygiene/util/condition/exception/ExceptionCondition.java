// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hygiene.util.condition.exception;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import hygiene.util.condition.Condition;

/**
 * The base type of conditions that stand in for a caught Java exception, so that it can be handled like any other
 * condition.
 */
abstract class ExceptionCondition<E extends Exception> extends Condition {
    ExceptionCondition(final E exception) {
        super(String.valueOf(exception.getMessage()));
        this.exception = exception;
    }

    /**
     * Returns the exception this condition represents.
     */
    public final E exception() {
        return exception;
    }

    /**
     * Returns the stack trace of the represented exception.
     */
    @Override
    public String detailedMessage() {
        final var charset = StandardCharsets.UTF_8;
        final var stream = new ByteArrayOutputStream();
        final var printStream = new PrintStream(stream, false, charset);
        exception.printStackTrace(printStream);
        printStream.flush();
        return stream.toString(charset);
    }

    @Override
    public String toString() {
        return getClass().getName() + ": " + exception;
    }

    private final E exception;
}
