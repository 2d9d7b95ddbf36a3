// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hygiene.util.condition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import hygiene.util.SneakyThrow;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A condition context keeps track of currently registered handlers and restart points.
 * <p>
 * Each thread has its own context. Instances are not accessible directly; the static methods operate on the calling
 * thread's context.
 *
 * @see Handler
 * @see Restart
 */
public final class ConditionContext {
    private ConditionContext() {
    }

    /**
     * Signals the given condition.
     * <p>
     * Handlers are invoked from the newest to the oldest. If all of them decline, this method returns normally.
     * Since handlers are allowed to unwind to a restart point, it may throw {@link Unwind}.
     */
    public static void signal(final Condition condition) {
        localContext().signal(new SignaledCondition(condition, false));
    }

    /**
     * Signals the given condition as an error.
     * <p>
     * Behaves like {@link #signal(Condition)}, except that if all handlers decline, an {@link UnhandledErrorError} is
     * thrown. Since this method never returns normally, it's declared to return {@link UnhandledErrorError} that can
     * be "thrown" at call sites to help the compiler's control flow analysis.
     */
    public static UnhandledErrorError error(final Condition condition) {
        localContext().signal(new SignaledCondition(condition, true));
        throw new UnhandledErrorError(condition);
    }

    /**
     * Executes the given function with a restart point around it.
     *
     * @param restartName The user-readable name of this restart point.
     * @param callback    The function to execute; the restart object is passed as an argument.
     * @return The value returned by {@code callback}, or {@code null} if executing it unwound to this restart point.
     */
    public static <T> @Nullable T withRestart(final String restartName, final RestartCallback<? extends T> callback) {
        final var restart = new Restart(restartName);
        try {
            return callback.call(restart);
        } catch (final Throwable throwable) {
            if (!(throwable instanceof Unwind unwind) || unwind.target() != restart) {
                throw SneakyThrow.doThrow(throwable);
            }
            return null;
        } finally {
            restart.unlink();
        }
    }

    /**
     * Returns all active restart points of the calling thread, ordered from the newest one to the oldest.
     */
    public static List<Restart> restarts() {
        final var restarts = new ArrayList<Restart>();
        for (var restart = localContext().firstRestart; restart != null; restart = restart.next) {
            restarts.add(restart);
        }
        return Collections.unmodifiableList(restarts);
    }

    static ConditionContext localContext() {
        return localContext.get();
    }

    private void signal(final SignaledCondition condition) {
        for (var handler = findFirstHandler(); handler != null; handler = handler.next) {
            final var currentSave = currentHandler;
            currentHandler = handler;
            try {
                handler.handle(condition);
            } catch (final Unwind unwind) {
                throw SneakyThrow.doThrow(unwind);
            } finally {
                currentHandler = currentSave;
            }
        }
    }

    private @Nullable Handler findFirstHandler() {
        // A condition signaled from within a handler is only seen by the handlers established before that one.
        return (currentHandler == null) ? firstHandler : currentHandler.next;
    }

    @Nullable Handler firstHandler = null;
    @Nullable Restart firstRestart = null;
    private @Nullable Handler currentHandler = null;

    @SuppressWarnings("nullness:type.argument") // Not actually nullable, CF doesn't understand withInitial.
    private static final ThreadLocal<ConditionContext> localContext = ThreadLocal.withInitial(ConditionContext::new);
}
