// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hygiene.util.condition;

/**
 * A functional interface representing {@link Handler} procedures.
 */
@FunctionalInterface
public interface HandlerProcedure {
    /**
     * Processes the given condition.
     * <p>
     * A handler declines by returning normally, or handles the condition by performing a non-local control flow
     * transfer, typically {@link Restart#unwindTo()}.
     */
    void handle(SignaledCondition condition) throws Unwind;
}
