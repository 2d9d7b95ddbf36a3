// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hygiene.util.condition;

/**
 * The base type for all conditions.
 * <p>
 * Unlike exceptions, conditions are announced to handlers <em>before</em> the stack is unwound, which lets a handler
 * established around a single macro use inspect the failure and transfer control to a restart point established
 * after the handler itself.
 */
public abstract class Condition {
    /**
     * Initializes a new condition with the given user-readable message.
     */
    protected Condition(final String message) {
        this.message = message;
    }

    /**
     * Retrieves the user-readable message representing this condition.
     */
    public final String message() {
        return message;
    }

    /**
     * Retrieves the full, detailed, user-readable message representing this condition.
     * <p>
     * Subclasses typically append the offending syntax and its source location.
     */
    public String detailedMessage() {
        return message;
    }

    @Override
    public String toString() {
        return getClass().getName() + ": " + message;
    }

    private final String message;
}
