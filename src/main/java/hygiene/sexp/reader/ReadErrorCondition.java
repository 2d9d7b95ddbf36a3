// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hygiene.sexp.reader;

import hygiene.sexp.SourceLocation;
import hygiene.util.condition.Condition;

/**
 * A condition type indicating that the Lisp source could not be parsed.
 */
public final class ReadErrorCondition extends Condition {
    ReadErrorCondition(final String rawMessage, final SourceLocation location) {
        super(rawMessage);
        this.location = location;
    }

    /**
     * Returns the location in the source text the error was detected at.
     */
    public SourceLocation location() {
        return location;
    }

    @Override
    public String detailedMessage() {
        return message() + "\nAt " + location;
    }

    private final SourceLocation location;
}
