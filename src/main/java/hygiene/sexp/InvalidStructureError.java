// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hygiene.sexp;

/**
 * Error type signifying that a syntax object violates an invariant of the representation, for example a template that
 * passed the identifier check but didn't unwrap to an identifier.
 * <p>
 * Since this represents a defect in this library rather than in the code being expanded, this class extends
 * {@link AssertionError}.
 */
public final class InvalidStructureError extends AssertionError {
    public InvalidStructureError(final String message, final Sexp offender) {
        super(message + ": " + Sexps.prettyPrint(offender));
        this.offender = offender;
    }

    /**
     * Returns the syntax object that violated the invariant.
     */
    public Sexp offender() {
        return offender;
    }

    private final transient Sexp offender;
}
