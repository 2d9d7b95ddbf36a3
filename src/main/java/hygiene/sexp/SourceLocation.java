// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hygiene.sexp;

/**
 * The place in the source text a syntax object was read from.
 * <p>
 * This library never interprets locations, it only carries them around so that diagnostics can point at the right
 * place.
 *
 * @param origin A user-readable name of the source, such as a file name.
 * @param line   The 1-based line number.
 * @param column The 1-based column number, counted in bytes.
 */
public record SourceLocation(String origin, int line, int column) {
    @Override
    public String toString() {
        return origin + ':' + line + ':' + column;
    }
}
