// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hygiene.expander;

import java.util.List;
import hygiene.sexp.SourceLocation;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A report of a macro use whose expansion was abandoned because of malformed syntax.
 *
 * @param conditionType   The name of the condition type that was signaled.
 * @param detailedMessage The detailed message of the condition, including the offending syntax.
 * @param location        The location of the offending syntax, if it carries one.
 * @param traces          The operation traces active when the condition was signaled, most recent first.
 */
public record ExpansionDiagnostic(
    String conditionType,
    String detailedMessage,
    @Nullable SourceLocation location,
    List<String> traces
) {
    /**
     * Formats this diagnostic into a multi-line user-readable report.
     */
    public String format() {
        final var builder = new StringBuilder();
        builder.append("A fatal condition of type ").append(conditionType).append(" has been signaled.\n");
        builder.append("\nDetailed message:\n").append(detailedMessage.stripTrailing()).append('\n');
        builder.append("\nOperation trace:\n");
        for (final var trace : traces) {
            builder.append(" - ").append(trace).append('\n');
        }
        return builder.toString();
    }
}
