// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hygiene.test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import hygiene.sexp.Marks;
import hygiene.sexp.Sexp;
import hygiene.sexp.SymbolTable;
import hygiene.sexp.Syntax;
import hygiene.sexp.reader.ByteStream;
import hygiene.sexp.reader.Reader;
import hygiene.syntax.Stx;

final class TestSyntax {
    private TestSyntax() {
    }

    static Reader reader(final SymbolTable symbolTable, final String text) {
        final var stream = new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
        return new Reader(new ByteStream(stream), symbolTable, "test");
    }

    static Syntax read(final SymbolTable symbolTable, final String text) {
        return Objects.requireNonNull(reader(symbolTable, text).readTopLevelForm());
    }

    // Every identifier reachable from the given syntax, left to right, as its name and marks.
    static List<NamedMarks> identifiers(final Sexp stx) {
        final var result = new ArrayList<NamedMarks>();
        collectIdentifiers(stx, result);
        return result;
    }

    private static void collectIdentifiers(final Sexp stx, final List<NamedMarks> result) {
        if (Stx.isIdentifier(stx)) {
            final var symbol = (Sexp.Symbol) Stx.stxE(stx);
            result.add(new NamedMarks(symbol.symbolName(), Objects.requireNonNull(Stx.identifierMarks(stx))));
            return;
        }
        final var datum = Stx.syntaxE(stx);
        if (datum instanceof Sexp.Pair pair) {
            collectIdentifiers(pair.car(), result);
            collectIdentifiers(pair.cdr(), result);
        } else if (datum instanceof Sexp.Vector vector) {
            for (int i = 0; i < vector.length(); i += 1) {
                collectIdentifiers(vector.get(i), result);
            }
        } else if (datum instanceof Sexp.Box box) {
            collectIdentifiers(box.value(), result);
        }
    }

    record NamedMarks(String name, Marks marks) {
    }
}
