// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hygiene.sexp;

import java.util.concurrent.ConcurrentHashMap;

/**
 * A table for interning Lisp symbols and keywords.
 * <p>
 * Interned symbols can be compared for equality using object identity, which is much faster than string comparison.
 * Symbols that were not interned, such as generated identifier names, are never equal to an interned symbol, even if
 * their names happen to coincide.
 * <p>
 * This class is thread-safe: multiple threads can safely intern symbols into the same symbol table at the same time
 * with no external synchronization.
 */
public final class SymbolTable {
    /**
     * Produces a canonical representation of the given symbol in this table.
     * <p>
     * If the symbol name refers to a known symbol, or a symbol with that name already exists in the table, a reference
     * to that existing symbol is returned. Otherwise, a new symbol is created and recorded as the canonical
     * representation of that symbol, that will be returned by future calls with the same symbol name.
     */
    public Sexp.Symbol intern(final String symbolName) {
        final var knownSymbol = Sexp.KnownSymbol.byName(symbolName);
        if (knownSymbol != null) {
            return knownSymbol;
        }
        return symbols.computeIfAbsent(symbolName, Sexp.RegularSymbol::new);
    }

    /**
     * Produces the canonical keyword with the given name, given without the leading colon.
     */
    public Sexp.Keyword internKeyword(final String keywordName) {
        return keywords.computeIfAbsent(keywordName, Sexp.Keyword::new);
    }

    private final ConcurrentHashMap<String, Sexp.RegularSymbol> symbols = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Sexp.Keyword> keywords = new ConcurrentHashMap<>();
}
