// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hygiene.sexp;

import java.util.concurrent.atomic.AtomicLong;

/**
 * The source of unique tokens for one compilation process: fresh {@link Mark}s and serial numbers for generated
 * symbol names.
 * <p>
 * This is the only mutable state shared between expansions. The counter only ever increases, so no token is reused
 * for the lifetime of the allocator. Create one allocator per compilation process and pass it to whatever needs to mint
 * tokens.
 * <p>
 * This class is thread-safe: independent compilation units can be expanded in parallel with the same allocator.
 */
public final class TokenAllocator {
    /**
     * Mints a fresh mark, distinct from every other mark in existence.
     */
    public Mark newMark() {
        return new Mark(nextSerial());
    }

    /**
     * Returns the next serial number. Serial numbers are strictly increasing.
     */
    public long nextSerial() {
        return counter.incrementAndGet();
    }

    private final AtomicLong counter = new AtomicLong(0);
}
