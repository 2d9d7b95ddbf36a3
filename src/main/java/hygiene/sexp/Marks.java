// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hygiene.sexp;

import java.util.Iterator;
import java.util.NoSuchElementException;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An immutable sequence of {@link Mark}s, the most recently applied one first.
 * <p>
 * This is a persistent singly-linked list: prepending and dropping the first mark are constant-time and share the rest
 * of the sequence, which is what mark application needs. Two sequences are equal iff they contain the very same marks
 * in the same order.
 */
public final class Marks implements Iterable<Mark> {
    private Marks(final @Nullable Mark first, final @Nullable Marks rest, final int size) {
        this.first = first;
        this.rest = rest;
        this.size = size;
    }

    /**
     * Returns the empty mark sequence.
     */
    public static Marks empty() {
        return empty;
    }

    /**
     * Returns the sequence of the given marks, in the given order. No cancellation takes place.
     */
    public static Marks of(final Mark... marks) {
        var result = empty;
        for (int i = marks.length - 1; i >= 0; i -= 1) {
            result = result.prepended(marks[i]);
        }
        return result;
    }

    /**
     * Returns {@code true} iff this sequence contains no marks.
     */
    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Returns the number of marks in this sequence.
     */
    public int size() {
        return size;
    }

    /**
     * Returns the first, most recently applied, mark.
     *
     * @throws NoSuchElementException if this sequence is empty
     */
    public Mark first() {
        if (first == null) {
            throw new NoSuchElementException("No marks in an empty mark sequence");
        }
        return first;
    }

    /**
     * Returns this sequence without its first mark.
     *
     * @throws NoSuchElementException if this sequence is empty
     */
    public Marks rest() {
        if (rest == null) {
            throw new NoSuchElementException("No marks in an empty mark sequence");
        }
        return rest;
    }

    /**
     * Returns a new sequence starting with the given mark, followed by this sequence. No cancellation takes place,
     * use {@link Hygiene#applyMark(Mark, Marks)} for that.
     */
    @CheckReturnValue
    public Marks prepended(final Mark mark) {
        return new Marks(mark, this, size + 1);
    }

    /**
     * Returns the marks of this sequence in reverse order.
     */
    @CheckReturnValue
    public Marks reversed() {
        var result = empty;
        for (final var mark : this) {
            result = result.prepended(mark);
        }
        return result;
    }

    @Override
    public Iterator<Mark> iterator() {
        return new MarksIterator(this);
    }

    @Override
    public boolean equals(final @Nullable Object object) {
        if (this == object) {
            return true;
        }
        if (!(object instanceof Marks other) || other.size != size) {
            return false;
        }
        var left = this;
        var right = other;
        while (left.first != null) {
            if (left == right) {
                return true;
            }
            if (left.first != right.first) {
                return false;
            }
            left = left.rest();
            right = right.rest();
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = 1;
        for (final var mark : this) {
            hash = 31 * hash + System.identityHashCode(mark);
        }
        return hash;
    }

    @Override
    public String toString() {
        final var builder = new StringBuilder("[");
        for (final var mark : this) {
            if (builder.length() > 1) {
                builder.append(' ');
            }
            builder.append(mark);
        }
        return builder.append(']').toString();
    }

    private static final Marks empty = new Marks(null, null, 0);

    private final @Nullable Mark first;
    private final @Nullable Marks rest;
    private final int size;

    private static final class MarksIterator implements Iterator<Mark> {
        private MarksIterator(final Marks marks) {
            current = marks;
        }

        @Override
        public boolean hasNext() {
            return !current.isEmpty();
        }

        @Override
        public Mark next() {
            final var mark = current.first();
            current = current.rest();
            return mark;
        }

        private Marks current;
    }
}
