/*
 * Copyright (c) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package com.hellblazer.sparse.matrix.store;

import java.util.Map;
import java.util.Objects;

/**
 * A bidirectional position within a {@link BackingStore}. Like a {@link java.util.ListIterator}, a cursor sits in the
 * gap between two entries: {@link #next()} returns the entry after the gap and moves past it, {@link #previous()}
 * returns the entry before the gap and moves before it.
 * <p>
 * Entries returned are immutable snapshots. Whether a cursor stays usable after the store is modified is defined by
 * the store implementation.
 *
 * @param <K> the key type
 * @param <V> the value type
 * @author hal.hildebrand
 */
public interface StoreCursor<K, V> {

    boolean hasNext();

    boolean hasPrevious();

    /**
     * @return the entry after the cursor
     * @throws java.util.NoSuchElementException if the cursor is after the last entry
     */
    Map.Entry<K, V> next();

    /**
     * Answer a token identifying the gap this cursor sits in. Tokens from cursors of the same store are equal iff the
     * cursors are at the same position.
     *
     * @return the position token
     */
    Object position();

    /**
     * @return the entry before the cursor
     * @throws java.util.NoSuchElementException if the cursor is before the first entry
     */
    Map.Entry<K, V> previous();

    /**
     * @return the store this cursor traverses
     */
    BackingStore<K, V> store();

    /**
     * Answer true if the other cursor traverses the same store and sits at the same position
     */
    default boolean samePosition(StoreCursor<?, ?> other) {
        return other != null && store() == other.store() && Objects.equals(position(), other.position());
    }
}
