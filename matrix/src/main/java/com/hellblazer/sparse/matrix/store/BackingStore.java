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

import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * The capabilities a sparse matrix needs from its associative storage. Implementations decide the traversal order
 * and how their cursors behave when the store is modified during traversal.
 * <p>
 * Keys and values are never null.
 *
 * @param <K> the key type
 * @param <V> the value type
 * @author hal.hildebrand
 */
public interface BackingStore<K, V> extends Iterable<Map.Entry<K, V>> {

    /**
     * Remove all entries
     */
    void clear();

    /**
     * Answer a cursor positioned before the first entry in this store's native order
     *
     * @return the cursor
     */
    StoreCursor<K, V> cursor();

    /**
     * Answer a cursor positioned after the last entry in this store's native order
     *
     * @return the cursor
     */
    StoreCursor<K, V> cursorAtEnd();

    /**
     * Remove the entry for the key, if present
     *
     * @param key the key
     * @return true if an entry was removed
     */
    boolean erase(K key);

    /**
     * Find the value stored for the key
     *
     * @param key the key
     * @return the value, or empty if absent
     */
    Optional<V> find(K key);

    boolean isEmpty();

    @Override
    default Iterator<Map.Entry<K, V>> iterator() {
        var cursor = cursor();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return cursor.hasNext();
            }

            @Override
            public Map.Entry<K, V> next() {
                if (!cursor.hasNext()) {
                    throw new NoSuchElementException();
                }
                return cursor.next();
            }
        };
    }

    /**
     * Insert the entry, overwriting any value already stored for the key
     *
     * @param key   the key
     * @param value the value
     */
    void put(K key, V value);

    int size();
}
