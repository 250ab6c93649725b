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

import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * A {@link BackingStore} over a {@link HashMap}, traversed in hash order.
 * <p>
 * Cursors are fail-fast: once a key is inserted or erased (or the store cleared) after a cursor was created, the
 * cursor's next step throws {@link ConcurrentModificationException}. Overwriting the value of a key that is already
 * present is not a structural change and is observed by live cursors.
 * <p>
 * Each cursor copies the current key set when it is created, so every {@link #cursor()} and {@link #cursorAtEnd()},
 * and with them every for-each loop, stream and iterator comparison on a matrix over this store, costs time and
 * memory proportional to the number of entries.
 *
 * @param <K> the key type
 * @param <V> the value type
 * @author hal.hildebrand
 */
public class HashedStore<K, V> implements BackingStore<K, V> {

    private final HashMap<K, V> map;
    private       int           modCount;

    public HashedStore() {
        map = new HashMap<>();
    }

    /**
     * Create a store preallocated for the expected number of entries
     *
     * @param initialCapacity the initial capacity of the hash table
     */
    public HashedStore(int initialCapacity) {
        map = new HashMap<>(initialCapacity);
    }

    public HashedStore(int initialCapacity, float loadFactor) {
        map = new HashMap<>(initialCapacity, loadFactor);
    }

    @Override
    public void clear() {
        if (!map.isEmpty()) {
            map.clear();
            modCount++;
        }
    }

    @Override
    public StoreCursor<K, V> cursor() {
        return new Cursor(false);
    }

    @Override
    public StoreCursor<K, V> cursorAtEnd() {
        return new Cursor(true);
    }

    @Override
    public boolean erase(K key) {
        if (map.remove(key) != null) {
            modCount++;
            return true;
        }
        return false;
    }

    @Override
    public Optional<V> find(K key) {
        return Optional.ofNullable(map.get(key));
    }

    @Override
    public boolean isEmpty() {
        return map.isEmpty();
    }

    @Override
    public void put(K key, V value) {
        Objects.requireNonNull(key, "Key cannot be null");
        Objects.requireNonNull(value, "Value cannot be null");
        if (map.put(key, value) == null) {
            modCount++;
        }
    }

    @Override
    public int size() {
        return map.size();
    }

    @Override
    public String toString() {
        return "HashedStore" + map;
    }

    private class Cursor implements StoreCursor<K, V> {
        private final List<K> keys;
        private final int     expectedModCount;
        private       int     index;

        private Cursor(boolean atEnd) {
            keys = new ArrayList<>(map.keySet());
            expectedModCount = modCount;
            index = atEnd ? keys.size() : 0;
        }

        @Override
        public boolean hasNext() {
            return index < keys.size();
        }

        @Override
        public boolean hasPrevious() {
            return index > 0;
        }

        @Override
        public Map.Entry<K, V> next() {
            checkForComodification();
            if (index >= keys.size()) {
                throw new NoSuchElementException();
            }
            var key = keys.get(index++);
            return Map.entry(key, map.get(key));
        }

        @Override
        public Object position() {
            return index;
        }

        @Override
        public Map.Entry<K, V> previous() {
            checkForComodification();
            if (index <= 0) {
                throw new NoSuchElementException();
            }
            var key = keys.get(--index);
            return Map.entry(key, map.get(key));
        }

        @Override
        public BackingStore<K, V> store() {
            return HashedStore.this;
        }

        @Override
        public String toString() {
            return "HashedStore.Cursor[" + index + " of " + keys.size() + "]";
        }

        private void checkForComodification() {
            if (modCount != expectedModCount) {
                throw new ConcurrentModificationException();
            }
        }
    }
}
