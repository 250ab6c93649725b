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

import java.util.Comparator;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * A {@link BackingStore} over a {@link NavigableMap}, traversed in key order.
 * <p>
 * Cursors remember the key just before their gap and re-navigate the map on every step, so they remain usable
 * across any modification of the store. Entries inserted ahead of a cursor are visited, entries erased ahead of it
 * are skipped, and erasing the entry a cursor last returned leaves the cursor in the gap where that entry was.
 * <p>
 * A cursor from {@link #cursorAtEnd()} is therefore not a stable end sentinel: once a key greater than the last one
 * is inserted, that cursor has a next entry and no longer sits at the same position as a fresh end cursor.
 *
 * @param <K> the key type
 * @param <V> the value type
 * @author hal.hildebrand
 */
public class OrderedStore<K, V> implements BackingStore<K, V> {

    private static final Object START = new Object() {
        @Override
        public String toString() {
            return "START";
        }
    };

    private final NavigableMap<K, V> map;

    /**
     * Create a store ordered by the natural ordering of the keys
     */
    public OrderedStore() {
        this(new TreeMap<>());
    }

    public OrderedStore(Comparator<? super K> comparator) {
        this(new TreeMap<>(comparator));
    }

    /**
     * Create a store over the supplied map, e.g. a {@link java.util.concurrent.ConcurrentSkipListMap}
     *
     * @param map the map holding the entries
     */
    public OrderedStore(NavigableMap<K, V> map) {
        this.map = Objects.requireNonNull(map, "Map cannot be null");
    }

    @Override
    public void clear() {
        map.clear();
    }

    @Override
    public StoreCursor<K, V> cursor() {
        return new Cursor(null);
    }

    @Override
    public StoreCursor<K, V> cursorAtEnd() {
        return new Cursor(map.isEmpty() ? null : map.lastKey());
    }

    @Override
    public boolean erase(K key) {
        return map.remove(key) != null;
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
        map.put(key, value);
    }

    @Override
    public int size() {
        return map.size();
    }

    @Override
    public String toString() {
        return "OrderedStore" + map;
    }

    private class Cursor implements StoreCursor<K, V> {
        // key at or before the gap, null when before the first entry
        private K after;

        private Cursor(K after) {
            this.after = after;
        }

        @Override
        public boolean hasNext() {
            return after == null ? !map.isEmpty() : map.higherKey(after) != null;
        }

        @Override
        public boolean hasPrevious() {
            return after != null && map.floorKey(after) != null;
        }

        @Override
        public Map.Entry<K, V> next() {
            var entry = after == null ? map.firstEntry() : map.higherEntry(after);
            if (entry == null) {
                throw new NoSuchElementException();
            }
            after = entry.getKey();
            return Map.entry(entry.getKey(), entry.getValue());
        }

        @Override
        public Object position() {
            var floor = after == null ? null : map.floorKey(after);
            return floor == null ? START : floor;
        }

        @Override
        public Map.Entry<K, V> previous() {
            var entry = after == null ? null : map.floorEntry(after);
            if (entry == null) {
                throw new NoSuchElementException();
            }
            after = map.lowerKey(entry.getKey());
            return Map.entry(entry.getKey(), entry.getValue());
        }

        @Override
        public BackingStore<K, V> store() {
            return OrderedStore.this;
        }

        @Override
        public String toString() {
            return "OrderedStore.Cursor[after " + position() + "]";
        }
    }
}
