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

package com.hellblazer.sparse.matrix;

import com.hellblazer.sparse.matrix.store.BackingStore;
import com.hellblazer.sparse.matrix.store.HashedStore;
import com.hellblazer.sparse.matrix.store.OrderedStore;

import java.util.Objects;

/**
 * Configuration for the storage of a sparse matrix. Selects the backing structure and the construction arguments
 * forwarded to it.
 *
 * @author hal.hildebrand
 */
public class MatrixConfig {

    public static final int   DEFAULT_INITIAL_CAPACITY = 16;
    public static final float DEFAULT_LOAD_FACTOR      = 0.75f;

    private StoreType storeType       = StoreType.ORDERED;
    private int       initialCapacity = DEFAULT_INITIAL_CAPACITY;
    private float     loadFactor      = DEFAULT_LOAD_FACTOR;

    /**
     * Configuration for a hash backed matrix preallocated for the expected number of non-default cells.
     */
    public static MatrixConfig hashed(int initialCapacity) {
        return new MatrixConfig().withStoreType(StoreType.HASHED).withInitialCapacity(initialCapacity);
    }

    /**
     * Configuration for a tree backed matrix, iterated in row-major order. This is the default.
     */
    public static MatrixConfig ordered() {
        return new MatrixConfig();
    }

    /**
     * Initial capacity of the hash table. Ignored by ordered stores.
     */
    public int getInitialCapacity() {
        return initialCapacity;
    }

    /**
     * Load factor of the hash table. Ignored by ordered stores.
     */
    public float getLoadFactor() {
        return loadFactor;
    }

    public StoreType getStoreType() {
        return storeType;
    }

    /**
     * Build an empty store as configured.
     *
     * @param <K> the key type
     * @param <V> the value type
     * @return the new store
     */
    public <K, V> BackingStore<K, V> newStore() {
        return switch (storeType) {
            case ORDERED -> new OrderedStore<>();
            case HASHED -> new HashedStore<>(initialCapacity, loadFactor);
        };
    }

    @Override
    public String toString() {
        return "MatrixConfig[storeType=" + storeType + ", initialCapacity=" + initialCapacity + ", loadFactor="
        + loadFactor + "]";
    }

    // Fluent API for configuration

    public MatrixConfig withInitialCapacity(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Initial capacity must be positive");
        }
        this.initialCapacity = capacity;
        return this;
    }

    public MatrixConfig withLoadFactor(float loadFactor) {
        if (loadFactor <= 0 || Float.isNaN(loadFactor)) {
            throw new IllegalArgumentException("Load factor must be positive");
        }
        this.loadFactor = loadFactor;
        return this;
    }

    public MatrixConfig withStoreType(StoreType storeType) {
        this.storeType = Objects.requireNonNull(storeType, "Store type cannot be null");
        return this;
    }
}
