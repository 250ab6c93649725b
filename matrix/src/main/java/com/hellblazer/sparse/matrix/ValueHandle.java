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

import com.hellblazer.sparse.common.Coordinate;

import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * A deferred accessor bound to one full coordinate of a sparse matrix. Creating a handle touches no storage; every
 * read or write resolves against the matrix at the moment it is made, and nothing is cached, so all handles to a
 * coordinate observe the latest state.
 * <p>
 * Writes through {@link #assign(Object)} apply the matrix's erase-on-default rule: assigning the default value
 * removes the cell rather than storing it.
 *
 * <pre>
 * var cell = matrix.at(0, 1);
 * cell.assign(7);          // stored
 * int value = cell.get();  // 7
 * cell.assign(0);          // default, so erased
 * </pre>
 *
 * @param <V> the element type
 * @author hal.hildebrand
 */
public final class ValueHandle<V> {

    private final SparseMatrix<V> matrix;
    private final Coordinate      coordinate;

    ValueHandle(SparseMatrix<V> matrix, Coordinate coordinate) {
        this.matrix = matrix;
        this.coordinate = coordinate;
    }

    /**
     * Write a value, erasing the cell instead if the value is the matrix's default. The comparison uses
     * {@link Object#equals(Object)}, so for a {@code Double} matrix with default {@code 0.0} assigning {@code -0.0}
     * stores the cell.
     *
     * @param value the non-null value
     * @return this handle
     */
    public ValueHandle<V> assign(V value) {
        Objects.requireNonNull(value, "Value cannot be null");
        if (matrix.isDefault(value)) {
            matrix.erase(coordinate);
        } else {
            matrix.set(value, coordinate);
        }
        return this;
    }

    /**
     * Copy the current value read through another handle into this handle's cell. The two cells are not linked
     * afterwards.
     *
     * @param source the handle to read
     * @return this handle
     */
    public ValueHandle<V> assign(ValueHandle<? extends V> source) {
        return assign(source.get());
    }

    public Coordinate coordinate() {
        return coordinate;
    }

    /**
     * @return the stored value, or the matrix's default if the cell is absent
     */
    public V get() {
        return matrix.getOrDefault(coordinate);
    }

    /**
     * Compare the cell's current value with the given value
     */
    public boolean holds(V value) {
        return Objects.equals(get(), value);
    }

    /**
     * @return true if the cell reads as the matrix's default
     */
    public boolean isDefault() {
        return matrix.isDefault(get());
    }

    /**
     * @return the stored value, or empty if the cell is absent
     */
    public Optional<V> stored() {
        return matrix.find(coordinate);
    }

    @Override
    public String toString() {
        return coordinate + "=" + get();
    }

    /**
     * Read, transform and write back through {@link #assign(Object)}
     *
     * @param function applied to the current value
     * @return this handle
     */
    public ValueHandle<V> update(UnaryOperator<V> function) {
        return assign(function.apply(get()));
    }
}
