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

import com.hellblazer.sparse.common.ArityMismatchException;
import com.hellblazer.sparse.common.Coordinate;

import java.util.Arrays;

/**
 * A partially specified coordinate, accumulated one component at a time:
 *
 * <pre>
 * matrix.index(0).index(1).at(2).assign(222);   // 3 dimensions
 * matrix.index(4).at(5).get();                  // 2 dimensions
 * matrix.index(9).get();                        // 1 dimension
 * matrix.index(9).assign(5);                    // 1 dimension
 * </pre>
 * <p>
 * Chains are immutable and never touch storage. Supplying more components than the matrix has dimensions, or asking
 * for a handle before all are supplied, fails with {@link ArityMismatchException} at that call.
 *
 * @param <V> the element type
 * @author hal.hildebrand
 */
public final class IndexChain<V> {

    private final SparseMatrix<V> matrix;
    private final long[]          components;

    IndexChain(SparseMatrix<V> matrix, long[] components) {
        this.matrix = matrix;
        this.components = components;
    }

    /**
     * Supply the final component
     *
     * @param last the component for the last dimension
     * @return a handle bound to the completed coordinate
     * @throws ArityMismatchException if more than one dimension remains, or none does
     */
    public ValueHandle<V> at(long last) {
        if (remaining() != 1) {
            throw new ArityMismatchException(matrix.dimensions(), components.length + 1);
        }
        return index(last).handle();
    }

    /**
     * Write through the completed coordinate, as {@link ValueHandle#assign(Object)}
     *
     * @param value the non-null value
     * @return a handle bound to the completed coordinate
     * @throws ArityMismatchException if dimensions remain unspecified
     */
    public ValueHandle<V> assign(V value) {
        return handle().assign(value);
    }

    /**
     * Read the completed coordinate, as {@link ValueHandle#get()}
     *
     * @throws ArityMismatchException if dimensions remain unspecified
     */
    public V get() {
        return handle().get();
    }

    /**
     * @return a handle bound to the completed coordinate
     * @throws ArityMismatchException if dimensions remain unspecified
     */
    public ValueHandle<V> handle() {
        if (!isComplete()) {
            throw new ArityMismatchException(matrix.dimensions(), components.length);
        }
        return matrix.at(components);
    }

    /**
     * Supply the next component
     *
     * @param next the component for the next dimension
     * @return a new chain extended by that component
     * @throws ArityMismatchException   if the chain is already complete
     * @throws IllegalArgumentException if the component is negative
     */
    public IndexChain<V> index(long next) {
        if (isComplete()) {
            throw new ArityMismatchException(matrix.dimensions(), components.length + 1);
        }
        Coordinate.checkComponent(components.length, next);
        var extended = Arrays.copyOf(components, components.length + 1);
        extended[components.length] = next;
        return new IndexChain<>(matrix, extended);
    }

    public boolean isComplete() {
        return remaining() == 0;
    }

    /**
     * @return the number of dimensions still to be supplied
     */
    public int remaining() {
        return matrix.dimensions() - components.length;
    }

    @Override
    public String toString() {
        return "IndexChain" + Arrays.toString(components) + "[remaining=" + remaining() + "]";
    }
}
