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

import java.util.Comparator;
import java.util.Objects;

/**
 * One stored cell of a sparse matrix as produced by iteration: the coordinate components in dimension order followed
 * by the value. Cells are detached snapshots; assigning through a {@link ValueHandle} does not change a cell already
 * produced.
 *
 * @param coordinate the cell's coordinate
 * @param value      the stored, non-default value
 * @param <V>        the element type
 * @author hal.hildebrand
 */
public record Cell<V>(Coordinate coordinate, V value) {

    public Cell {
        Objects.requireNonNull(coordinate, "Coordinate cannot be null");
        Objects.requireNonNull(value, "Value cannot be null");
    }

    /**
     * Order cells by their values, e.g. for {@code matrix.stream().max(Cell.byValue(naturalOrder()))}
     */
    public static <T> Comparator<Cell<T>> byValue(Comparator<? super T> comparator) {
        return (a, b) -> comparator.compare(a.value, b.value);
    }

    public int dimensions() {
        return coordinate.dimensions();
    }

    /**
     * @param dimension zero based dimension
     * @return the coordinate component for that dimension
     */
    public long position(int dimension) {
        return coordinate.get(dimension);
    }

    /**
     * @return the coordinate components in dimension order
     */
    public long[] positions() {
        return coordinate.toArray();
    }
}
