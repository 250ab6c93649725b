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

package com.hellblazer.sparse.common;

import java.util.Arrays;

/**
 * Immutable address of one cell in N-dimensional space: an ordered tuple of non-negative {@code long} components.
 * <p>
 * Coordinates of equal arity compare lexicographically in dimension order, so an ordered map of coordinates
 * traverses in row-major order. A shorter coordinate that is a prefix of a longer one sorts first.
 *
 * @author hal.hildebrand
 */
public final class Coordinate implements Comparable<Coordinate> {

    private final long[] components;
    private final int    hash;

    private Coordinate(long[] components) {
        this.components = components;
        this.hash = TupleHash.hash(components);
    }

    /**
     * Create a coordinate from its components. The array is copied.
     *
     * @param components one or more non-negative components
     * @return the coordinate
     * @throws IllegalArgumentException if there are no components or any component is negative
     */
    public static Coordinate of(long... components) {
        if (components.length == 0) {
            throw new IllegalArgumentException("A coordinate needs at least one component");
        }
        for (var i = 0; i < components.length; i++) {
            checkComponent(i, components[i]);
        }
        return new Coordinate(components.clone());
    }

    /**
     * Verify a single coordinate component.
     *
     * @param dimension the dimension the component belongs to, for the error message
     * @param component the component value
     * @throws IllegalArgumentException if the component is negative
     */
    public static void checkComponent(int dimension, long component) {
        if (component < 0) {
            throw new IllegalArgumentException(
            "Coordinate components must be non-negative, got " + component + " for dimension " + dimension);
        }
    }

    @Override
    public int compareTo(Coordinate other) {
        var common = Math.min(components.length, other.components.length);
        for (var i = 0; i < common; i++) {
            var c = Long.compare(components[i], other.components[i]);
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(components.length, other.components.length);
    }

    public int dimensions() {
        return components.length;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Coordinate other)) return false;
        return hash == other.hash && Arrays.equals(components, other.components);
    }

    /**
     * @param dimension zero based dimension
     * @return the component for that dimension
     * @throws IndexOutOfBoundsException if the dimension is out of range
     */
    public long get(int dimension) {
        if (dimension < 0 || dimension >= components.length) {
            throw new IndexOutOfBoundsException("Dimension:" + dimension + ", Dimensions:" + components.length);
        }
        return components[dimension];
    }

    @Override
    public int hashCode() {
        return hash;
    }

    /**
     * @return a copy of the components in dimension order
     */
    public long[] toArray() {
        return components.clone();
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("(");
        for (var i = 0; i < components.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(components[i]);
        }
        return sb.append(')').toString();
    }
}
