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

/**
 * The shape of a fixed-arity coordinate: builds {@link Coordinate}s of exactly {@link #dimensions()} components and
 * rejects everything else.
 *
 * @author hal.hildebrand
 */
public final class Arity {

    private static final Arity[] COMMON = { new Arity(1), new Arity(2), new Arity(3), new Arity(4) };

    private final int dimensions;

    private Arity(int dimensions) {
        this.dimensions = dimensions;
    }

    /**
     * Answer the arity for coordinates of the given number of dimensions.
     *
     * @param dimensions number of components, at least 1
     * @return the arity
     * @throws IllegalArgumentException if dimensions is not positive
     */
    public static Arity of(int dimensions) {
        if (dimensions < 1) {
            throw new IllegalArgumentException("Dimensions must be positive, got: " + dimensions);
        }
        return dimensions <= COMMON.length ? COMMON[dimensions - 1] : new Arity(dimensions);
    }

    /**
     * Verify a component count against this arity.
     *
     * @param count the number of components supplied
     * @throws ArityMismatchException if the count differs from the dimensions
     */
    public void check(int count) {
        if (count != dimensions) {
            throw new ArityMismatchException(dimensions, count);
        }
    }

    /**
     * Verify that a coordinate has this arity.
     *
     * @param coordinate the coordinate to check
     * @return the coordinate
     */
    public Coordinate check(Coordinate coordinate) {
        check(coordinate.dimensions());
        return coordinate;
    }

    /**
     * Build a coordinate of this arity.
     *
     * @param components exactly {@link #dimensions()} non-negative components
     * @return the coordinate
     * @throws ArityMismatchException   if the number of components is wrong
     * @throws IllegalArgumentException if a component is negative
     */
    public Coordinate coordinate(long... components) {
        check(components.length);
        return Coordinate.of(components);
    }

    public int dimensions() {
        return dimensions;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Arity other)) return false;
        return dimensions == other.dimensions;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(dimensions);
    }

    @Override
    public String toString() {
        return "Arity(" + dimensions + ")";
    }
}
