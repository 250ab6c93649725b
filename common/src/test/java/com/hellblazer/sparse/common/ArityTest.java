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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class ArityTest {

    @ParameterizedTest
    @ValueSource(ints = { 1, 2, 3, 4, 7, 32 })
    public void testBuildsCoordinatesOfItsArity(int dimensions) {
        var arity = Arity.of(dimensions);
        assertEquals(dimensions, arity.dimensions());

        var components = new long[dimensions];
        for (var i = 0; i < dimensions; i++) {
            components[i] = i * 10L;
        }
        var coordinate = arity.coordinate(components);
        assertEquals(dimensions, coordinate.dimensions());
        assertEquals((dimensions - 1) * 10L, coordinate.get(dimensions - 1));
    }

    @Test
    public void testRejectsNonPositiveDimensions() {
        assertThrows(IllegalArgumentException.class, () -> Arity.of(0));
        assertThrows(IllegalArgumentException.class, () -> Arity.of(-3));
    }

    @Test
    public void testTooFewComponents() {
        var e = assertThrows(ArityMismatchException.class, () -> Arity.of(3).coordinate(1, 2));
        assertEquals(3, e.getExpected());
        assertEquals(2, e.getActual());
        assertEquals("Expected 3 coordinate components, got 2", e.getMessage());
    }

    @Test
    public void testTooManyComponents() {
        var e = assertThrows(ArityMismatchException.class, () -> Arity.of(2).coordinate(1, 2, 3));
        assertEquals(2, e.getExpected());
        assertEquals(3, e.getActual());
    }

    @Test
    public void testArityMismatchIsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> Arity.of(1).check(2));
    }

    @Test
    public void testCheckCoordinate() {
        var arity = Arity.of(2);
        var coordinate = Coordinate.of(4, 5);
        assertSame(coordinate, arity.check(coordinate));
        assertThrows(ArityMismatchException.class, () -> arity.check(Coordinate.of(4, 5, 6)));
    }

    @Test
    public void testEquality() {
        assertEquals(Arity.of(2), Arity.of(2));
        assertEquals(Arity.of(9), Arity.of(9));
        assertEquals(Arity.of(9).hashCode(), Arity.of(9).hashCode());
        assertNotEquals(Arity.of(2), Arity.of(3));
        assertEquals("Arity(3)", Arity.of(3).toString());
    }
}
