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
 * Thrown when the number of coordinate components supplied does not match the dimensionality of the target.
 *
 * @author hal.hildebrand
 */
public class ArityMismatchException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final int expected;
    private final int actual;

    public ArityMismatchException(int expected, int actual) {
        super("Expected " + expected + " coordinate components, got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public int getActual() {
        return actual;
    }

    public int getExpected() {
        return expected;
    }
}
