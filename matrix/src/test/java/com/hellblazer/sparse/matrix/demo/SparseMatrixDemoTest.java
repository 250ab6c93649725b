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

package com.hellblazer.sparse.matrix.demo;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class SparseMatrixDemoTest {

    @Test
    public void testPopulate() {
        var matrix = new SparseMatrixDemo().populate();
        // (0, 0) and (9, 0) hold the default and are not stored
        assertEquals(18, matrix.size());
        assertTrue(matrix.find(0, 0).isEmpty());
        assertTrue(matrix.find(9, 0).isEmpty());
        assertEquals(9, matrix.getOrDefault(0, 9));
        assertEquals(5, matrix.getOrDefault(5, 5));
        assertEquals(4, matrix.getOrDefault(5, 4));
        assertEquals(0, matrix.getOrDefault(5, 6));
    }

    @Test
    public void testOutput() {
        var bytes = new ByteArrayOutputStream();
        try (var out = new PrintStream(bytes, true, StandardCharsets.UTF_8)) {
            new SparseMatrixDemo().run(out);
        }
        var lines = bytes.toString(StandardCharsets.UTF_8).lines().toList();
        assertEquals(8 + 1 + 18, lines.size());

        assertEquals("1 0 0 0 0 0 0 8", lines.get(0));
        assertEquals("0 2 0 0 0 0 7 0", lines.get(1));
        assertEquals("0 0 0 4 5 0 0 0", lines.get(3));
        assertEquals("0 0 0 4 5 0 0 0", lines.get(4));
        assertEquals("1 0 0 0 0 0 0 8", lines.get(7));
        assertEquals("18", lines.get(8));

        var cells = new HashSet<List<Integer>>();
        for (var line : lines.subList(9, lines.size())) {
            var parts = Arrays.stream(line.split(" ")).map(Integer::valueOf).toList();
            assertEquals(3, parts.size());
            assertNotEquals(0, parts.get(2).intValue());
            cells.add(parts);
        }
        assertEquals(18, cells.size());
        assertTrue(cells.contains(List.of(3, 3, 3)));
        assertTrue(cells.contains(List.of(3, 6, 6)));
    }
}
