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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ConcurrentModificationException;
import java.util.HashSet;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class HashedStoreTest {

    private HashedStore<String, Integer> store;

    @BeforeEach
    public void setUp() {
        store = new HashedStore<>(2048);
        store.put("a", 1);
        store.put("b", 2);
        store.put("c", 3);
    }

    @Test
    public void testBasicOperations() {
        assertEquals(3, store.size());
        assertEquals(Optional.of(2), store.find("b"));
        assertEquals(Optional.empty(), store.find("z"));
        assertTrue(store.erase("b"));
        assertFalse(store.erase("b"));
        assertEquals(2, store.size());
        store.clear();
        assertTrue(store.isEmpty());
    }

    @Test
    public void testConstructorArguments() {
        assertTrue(new HashedStore<String, Integer>().isEmpty());
        assertTrue(new HashedStore<String, Integer>(16, 0.5f).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> new HashedStore<String, Integer>(-1));
        assertThrows(IllegalArgumentException.class, () -> new HashedStore<String, Integer>(16, 0f));
    }

    @Test
    public void testFullTraversal() {
        var keys = new HashSet<String>();
        store.forEach(e -> keys.add(e.getKey()));
        assertEquals(Set.of("a", "b", "c"), keys);
    }

    @Test
    public void testInsertInvalidatesCursor() {
        var cursor = store.cursor();
        cursor.next();
        store.put("d", 4);
        assertThrows(ConcurrentModificationException.class, cursor::next);
        assertThrows(ConcurrentModificationException.class, cursor::previous);
    }

    @Test
    public void testEraseInvalidatesCursor() {
        var cursor = store.cursorAtEnd();
        store.erase("a");
        assertThrows(ConcurrentModificationException.class, cursor::previous);
    }

    @Test
    public void testRedundantEraseDoesNotInvalidate() {
        var cursor = store.cursor();
        store.erase("missing");
        assertDoesNotThrow(cursor::next);
        store.clear();
        assertThrows(ConcurrentModificationException.class, cursor::next);

        var fresh = store.cursor();
        store.clear();
        assertFalse(fresh.hasNext());
        assertThrows(NoSuchElementException.class, fresh::next);
    }

    @Test
    public void testOverwriteIsNotStructural() {
        var cursor = store.cursor();
        var first = cursor.next();
        store.put(first.getKey(), 100);
        var back = cursor.previous();
        assertEquals(first.getKey(), back.getKey());
        assertEquals(100, back.getValue());
    }

    @Test
    public void testCursorSnapshotsKeysAtCreation() {
        var cursor = store.cursorAtEnd();
        assertEquals(3, cursor.position());
        store.put("d", 4);
        assertEquals(3, cursor.position());
        assertEquals(4, store.cursorAtEnd().position());
        assertThrows(ConcurrentModificationException.class, cursor::previous);
    }

    @Test
    public void testPositions() {
        var begin = store.cursor();
        var end = store.cursorAtEnd();
        assertFalse(begin.samePosition(end));
        begin.next();
        begin.next();
        begin.next();
        assertTrue(begin.samePosition(end));
        assertFalse(begin.hasNext());
        assertTrue(end.hasPrevious());
    }
}
