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
import com.hellblazer.sparse.matrix.store.StoreCursor;

import java.util.ListIterator;

/**
 * Read-only, bidirectional iteration over the stored cells of a sparse matrix, in the native order of its backing
 * store. Each step produces a fresh {@link Cell}.
 * <p>
 * Two iterators are equal when they traverse the same store and sit at the same position, so an iterator obtained
 * from {@link SparseMatrix#iterator()} and stepped past every cell equals one obtained from
 * {@link SparseMatrix#iteratorAtEnd()}. Behavior under concurrent modification of the matrix is that of the backing
 * store's cursors.
 *
 * @param <V> the element type
 * @author hal.hildebrand
 */
public final class CellIterator<V> implements ListIterator<Cell<V>> {

    private final StoreCursor<Coordinate, V> cursor;
    private       int                        nextIndex;

    CellIterator(StoreCursor<Coordinate, V> cursor, int nextIndex) {
        this.cursor = cursor;
        this.nextIndex = nextIndex;
    }

    /**
     * Unsupported: cells are only added by assigning through a {@link ValueHandle}
     */
    @Override
    public void add(Cell<V> cell) {
        throw new UnsupportedOperationException("Cell iteration is read-only");
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CellIterator<?> other)) return false;
        return cursor.samePosition(other.cursor);
    }

    @Override
    public int hashCode() {
        return cursor.position().hashCode();
    }

    @Override
    public boolean hasNext() {
        return cursor.hasNext();
    }

    @Override
    public boolean hasPrevious() {
        return cursor.hasPrevious();
    }

    @Override
    public Cell<V> next() {
        var entry = cursor.next();
        nextIndex++;
        return new Cell<>(entry.getKey(), entry.getValue());
    }

    /**
     * Answer the number of forward steps taken from the iterator's starting point, offset by that starting point
     * (zero for {@link SparseMatrix#iterator()}, the size at creation for {@link SparseMatrix#iteratorAtEnd()}).
     */
    @Override
    public int nextIndex() {
        return nextIndex;
    }

    @Override
    public Cell<V> previous() {
        var entry = cursor.previous();
        nextIndex--;
        return new Cell<>(entry.getKey(), entry.getValue());
    }

    @Override
    public int previousIndex() {
        return nextIndex - 1;
    }

    /**
     * Unsupported: erase by assigning the default value through a {@link ValueHandle}
     */
    @Override
    public void remove() {
        throw new UnsupportedOperationException("Cell iteration is read-only");
    }

    /**
     * Unsupported: overwrite by assigning through a {@link ValueHandle}
     */
    @Override
    public void set(Cell<V> cell) {
        throw new UnsupportedOperationException("Cell iteration is read-only");
    }

    @Override
    public String toString() {
        return "CellIterator[" + cursor + "]";
    }
}
