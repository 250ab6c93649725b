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

import com.hellblazer.sparse.common.Arity;
import com.hellblazer.sparse.common.ArityMismatchException;
import com.hellblazer.sparse.common.Coordinate;
import com.hellblazer.sparse.matrix.store.BackingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A sparse N-dimensional matrix. Behaves like an unbounded dense array of the element type in which every cell
 * initially holds the matrix's default value, but only cells holding some other value occupy storage.
 * <p>
 * Cells are addressed by non-negative {@code long} components, one per dimension, either all at once through
 * {@link #at(long...)} or one at a time through {@link #index(long)}. Both produce a {@link ValueHandle}, which reads
 * and writes the cell on demand. Writing the default value through a handle erases the cell, so {@link #size()} is
 * exactly the number of non-default cells.
 *
 * <pre>
 * var grid = SparseMatrix.create(2, 0);
 * grid.at(3, 4).assign(7);
 * grid.index(3).at(4).get();          // 7
 *
 * var line = SparseMatrix.create(1, 0);
 * line.index(9).assign(5);            // a one dimensional chain is complete after one component
 * line.index(9).get();                // 5
 * </pre>
 * <p>
 * The matrix is generic over its {@link BackingStore}; the store determines the iteration order and how iterators
 * behave if the matrix is modified while they are live. A matrix is not thread safe.
 *
 * @param <V> the element type
 * @author hal.hildebrand
 */
public class SparseMatrix<V> implements Iterable<Cell<V>> {

    private static final Logger log = LoggerFactory.getLogger(SparseMatrix.class);

    private final Arity                       arity;
    private final V                           defaultValue;
    private final BackingStore<Coordinate, V> store;

    /**
     * Create a matrix over the supplied store. Package private so that a store is never shared between matrices;
     * public construction goes through {@link #create(int, Object, MatrixConfig)}, which builds a fresh store.
     *
     * @param dimensions   the number of coordinate components per cell, at least 1
     * @param defaultValue the value every absent cell reads as
     * @param store        an empty store, owned by this matrix from now on
     * @throws IllegalArgumentException if dimensions is not positive or the store is not empty
     */
    SparseMatrix(int dimensions, V defaultValue, BackingStore<Coordinate, V> store) {
        this.arity = Arity.of(dimensions);
        this.defaultValue = Objects.requireNonNull(defaultValue, "Default value cannot be null");
        this.store = Objects.requireNonNull(store, "Store cannot be null");
        if (!store.isEmpty()) {
            throw new IllegalArgumentException("Backing store must be empty, has " + store.size() + " entries");
        }
        log.debug("Created {}-dimensional sparse matrix, default: {}, store: {}", dimensions, defaultValue,
                  store.getClass().getSimpleName());
    }

    private SparseMatrix(SparseMatrix<V> source) {
        this.arity = source.arity;
        this.defaultValue = source.defaultValue;
        this.store = source.store;
    }

    /**
     * Create a matrix iterated in row-major order
     */
    public static <V> SparseMatrix<V> create(int dimensions, V defaultValue) {
        return create(dimensions, defaultValue, MatrixConfig.ordered());
    }

    public static <V> SparseMatrix<V> create(int dimensions, V defaultValue, MatrixConfig config) {
        return new SparseMatrix<>(dimensions, defaultValue, config.newStore());
    }

    /**
     * Answer a read-only view of the matrix. The view shares the matrix's storage and sees its updates; every write
     * through the view, or through handles obtained from it, throws {@link UnsupportedOperationException}.
     */
    public static <V> SparseMatrix<V> unmodifiable(SparseMatrix<V> matrix) {
        return matrix instanceof Unmodifiable ? matrix : new Unmodifiable<>(matrix);
    }

    /**
     * Access one cell by its full coordinate. No storage is touched until the handle is used.
     *
     * @param positions one non-negative component per dimension
     * @return a handle bound to the cell
     * @throws ArityMismatchException   if the number of components is not {@link #dimensions()}
     * @throws IllegalArgumentException if a component is negative
     */
    public ValueHandle<V> at(long... positions) {
        return new ValueHandle<>(this, arity.coordinate(positions));
    }

    public ValueHandle<V> at(Coordinate coordinate) {
        return new ValueHandle<>(this, arity.check(coordinate));
    }

    /**
     * Erase every cell
     */
    public void clear() {
        log.trace("Clearing {} cells", store.size());
        store.clear();
    }

    public V defaultValue() {
        return defaultValue;
    }

    public int dimensions() {
        return arity.dimensions();
    }

    /**
     * Remove the cell, which then reads as the default. Erasing an absent cell does nothing.
     *
     * @param positions one non-negative component per dimension
     * @return true if a stored cell was removed
     */
    public boolean erase(long... positions) {
        return erase(arity.coordinate(positions));
    }

    public boolean erase(Coordinate coordinate) {
        var removed = store.erase(arity.check(coordinate));
        if (removed) {
            log.trace("Erased {}", coordinate);
        }
        return removed;
    }

    /**
     * @param positions one non-negative component per dimension
     * @return the stored value, or empty if the cell is absent
     */
    public Optional<V> find(long... positions) {
        return find(arity.coordinate(positions));
    }

    public Optional<V> find(Coordinate coordinate) {
        return store.find(arity.check(coordinate));
    }

    /**
     * @param positions one non-negative component per dimension
     * @return the stored value, or the default value if the cell is absent
     */
    public V getOrDefault(long... positions) {
        return getOrDefault(arity.coordinate(positions));
    }

    public V getOrDefault(Coordinate coordinate) {
        return find(coordinate).orElse(defaultValue);
    }

    /**
     * Begin a chained access with the component for the first dimension
     *
     * @param position the first component
     * @return a chain awaiting the remaining components; complete already for a one dimensional matrix
     * @throws IllegalArgumentException if the component is negative
     */
    public IndexChain<V> index(long position) {
        Coordinate.checkComponent(0, position);
        return new IndexChain<>(this, new long[] { position });
    }

    public boolean isDefault(V value) {
        return defaultValue.equals(value);
    }

    public boolean isEmpty() {
        return store.isEmpty();
    }

    public boolean isModifiable() {
        return true;
    }

    /**
     * @return an iterator positioned before the first stored cell
     */
    @Override
    public CellIterator<V> iterator() {
        return new CellIterator<>(store.cursor(), 0);
    }

    /**
     * Answer an iterator positioned after the last stored cell, for stepping backwards. This is a position, not a
     * sentinel: with an ordered store, cells inserted beyond the last one after the iterator was created lie ahead of
     * it, so it no longer equals a fresh {@code iteratorAtEnd()}.
     *
     * @return an iterator positioned after the last stored cell
     */
    public CellIterator<V> iteratorAtEnd() {
        return new CellIterator<>(store.cursorAtEnd(), store.size());
    }

    /**
     * Store a value unconditionally, even the default. Prefer {@link ValueHandle#assign(Object)}, which erases the
     * cell when given the default value and so keeps {@link #size()} equal to the number of non-default cells.
     *
     * @param value     the non-null value
     * @param positions one non-negative component per dimension
     */
    public void set(V value, long... positions) {
        set(value, arity.coordinate(positions));
    }

    public void set(V value, Coordinate coordinate) {
        Objects.requireNonNull(value, "Value cannot be null");
        if (isDefault(value)) {
            log.debug("Storing default value {} at {}", value, coordinate);
        }
        store.put(arity.check(coordinate), value);
    }

    /**
     * @return the number of stored cells
     */
    public int size() {
        return store.size();
    }

    @Override
    public Spliterator<Cell<V>> spliterator() {
        return Spliterators.spliterator(iterator(), store.size(), Spliterator.DISTINCT | Spliterator.NONNULL);
    }

    /**
     * @return the stored cells, in the backing store's order
     */
    public Stream<Cell<V>> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[dimensions=" + dimensions() + ", default=" + defaultValue + ", size="
        + size() + "]";
    }

    private static final class Unmodifiable<V> extends SparseMatrix<V> {

        private Unmodifiable(SparseMatrix<V> source) {
            super(source);
        }

        @Override
        public void clear() {
            throw new UnsupportedOperationException("Matrix is read-only");
        }

        @Override
        public boolean erase(Coordinate coordinate) {
            throw new UnsupportedOperationException("Matrix is read-only");
        }

        @Override
        public boolean isModifiable() {
            return false;
        }

        @Override
        public void set(V value, Coordinate coordinate) {
            throw new UnsupportedOperationException("Matrix is read-only");
        }
    }
}
