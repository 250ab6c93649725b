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

import com.hellblazer.sparse.matrix.MatrixConfig;
import com.hellblazer.sparse.matrix.SparseMatrix;

import java.io.PrintStream;
import java.util.StringJoiner;

/**
 * Fills both diagonals of a 10 x 10 region of a hash backed 2D matrix with default 0, then prints the inner 8 x 8
 * block, the number of stored cells and every stored cell as {@code row column value}.
 *
 * @author hal.hildebrand
 */
public class SparseMatrixDemo {

    public static final int EXTENT = 10;

    public static void main(String[] args) {
        new SparseMatrixDemo().run(System.out);
    }

    /**
     * @return the populated matrix
     */
    public SparseMatrix<Integer> populate() {
        var matrix = SparseMatrix.create(2, 0, MatrixConfig.hashed(2 * EXTENT));
        for (var i = 0; i < EXTENT; i++) {
            matrix.index(i).at(i).assign(i);
        }
        for (var row = 0; row < EXTENT; row++) {
            var column = EXTENT - 1 - row;
            matrix.index(row).at(column).assign(column);
        }
        return matrix;
    }

    public void run(PrintStream out) {
        var matrix = populate();

        for (var row = 1; row < EXTENT - 1; row++) {
            var line = new StringJoiner(" ");
            for (var column = 1; column < EXTENT - 1; column++) {
                line.add(String.valueOf(matrix.index(row).at(column).get()));
            }
            out.println(line);
        }

        out.println(matrix.size());

        for (var cell : matrix) {
            out.println(cell.position(0) + " " + cell.position(1) + " " + cell.value());
        }
    }
}
