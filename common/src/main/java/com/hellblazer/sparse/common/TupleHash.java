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
 * Order-sensitive hashing of fixed-arity tuples of {@code long} components.
 * <p>
 * Each component is spread with a golden-ratio multiply, folded into the running state with a rotation, and the
 * final state is avalanched before being narrowed to an {@code int}. Swapping two components changes the result and
 * repeated components do not cancel each other out.
 *
 * @author hal.hildebrand
 */
public final class TupleHash {

    private static final long SEED      = 0x2127599BF4325C37L;
    private static final long GOLDEN    = 0x9E3779B97F4A7C15L;
    private static final long MIX       = 0xD6E8FEB86659FD93L;
    private static final int  ROTATION  = 27;

    private TupleHash() {
    }

    /**
     * Combine all components, in order, into a single 64 bit hash.
     *
     * @param components the tuple components
     * @return the 64 bit hash
     */
    public static long hash64(long... components) {
        var state = SEED ^ (components.length * GOLDEN);
        for (var component : components) {
            state = Long.rotateLeft(state ^ (component * GOLDEN), ROTATION) * MIX;
        }
        return avalanche(state);
    }

    /**
     * Combine all components, in order, into a hash suitable for {@link Object#hashCode()}.
     *
     * @param components the tuple components
     * @return the folded 32 bit hash
     */
    public static int hash(long... components) {
        var h = hash64(components);
        return (int) (h ^ (h >>> 32));
    }

    static long avalanche(long h) {
        h ^= (h >>> 32);
        h *= MIX;
        h ^= (h >>> 32);
        h *= MIX;
        h ^= (h >>> 32);
        return h;
    }
}
