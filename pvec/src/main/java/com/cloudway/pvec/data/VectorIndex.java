/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.pvec.data;

/**
 * Index arithmetic for a 32-way branching trie. All indices handled here are
 * 0-based; the public API converts from 1-based positions before calling in.
 */
final class VectorIndex {
    private VectorIndex() {}

    static final int BITS  = 5;
    static final int WIDTH = 1 << BITS;
    static final int MASK  = WIDTH - 1;

    /**
     * Returns the number of elements stored in the trie, i.e. the index of
     * the first element held by the tail.
     */
    static int tailOffset(int size) {
        return size == 0 ? 0 : ((size - 1) >>> BITS) << BITS;
    }

    /**
     * Returns the number of elements held by the tail.
     */
    static int tailSize(int size) {
        return size == 0 ? 0 : ((size - 1) & MASK) + 1;
    }

    /**
     * Returns the child slot to follow at the given trie level.
     */
    static int selector(int index, int level) {
        return (index >>> level) & MASK;
    }

    /**
     * Returns {@code true} if a trie of the given height cannot accept
     * another leaf without growing.
     */
    static boolean isTrieFull(int size, int shift) {
        return (size >>> BITS) > (1 << shift);
    }

    /**
     * Returns the highest level at which the slot on the path to the
     * rightmost leaf must be cleared when that leaf is removed. The trie
     * holds {@code trieSize} elements after removal, which is also the
     * index of the first element of the removed leaf.
     */
    static int divergenceLevel(int trieSize, int shift) {
        int diverges = trieSize ^ (trieSize - 1);
        int level = shift;
        while (level > BITS && (diverges >>> level) == 0) {
            level -= BITS;
        }
        return level;
    }
}
