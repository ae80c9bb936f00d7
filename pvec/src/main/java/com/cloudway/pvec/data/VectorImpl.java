/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.pvec.data;

import java.util.AbstractList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.RandomAccess;
import java.util.StringJoiner;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.base.Preconditions;
import com.google.common.collect.UnmodifiableIterator;

import static com.cloudway.pvec.data.VectorIndex.*;

// @formatter:off

final class VectorImpl {
    private VectorImpl() {}

    private static final Logger logger = Logger.getLogger(VectorImpl.class.getName());

    private static final Object[] EMPTY_TAIL = new Object[0];
    private static final PVector<?> EMPTY = new PVector<>(0, 0, null, EMPTY_TAIL);

    @SuppressWarnings("unchecked")
    static <A> Vector<A> empty() {
        return (Vector<A>)EMPTY;
    }

    static <A> TransientVector<A> newTransient() {
        return new TVector<>(0, 0, null, new Object[WIDTH]);
    }

    // ------------------------------------------------------------------------

    /**
     * A trie node. Nodes above the leaf level hold child nodes, leaf nodes
     * hold elements. The edit token identifies the transient that may mutate
     * the node in place; published nodes are never mutated again.
     */
    static final class Node {
        final Object edit;
        final Object[] array;

        Node(Object edit, Object[] array) {
            this.edit = edit;
            this.array = array;
        }

        Node(Object edit) {
            this(edit, new Object[WIDTH]);
        }
    }

    // Trie Engine

    /**
     * Returns a node that can be written by the owner of the edit token,
     * copying the given node unless it is already owned. A {@code null}
     * token always copies.
     */
    static Node editable(Node node, Object edit) {
        if (edit != null && node.edit == edit) {
            return node;
        } else {
            return new Node(edit, node.array.clone());
        }
    }

    /**
     * Wraps a node into a chain of single-child nodes reaching the given level.
     */
    static Node newPath(Object edit, int level, Node node) {
        for (; level > 0; level -= BITS) {
            Node parent = new Node(edit);
            parent.array[0] = node;
            node = parent;
        }
        return node;
    }

    /**
     * Walks down from a writable node at {@code fromLevel} to the node at
     * {@code toLevel} along the path of the given index. Every node visited
     * is made writable and linked into its parent, so the returned node may
     * be written directly. Missing nodes are created empty.
     */
    static Node descend(Object edit, Node node, int fromLevel, int toLevel, int index) {
        for (int level = fromLevel; level > toLevel; level -= BITS) {
            int sub = selector(index, level);
            Node child = (Node)node.array[sub];
            child = child == null ? new Node(edit) : editable(child, edit);
            node.array[sub] = child;
            node = child;
        }
        return node;
    }

    /**
     * Returns the leaf node holding the element at the given trie index.
     */
    static Node leafNodeFor(Node root, int shift, int index) {
        Node node = root;
        for (int level = shift; level > 0; level -= BITS) {
            node = (Node)node.array[selector(index, level)];
        }
        return node;
    }

    static Object[] leafFor(Node root, int shift, int index) {
        return leafNodeFor(root, shift, index).array;
    }

    static Node assocTrie(Object edit, int shift, Node root, int index, Object value) {
        Node newRoot = editable(root, edit);
        descend(edit, newRoot, shift, 0, index).array[index & MASK] = value;
        return newRoot;
    }

    static Node pushLeaf(Object edit, int shift, Node root, int index, Node leaf) {
        Node newRoot = editable(root, edit);
        descend(edit, newRoot, shift, BITS, index).array[selector(index, BITS)] = leaf;
        return newRoot;
    }

    static Node growTrie(Object edit, int shift, Node root, Node leaf) {
        Node newRoot = new Node(edit);
        newRoot.array[0] = root;
        newRoot.array[1] = newPath(edit, shift, leaf);
        if (logger.isLoggable(Level.FINEST)) {
            logger.finest("trie grows to shift " + (shift + BITS));
        }
        return newRoot;
    }

    /**
     * Detaches the rightmost leaf from the trie. The trie holds
     * {@code trieSize} elements after the removal.
     */
    static Node removeLeaf(Object edit, int shift, Node root, int trieSize) {
        int level = divergenceLevel(trieSize, shift);
        Node newRoot = editable(root, edit);
        descend(edit, newRoot, shift, level, trieSize).array[selector(trieSize, level)] = null;
        return newRoot;
    }

    /**
     * Returns the leftmost leaf under the second child of the root, which
     * becomes the tail when the trie shrinks one level.
     */
    static Node lowerLeaf(Node root, int shift) {
        Node node = (Node)root.array[1];
        for (int level = shift - BITS; level > 0; level -= BITS) {
            node = (Node)node.array[0];
        }
        if (logger.isLoggable(Level.FINEST)) {
            logger.finest("trie shrinks to shift " + (shift - BITS));
        }
        return node;
    }

    static IndexOutOfBoundsException outOfRange(int i, int size) {
        return new IndexOutOfBoundsException("Index: " + i + ", Size: " + size);
    }

    static NoSuchElementException emptyVector() {
        return new NoSuchElementException("Vector is empty");
    }

    // ------------------------------------------------------------------------

    static final class PVector<A> implements Vector<A> {
        final int size;
        final int shift;
        final Node root;
        final Object[] tail;

        PVector(int size, int shift, Node root, Object[] tail) {
            this.size = size;
            this.shift = shift;
            this.root = root;
            this.tail = tail;
        }

        @Override
        public int size() {
            return size;
        }

        @Override
        @SuppressWarnings("unchecked")
        public A get(int i) {
            if (i < 1 || i > size)
                throw outOfRange(i, size);

            int index = i - 1;
            if (index >= tailOffset(size)) {
                return (A)tail[index & MASK];
            } else {
                return (A)leafFor(root, shift, index)[index & MASK];
            }
        }

        @Override
        public Vector<A> set(int i, A value) {
            if (i < 1 || i > size)
                throw outOfRange(i, size);

            int index = i - 1;
            if (index >= tailOffset(size)) {
                Object[] newTail = tail.clone();
                newTail[index & MASK] = value;
                return new PVector<>(size, shift, root, newTail);
            } else {
                return new PVector<>(size, shift, assocTrie(null, shift, root, index, value), tail);
            }
        }

        @Override
        public Vector<A> push(A value) {
            int ts = tailSize(size);
            if (ts < WIDTH) {
                Object[] newTail = Arrays.copyOf(tail, ts + 1);
                newTail[ts] = value;
                return new PVector<>(size + 1, shift, root, newTail);
            }

            Node leaf = new Node(null, tail);
            Object[] newTail = { value };
            if (size == WIDTH) {
                return new PVector<>(size + 1, 0, leaf, newTail);
            } else if (isTrieFull(size, shift)) {
                return new PVector<>(size + 1, shift + BITS, growTrie(null, shift, root, leaf), newTail);
            } else {
                return new PVector<>(size + 1, shift, pushLeaf(null, shift, root, size - WIDTH, leaf), newTail);
            }
        }

        @Override
        public Vector<A> pop() {
            if (size == 0)
                throw emptyVector();
            if (size == 1)
                return empty();

            if (tailSize(size) > 1) {
                return new PVector<>(size - 1, shift, root, Arrays.copyOf(tail, tail.length - 1));
            }

            int trieSize = size - 1 - WIDTH;
            if (trieSize == 0) {
                return new PVector<>(size - 1, 0, null, root.array);
            } else if (trieSize == 1 << shift) {
                Node leaf = lowerLeaf(root, shift);
                return new PVector<>(size - 1, shift - BITS, (Node)root.array[0], leaf.array);
            } else {
                Object[] newTail = leafFor(root, shift, trieSize);
                return new PVector<>(size - 1, shift, removeLeaf(null, shift, root, trieSize), newTail);
            }
        }

        @Override
        public TransientVector<A> asTransient() {
            Object[] buffer = new Object[WIDTH];
            System.arraycopy(tail, 0, buffer, 0, tail.length);
            return new TVector<>(size, shift, root, buffer);
        }

        @Override
        public Iterator<A> iterator() {
            return new Cursor<>(this);
        }

        public boolean equals(Object obj) {
            if (this == obj)
                return true;
            if (!(obj instanceof Vector))
                return false;

            Vector<?> that = (Vector<?>)obj;
            if (size != that.size())
                return false;

            Iterator<?> it = that.iterator();
            for (A a : this) {
                if (!Objects.equals(a, it.next()))
                    return false;
            }
            return true;
        }

        public int hashCode() {
            int hash = 1;
            for (A a : this) {
                hash = 31 * hash + Objects.hashCode(a);
            }
            return hash;
        }

        public String toString() {
            StringJoiner sj = new StringJoiner(", ", "[", "]");
            for (A a : this) {
                sj.add(String.valueOf(a));
            }
            return sj.toString();
        }
    }

    // ------------------------------------------------------------------------

    static final class TVector<A> implements TransientVector<A> {
        private int size;
        private int shift;
        private Node root;
        private Object[] tail;
        private Object edit;

        TVector(int size, int shift, Node root, Object[] tail) {
            this.size = size;
            this.shift = shift;
            this.root = root;
            this.tail = tail;
            this.edit = new Object();
        }

        private void ensureEditable() {
            Preconditions.checkState(edit != null, "Transient used after persistent() call");
        }

        @Override
        public int size() {
            ensureEditable();
            return size;
        }

        @Override
        @SuppressWarnings("unchecked")
        public A get(int i) {
            ensureEditable();
            if (i < 1 || i > size)
                throw outOfRange(i, size);

            int index = i - 1;
            if (index >= tailOffset(size)) {
                return (A)tail[index & MASK];
            } else {
                return (A)leafFor(root, shift, index)[index & MASK];
            }
        }

        @Override
        public TransientVector<A> set(int i, A value) {
            ensureEditable();
            if (i < 1 || i > size)
                throw outOfRange(i, size);

            int index = i - 1;
            if (index >= tailOffset(size)) {
                tail[index & MASK] = value;
            } else {
                root = assocTrie(edit, shift, root, index, value);
            }
            return this;
        }

        @Override
        public TransientVector<A> push(A value) {
            ensureEditable();

            int ts = tailSize(size);
            if (ts < WIDTH) {
                tail[ts] = value;
                size++;
                return this;
            }

            Node leaf = new Node(edit, tail);
            if (size == WIDTH) {
                root = leaf;
            } else if (isTrieFull(size, shift)) {
                root = growTrie(edit, shift, root, leaf);
                shift += BITS;
            } else {
                root = pushLeaf(edit, shift, root, size - WIDTH, leaf);
            }
            tail = new Object[WIDTH];
            tail[0] = value;
            size++;
            return this;
        }

        @Override
        public TransientVector<A> pop() {
            ensureEditable();
            if (size == 0)
                throw emptyVector();

            if (size == 1 || tailSize(size) > 1) {
                size--;
                tail[size & MASK] = null;
                return this;
            }

            int trieSize = size - 1 - WIDTH;
            Node leaf;
            if (trieSize == 0) {
                leaf = root;
                root = null;
            } else if (trieSize == 1 << shift) {
                leaf = lowerLeaf(root, shift);
                root = (Node)root.array[0];
                shift -= BITS;
            } else {
                leaf = leafNodeFor(root, shift, trieSize);
                root = removeLeaf(edit, shift, root, trieSize);
            }
            tail = ownedArray(leaf);
            size--;
            return this;
        }

        private Object[] ownedArray(Node leaf) {
            return leaf.edit == edit ? leaf.array : leaf.array.clone();
        }

        @Override
        public Vector<A> persistent() {
            ensureEditable();
            edit = null;
            if (logger.isLoggable(Level.FINER)) {
                logger.finer("transient frozen at size " + size);
            }
            return size == 0 ? empty()
                             : new PVector<>(size, shift, root, Arrays.copyOf(tail, tailSize(size)));
        }
    }

    // ------------------------------------------------------------------------

    /**
     * Iterates a persistent vector leaf by leaf. The ancestors of the current
     * leaf are cached per level, so crossing a leaf boundary only redescends
     * the levels whose selector changed.
     */
    static final class Cursor<A> extends UnmodifiableIterator<A> {
        private final int size;
        private final int tailOffset;
        private final Object[] tail;
        private final Node[] stack;
        private Object[] leaf;
        private int index;

        Cursor(PVector<A> vec) {
            this.size = vec.size;
            this.tailOffset = tailOffset(vec.size);
            this.tail = vec.tail;
            this.stack = new Node[vec.shift / BITS];

            if (tailOffset == 0) {
                leaf = tail;
            } else if (stack.length == 0) {
                leaf = vec.root.array;
            } else {
                stack[stack.length - 1] = vec.root;
                for (int k = stack.length - 1; k > 0; k--) {
                    stack[k - 1] = (Node)stack[k].array[0];
                }
                leaf = ((Node)stack[0].array[0]).array;
            }
        }

        @Override
        public boolean hasNext() {
            return index < size;
        }

        @Override
        @SuppressWarnings("unchecked")
        public A next() {
            if (index >= size)
                throw new NoSuchElementException();
            if (index != 0 && (index & MASK) == 0)
                nextLeaf();
            return (A)leaf[index++ & MASK];
        }

        private void nextLeaf() {
            if (index >= tailOffset) {
                leaf = tail;
                return;
            }

            int diff = index ^ (index - 1);
            int top = 0;
            while (top < stack.length - 1 && (diff >>> (BITS * top + 2 * BITS)) != 0) {
                top++;
            }
            for (int k = top - 1; k >= 0; k--) {
                stack[k] = (Node)stack[k + 1].array[selector(index, BITS * k + 2 * BITS)];
            }
            leaf = ((Node)stack[0].array[selector(index, BITS)]).array;
        }
    }

    // ------------------------------------------------------------------------

    /**
     * A read-only {@link java.util.List} view of a vector, indexed from zero.
     */
    static final class ListView<A> extends AbstractList<A> implements RandomAccess {
        private final Vector<A> vector;

        ListView(Vector<A> vector) {
            this.vector = vector;
        }

        @Override
        public A get(int index) {
            Preconditions.checkElementIndex(index, vector.size());
            return vector.get(index + 1);
        }

        @Override
        public int size() {
            return vector.size();
        }

        @Override
        public Iterator<A> iterator() {
            return vector.iterator();
        }
    }
}
