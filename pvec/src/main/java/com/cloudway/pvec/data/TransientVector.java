/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.pvec.data;

import java.util.NoSuchElementException;

/**
 * A vector that is mutated in place. Transient vectors trade persistence for
 * fewer allocations and are intended for bulk construction: build with
 * repeated {@link #push} calls, then call {@link #persistent()} once and use
 * only the returned {@link Vector}.
 *
 * <p>A transient vector must be confined to a single owner. It is not
 * thread-safe, and once {@link #persistent()} has been called every further
 * operation fails with {@code IllegalStateException}. A failed operation
 * leaves the transient unchanged.</p>
 *
 * @param <A> the type of vector elements
 */
public interface TransientVector<A>
{
    /**
     * Returns the number of elements in this vector.
     */
    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Returns the element at the given 1-based position.
     *
     * @throws IndexOutOfBoundsException if {@code i} is outside {@code [1, size()]}
     */
    A get(int i);

    /**
     * Replaces the element at the given 1-based position.
     *
     * @return this vector
     * @throws IndexOutOfBoundsException if {@code i} is outside {@code [1, size()]}
     */
    TransientVector<A> set(int i, A value);

    /**
     * Appends the given element.
     *
     * @return this vector
     */
    TransientVector<A> push(A value);

    /**
     * Appends all elements of the given iterable, in iteration order.
     *
     * @return this vector
     */
    default TransientVector<A> pushAll(Iterable<? extends A> elements) {
        for (A a : elements) {
            push(a);
        }
        return this;
    }

    /**
     * Removes the last element.
     *
     * @return this vector
     * @throws NoSuchElementException if this vector is empty
     */
    TransientVector<A> pop();

    /**
     * Freezes this transient and returns its contents as a persistent vector.
     * The transient cannot be used afterwards.
     *
     * @return a persistent vector holding the current contents
     */
    Vector<A> persistent();
}
