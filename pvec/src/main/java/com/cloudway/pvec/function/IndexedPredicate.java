/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.pvec.function;

import com.cloudway.pvec.data.Vector;

/**
 * Represents a predicate of a vector element, its position, and the vector
 * being traversed.
 *
 * @param <T> the type of the vector element
 */
@FunctionalInterface
public interface IndexedPredicate<T>
{
    /**
     * Evaluates this predicate on the given element.
     *
     * @param element the vector element
     * @param index the 1-based position of the element
     * @param vector the vector being traversed
     * @return {@code true} if the element matches the predicate
     */
    boolean test(T element, int index, Vector<? extends T> vector);
}
