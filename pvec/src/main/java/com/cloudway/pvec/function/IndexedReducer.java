/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.pvec.function;

import com.cloudway.pvec.data.Vector;

/**
 * Represents a step of a left fold over a vector.
 *
 * @param <T> the type of the vector element
 * @param <R> the type of the accumulated result
 */
@FunctionalInterface
public interface IndexedReducer<T, R>
{
    /**
     * Combines the accumulated result with the next element.
     *
     * @param acc the result accumulated so far
     * @param element the vector element
     * @param index the 1-based position of the element
     * @param vector the vector being folded
     * @return the new accumulated result
     */
    R apply(R acc, T element, int index, Vector<? extends T> vector);
}
