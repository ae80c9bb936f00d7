/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.pvec.function;

import com.cloudway.pvec.data.Vector;

/**
 * Represents a function that accepts a vector element together with its
 * position and the vector being traversed, and produces a result.
 *
 * @param <T> the type of the vector element
 * @param <R> the type of the result of the function
 */
@FunctionalInterface
public interface IndexedFunction<T, R>
{
    /**
     * Applies this function to the given element.
     *
     * @param element the vector element
     * @param index the 1-based position of the element
     * @param vector the vector being traversed
     * @return the function result
     */
    R apply(T element, int index, Vector<? extends T> vector);
}
