/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.pvec.function;

/**
 * Represents an operation that accepts a vector element and its position.
 *
 * @param <T> the type of the vector element
 */
@FunctionalInterface
public interface IndexedConsumer<T>
{
    void accept(int index, T element);
}
