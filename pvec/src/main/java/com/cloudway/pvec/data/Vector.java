/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.pvec.data;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Function;
import java.util.function.IntFunction;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.Collector;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.Maps;
import com.google.common.collect.UnmodifiableIterator;

import com.cloudway.pvec.function.IndexedConsumer;
import com.cloudway.pvec.function.IndexedFunction;
import com.cloudway.pvec.function.IndexedPredicate;
import com.cloudway.pvec.function.IndexedReducer;

/**
 * A persistent vector: an ordered, indexable sequence that supports read,
 * update, append and remove-last in effectively constant time. Every update
 * returns a new vector and leaves this vector unchanged, so vectors can be
 * freely shared, including between threads.
 *
 * <p>Elements are addressed by 1-based position, from {@code 1} to
 * {@link #size()} inclusive. {@code null} elements are permitted.</p>
 *
 * <p>For bulk construction, obtain a {@link TransientVector} with
 * {@link #asTransient()}, mutate it in place, and freeze it back with
 * {@link TransientVector#persistent()}.</p>
 *
 * @param <A> the type of vector elements
 */
public interface Vector<A> extends Iterable<A>
{
    // Constructors

    /**
     * Returns the empty vector.
     *
     * @return the empty vector
     */
    static <A> Vector<A> empty() {
        return VectorImpl.empty();
    }

    /**
     * Construct a vector with given elements.
     */
    @SafeVarargs
    static <A> Vector<A> of(A... elements) {
        TransientVector<A> t = VectorImpl.newTransient();
        for (A a : elements) {
            t.push(a);
        }
        return t.persistent();
    }

    /**
     * Construct a vector holding the elements of the given iterable, in
     * iteration order.
     *
     * @param elements the source of elements
     * @return a vector holding all elements, or the empty vector
     */
    @SuppressWarnings("unchecked")
    static <A> Vector<A> from(Iterable<? extends A> elements) {
        if (elements instanceof Vector) {
            return (Vector<A>)elements;
        }
        return VectorImpl.<A>newTransient().pushAll(elements).persistent();
    }

    /**
     * Construct a vector of the given length whose element at position
     * {@code i} is {@code f.apply(i)}.
     *
     * @param len the length of the vector
     * @param f the function producing elements from 1-based positions
     * @return the generated vector
     * @throws IllegalArgumentException if {@code len} is negative
     */
    static <A> Vector<A> iterate(int len, IntFunction<? extends A> f) {
        if (len < 0)
            throw new IllegalArgumentException("iterate called with negative length");

        TransientVector<A> t = VectorImpl.newTransient();
        for (int i = 1; i <= len; i++) {
            t.push(f.apply(i));
        }
        return t.persistent();
    }

    /**
     * Returns a {@code Collector} that accumulates the input elements into
     * a vector, in encounter order.
     */
    static <A> Collector<A, ?, Vector<A>> collector() {
        return Collector.<A, TransientVector<A>, Vector<A>>of(
            VectorImpl::newTransient,
            TransientVector::push,
            (l, r) -> l.pushAll(r.persistent()),
            TransientVector::persistent);
    }

    // Core operations

    /**
     * Returns the number of elements in this vector.
     *
     * @return the number of elements in this vector
     */
    int size();

    /**
     * Returns {@code true} if this vector contains no elements.
     *
     * @return {@code true} if this vector contains no elements
     */
    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Returns the element at the given position.
     *
     * @param i the 1-based position of the element
     * @return the element at the position
     * @throws IndexOutOfBoundsException if {@code i} is outside {@code [1, size()]}
     */
    A get(int i);

    /**
     * Returns a vector with the element at the given position replaced.
     * The returned vector shares all trie nodes with this vector except
     * those on the path to the replaced element.
     *
     * @param i the 1-based position of the element
     * @param value the new element
     * @return the updated vector
     * @throws IndexOutOfBoundsException if {@code i} is outside {@code [1, size()]}
     */
    Vector<A> set(int i, A value);

    /**
     * Returns a vector with the element at the given position replaced by
     * the result of applying the given function to it.
     *
     * @throws IndexOutOfBoundsException if {@code i} is outside {@code [1, size()]}
     */
    default Vector<A> modify(int i, UnaryOperator<A> f) {
        requireNonNull(f);
        return set(i, f.apply(get(i)));
    }

    /**
     * Returns a vector with the given element appended.
     *
     * @param value the element to append
     * @return the extended vector
     */
    Vector<A> push(A value);

    /**
     * Returns a vector with the last element removed.
     *
     * @return the shortened vector
     * @throws NoSuchElementException if this vector is empty
     */
    Vector<A> pop();

    /**
     * Returns the last element of this vector.
     *
     * @return the last element of this vector
     * @throws NoSuchElementException if this vector is empty
     */
    default A last() {
        if (isEmpty())
            throw VectorImpl.emptyVector();
        return get(size());
    }

    /**
     * Returns a transient vector initialized with the contents of this
     * vector. This vector is not affected by mutations of the transient.
     *
     * @return a new transient vector
     */
    TransientVector<A> asTransient();

    // Iteration

    /**
     * Returns an iterator over the elements in this vector, in order.
     */
    @Override
    Iterator<A> iterator();

    @Override
    default Spliterator<A> spliterator() {
        return Spliterators.spliterator(iterator(), size(),
            Spliterator.ORDERED | Spliterator.SIZED | Spliterator.IMMUTABLE);
    }

    /**
     * Returns a sequential {@code Stream} with this vector as its source.
     */
    default Stream<A> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    /**
     * Performs the given action for each element, passing the 1-based
     * position along with the element.
     *
     * @param action the action to be performed for each element
     */
    default void forEachIndexed(IndexedConsumer<? super A> action) {
        requireNonNull(action);
        int i = 0;
        for (A a : this) {
            action.accept(++i, a);
        }
    }

    /**
     * Returns the (position, element) pairs of this vector. Positions are
     * 1-based.
     */
    default Iterable<Map.Entry<Integer, A>> indexed() {
        return () -> new UnmodifiableIterator<Map.Entry<Integer, A>>() {
            private final Iterator<A> it = iterator();
            private int i = 0;

            @Override
            public boolean hasNext() {
                return it.hasNext();
            }

            @Override
            public Map.Entry<Integer, A> next() {
                A a = it.next();
                return Maps.immutableEntry(++i, a);
            }
        };
    }

    // Derived operations

    /**
     * Returns a vector consisting of the results of applying the given
     * function to the elements of this vector.
     *
     * @param f the function receiving element, position and this vector
     * @return the mapped vector
     */
    default <B> Vector<B> map(IndexedFunction<? super A, ? extends B> f) {
        requireNonNull(f);
        TransientVector<B> t = VectorImpl.newTransient();
        forEachIndexed((i, a) -> t.push(f.apply(a, i, this)));
        return t.persistent();
    }

    default <B> Vector<B> map(Function<? super A, ? extends B> f) {
        requireNonNull(f);
        return map((a, i, v) -> f.apply(a));
    }

    /**
     * Returns a vector consisting of the elements of this vector that match
     * the given predicate.
     *
     * @param p the predicate receiving element, position and this vector
     * @return the filtered vector
     */
    default Vector<A> filter(IndexedPredicate<? super A> p) {
        requireNonNull(p);
        TransientVector<A> t = VectorImpl.newTransient();
        forEachIndexed((i, a) -> {
            if (p.test(a, i, this))
                t.push(a);
        });
        return t.persistent();
    }

    default Vector<A> filter(Predicate<? super A> p) {
        requireNonNull(p);
        return filter((a, i, v) -> p.test(a));
    }

    /**
     * Folds the elements of this vector from left to right.
     *
     * @param z the initial accumulator
     * @param f the folding function
     * @return the folded result
     */
    default <R> R reduce(R z, IndexedReducer<? super A, R> f) {
        return reduceWhile(z, f, r -> true);
    }

    /**
     * Folds the elements of this vector from left to right, stopping as
     * soon as the accumulated result no longer satisfies the given
     * predicate. The result that failed the predicate is returned.
     *
     * @param z the initial accumulator
     * @param f the folding function
     * @param p the condition to continue folding
     * @return the folded result
     */
    default <R> R reduceWhile(R z, IndexedReducer<? super A, R> f, Predicate<? super R> p) {
        requireNonNull(f);
        requireNonNull(p);
        R acc = z;
        int i = 0;
        for (A a : this) {
            acc = f.apply(acc, a, ++i, this);
            if (!p.test(acc))
                break;
        }
        return acc;
    }

    /**
     * Returns an array containing all of the elements in this vector in
     * proper sequence.
     */
    default Object[] toArray() {
        Object[] result = new Object[size()];
        int i = 0;
        for (A a : this) {
            result[i++] = a;
        }
        return result;
    }

    /**
     * Returns an array containing all of the elements in this vector, using
     * the provided generator function to allocate the returned array.
     */
    @SuppressWarnings("unchecked")
    default <T> T[] toArray(IntFunction<T[]> generator) {
        T[] result = generator.apply(size());
        int i = 0;
        for (A a : this) {
            result[i++] = (T)a;
        }
        return result;
    }

    /**
     * Returns a read-only {@link List} view of this vector. The view follows
     * the {@code List} contract and is indexed from zero.
     */
    default List<A> asList() {
        return new VectorImpl.ListView<>(this);
    }
}
