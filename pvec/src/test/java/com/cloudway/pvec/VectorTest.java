/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.pvec;

import java.util.NoSuchElementException;
import java.util.function.Consumer;

import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;

import com.cloudway.pvec.data.Vector;

public class VectorTest {
    private static final int N = 2000;
    private Vector<Integer> vec;

    @Before
    public void init() {
        vec = Vector.iterate(N, i -> i);
    }

    static Vector<Integer> pushRange(Vector<Integer> v, int from, int to) {
        for (int i = from; i <= to; i++) {
            v = v.push(i);
        }
        return v;
    }

    static void assertRange(Vector<Integer> v, int n) {
        assertEquals(n, v.size());
        for (int i = 1; i <= n; i++) {
            assertEquals("get " + i, i, (int)v.get(i));
        }
    }

    @Test
    public void emptyVector() {
        Vector<String> empty = Vector.empty();
        assertEquals(0, empty.size());
        assertTrue(empty.isEmpty());
        assertFalse(empty.iterator().hasNext());
        assertEquals(0, empty.toArray().length);
        assertSame(empty, Vector.of());
    }

    @Test
    public void get() {
        for (int i = 1; i <= N; i++) {
            assertEquals(i, (int)vec.get(i));
        }
    }

    @Test
    public void getOutOfRange() {
        outOfRange(v -> v.get(0));
        outOfRange(v -> v.get(-1));
        outOfRange(v -> v.get(N + 1));
        outOfRange(v -> Vector.empty().get(1));
    }

    @Test
    public void setOutOfRange() {
        outOfRange(v -> v.set(0, 42));
        outOfRange(v -> v.set(N + 1, 42));
        assertRange(vec, N);
    }

    private void outOfRange(Consumer<Vector<Integer>> action) {
        try {
            action.accept(vec);
            fail("IndexOutOfBoundsException was not thrown");
        } catch (IndexOutOfBoundsException ex) {
            // ok
        }
    }

    @Test
    public void set() {
        Vector<Integer> xs = vec;
        for (int i = 1; i <= N; i++) {
            xs = xs.set(i, i * 10);
        }
        for (int i = 1; i <= N; i++) {
            assertEquals("set " + i, i * 10, (int)xs.get(i));
        }
        assertRange(vec, N);
    }

    @Test
    public void setLeavesOtherPositions() {
        for (int i = 1; i <= N; i += 37) {
            Vector<Integer> xs = vec.set(i, -1);
            assertEquals(-1, (int)xs.get(i));
            for (int j = 1; j <= N; j++) {
                if (j != i) {
                    assertEquals("set " + i, vec.get(j), xs.get(j));
                }
            }
        }
    }

    @Test
    public void modify() {
        Vector<Integer> xs = vec;
        for (int i = 1; i <= N; i++) {
            xs = xs.modify(i, x -> x * 10);
        }
        for (int i = 1; i <= N; i++) {
            assertEquals("modify " + i, i * 10, (int)xs.get(i));
        }
    }

    @Test
    public void pushKeepsPreviousVersions() {
        Vector<Integer> v = Vector.empty();
        Vector<?>[] versions = new Vector<?>[100];
        for (int i = 1; i <= 100; i++) {
            versions[i - 1] = v;
            v = v.push(i);
            assertEquals(i, v.size());
        }
        for (int n = 0; n < 100; n++) {
            @SuppressWarnings("unchecked")
            Vector<Integer> old = (Vector<Integer>)versions[n];
            assertRange(old, n);
        }
    }

    @Test
    public void pushThenPop() {
        Vector<Integer> xs = vec;
        for (int n = N; n > 7; n -= 7) {
            Vector<Integer> ys = xs.push(-1).pop();
            assertEquals(xs, ys);
            assertRange(ys, n);
            xs = xs.pop().pop().pop().pop().pop().pop().pop();
        }
    }

    @Test
    public void pushAndPopAcrossBoundaries() {
        Vector<Integer> v = Vector.empty();
        for (int i = 1; i <= 1024; i++) {
            v = v.push(i);
            assertEquals(i, (int)v.get(i));
            v = v.set(i, -i);
            assertEquals(-i, (int)v.get(i));
            v = v.set(i, i);
        }
        assertRange(v, 1024);

        for (int i = 1024; i > 0; i--) {
            assertEquals(i, v.size());
            assertEquals(i, (int)v.last());
            v = v.pop();
            assertEquals(i - 1, v.size());
        }
        assertTrue(v.isEmpty());

        try {
            v.pop();
            fail("NoSuchElementException was not thrown");
        } catch (NoSuchElementException ex) {
            // ok
        }
    }

    @Test
    public void popReproducesSequenceThroughHeightChanges() {
        int n = 33 + 32 * 32 * 33;
        Vector<Integer> up = pushRange(Vector.empty(), 1, n);
        Vector<?>[] trace = new Vector<?>[n + 1];

        Vector<Integer> v = Vector.empty();
        for (int i = 1; i <= n; i++) {
            trace[i - 1] = v;
            v = v.push(i);
        }
        trace[n] = v;
        assertEquals(up, v);

        for (int i = n; i > 0; i--) {
            v = v.pop();
            assertEquals(i - 1, v.size());
            if (i % 97 == 0 || i <= 70 || (i >= 1050 && i <= 1100)) {
                assertEquals("pop to " + (i - 1), trace[i - 1], v);
                assertRange(v, i - 1);
            }
        }
    }

    @Test
    public void popOnEmpty() {
        try {
            Vector.empty().pop();
            fail("NoSuchElementException was not thrown");
        } catch (NoSuchElementException ex) {
            // ok
        }
    }

    @Test(expected = NoSuchElementException.class)
    public void lastOnEmpty() {
        Vector.empty().last();
    }

    @Test
    public void popDoesNotAffectSource() {
        Vector<Integer> xs = vec;
        while (!xs.isEmpty()) {
            xs = xs.pop();
        }
        assertRange(vec, N);
    }

    @Test
    public void from() {
        Vector<String> v = Vector.from(java.util.Arrays.asList("a", "b", "c"));
        assertEquals(3, v.size());
        assertEquals("a", v.get(1));
        assertEquals("c", v.get(3));
        assertSame(v, Vector.from(v));
        assertTrue(Vector.from(java.util.Collections.emptyList()).isEmpty());
    }

    @Test
    public void nullElements() {
        Vector<String> v = Vector.of("a", null, "c");
        assertNull(v.get(2));
        assertEquals("[a, null, c]", v.toString());
        assertNull(v.set(1, null).get(1));
    }

    @Test(expected = IllegalArgumentException.class)
    public void iterateNegativeLength() {
        Vector.iterate(-1, i -> i);
    }

    @Test
    public void equalsAndHashCode() {
        Vector<Integer> other = pushRange(Vector.empty(), 1, N);
        assertEquals(vec, other);
        assertEquals(vec.hashCode(), other.hashCode());
        assertEquals(vec.asList().hashCode(), vec.hashCode());
        assertNotEquals(vec, other.pop());
        assertNotEquals(vec, other.set(5, 0));
    }
}
