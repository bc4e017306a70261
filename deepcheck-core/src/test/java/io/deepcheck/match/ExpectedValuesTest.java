/*
 * The MIT License
 *
 * Copyright 2025 The deepcheck Authors
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.deepcheck.match;

import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExpectedValuesTest {

    @Test
    void testVarargs() {
        assertEquals(List.of(1, 2, 3), ExpectedValues.of(1, 2, 3));
        assertEquals(List.of(), ExpectedValues.of());
    }

    @Test
    void testAbsent() {
        assertNull(ExpectedValues.of((Object[]) null));
    }

    @Test
    void testSingleNullIsOneElement() {
        List<Object> values = ExpectedValues.of((Object) null);
        assertEquals(1, values.size());
        assertNull(values.get(0));
    }

    @Test
    void testSingleIterableIsUnwrapped() {
        assertEquals(List.of("a", "b"), ExpectedValues.of((Object) List.of("a", "b")));
        ArrayDeque<Integer> deque = new ArrayDeque<>(List.of(3, 4));
        assertEquals(List.of(3, 4), ExpectedValues.of(deque));
    }

    @Test
    void testSingleArrayIsUnwrapped() {
        assertEquals(List.of(1L, 2L), ExpectedValues.of((Object) new long[]{1, 2}));
    }

    @Test
    void testTextIsNeverUnwrapped() {
        assertEquals(List.of("abc"), ExpectedValues.of("abc"));
        StringBuilder sb = new StringBuilder("abc");
        assertSame(sb, ExpectedValues.of(sb).get(0));
        char[] chars = {'a', 'b'};
        List<Object> values = ExpectedValues.of((Object) chars);
        assertEquals(1, values.size());
        assertSame(chars, values.get(0));
    }

    @Test
    void testSeveralCollectionsAreElements() {
        List<Object> values = ExpectedValues.of(List.of(1), List.of(2));
        assertEquals(2, values.size());
        assertEquals(List.of(1), values.get(0));
    }

    @Test
    void testToList() {
        assertNull(ExpectedValues.toList(null));
        assertNull(ExpectedValues.toList("abc"));
        assertNull(ExpectedValues.toList(42));
        assertEquals(List.of('x', 'y'), ExpectedValues.toList(new char[]{'x', 'y'}));
        assertEquals(List.of(Map.entry("k", 1)), ExpectedValues.toList(Map.of("k", 1)));
        Iterable<String> iterable = () -> List.of("i").iterator();
        assertEquals(List.of("i"), ExpectedValues.toList(iterable));
    }

}
