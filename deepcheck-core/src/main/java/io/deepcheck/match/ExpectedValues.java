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

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Turns the arguments of a collection check into the list of expected elements.
 * <p>
 * A single argument that is itself a collection (any {@link Iterable} or array)
 * is the expected collection, not one expected element. Text is never unwrapped:
 * a single {@link CharSequence} or {@code char[]} stays one element.
 */
public final class ExpectedValues {

    private ExpectedValues() {
        // only static methods
    }

    /**
     * @return the expected elements, or null when no expected values were given at all
     */
    public static List<Object> of(Object... values) {
        if (values == null) {
            return null;
        }
        if (values.length == 1 && isCollectionButNotText(values[0])) {
            return toList(values[0]);
        }
        return new ArrayList<>(Arrays.asList(values));
    }

    static boolean isCollectionButNotText(Object o) {
        if (o == null || o instanceof CharSequence || o instanceof char[]) {
            return false;
        }
        return o instanceof Iterable || o.getClass().isArray();
    }

    /**
     * Elements of an iterable, an array (primitive arrays included) or the entries of a map.
     *
     * @return a new list, or null if the value is none of these
     */
    public static List<Object> toList(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        if (value instanceof Iterable<?> iterable) {
            List<Object> list = new ArrayList<>();
            for (Object o : iterable) {
                list.add(o);
            }
            return list;
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> list = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                list.add(Array.get(value, i));
            }
            return list;
        }
        if (value instanceof Map<?, ?> map) {
            return new ArrayList<>(map.entrySet());
        }
        return null;
    }

}
