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

import java.util.List;
import java.util.Objects;

/**
 * Single-predicate checks. Each one answers its positive question only, negated
 * forms are derived by {@link Operation}.
 */
public final class Checks {

    private Checks() {
        // only static methods
    }

    public static PredicateVerdict isNull(Object actual) {
        return new PredicateVerdict(actual == null, "not null", actual, null);
    }

    public static PredicateVerdict isEqualTo(Object actual, Object expected) {
        return new PredicateVerdict(Objects.deepEquals(expected, actual), "not equal", actual, expected);
    }

    public static PredicateVerdict isSameReference(Object actual, Object expected) {
        return new PredicateVerdict(actual == expected, "not the same instance", actual, expected);
    }

    /**
     * The runtime class is exactly the given type, a subclass does not qualify.
     */
    public static PredicateVerdict isInstanceOf(Object actual, Class<?> type) {
        Class<?> actualType = actual == null ? null : actual.getClass();
        return new PredicateVerdict(type.equals(actualType), "not an instance of " + type.getName(), actualType, type);
    }

    /**
     * The runtime class is the given type or one of its subtypes.
     */
    public static PredicateVerdict inheritsFrom(Object actual, Class<?> type) {
        Class<?> actualType = actual == null ? null : actual.getClass();
        boolean holds = actualType != null && type.isAssignableFrom(actualType);
        return new PredicateVerdict(holds, "not derived from " + type.getName(), actualType, type);
    }

    /**
     * @param actual any value accepted by {@link ExpectedValues#toList(Object)}
     */
    public static PredicateVerdict hasSize(Object actual, long size) {
        List<Object> list = requireCollection(actual);
        return new PredicateVerdict(list.size() == size, "size is " + list.size(), list, size);
    }

    public static PredicateVerdict isEmpty(Object actual) {
        List<Object> list = requireCollection(actual);
        return new PredicateVerdict(list.isEmpty(), "not empty", list, List.of());
    }

    static List<Object> requireCollection(Object actual) {
        List<Object> list = ExpectedValues.toList(actual);
        if (list == null) {
            throw new IllegalArgumentException("not a collection: " + (actual == null ? null : actual.getClass().getName()));
        }
        return list;
    }

}
