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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The three membership questions over two sequences. Elements are compared with
 * their own {@code equals}, never field by field. Each call works on private
 * copies, an instance holds no state.
 * <p>
 * The {@code Object...} overloads apply {@link ExpectedValues#of(Object...)} first,
 * so one collection argument is taken as the expected collection itself.
 */
public class CollectionReconciler {

    /**
     * Every expected element is matched by a distinct actual element, in any order.
     * Duplicates in the expected elements need as many duplicates in the actual ones.
     */
    public CollectionVerdict containsAtLeast(Iterable<?> haystack, Iterable<?> needles) {
        List<Object> expected = requireExpected(needles, "contains");
        List<Object> actual = ExpectedValues.toList(haystack);
        List<Object> remaining = new ArrayList<>(expected);
        for (Object element : actual) {
            if (remaining.isEmpty()) {
                break;
            }
            int index = indexOf(remaining, element);
            if (index != -1) {
                remaining.remove(index);
            }
        }
        if (remaining.isEmpty()) {
            return CollectionVerdict.ALL_FOUND;
        }
        return new CollectionVerdict.MissingElements(remaining, actual, expected);
    }

    public CollectionVerdict containsAtLeast(Iterable<?> haystack, Object... expectedValues) {
        return containsAtLeast(haystack, ExpectedValues.of(expectedValues));
    }

    /**
     * Same elements in the same order, same count. A null {@code needles} means no
     * expected collection was given and is reported as an order mismatch at index 0
     * with no expected items.
     */
    public CollectionVerdict containsExactly(Iterable<?> haystack, Iterable<?> needles) {
        List<Object> actual = ExpectedValues.toList(haystack);
        if (needles == null) {
            return new CollectionVerdict.OrderMismatch(0, elementAt(actual, 0), null, actual, null);
        }
        List<Object> expected = ExpectedValues.toList(needles);
        int count = Math.max(actual.size(), expected.size());
        for (int i = 0; i < count; i++) {
            if (i >= actual.size() || i >= expected.size() || !Objects.equals(actual.get(i), expected.get(i))) {
                return new CollectionVerdict.OrderMismatch(i, elementAt(actual, i), elementAt(expected, i), actual, expected);
            }
        }
        return CollectionVerdict.ALL_FOUND;
    }

    public CollectionVerdict containsExactly(Iterable<?> haystack, Object... expectedValues) {
        return containsExactly(haystack, ExpectedValues.of(expectedValues));
    }

    /**
     * Every actual element equals some expected element. Membership only: an actual
     * element repeated more often than expected is not reported.
     */
    public CollectionVerdict containsOnly(Iterable<?> haystack, Iterable<?> needles) {
        List<Object> expected = requireExpected(needles, "contains only");
        List<Object> actual = ExpectedValues.toList(haystack);
        List<Object> unexpected = new ArrayList<>();
        for (Object element : actual) {
            if (indexOf(expected, element) == -1) {
                unexpected.add(element);
            }
        }
        if (unexpected.isEmpty()) {
            return CollectionVerdict.ALL_FOUND;
        }
        return new CollectionVerdict.UnexpectedElements(unexpected, actual, expected);
    }

    public CollectionVerdict containsOnly(Iterable<?> haystack, Object... expectedValues) {
        return containsOnly(haystack, ExpectedValues.of(expectedValues));
    }

    private static List<Object> requireExpected(Iterable<?> needles, String operation) {
        if (needles == null) {
            throw new IllegalArgumentException(operation + ": expected values must not be null");
        }
        return ExpectedValues.toList(needles);
    }

    private static int indexOf(List<Object> list, Object element) {
        for (int i = 0; i < list.size(); i++) {
            if (Objects.equals(list.get(i), element)) {
                return i;
            }
        }
        return -1;
    }

    private static Object elementAt(List<Object> list, int index) {
        return index < list.size() ? list.get(index) : null;
    }

}
