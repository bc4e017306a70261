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

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CollectionReconcilerTest {

    final CollectionReconciler reconciler = new CollectionReconciler();

    @Test
    void testContainsAtLeastIsMultiset() {
        assertSame(CollectionVerdict.ALL_FOUND, reconciler.containsAtLeast(List.of(1, 2, 2, 3), 2, 2));
        CollectionVerdict verdict = reconciler.containsAtLeast(List.of(1, 2, 3), 2, 2);
        CollectionVerdict.MissingElements missing = assertInstanceOf(CollectionVerdict.MissingElements.class, verdict);
        assertEquals(List.of(2), missing.missing());
        assertEquals(List.of(1, 2, 3), missing.actual());
        assertEquals(List.of(2, 2), missing.expected());
    }

    @Test
    void testContainsAtLeastAnyOrder() {
        assertTrue(reconciler.containsAtLeast(List.of("a", "b", "c"), "c", "a").isMatch());
        assertTrue(reconciler.containsAtLeast(List.of("a"), new Object[0]).isMatch());
    }

    @Test
    void testContainsAtLeastKeepsOrderOfMissing() {
        CollectionVerdict verdict = reconciler.containsAtLeast(List.of(2), 5, 2, 4, 5);
        assertEquals(List.of(5, 4, 5), ((CollectionVerdict.MissingElements) verdict).missing());
    }

    @Test
    void testContainsAtLeastWithNulls() {
        assertTrue(reconciler.containsAtLeast(Arrays.asList(1, null), (Object) null).isMatch());
        assertFalse(reconciler.containsAtLeast(List.of(1), (Object) null).isMatch());
    }

    @Test
    void testContainsAtLeastWithoutExpectedValues() {
        assertThrows(IllegalArgumentException.class, () -> reconciler.containsAtLeast(List.of(1), (Iterable<?>) null));
        assertThrows(IllegalArgumentException.class, () -> reconciler.containsAtLeast(List.of(1), (Object[]) null));
    }

    @Test
    void testContainsExactly() {
        assertSame(CollectionVerdict.ALL_FOUND, reconciler.containsExactly(List.of(1, 2, 3), 1, 2, 3));
        CollectionVerdict verdict = reconciler.containsExactly(List.of(1, 2, 3), 3, 2, 1);
        CollectionVerdict.OrderMismatch order = assertInstanceOf(CollectionVerdict.OrderMismatch.class, verdict);
        assertEquals(0, order.index());
        assertEquals(1, order.actualElement());
        assertEquals(3, order.expectedElement());
        assertEquals("[0]", order.path());
        assertEquals("elements differ at index 0", order.reason());
    }

    @Test
    void testContainsExactlyLengthMismatch() {
        CollectionVerdict.OrderMismatch shorter = (CollectionVerdict.OrderMismatch) reconciler.containsExactly(List.of(1, 2), 1, 2, 3);
        assertEquals(2, shorter.index());
        assertNull(shorter.actualElement());
        assertEquals(3, shorter.expectedElement());
        assertEquals("actual has fewer elements than expected", shorter.reason());
        CollectionVerdict.OrderMismatch longer = (CollectionVerdict.OrderMismatch) reconciler.containsExactly(List.of(1, 2, 3), 1, 2);
        assertEquals(2, longer.index());
        assertEquals(3, longer.actualElement());
        assertEquals("actual has more elements than expected", longer.reason());
    }

    @Test
    void testContainsExactlyEmpty() {
        assertTrue(reconciler.containsExactly(List.of(), List.of()).isMatch());
        assertFalse(reconciler.containsExactly(List.of(1), List.of()).isMatch());
    }

    @Test
    void testContainsExactlyWithoutExpectedCollection() {
        CollectionVerdict verdict = reconciler.containsExactly(List.of(1, 2), (Iterable<?>) null);
        CollectionVerdict.OrderMismatch order = assertInstanceOf(CollectionVerdict.OrderMismatch.class, verdict);
        assertTrue(order.isExpectedAbsent());
        assertEquals(0, order.index());
        assertEquals(List.of(1, 2), order.actualItems());
        assertNull(order.expected());
        assertEquals("expected no collection", order.reason());
        assertTrue(((CollectionVerdict.OrderMismatch) reconciler.containsExactly(List.of(), (Object[]) null)).isExpectedAbsent());
    }

    @Test
    void testContainsOnlyIsMembership() {
        assertSame(CollectionVerdict.ALL_FOUND, reconciler.containsOnly(List.of(1, 1, 2), 1, 2));
        assertTrue(reconciler.containsOnly(List.of(1), 1, 2, 3).isMatch());
        CollectionVerdict verdict = reconciler.containsOnly(List.of(1, 2, 3), 1, 2);
        CollectionVerdict.UnexpectedElements unexpected = assertInstanceOf(CollectionVerdict.UnexpectedElements.class, verdict);
        assertEquals(List.of(3), unexpected.unexpected());
    }

    @Test
    void testContainsOnlyReportsEveryUnexpectedOccurrence() {
        CollectionVerdict verdict = reconciler.containsOnly(List.of(4, 1, 4, 5), 1);
        assertEquals(List.of(4, 4, 5), ((CollectionVerdict.UnexpectedElements) verdict).unexpected());
    }

    @Test
    void testSingleCollectionArgumentIsUnwrapped() {
        List<Integer> expected = List.of(2, 2);
        assertTrue(reconciler.containsAtLeast(List.of(1, 2, 2), (Object) expected).isMatch());
        assertTrue(reconciler.containsExactly(List.of(1, 2), (Object) List.of(1, 2)).isMatch());
        assertTrue(reconciler.containsOnly(List.of(1, 2), (Object) new LinkedHashSet<>(List.of(2, 1))).isMatch());
        assertTrue(reconciler.containsExactly(List.of(1, 2), (Object) new int[]{1, 2}).isMatch());
    }

    @Test
    void testSingleStringArgumentIsOneElement() {
        assertTrue(reconciler.containsAtLeast(List.of("ab", "c"), "ab").isMatch());
        assertFalse(reconciler.containsAtLeast(List.of("a", "b"), "ab").isMatch());
        assertTrue(reconciler.containsExactly(List.of("ab"), "ab").isMatch());
        CollectionVerdict verdict = reconciler.containsOnly(List.of("a", "b"), "ab");
        assertEquals(List.of("a", "b"), ((CollectionVerdict.UnexpectedElements) verdict).unexpected());
    }

    @Test
    void testCollectionOfCollections() {
        List<List<Integer>> actual = List.of(List.of(1), List.of(2));
        assertTrue(reconciler.containsAtLeast(actual, List.of(1), List.of(2)).isMatch());
        assertFalse(reconciler.containsAtLeast(actual, (Object) List.of(1)).isMatch());
    }

}
