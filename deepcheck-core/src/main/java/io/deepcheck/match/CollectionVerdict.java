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

/**
 * Verdicts of the collection checks. {@code actual} is the checked sequence and
 * {@code expected} the normalized expected elements, both as lists.
 */
public interface CollectionVerdict extends Verdict {

    CollectionVerdict ALL_FOUND = new CollectionVerdict() {

        @Override
        public boolean isMatch() {
            return true;
        }

        @Override
        public String reason() {
            return null;
        }

        @Override
        public Object actual() {
            return null;
        }

        @Override
        public Object expected() {
            return null;
        }

        @Override
        public String toString() {
            return "[all found]";
        }

    };

    @Override
    default String path() {
        return "";
    }

    record MissingElements(List<Object> missing, List<Object> actual, List<Object> expected) implements CollectionVerdict {

        @Override
        public boolean isMatch() {
            return false;
        }

        @Override
        public String reason() {
            return "missing " + missing.size() + " expected element(s)";
        }

    }

    record UnexpectedElements(List<Object> unexpected, List<Object> actual, List<Object> expected) implements CollectionVerdict {

        @Override
        public boolean isMatch() {
            return false;
        }

        @Override
        public String reason() {
            return "found " + unexpected.size() + " unexpected element(s)";
        }

    }

    /**
     * First position where the two sequences disagree. An element past the end of a
     * sequence is null. {@code expectedItems} is null when no expected collection was
     * given at all.
     */
    record OrderMismatch(int index, Object actualElement, Object expectedElement,
                         List<Object> actualItems, List<Object> expectedItems) implements CollectionVerdict {

        @Override
        public boolean isMatch() {
            return false;
        }

        public boolean isExpectedAbsent() {
            return expectedItems == null;
        }

        @Override
        public String path() {
            return "[" + index + "]";
        }

        @Override
        public String reason() {
            if (isExpectedAbsent()) {
                return "expected no collection";
            }
            if (index >= actualItems.size()) {
                return "actual has fewer elements than expected";
            }
            if (index >= expectedItems.size()) {
                return "actual has more elements than expected";
            }
            return "elements differ at index " + index;
        }

        @Override
        public Object actual() {
            return actualItems;
        }

        @Override
        public Object expected() {
            return expectedItems;
        }

    }

}
