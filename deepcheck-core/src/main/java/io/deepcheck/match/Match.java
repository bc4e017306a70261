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

import java.util.function.Consumer;

public class Match {

    /**
     * Each negated type names its positive counterpart and the reason reported when
     * the positive verdict holds.
     */
    public enum Type {

        EQUALS,
        NOT_EQUALS(EQUALS, "is equal"),
        FIELDS_EQUAL,
        FIELDS_NOT_EQUAL(FIELDS_EQUAL, "all fields have the same values"),
        CONTAINS(true),
        NOT_CONTAINS(CONTAINS, "actual contains expected"),
        CONTAINS_EXACTLY(true),
        NOT_CONTAINS_EXACTLY(CONTAINS_EXACTLY, "actual contains exactly expected"),
        CONTAINS_ONLY(true),
        NOT_CONTAINS_ONLY(CONTAINS_ONLY, "actual contains only expected"),
        NULL,
        NOT_NULL(NULL, "is null"),
        SAME_REFERENCE,
        DISTINCT_FROM(SAME_REFERENCE, "is the same instance"),
        INSTANCE_OF,
        NOT_INSTANCE_OF(INSTANCE_OF, "is an instance of the type"),
        INHERITS_FROM,
        SIZE(true),
        EMPTY(true),
        NOT_EMPTY(EMPTY, "is empty");

        final boolean negated;
        final boolean collection;
        final String negatedReason;
        private final Type positive;

        Type() {
            this(false);
        }

        Type(boolean collection) {
            this.negated = false;
            this.collection = collection;
            this.negatedReason = null;
            this.positive = null;
        }

        Type(Type positive, String negatedReason) {
            this.negated = true;
            this.collection = positive.collection;
            this.negatedReason = negatedReason;
            this.positive = positive;
        }

        public boolean isNegated() {
            return negated;
        }

        public Type positive() {
            return positive == null ? this : positive;
        }

    }

    /**
     * Checks on the actual value throw an {@link AssertionError} when they fail.
     */
    public static Value that(Object actual) {
        return new Value(actual, result -> {
            if (!result.pass) {
                throw new AssertionError(result.message);
            }
        });
    }

    /**
     * Checks on the actual value hand every result to the consumer and return it.
     */
    public static Value evaluate(Object actual, Consumer<Result> onResult) {
        return new Value(actual, onResult);
    }

    public static Result execute(Type matchType, Object actual, Object expected) {
        Operation op = new Operation(matchType, actual, expected);
        op.execute();
        return op.getResult();
    }

}
