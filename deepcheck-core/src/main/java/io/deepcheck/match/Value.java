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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * The actual value of a check. Every check method computes a {@link Result},
 * hands it to the result consumer and returns it.
 */
public class Value {

    private static final Logger logger = LoggerFactory.getLogger(Value.class);

    private final Object value;
    private final Consumer<Result> onResult;
    private final String pathPrefix;

    Value(Object value, Consumer<Result> onResult) {
        this(value, onResult, "");
    }

    private Value(Object value, Consumer<Result> onResult, String pathPrefix) {
        this.value = value;
        this.onResult = onResult;
        this.pathPrefix = pathPrefix;
    }

    @SuppressWarnings("unchecked")
    public <T> T getValue() {
        return (T) value;
    }

    /**
     * The same actual value, reported at the given path (e.g. "order.customer").
     */
    public Value at(String pathPrefix) {
        return new Value(value, onResult, pathPrefix);
    }

    public Result is(Match.Type matchType, Object expected) {
        Operation op = new Operation(matchType, value, expected, pathPrefix);
        op.execute();
        Result result = op.getResult();
        if (!result.pass) {
            logger.debug("{}", result.message);
        }
        if (onResult != null) {
            onResult.accept(result);
        }
        return result;
    }

    @Override
    public String toString() {
        return "[value: " + value + "]";
    }

    //======================================================================
    //
    public Result isEqualTo(Object expected) {
        return is(Match.Type.EQUALS, expected);
    }

    public Result isNotEqualTo(Object expected) {
        return is(Match.Type.NOT_EQUALS, expected);
    }

    public Result hasFieldsWithSameValues(Object expected) {
        return is(Match.Type.FIELDS_EQUAL, expected);
    }

    public Result hasNotFieldsWithSameValues(Object expected) {
        return is(Match.Type.FIELDS_NOT_EQUAL, expected);
    }

    public Result contains(Object... expected) {
        return is(Match.Type.CONTAINS, ExpectedValues.of(expected));
    }

    public Result notContains(Object... expected) {
        return is(Match.Type.NOT_CONTAINS, ExpectedValues.of(expected));
    }

    public Result containsExactly(Object... expected) {
        return is(Match.Type.CONTAINS_EXACTLY, ExpectedValues.of(expected));
    }

    public Result notContainsExactly(Object... expected) {
        return is(Match.Type.NOT_CONTAINS_EXACTLY, ExpectedValues.of(expected));
    }

    public Result containsOnly(Object... expected) {
        return is(Match.Type.CONTAINS_ONLY, ExpectedValues.of(expected));
    }

    public Result notContainsOnly(Object... expected) {
        return is(Match.Type.NOT_CONTAINS_ONLY, ExpectedValues.of(expected));
    }

    public Result isNull() {
        return is(Match.Type.NULL, null);
    }

    public Result isNotNull() {
        return is(Match.Type.NOT_NULL, null);
    }

    public Result isSameReferenceAs(Object expected) {
        return is(Match.Type.SAME_REFERENCE, expected);
    }

    public Result isDistinctFrom(Object expected) {
        return is(Match.Type.DISTINCT_FROM, expected);
    }

    public Result isInstanceOf(Class<?> type) {
        return is(Match.Type.INSTANCE_OF, type);
    }

    public Result isNotInstanceOf(Class<?> type) {
        return is(Match.Type.NOT_INSTANCE_OF, type);
    }

    public Result inheritsFrom(Class<?> type) {
        return is(Match.Type.INHERITS_FROM, type);
    }

    public Result hasSize(long size) {
        return is(Match.Type.SIZE, size);
    }

    public Result isEmpty() {
        return is(Match.Type.EMPTY, null);
    }

    public Result isNotEmpty() {
        return is(Match.Type.NOT_EMPTY, null);
    }

}
