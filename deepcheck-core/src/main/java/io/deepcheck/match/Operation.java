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

import io.deepcheck.common.Json;
import io.deepcheck.common.StringUtils;

import java.util.List;

/**
 * Runs one check: computes the verdict of the positive form of the match type and
 * interprets it. Negation is applied here and nowhere else.
 */
public class Operation {

    static final int MAX_VALUE_LENGTH = 500;

    final Match.Type type;
    final Object actual;
    final Object expected;
    final String pathPrefix;

    private final FieldComparator comparator;
    private final CollectionReconciler reconciler;

    Verdict verdict;
    boolean pass = true;
    private String failReason;

    Operation(Match.Type type, Object actual, Object expected) {
        this(type, actual, expected, "", new FieldComparator(), new CollectionReconciler());
    }

    Operation(Match.Type type, Object actual, Object expected, String pathPrefix) {
        this(type, actual, expected, pathPrefix, new FieldComparator(), new CollectionReconciler());
    }

    Operation(Match.Type type, Object actual, Object expected, String pathPrefix,
              FieldComparator comparator, CollectionReconciler reconciler) {
        this.type = type;
        this.actual = actual;
        this.expected = expected;
        this.pathPrefix = pathPrefix == null ? "" : pathPrefix;
        this.comparator = comparator;
        this.reconciler = reconciler;
    }

    boolean execute() {
        Match.Type positive = type.positive();
        if (positive.collection && ExpectedValues.toList(actual) == null) {
            return fail("actual is not a collection");
        }
        verdict = evaluate(positive);
        if (verdict instanceof FieldVerdict.CycleDetected) {
            // inconclusive, fails either polarity
            return fail(verdict.reason());
        }
        if (verdict.isMatch() != type.negated) {
            return pass();
        }
        return fail(type.negated ? type.negatedReason : verdict.reason());
    }

    private Verdict evaluate(Match.Type positive) {
        switch (positive) {
            case EQUALS:
                return Checks.isEqualTo(actual, expected);
            case FIELDS_EQUAL:
                return comparator.compare(expected, actual, pathPrefix);
            case CONTAINS:
                return reconciler.containsAtLeast(ExpectedValues.toList(actual), expectedValues());
            case CONTAINS_EXACTLY:
                return reconciler.containsExactly(ExpectedValues.toList(actual), expectedValues());
            case CONTAINS_ONLY:
                return reconciler.containsOnly(ExpectedValues.toList(actual), expectedValues());
            case NULL:
                return Checks.isNull(actual);
            case SAME_REFERENCE:
                return Checks.isSameReference(actual, expected);
            case INSTANCE_OF:
                return Checks.isInstanceOf(actual, expectedAs(Class.class));
            case INHERITS_FROM:
                return Checks.inheritsFrom(actual, expectedAs(Class.class));
            case SIZE:
                return Checks.hasSize(actual, expectedAs(Number.class).longValue());
            case EMPTY:
                return Checks.isEmpty(actual);
            default:
                throw new RuntimeException("unexpected match type: " + type);
        }
    }

    /**
     * The expected elements of a collection check: a collection or array is taken
     * as is, any other value is a single expected element, null means none given.
     */
    private List<Object> expectedValues() {
        return expected == null ? null : ExpectedValues.of(expected);
    }

    private <T> T expectedAs(Class<T> required) {
        if (!required.isInstance(expected)) {
            String found = expected == null ? "null" : expected.getClass().getName();
            throw new IllegalArgumentException(type + ": expected value must be a " + required.getSimpleName() + ", found " + found);
        }
        return required.cast(expected);
    }

    boolean pass() {
        pass = true;
        return true;
    }

    boolean fail(String reason) {
        pass = false;
        failReason = reason;
        return false;
    }

    /**
     * Returns a Result with both string message and structured failures.
     */
    Result getResult() {
        if (pass) {
            return verdict == null ? Result.PASS : Result.pass(verdict);
        }
        if (verdict == null) {
            Result.Failure failure = new Result.Failure(pathPrefix, failReason, actual, expected);
            return Result.fail(describe(failure, null), List.of(failure), null);
        }
        String path = verdict.isMatch() ? pathPrefix : verdict.path();
        Object actualValue = verdict.isMatch() ? actual : verdict.actual();
        Object expectedValue = verdict.isMatch() ? expected : verdict.expected();
        Result.Failure failure = new Result.Failure(path, failReason, actualValue, expectedValue);
        return Result.fail(describe(failure, verdict.isMatch() ? null : detail(verdict)), List.of(failure), verdict);
    }

    private String describe(Result.Failure failure, String detail) {
        String prefix = StringUtils.repeat(' ', 2);
        StringBuilder sb = new StringBuilder();
        sb.append("match failed: ").append(type).append('\n');
        sb.append(prefix).append(failure.path().isEmpty() ? "<root>" : failure.path())
                .append(" | ").append(failure.reason()).append('\n');
        if (detail != null) {
            sb.append(prefix).append(detail).append('\n');
        }
        sb.append(prefix).append(render(failure.actualValue())).append('\n');
        sb.append(prefix).append(render(failure.expectedValue())).append('\n');
        return sb.toString();
    }

    private static String detail(Verdict verdict) {
        if (verdict instanceof CollectionVerdict.MissingElements missing) {
            return "missing: " + render(missing.missing());
        }
        if (verdict instanceof CollectionVerdict.UnexpectedElements unexpected) {
            return "unexpected: " + render(unexpected.unexpected());
        }
        if (verdict instanceof CollectionVerdict.OrderMismatch order && !order.isExpectedAbsent()) {
            return "at index " + order.index() + ": " + render(order.actualElement()) + " instead of " + render(order.expectedElement());
        }
        return null;
    }

    private static String render(Object value) {
        return StringUtils.truncate(Json.stringify(value), MAX_VALUE_LENGTH, true);
    }

}
