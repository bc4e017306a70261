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

import io.deepcheck.reflect.Member;
import io.deepcheck.reflect.MemberResolver;
import io.deepcheck.reflect.TypeDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Method;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Compares two object graphs member by member and stops at the first difference.
 * <p>
 * Every instance field of the actual value (its own class first, then each
 * ancestor) is paired with the same field of the expected value when both share
 * the declaring class, and is otherwise resolved by name on the expected value's
 * type. Members whose
 * declared type has value equality are compared with {@code equals}, anything
 * else is compared by recursing into its fields. The comparator has no notion of
 * negation: callers interpret the verdict.
 */
public class FieldComparator {

    private static final Logger logger = LoggerFactory.getLogger(FieldComparator.class);

    /**
     * Detect instance pairs revisited on the current recursion path and report them
     * as {@link FieldVerdict.CycleDetected}. Can be switched off with the system
     * property "deepcheck.match.cycleGuard", in which case a self-referencing
     * graph overflows the stack.
     */
    public static final boolean CYCLE_GUARD = Boolean.parseBoolean(
            System.getProperty("deepcheck.match.cycleGuard", "true"));

    private final MemberResolver resolver;
    private final TypeDescriptor descriptor;
    private final boolean cycleGuard;

    public FieldComparator() {
        this(new MemberResolver(), CYCLE_GUARD);
    }

    public FieldComparator(MemberResolver resolver, boolean cycleGuard) {
        this.resolver = resolver;
        this.descriptor = resolver.getDescriptor();
        this.cycleGuard = cycleGuard;
    }

    public FieldVerdict compare(Object expected, Object actual) {
        return compare(expected, actual, "");
    }

    /**
     * @param pathPrefix path of the compared values within an enclosing graph, prepended to reported paths
     */
    public FieldVerdict compare(Object expected, Object actual, String pathPrefix) {
        PathGuard guard = cycleGuard ? new PathGuard() : null;
        return compare(expected, actual, Context.of(pathPrefix), guard);
    }

    private FieldVerdict compare(Object expected, Object actual, Context context, PathGuard guard) {
        if (expected == null || actual == null) {
            if (expected == actual) {
                return FieldVerdict.MATCH;
            }
            return new FieldVerdict.ValueMismatch(context.path, actual, expected, expected == null ? "expected null" : "actual is null");
        }
        if (isOpaque(actual.getClass()) || isOpaque(expected.getClass())) {
            // fields cannot (or need not) be walked, fall back to equals
            return equalValues(expected, actual, context);
        }
        if (guard != null && !guard.enter(expected, actual)) {
            logger.debug("cycle detected at {}", context);
            return new FieldVerdict.CycleDetected(context.path, actual, expected);
        }
        try {
            for (Class<?> type = actual.getClass(); type != null; type = descriptor.superType(type)) {
                for (Member member : descriptor.listMembers(type)) {
                    FieldVerdict verdict = compareMember(member, expected, actual, context, guard);
                    if (!verdict.isMatch()) {
                        return verdict;
                    }
                }
            }
            return FieldVerdict.MATCH;
        } finally {
            if (guard != null) {
                guard.exit();
            }
        }
    }

    private FieldVerdict compareMember(Member member, Object expected, Object actual, Context context, PathGuard guard) {
        Context child = context.descend(member.semanticName());
        Member counterpart = counterpart(member, expected);
        if (counterpart == null) {
            logger.debug("no counterpart for {} on {}", member, expected.getClass().getName());
            return new FieldVerdict.MissingMember(child.path, member.label(child.path), actual, expected);
        }
        Object actualValue = descriptor.getValue(actual, member);
        Object expectedValue = descriptor.getValue(expected, counterpart);
        if (logger.isTraceEnabled()) {
            logger.trace("{} (depth {}) : {} vs {}", child, child.depth, actualValue, expectedValue);
        }
        if (expectedValue == null) {
            if (actualValue == null) {
                return FieldVerdict.MATCH;
            }
            return new FieldVerdict.ValueMismatch(child.path, actualValue, null, "expected null");
        }
        if (hasValueEquality(counterpart.declaredType(), expectedValue)) {
            return equalValues(expectedValue, actualValue, child);
        }
        return compare(expectedValue, actualValue, child, guard);
    }

    /**
     * The same declared field when the expected value shares the member's owning
     * type, so that a base-class field hidden by a subclass field is paired with
     * itself. Otherwise the name is resolved from the expected value's own type.
     */
    private Member counterpart(Member member, Object expected) {
        if (member.owningType().isInstance(expected)) {
            Member same = descriptor.findMember(member.owningType(), member.rawName());
            if (same != null) {
                return same;
            }
        }
        return resolver.resolve(expected.getClass(), member.rawName());
    }

    private static FieldVerdict equalValues(Object expected, Object actual, Context context) {
        if (Objects.deepEquals(expected, actual)) {
            return FieldVerdict.MATCH;
        }
        logger.debug("not equal at {}", context);
        return new FieldVerdict.ValueMismatch(context.path, actual, expected, "not equal");
    }

    static boolean hasValueEquality(Class<?> declaredType, Object value) {
        if (declaredType.isPrimitive() || declaredType.isArray()) {
            return true;
        }
        if (overridesEquals(declaredType)) {
            return true;
        }
        // an interface says nothing about equality unless it redeclares equals()
        return declaredType.isInterface() && overridesEquals(value.getClass());
    }

    static boolean overridesEquals(Class<?> type) {
        try {
            Method method = type.getMethod("equals", Object.class);
            return method.getDeclaringClass() != Object.class;
        } catch (NoSuchMethodException e) {
            // interfaces do not expose the methods of Object
            return false;
        }
    }

    /**
     * Arrays, primitives and classes of named modules that are not open to this
     * library. Their fields are never walked.
     */
    static boolean isOpaque(Class<?> type) {
        if (type.isArray() || type.isPrimitive()) {
            return true;
        }
        Module module = type.getModule();
        return module.isNamed() && !module.isOpen(type.getPackageName(), FieldComparator.class.getModule());
    }

    /**
     * Expected / actual instance pairs on the current recursion path, by identity.
     */
    static class PathGuard {

        private final Deque<Object[]> pairs = new ArrayDeque<>();

        boolean enter(Object expected, Object actual) {
            for (Object[] pair : pairs) {
                if (pair[0] == expected && pair[1] == actual) {
                    return false;
                }
            }
            pairs.push(new Object[]{expected, actual});
            return true;
        }

        void exit() {
            pairs.pop();
        }

    }

}
