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

/**
 * Verdicts of the field-by-field comparison. Only the first difference is reported.
 */
public interface FieldVerdict extends Verdict {

    FieldVerdict MATCH = new FieldVerdict() {

        @Override
        public boolean isMatch() {
            return true;
        }

        @Override
        public String path() {
            return "";
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
            return "[match]";
        }

    };

    record ValueMismatch(String path, Object actual, Object expected, String reason) implements FieldVerdict {

        @Override
        public boolean isMatch() {
            return false;
        }

    }

    /**
     * A member of the actual value has no counterpart on the expected side.
     * {@code actual} and {@code expected} are the two objects owning the members.
     */
    record MissingMember(String path, String memberLabel, Object actual, Object expected) implements FieldVerdict {

        @Override
        public boolean isMatch() {
            return false;
        }

        @Override
        public String reason() {
            return memberLabel + " is absent from the expected value";
        }

    }

    /**
     * The same expected / actual pair was reached again on one recursion path. Not a
     * match, but not a difference either: {@link Operation} fails the check whether
     * or not it is negated.
     */
    record CycleDetected(String path, Object actual, Object expected) implements FieldVerdict {

        @Override
        public boolean isMatch() {
            return false;
        }

        @Override
        public String reason() {
            return "cyclic structure detected";
        }

    }

}
