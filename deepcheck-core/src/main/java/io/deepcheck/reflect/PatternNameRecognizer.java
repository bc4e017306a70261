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
package io.deepcheck.reflect;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Two wrapper patterns tried in order, each with exactly one capturing group for the
 * source name. A pattern must match the whole raw name, a partial match is ordinary.
 */
public class PatternNameRecognizer implements SyntheticNameRecognizer {

    private final Pattern accessorPattern;
    private final Pattern capturePattern;

    public PatternNameRecognizer(String accessorRegex, String captureRegex) {
        this.accessorPattern = Pattern.compile(accessorRegex);
        this.capturePattern = Pattern.compile(captureRegex);
    }

    @Override
    public MemberName normalize(String rawName) {
        String name = unwrap(accessorPattern, rawName);
        if (name != null) {
            return new MemberName(rawName, name, MemberOrigin.SYNTHESIZED_ACCESSOR);
        }
        name = unwrap(capturePattern, rawName);
        if (name != null) {
            return new MemberName(rawName, name, MemberOrigin.SYNTHESIZED_CAPTURE);
        }
        return MemberName.ordinary(rawName);
    }

    private static String unwrap(Pattern pattern, String rawName) {
        Matcher matcher = pattern.matcher(rawName);
        if (!matcher.matches() || matcher.groupCount() < 1) {
            return null;
        }
        String inner = matcher.group(1);
        return inner == null || inner.isEmpty() ? null : inner;
    }

    @Override
    public String toString() {
        return "[accessor: " + accessorPattern + ", capture: " + capturePattern + "]";
    }

}
