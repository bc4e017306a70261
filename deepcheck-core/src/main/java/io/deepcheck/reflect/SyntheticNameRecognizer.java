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

/**
 * Maps a compiler-generated member name back to the name declared in source.
 * Implementations must be pure: the same raw name always gives the same result.
 */
public interface SyntheticNameRecognizer {

    MemberName normalize(String rawName);

    /**
     * Treats every name as ordinary.
     */
    SyntheticNameRecognizer NONE = MemberName::ordinary;

    /**
     * Kotlin delegated-property backing fields ({@code name$delegate}) and
     * javac captured locals of anonymous / local classes ({@code val$name}).
     */
    SyntheticNameRecognizer JVM = new PatternNameRecognizer("^(.+)\\$delegate$", "^val\\$(.+)$");

    /**
     * Selected with the system property "deepcheck.names.recognizer", default "jvm".
     */
    SyntheticNameRecognizer DEFAULT = of(System.getProperty("deepcheck.names.recognizer", "jvm"));

    static SyntheticNameRecognizer of(String name) {
        return switch (name.trim().toLowerCase()) {
            case "jvm" -> JVM;
            case "none" -> NONE;
            default -> throw new IllegalArgumentException("unknown synthetic name recognizer: " + name);
        };
    }

}
