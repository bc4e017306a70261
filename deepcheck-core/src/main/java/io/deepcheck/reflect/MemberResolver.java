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
 * Finds the member of a type (or of one of its ancestors) that corresponds to a
 * member name coming from another type. An exact raw-name hit wins; otherwise the
 * semantic names are compared, so that a plain field and a compiler-generated one
 * standing for the same property resolve to each other.
 */
public class MemberResolver {

    private final TypeDescriptor descriptor;
    private final SyntheticNameRecognizer recognizer;

    public MemberResolver(TypeDescriptor descriptor, SyntheticNameRecognizer recognizer) {
        this.descriptor = descriptor;
        this.recognizer = recognizer;
    }

    public MemberResolver(ReflectionTypeDescriptor descriptor) {
        this(descriptor, descriptor.getRecognizer());
    }

    public MemberResolver() {
        this(new ReflectionTypeDescriptor());
    }

    public TypeDescriptor getDescriptor() {
        return descriptor;
    }

    /**
     * @param name a raw or semantic member name
     * @return the matching member, or null once the hierarchy is exhausted
     */
    public Member resolve(Class<?> type, String name) {
        if (type == null) {
            return null;
        }
        Member member = descriptor.findMember(type, name);
        if (member != null) {
            return member;
        }
        String wanted = recognizer.normalize(name).semanticName();
        for (Member candidate : descriptor.listMembers(type)) {
            if (wanted.equals(candidate.semanticName())) {
                return candidate;
            }
        }
        return resolve(descriptor.superType(type), name);
    }

}
