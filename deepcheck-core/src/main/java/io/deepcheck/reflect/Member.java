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

import java.lang.reflect.Field;

/**
 * An instance field of a type, with its name already normalized.
 * Values are read through the {@link TypeDescriptor} that produced it.
 */
public record Member(MemberName name, Class<?> owningType, Field field) {

    public String rawName() {
        return name.rawName();
    }

    public String semanticName() {
        return name.semanticName();
    }

    public MemberOrigin origin() {
        return name.origin();
    }

    public Class<?> declaredType() {
        return field.getType();
    }

    /**
     * Human-readable description used in diagnostics, e.g. "field 'address.city'".
     *
     * @param path the comparison path of this member, semantic names joined by '.'
     */
    public String label(String path) {
        switch (origin()) {
            case SYNTHESIZED_ACCESSOR:
                return "delegated property '" + path + "' (field '" + rawName() + "')";
            case SYNTHESIZED_CAPTURE:
                return "captured variable '" + path + "' (field '" + rawName() + "')";
            default:
                return "field '" + path + "'";
        }
    }

    @Override
    public String toString() {
        return owningType.getSimpleName() + "." + rawName();
    }

}
