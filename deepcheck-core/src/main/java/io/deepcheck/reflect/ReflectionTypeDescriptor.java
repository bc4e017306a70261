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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link TypeDescriptor} over java.lang.reflect fields. Every field is readable
 * whatever its modifier, except where the module system refuses access.
 */
public class ReflectionTypeDescriptor implements TypeDescriptor {

    private static final Logger logger = LoggerFactory.getLogger(ReflectionTypeDescriptor.class);

    private final SyntheticNameRecognizer recognizer;

    public ReflectionTypeDescriptor() {
        this(SyntheticNameRecognizer.DEFAULT);
    }

    public ReflectionTypeDescriptor(SyntheticNameRecognizer recognizer) {
        this.recognizer = recognizer;
    }

    public SyntheticNameRecognizer getRecognizer() {
        return recognizer;
    }

    @Override
    public List<Member> listMembers(Class<?> type) {
        Field[] fields = type.getDeclaredFields();
        List<Member> members = new ArrayList<>(fields.length);
        for (Field field : fields) {
            if (!Modifier.isStatic(field.getModifiers())) {
                members.add(toMember(type, field));
            }
        }
        return members;
    }

    @Override
    public Member findMember(Class<?> type, String rawName) {
        try {
            Field field = type.getDeclaredField(rawName);
            if (Modifier.isStatic(field.getModifiers())) {
                return null;
            }
            return toMember(type, field);
        } catch (NoSuchFieldException e) {
            return null;
        }
    }

    @Override
    public Class<?> superType(Class<?> type) {
        return type.getSuperclass();
    }

    @Override
    public Object getValue(Object instance, Member member) {
        Field field = member.field();
        if (!field.trySetAccessible()) {
            logger.warn("cannot open {} for reading", member);
            throw new IllegalStateException("member not accessible: " + member + " of " + member.owningType().getName());
        }
        try {
            return field.get(instance);
        } catch (IllegalAccessException | IllegalArgumentException e) {
            throw new IllegalStateException("cannot read member: " + member + " of " + member.owningType().getName(), e);
        }
    }

    private Member toMember(Class<?> type, Field field) {
        return new Member(recognizer.normalize(field.getName()), type, field);
    }

}
