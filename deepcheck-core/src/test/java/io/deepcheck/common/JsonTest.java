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
package io.deepcheck.common;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonTest {

    static class Thing {
        @Override
        public String toString() {
            return "thing";
        }
    }

    @Test
    void testStringify() {
        assertEquals("'foo'", Json.stringify("foo"));
        assertEquals("42", Json.stringify(42));
        assertEquals("null", Json.stringify(null));
        assertEquals("[1,2]", Json.stringify(List.of(1, 2)));
        assertEquals("[\"a\",\"b\"]", Json.stringify(List.of("a", "b")));
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("k", List.of(1, 2));
        map.put("b", true);
        assertEquals("{\"k\":[1,2],\"b\":true}", Json.stringify(map));
    }

    @Test
    void testNotJsonLikeFallsBackToString() {
        List<Object> list = new ArrayList<>();
        list.add(new Thing());
        assertEquals("[thing]", Json.stringify(list));
        assertEquals("thing", Json.stringify(new Thing()));
        assertEquals("{1=a}", Json.stringify(Map.of(1, "a")));
    }

    @Test
    void testIsJsonLike() {
        assertTrue(Json.isJsonLike(null));
        assertTrue(Json.isJsonLike(Arrays.asList(1, null, "x", false)));
        assertTrue(Json.isJsonLike(Map.of("a", Map.of("b", List.of(1.5)))));
        assertFalse(Json.isJsonLike(new int[]{1}));
        assertFalse(Json.isJsonLike(Map.of(1, "a")));
        assertFalse(Json.isJsonLike(List.of(List.of(new Thing()))));
    }

    @Test
    void testTruncate() {
        assertEquals("", StringUtils.truncate(null, 3, true));
        assertEquals("abc", StringUtils.truncate("abc", 3, true));
        assertEquals("ab ...", StringUtils.truncate("abc", 2, true));
        assertEquals("ab", StringUtils.truncate("abc", 2, false));
        assertEquals("   ", StringUtils.repeat(' ', 3));
    }

}
