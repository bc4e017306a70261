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

import net.minidev.json.JSONStyle;
import net.minidev.json.JSONValue;

import java.util.List;
import java.util.Map;

/**
 * Renders compared values for failure messages. Lists and maps made only of
 * JSON-friendly values become JSON, anything else falls back to toString().
 */
public class Json {

    private static final JSONStyle JSON_STYLE = new JSONStyle(JSONStyle.FLAG_PROTECT_4WEB);

    private Json() {
        // only static methods
    }

    public static String stringify(Object o) {
        if ((o instanceof Map || o instanceof List) && isJsonLike(o)) {
            return JSONValue.toJSONString(o, JSON_STYLE);
        }
        if (o instanceof String) {
            return "'" + o + "'";
        }
        return String.valueOf(o);
    }

    public static boolean isJsonLike(Object o) {
        if (o == null || o instanceof String || o instanceof Number || o instanceof Boolean) {
            return true;
        }
        if (o instanceof List<?> list) {
            for (Object item : list) {
                if (!isJsonLike(item)) {
                    return false;
                }
            }
            return true;
        }
        if (o instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String) || !isJsonLike(entry.getValue())) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }

}
