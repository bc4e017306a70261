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
 * Position of the comparison within the object graph: the path of semantic member
 * names from the root ("address.city") and the recursion depth.
 */
public class Context {

    static final Context ROOT = new Context(0, "");

    final int depth;
    final String path;

    Context(int depth, String path) {
        this.depth = depth;
        this.path = path;
    }

    static Context of(String pathPrefix) {
        if (pathPrefix == null || pathPrefix.isEmpty()) {
            return ROOT;
        }
        return new Context(0, pathPrefix);
    }

    Context descend(String name) {
        return new Context(depth + 1, path.isEmpty() ? name : path + '.' + name);
    }

    @Override
    public String toString() {
        return path.isEmpty() ? "<root>" : path;
    }

}
