/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.qdag.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.jetbrains.annotations.Contract;
import org.qdag.qirCompiler.compiler.errors.InternalCompilerError;

import javax.annotation.Nullable;
import java.util.Map;
import java.util.Objects;

public class Utilities {
    private Utilities() {}

    /** Frames of the calling thread, omitting this class and the JDK frames above it. */
    static String callerStack() {
        StringBuilder result = new StringBuilder();
        boolean skipping = true;
        for (StackTraceElement frame: Thread.currentThread().getStackTrace()) {
            boolean internal = frame.getClassName().equals(Utilities.class.getName()) ||
                    frame.getClassName().equals(Thread.class.getName());
            if (skipping && internal)
                continue;
            skipping = false;
            result.append("    at ").append(frame).append(System.lineSeparator());
        }
        return result.toString();
    }

    /** Check an internal invariant.  Unlike {@code assert} this is always on.
     * @throws InternalCompilerError when {@code condition} is false. */
    @Contract("false -> fail")
    public static void enforce(boolean condition) {
        enforce(condition, "Invariant violated");
    }

    /** Check an internal invariant, with a message describing the violation.
     * @throws InternalCompilerError when {@code condition} is false. */
    @Contract("false, _ -> fail")
    public static void enforce(boolean condition, String message) {
        if (!condition)
            throw new InternalCompilerError(message + System.lineSeparator() + callerStack());
    }

    /** A mapper producing byte-identical output for equal inputs: object keys are
     * sorted, and input objects with repeated keys are rejected. */
    public static ObjectMapper deterministicObjectMapper() {
        return JsonMapper.builder()
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .enable(DeserializationFeature.FAIL_ON_READING_DUP_TREE_KEY)
                .build();
    }

    /** Quote a name for an error message.  No escaping is done. */
    public static String singleQuote(@Nullable Object value) {
        return "'" + value + "'";
    }

    /** Insert a key that must not be present yet.
     * @return The inserted value. */
    @SuppressWarnings("UnusedReturnValue")
    public static <K, V> V putNew(Map<K, V> map, K key, V value) {
        V previous = map.putIfAbsent(Objects.requireNonNull(key), Objects.requireNonNull(value));
        if (previous != null)
            throw new InternalCompilerError("Duplicate key " + key + ": " + previous + " and " + value);
        return value;
    }

    /** Look up a key that must be present. */
    public static <K, V> V getExists(Map<K, V> map, K key) {
        V result = map.get(key);
        if (result == null)
            throw new InternalCompilerError("Missing key " + singleQuote(key));
        return result;
    }
}
