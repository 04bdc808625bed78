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

package org.qdag.qirCompiler.compiler.errors;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/** Problems found while reading, optimizing and writing one circuit.
 * Any error sets the exit code to 1; warnings leave it unchanged. */
public class CompilerMessages {
    /** One reported problem. */
    public static class Message {
        public final boolean warning;
        /** Short category, e.g. the {@link BaseCompilerException#getErrorKind()} of an exception. */
        public final String errorType;
        public final String message;

        Message(boolean warning, String errorType, String message) {
            this.warning = warning;
            this.errorType = errorType;
            this.message = message;
        }

        /** {@code error: <type>: <message>} or {@code warning: ...}, without a line terminator. */
        public String format() {
            return (this.warning ? "warning" : "error") + ": " + this.errorType + ": " + this.message;
        }

        public ObjectNode toJson(ObjectMapper mapper) {
            ObjectNode result = mapper.createObjectNode();
            result.put("warning", this.warning);
            result.put("error_type", this.errorType);
            result.put("message", this.message);
            return result;
        }

        @Override
        public String toString() {
            return this.format();
        }
    }

    private final List<Message> messages = new ArrayList<>();
    public int exitCode = 0;

    public void reportProblem(boolean warning, String errorType, String message) {
        this.messages.add(new Message(warning, errorType, message));
        if (!warning)
            this.exitCode = 1;
    }

    public void reportError(BaseCompilerException ex) {
        this.reportProblem(false, ex.getErrorKind(), ex.getMessage());
    }

    public Message getMessage(int index) {
        return this.messages.get(index);
    }

    private int count(boolean warnings) {
        int result = 0;
        for (Message message: this.messages)
            if (message.warning == warnings)
                result++;
        return result;
    }

    public int errorCount() {
        return this.count(false);
    }

    public int warningCount() {
        return this.count(true);
    }

    /** Print the messages one per line; with {@code quiet} only errors are printed. */
    public void show(PrintStream stream, boolean quiet) {
        for (Message message: this.messages)
            if (!quiet || !message.warning)
                stream.println(message.format());
    }

    public JsonNode toJson(ObjectMapper mapper) {
        ArrayNode result = mapper.createArrayNode();
        for (Message message: this.messages)
            result.add(message.toJson(mapper));
        return result;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (Message message: this.messages)
            builder.append(message.format()).append(System.lineSeparator());
        return builder.toString();
    }
}
