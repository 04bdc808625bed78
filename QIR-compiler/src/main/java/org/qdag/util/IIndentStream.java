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

import java.util.Collection;

/** Sink for the hierarchical text produced by circuit printers and the {@link Logger}.
 * All methods return the stream, so calls can be chained. */
@SuppressWarnings("UnusedReturnValue")
public interface IIndentStream {
    IIndentStream appendChar(char c);

    /** Append a string that does not contain a newline. */
    IIndentStream appendFast(String text);

    /** Append text that may span several lines; each line is indented. */
    default IIndentStream append(String text) {
        int start = 0;
        int end;
        while ((end = text.indexOf('\n', start)) >= 0) {
            this.appendFast(text.substring(start, end));
            this.newline();
            start = end + 1;
        }
        return this.appendFast(text.substring(start));
    }

    default <T extends ToIndentableString> IIndentStream append(T value) {
        return value.toString(this);
    }

    default IIndentStream append(boolean value) {
        return this.appendFast(value ? "true" : "false");
    }

    default IIndentStream append(int value) {
        return this.appendFast(Integer.toString(value));
    }

    default IIndentStream append(long value) {
        return this.appendFast(Long.toString(value));
    }

    default IIndentStream joinS(String separator, Collection<String> data) {
        String prefix = "";
        for (String item: data) {
            this.append(prefix).append(item);
            prefix = separator;
        }
        return this;
    }

    default IIndentStream newline() {
        return this.appendChar('\n');
    }

    /** Open a nested level and start a new line. */
    IIndentStream increase();

    /** Close a nested level; does not emit a newline. */
    IIndentStream decrease();
}
