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

import java.io.IOException;
import java.io.UncheckedIOException;

/** An {@link IIndentStream} backed by an {@link Appendable}.
 * Text written after a newline is prefixed with the current indentation,
 * which grows by a fixed step on {@link #increase()}. */
public class IndentStream implements IIndentStream {
    private Appendable out;
    /** Nesting depth. */
    private int depth = 0;
    /** Spaces per nesting level. */
    private int step = 4;
    /** Indentation to emit before the next character. */
    private boolean pendingIndent = false;

    public IndentStream(Appendable out) {
        this.out = out;
    }

    /** Redirect the output.
     * @return The previous destination. */
    public Appendable setOutputStream(Appendable out) {
        Appendable previous = this.out;
        this.out = out;
        return previous;
    }

    /** Set the number of spaces per nesting level.
     * A step of 0 also suppresses newlines, producing single-line output. */
    public IIndentStream setIndentAmount(int step) {
        Utilities.enforce(step >= 0, "Negative indent step " + step);
        this.step = step;
        return this;
    }

    private void write(CharSequence text) {
        try {
            this.out.append(text);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    private void flushIndent() {
        if (!this.pendingIndent)
            return;
        this.pendingIndent = false;
        int width = this.depth * this.step;
        if (width > 0)
            this.write(" ".repeat(width));
    }

    @Override
    public IIndentStream appendChar(char c) {
        if (c == '\n') {
            if (this.step > 0) {
                this.write("\n");
                this.pendingIndent = true;
            }
            return this;
        }
        if (!Character.isSpaceChar(c))
            this.flushIndent();
        this.write(String.valueOf(c));
        return this;
    }

    @Override
    public IIndentStream appendFast(String text) {
        if (text.isEmpty())
            return this;
        this.flushIndent();
        this.write(text);
        return this;
    }

    @Override
    public IIndentStream increase() {
        this.depth++;
        return this.newline();
    }

    @Override
    public IIndentStream decrease() {
        Utilities.enforce(this.depth > 0, "Unbalanced indentation");
        this.depth--;
        return this;
    }

    @Override
    public String toString() {
        return this.out.toString();
    }
}
