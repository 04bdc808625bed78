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

import org.qdag.qirCompiler.compiler.errors.CompilationError;

import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Process-wide debug log.
 * Every class that writes to the log has a level, 0 unless set with
 * {@link #setLoggingLevel}.  A message of level {@code n} written by a class
 * is emitted only when the class level is at least {@code n}.  Levels set on
 * a class also apply to its subclasses. */
public class Logger {
    /** Packages searched, in order, when a level is set by simple class name. */
    static final List<String> INSTRUMENTED_PACKAGES = List.of(
            "org.qdag.qirCompiler",
            "org.qdag.qirCompiler.circuit",
            "org.qdag.qirCompiler.compiler",
            "org.qdag.qirCompiler.compiler.frontend",
            "org.qdag.qirCompiler.compiler.backend",
            "org.qdag.qirCompiler.compiler.optimizer",
            "org.qdag.qirCompiler.compiler.optimizer.rules");

    public static final Logger INSTANCE = new Logger();

    private final Map<Class<?>, Integer> levels = new HashMap<>();
    private final IndentStream sink = new IndentStream(System.err);
    private final IIndentStream discard = new NullIndentStream();

    private Logger() {}

    /** The stream for a message of the given level written by {@code clazz}:
     * the debug stream if the message is enabled, a discarding stream otherwise. */
    public IIndentStream belowLevel(Class<?> clazz, int level) {
        return this.getLoggingLevel(clazz) >= level ? this.sink : this.discard;
    }

    public IIndentStream belowLevel(IWritesLogs writer, int level) {
        return this.belowLevel(writer.getClass(), level);
    }

    /** @return The level previously set on exactly this class, or 0. */
    public int setLoggingLevel(Class<?> clazz, int level) {
        Integer previous = this.levels.put(clazz, level);
        return previous == null ? 0 : previous;
    }

    /** Set the level of a class given by its simple name.
     * @throws CompilationError if no instrumented package contains the class. */
    @SuppressWarnings("UnusedReturnValue")
    public int setLoggingLevel(String className, int level) {
        Class<?> clazz = locateClass(className);
        if (clazz == null)
            throw new CompilationError("Class " + Utilities.singleQuote(className) +
                    " not found for setting up logging");
        return this.setLoggingLevel(clazz, level);
    }

    @Nullable
    static Class<?> locateClass(String className) {
        for (String pack: INSTRUMENTED_PACKAGES) {
            try {
                return Class.forName(pack + "." + className);
            } catch (ClassNotFoundException ignored) {
                // not in this package
            }
        }
        return null;
    }

    public int getLoggingLevel(Class<?> clazz) {
        Integer exact = this.levels.get(clazz);
        if (exact != null)
            return exact;
        for (Map.Entry<Class<?>, Integer> entry: this.levels.entrySet())
            if (entry.getKey().isAssignableFrom(clazz))
                return entry.getValue();
        return 0;
    }

    /** Forget all levels set so far. */
    public void reset() {
        this.levels.clear();
    }

    /** Redirect the log; the current indentation is kept.
     * @return The previous destination. */
    public Appendable setDebugStream(Appendable destination) {
        return this.sink.setOutputStream(destination);
    }
}
