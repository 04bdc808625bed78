package org.qdag.util;

import org.qdag.qirCompiler.compiler.IErrorReporter;

/** Configuration that can check itself before use. */
public interface IValidate {
    /** Report every problem found to {@code reporter}.
     * @return true if no errors were found. */
    boolean validate(IErrorReporter reporter);
}
