package org.qdag.qirCompiler.compiler;

/** A part of the compiler that has access to the compiler object. */
public interface ICompilerComponent {
    QIRCompiler compiler();
}
