package com.rbdesugar.errors;

/**
 * Receives diagnostics. Rendering them is up to the implementation.
 */
@FunctionalInterface
public interface DiagnosticSink {

    void report(Diagnostic diagnostic);
}
