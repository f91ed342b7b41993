package com.rbdesugar.desugar;

import com.rbdesugar.ast.SourceLocation;
import com.rbdesugar.errors.Diagnostic;
import com.rbdesugar.errors.DiagnosticSink;
import com.rbdesugar.errors.ErrorClass;
import com.rbdesugar.errors.LoweringException;

/**
 * Reports a fatal lowering error once per invocation, however many frames it unwinds through.
 */
final class FatalErrorReporter {

    private boolean reported;

    void reportOnce(DiagnosticSink sink, SourceLocation loc, LoweringException e) {
        if (reported) {
            return;
        }
        reported = true;
        sink.report(new Diagnostic(loc, ErrorClass.INTERNAL_ERROR, "Failed to process tree: " + e.getMessage()));
    }

    void reset() {
        reported = false;
    }
}
