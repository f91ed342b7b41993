package com.rbdesugar.errors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A sink that keeps every diagnostic in arrival order. One instance per compilation unit.
 */
public final class CollectingDiagnosticSink implements DiagnosticSink {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    @Override
    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public List<Diagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public long count(ErrorClass what) {
        return diagnostics.stream().filter(d -> d.what() == what).count();
    }

    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }
}
