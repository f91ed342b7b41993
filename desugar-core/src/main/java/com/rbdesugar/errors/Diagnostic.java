package com.rbdesugar.errors;

import com.rbdesugar.ast.SourceLocation;

/**
 * One reported problem: where it happened, what kind it is, and the message header.
 */
public record Diagnostic(SourceLocation loc, ErrorClass what, String header) {

    @Override
    public String toString() {
        return loc + ": " + header + " [" + what.code() + "]";
    }
}
