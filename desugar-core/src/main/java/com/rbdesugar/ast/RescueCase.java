package com.rbdesugar.ast;

import java.util.List;

public record RescueCase(
    SourceLocation loc,
    List<Expression> exceptions,   // Empty means the default exception class
    Local var,
    Expression body
) implements Expression {

    public RescueCase {
        exceptions = List.copyOf(exceptions);
    }

    @Override
    public String type() {
        return "RescueCase";
    }
}
