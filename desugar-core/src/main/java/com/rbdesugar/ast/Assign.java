package com.rbdesugar.ast;

public record Assign(
    SourceLocation loc,
    Expression lhs,
    Expression rhs
) implements Expression {

    @Override
    public String type() {
        return "Assign";
    }
}
