package com.rbdesugar.ast;

public record While(
    SourceLocation loc,
    Expression cond,
    Expression body
) implements Expression {

    @Override
    public String type() {
        return "While";
    }
}
