package com.rbdesugar.ast;

public record If(
    SourceLocation loc,
    Expression cond,
    Expression thenp,
    Expression elsep
) implements Expression {

    @Override
    public String type() {
        return "If";
    }
}
