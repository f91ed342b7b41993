package com.rbdesugar.ast;

public record Next(
    SourceLocation loc,
    Expression expr   // EmptyTree when no value is given
) implements Expression {

    @Override
    public String type() {
        return "Next";
    }
}
