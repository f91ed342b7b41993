package com.rbdesugar.ast;

public record Return(
    SourceLocation loc,
    Expression expr   // EmptyTree when no value is given
) implements Expression {

    @Override
    public String type() {
        return "Return";
    }
}
