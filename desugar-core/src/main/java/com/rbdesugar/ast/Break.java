package com.rbdesugar.ast;

public record Break(
    SourceLocation loc,
    Expression expr   // EmptyTree when no value is given
) implements Expression {

    @Override
    public String type() {
        return "Break";
    }
}
