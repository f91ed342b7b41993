package com.rbdesugar.ast;

public record Splat(
    SourceLocation loc,
    Expression arg
) implements Expression {

    @Override
    public String type() {
        return "Splat";
    }
}
