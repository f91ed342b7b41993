package com.rbdesugar.ast;

public record Self(SourceLocation loc) implements Expression {

    @Override
    public String type() {
        return "Self";
    }
}
