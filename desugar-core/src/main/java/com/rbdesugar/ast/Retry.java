package com.rbdesugar.ast;

public record Retry(SourceLocation loc) implements Expression {

    @Override
    public String type() {
        return "Retry";
    }
}
