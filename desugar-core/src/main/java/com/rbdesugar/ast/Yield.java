package com.rbdesugar.ast;

import java.util.List;

public record Yield(
    SourceLocation loc,
    List<Expression> args
) implements Expression {

    public Yield {
        args = List.copyOf(args);
    }

    @Override
    public String type() {
        return "Yield";
    }
}
