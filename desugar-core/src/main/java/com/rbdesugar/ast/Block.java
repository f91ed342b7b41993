package com.rbdesugar.ast;

import java.util.List;

public record Block(
    SourceLocation loc,
    List<Expression> args,
    Expression body
) implements Expression {

    public Block {
        args = List.copyOf(args);
    }

    @Override
    public String type() {
        return "Block";
    }
}
