package com.rbdesugar.ast;

public record OptionalArg(
    SourceLocation loc,
    Reference expr,
    Expression defaultValue
) implements Reference {

    @Override
    public String type() {
        return "OptionalArg";
    }
}
