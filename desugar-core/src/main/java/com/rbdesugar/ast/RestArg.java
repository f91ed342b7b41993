package com.rbdesugar.ast;

public record RestArg(
    SourceLocation loc,
    Reference expr
) implements Reference {

    @Override
    public String type() {
        return "RestArg";
    }
}
