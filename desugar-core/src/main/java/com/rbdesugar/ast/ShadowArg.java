package com.rbdesugar.ast;

public record ShadowArg(
    SourceLocation loc,
    Reference expr
) implements Reference {

    @Override
    public String type() {
        return "ShadowArg";
    }
}
