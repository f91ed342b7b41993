package com.rbdesugar.ast;

public record BlockArg(
    SourceLocation loc,
    Reference expr
) implements Reference {

    @Override
    public String type() {
        return "BlockArg";
    }
}
