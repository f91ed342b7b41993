package com.rbdesugar.ast;

public record KeywordArg(
    SourceLocation loc,
    Reference expr
) implements Reference {

    @Override
    public String type() {
        return "KeywordArg";
    }
}
