package com.rbdesugar.ast;

import com.rbdesugar.names.Name;

public record UnresolvedConstantLit(
    SourceLocation loc,
    Expression scope,   // EmptyTree when the constant is written without a scope
    Name cnst
) implements Expression {

    @Override
    public String type() {
        return "UnresolvedConstantLit";
    }
}
