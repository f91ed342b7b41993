package com.rbdesugar.ast;

import com.rbdesugar.names.Name;

import java.util.List;

public record MethodDef(
    SourceLocation loc,
    SourceLocation declLoc,
    Name name,
    List<Expression> args,
    Expression rhs,
    boolean selfMethod   // def self.name
) implements Expression {

    public MethodDef {
        args = List.copyOf(args);
    }

    @Override
    public String type() {
        return "MethodDef";
    }
}
