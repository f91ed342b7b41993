package com.rbdesugar.ast;

import java.util.List;

public record ClassDef(
    SourceLocation loc,
    SourceLocation declLoc,
    CoreSymbol symbol,          // CoreSymbol.TODO until resolution, ROOT for the top-level wrapper
    Expression name,            // EmptyTree for the top-level wrapper
    List<Expression> ancestors,
    List<Expression> rhs,
    Kind kind
) implements Expression {

    public ClassDef {
        ancestors = List.copyOf(ancestors);
        rhs = List.copyOf(rhs);
    }

    @Override
    public String type() {
        return "ClassDef";
    }

    public enum Kind {
        CLASS,
        MODULE
    }
}
