package com.rbdesugar.ast;

import java.util.List;

public record ArrayLit(
    SourceLocation loc,
    List<Expression> elems
) implements Expression {

    public ArrayLit {
        elems = List.copyOf(elems);
    }

    @Override
    public String type() {
        return "ArrayLit";
    }
}
