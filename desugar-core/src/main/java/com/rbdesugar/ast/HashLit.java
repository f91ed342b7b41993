package com.rbdesugar.ast;

import java.util.List;

public record HashLit(
    SourceLocation loc,
    List<Expression> keys,
    List<Expression> values
) implements Expression {

    public HashLit {
        keys = List.copyOf(keys);
        values = List.copyOf(values);
        if (keys.size() != values.size()) {
            throw new IllegalArgumentException("hash literal needs as many keys as values");
        }
    }

    @Override
    public String type() {
        return "HashLit";
    }
}
