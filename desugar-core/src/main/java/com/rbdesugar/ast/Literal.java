package com.rbdesugar.ast;

import com.rbdesugar.names.Name;

/**
 * A literal value. {@code value} is a {@link Long} for integers, a {@link Double} for floats, a
 * {@link Name} for strings and symbols, and null for {@code true}, {@code false} and {@code nil}.
 */
public record Literal(
    SourceLocation loc,
    Kind kind,
    Object value
) implements Expression {

    @Override
    public String type() {
        return "Literal";
    }

    public enum Kind {
        INTEGER,
        FLOAT,
        STRING,
        SYMBOL,
        TRUE,
        FALSE,
        NIL
    }
}
