package com.rbdesugar.ast;

import java.util.List;

/**
 * Statements evaluated in order for their effects, followed by the expression that gives the
 * sequence its value.
 */
public record InsSeq(
    SourceLocation loc,
    List<Expression> stats,
    Expression expr
) implements Expression {

    public InsSeq {
        stats = List.copyOf(stats);
    }

    @Override
    public String type() {
        return "InsSeq";
    }
}
