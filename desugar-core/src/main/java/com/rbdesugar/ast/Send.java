package com.rbdesugar.ast;

import com.rbdesugar.names.Name;

import java.util.List;

public record Send(
    SourceLocation loc,
    Expression recv,
    Name fun,
    List<Expression> args,
    boolean privateOk,   // Set only for calls written without a receiver
    Block block          // Can be null
) implements Expression {

    public Send {
        args = List.copyOf(args);
    }

    public Send(SourceLocation loc, Expression recv, Name fun, List<Expression> args) {
        this(loc, recv, fun, args, false, null);
    }

    /**
     * Returns this call with {@code block} attached, replacing any block it already carries.
     */
    public Send withBlock(Block block) {
        return new Send(loc, recv, fun, args, privateOk, block);
    }

    @Override
    public String type() {
        return "Send";
    }
}
