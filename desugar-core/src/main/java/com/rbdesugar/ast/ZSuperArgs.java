package com.rbdesugar.ast;

/**
 * Stands for "the arguments of the enclosing method" in a bare {@code super} call.
 */
public record ZSuperArgs(SourceLocation loc) implements Expression {

    @Override
    public String type() {
        return "ZSuperArgs";
    }
}
