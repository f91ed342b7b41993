package com.rbdesugar.ast;

/**
 * Placeholder for an absent expression. Carries the location of the construct it stands in for.
 */
public record EmptyTree(SourceLocation loc) implements Expression {

    @Override
    public String type() {
        return "EmptyTree";
    }
}
