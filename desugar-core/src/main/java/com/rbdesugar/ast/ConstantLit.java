package com.rbdesugar.ast;

/**
 * A reference to a constant the lowering pass knows statically.
 */
public record ConstantLit(
    SourceLocation loc,
    CoreSymbol symbol
) implements Expression {

    @Override
    public String type() {
        return "ConstantLit";
    }
}
