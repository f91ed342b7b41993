package com.rbdesugar.ast;

/**
 * Constants referenced by synthesized code. {@link #TODO} marks a class whose symbol is
 * assigned later by name resolution.
 */
public enum CoreSymbol {
    ROOT("<root>"),
    TODO("<todo sym>"),
    MAGIC("Magic"),
    RANGE("Range"),
    KERNEL("Kernel"),
    REGEXP("Regexp");

    private final String show;

    CoreSymbol(String show) {
        this.show = show;
    }

    public String show() {
        return show;
    }
}
