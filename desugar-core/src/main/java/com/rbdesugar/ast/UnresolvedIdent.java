package com.rbdesugar.ast;

import com.rbdesugar.names.Name;

public record UnresolvedIdent(
    SourceLocation loc,
    Kind kind,
    Name name
) implements Reference {

    @Override
    public String type() {
        return "UnresolvedIdent";
    }

    public enum Kind {
        LOCAL,
        INSTANCE,
        CLASS,
        GLOBAL
    }
}
