package com.rbdesugar.ast;

import com.rbdesugar.names.Name;

public record Local(
    SourceLocation loc,
    Name name
) implements Reference {

    @Override
    public String type() {
        return "Local";
    }
}
