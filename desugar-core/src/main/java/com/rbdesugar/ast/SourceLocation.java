package com.rbdesugar.ast;

/**
 * A source span, 1-based lines and 0-based columns, as handed over by the parser.
 */
public record SourceLocation(Position start, Position end) {

    private static final SourceLocation NONE = new SourceLocation(new Position(0, 0), new Position(0, 0));

    public static SourceLocation none() {
        return NONE;
    }

    public static SourceLocation of(int startLine, int startCol, int endLine, int endCol) {
        return new SourceLocation(new Position(startLine, startCol), new Position(endLine, endCol));
    }

    /**
     * A location exists when both ends are present and point at a real line.
     */
    public boolean exists() {
        return start != null && end != null && start.line() > 0 && end.line() > 0;
    }

    public boolean singleLine() {
        return exists() && start.line() == end.line();
    }

    @Override
    public String toString() {
        if (start == null || end == null) {
            return "<no location>";
        }
        return start.line() + ":" + start.column() + "-" + end.line() + ":" + end.column();
    }

    public record Position(int line, int column) {}
}
