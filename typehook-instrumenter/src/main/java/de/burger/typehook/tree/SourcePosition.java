package de.burger.typehook.tree;

/**
 * Line/column span of a node. Lines are 1-based, columns 0-based; {@link #UNKNOWN} marks nodes
 * whose position has not been assigned yet.
 */
public record SourcePosition(int line, int column, int endLine, int endColumn) {

    public static final SourcePosition UNKNOWN = new SourcePosition(0, 0, 0, 0);

    public SourcePosition {
        if (line < 0 || column < 0 || endLine < 0 || endColumn < 0) {
            throw new IllegalArgumentException(
                "Negative source position: " + line + ":" + column + "-" + endLine + ":" + endColumn);
        }
    }

    public static SourcePosition at(int line, int column) {
        return new SourcePosition(line, column, line, column);
    }

    public static SourcePosition line(int line) {
        return at(line, 0);
    }

    public boolean isKnown() {
        return line > 0;
    }
}
