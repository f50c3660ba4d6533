package de.burger.typehook.tree;

/**
 * Raised when a node violates the shape the instrumenter relies on (for example a declaration
 * without a name). Trees come from an already validated parse, so this always signals a bug
 * upstream and is never recovered from.
 */
public class MalformedNodeException extends IllegalStateException {

    private final transient Node node;

    public MalformedNodeException(String message, Node node) {
        super(message + " (at " + describe(node) + ")");
        this.node = node;
    }

    public Node node() {
        return node;
    }

    private static String describe(Node node) {
        if (node == null) {
            return "<null node>";
        }
        SourcePosition pos = node.position();
        return node.getClass().getSimpleName() + " line " + pos.line() + ", column " + pos.column();
    }
}
