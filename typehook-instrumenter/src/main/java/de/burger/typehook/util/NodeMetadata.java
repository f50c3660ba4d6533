package de.burger.typehook.util;

import de.burger.typehook.tree.Attribute;
import de.burger.typehook.tree.BinOp;
import de.burger.typehook.tree.Call;
import de.burger.typehook.tree.Constant;
import de.burger.typehook.tree.Expr;
import de.burger.typehook.tree.Keyword;
import de.burger.typehook.tree.Lambda;
import de.burger.typehook.tree.MalformedNodeException;
import de.burger.typehook.tree.Name;
import de.burger.typehook.tree.Node;
import de.burger.typehook.tree.SourcePosition;
import de.burger.typehook.tree.Stmt;
import de.burger.typehook.tree.Subscript;
import de.burger.typehook.tree.Tuple;
import java.util.List;
import java.util.Objects;

/**
 * Source position bookkeeping for synthetic nodes. Generated code is attributed to the
 * declaration or statement it was generated for, so tracebacks point at real source lines.
 */
public final class NodeMetadata {
    private NodeMetadata() {
    }

    /**
     * Rebuild {@code expr} and every sub-expression with {@code position}. Only used on freshly
     * synthesized expressions; parsed nodes keep their own positions.
     */
    public static Expr withPosition(Expr expr, SourcePosition position) {
        Objects.requireNonNull(position, "position");
        if (expr instanceof Name name) {
            return new Name(name.id(), position);
        }
        if (expr instanceof Constant constant) {
            return new Constant(constant.value(), position);
        }
        if (expr instanceof Attribute attribute) {
            return new Attribute(withPosition(attribute.value(), position), attribute.attr(), position);
        }
        if (expr instanceof Call call) {
            List<Expr> args = call.args().stream().map(a -> withPosition(a, position)).toList();
            List<Keyword> keywords = call.keywords().stream()
                .map(k -> new Keyword(k.name(), withPosition(k.value(), position)))
                .toList();
            return new Call(withPosition(call.func(), position), args, keywords, position);
        }
        if (expr instanceof Subscript subscript) {
            return new Subscript(withPosition(subscript.value(), position), withPosition(subscript.slice(), position), position);
        }
        if (expr instanceof Tuple tuple) {
            return new Tuple(tuple.elements().stream().map(e -> withPosition(e, position)).toList(), position);
        }
        if (expr instanceof BinOp binOp) {
            return new BinOp(withPosition(binOp.left(), position), binOp.operator(), withPosition(binOp.right(), position), position);
        }
        if (expr instanceof Lambda lambda) {
            return new Lambda(lambda.args(), withPosition(lambda.body(), position), position);
        }
        throw new MalformedNodeException("Unsupported expression kind", expr);
    }

    /**
     * Position for a statement inserted at {@code index}: that of the statement currently there,
     * else that of {@code fallback} (the enclosing node).
     */
    public static SourcePosition insertionPosition(List<Stmt> body, int index, Node fallback) {
        if (index >= 0 && index < body.size()) {
            return body.get(index).position();
        }
        return fallback.position();
    }
}
