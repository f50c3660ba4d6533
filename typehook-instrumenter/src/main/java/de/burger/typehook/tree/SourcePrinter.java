package de.burger.typehook.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a tree back to source text. Used for the debug dump of instrumented modules and by
 * tests; the output is canonical (four-space indents, single-quoted strings), not a faithful
 * reproduction of the original formatting.
 */
public final class SourcePrinter {
    private static final String INDENT = "    ";

    private final StringBuilder out = new StringBuilder();

    private SourcePrinter() {
    }

    public static String print(SourceModule module) {
        SourcePrinter printer = new SourcePrinter();
        printer.statements(module.body(), 0);
        return printer.out.toString();
    }

    public static String print(Stmt stmt) {
        SourcePrinter printer = new SourcePrinter();
        printer.statement(stmt, 0);
        return printer.out.toString();
    }

    public static String expression(Expr expr) {
        if (expr instanceof Name name) {
            return name.id();
        }
        if (expr instanceof Constant constant) {
            return literal(constant.value());
        }
        if (expr instanceof Attribute attribute) {
            return expression(attribute.value()) + "." + attribute.attr();
        }
        if (expr instanceof Call call) {
            var parts = new ArrayList<String>();
            call.args().forEach(a -> parts.add(expression(a)));
            call.keywords().forEach(k -> parts.add(k.name() + "=" + expression(k.value())));
            return expression(call.func()) + "(" + String.join(", ", parts) + ")";
        }
        if (expr instanceof Subscript subscript) {
            String slice = subscript.slice() instanceof Tuple tuple && !tuple.elements().isEmpty()
                ? joined(tuple.elements())
                : expression(subscript.slice());
            return expression(subscript.value()) + "[" + slice + "]";
        }
        if (expr instanceof Tuple tuple) {
            if (tuple.elements().size() == 1) {
                return "(" + expression(tuple.elements().get(0)) + ",)";
            }
            return "(" + joined(tuple.elements()) + ")";
        }
        if (expr instanceof BinOp binOp) {
            String right = binOp.right() instanceof BinOp || binOp.right() instanceof Lambda
                ? "(" + expression(binOp.right()) + ")"
                : expression(binOp.right());
            return expression(binOp.left()) + " " + binOp.operator() + " " + right;
        }
        if (expr instanceof Lambda lambda) {
            String params = parameters(lambda.args(), false);
            return (params.isEmpty() ? "lambda" : "lambda " + params) + ": " + expression(lambda.body());
        }
        throw new MalformedNodeException("Unsupported expression kind", expr);
    }

    private void statements(List<Stmt> body, int depth) {
        if (body.isEmpty()) {
            line(depth, "pass");
            return;
        }
        for (Stmt stmt : body) {
            statement(stmt, depth);
        }
    }

    private void statement(Stmt stmt, int depth) {
        if (stmt instanceof ClassDef classDef) {
            classDef.decorators().forEach(d -> line(depth, "@" + expression(d)));
            var header = new ArrayList<String>();
            classDef.bases().forEach(b -> header.add(expression(b)));
            classDef.keywords().forEach(k -> header.add(k.name() + "=" + expression(k.value())));
            line(depth, "class " + classDef.name() + (header.isEmpty() ? "" : "(" + String.join(", ", header) + ")") + ":");
            statements(classDef.body(), depth + 1);
        } else if (stmt instanceof FunctionDef function) {
            function.decorators().forEach(d -> line(depth, "@" + expression(d)));
            String returns = function.returns() == null ? "" : " -> " + expression(function.returns());
            line(depth, (function.async() ? "async def " : "def ") + function.name()
                + "(" + parameters(function.args(), true) + ")" + returns + ":");
            statements(function.body(), depth + 1);
        } else if (stmt instanceof Import importStmt) {
            line(depth, "import " + aliases(importStmt.names()));
        } else if (stmt instanceof ImportFrom importFrom) {
            line(depth, "from " + ".".repeat(importFrom.level()) + importFrom.module() + " import " + aliases(importFrom.names()));
        } else if (stmt instanceof ExprStmt exprStmt) {
            line(depth, expression(exprStmt.value()));
        } else if (stmt instanceof Assign assign) {
            line(depth, assign.targets().stream().map(t -> expression(t) + " = ").collect(Collectors.joining())
                + expression(assign.value()));
        } else if (stmt instanceof AnnAssign annAssign) {
            String target = expression(annAssign.target());
            if (!annAssign.simple() && annAssign.target() instanceof Name) {
                target = "(" + target + ")";
            }
            String value = annAssign.value() == null ? "" : " = " + expression(annAssign.value());
            line(depth, target + ": " + expression(annAssign.annotation()) + value);
        } else if (stmt instanceof TypeAlias alias) {
            String params = alias.typeParams().isEmpty()
                ? ""
                : "[" + alias.typeParams().stream().map(Name::id).collect(Collectors.joining(", ")) + "]";
            line(depth, "type " + alias.name().id() + params + " = " + expression(alias.value()));
        } else if (stmt instanceof Return returnStmt) {
            line(depth, returnStmt.value() == null ? "return" : "return " + expression(returnStmt.value()));
        } else if (stmt instanceof Pass) {
            line(depth, "pass");
        } else if (stmt instanceof If ifStmt) {
            line(depth, "if " + expression(ifStmt.test()) + ":");
            statements(ifStmt.body(), depth + 1);
            elseBlock(ifStmt.orElse(), depth);
        } else if (stmt instanceof For forStmt) {
            line(depth, (forStmt.async() ? "async for " : "for ") + expression(forStmt.target())
                + " in " + expression(forStmt.iter()) + ":");
            statements(forStmt.body(), depth + 1);
            elseBlock(forStmt.orElse(), depth);
        } else if (stmt instanceof While whileStmt) {
            line(depth, "while " + expression(whileStmt.test()) + ":");
            statements(whileStmt.body(), depth + 1);
            elseBlock(whileStmt.orElse(), depth);
        } else if (stmt instanceof With with) {
            String items = with.items().stream()
                .map(i -> i.optionalVars() == null
                    ? expression(i.context())
                    : expression(i.context()) + " as " + expression(i.optionalVars()))
                .collect(Collectors.joining(", "));
            line(depth, (with.async() ? "async with " : "with ") + items + ":");
            statements(with.body(), depth + 1);
        } else if (stmt instanceof Try tryStmt) {
            line(depth, "try:");
            statements(tryStmt.body(), depth + 1);
            for (ExceptHandler handler : tryStmt.handlers()) {
                String clause = handler.type() == null ? "except" : "except " + expression(handler.type());
                if (handler.name() != null) {
                    clause += " as " + handler.name();
                }
                line(depth, clause + ":");
                statements(handler.body(), depth + 1);
            }
            elseBlock(tryStmt.orElse(), depth);
            if (!tryStmt.finalBody().isEmpty()) {
                line(depth, "finally:");
                statements(tryStmt.finalBody(), depth + 1);
            }
        } else {
            throw new MalformedNodeException("Unsupported statement kind", stmt);
        }
    }

    private void elseBlock(List<Stmt> orElse, int depth) {
        if (!orElse.isEmpty()) {
            line(depth, "else:");
            statements(orElse, depth + 1);
        }
    }

    private void line(int depth, String text) {
        out.append(INDENT.repeat(depth)).append(text).append('\n');
    }

    private static String parameters(Arguments arguments, boolean withAnnotations) {
        var parts = new ArrayList<String>();
        arguments.posOnly().forEach(a -> parts.add(parameter(a, withAnnotations)));
        if (!arguments.posOnly().isEmpty()) {
            parts.add("/");
        }
        arguments.args().forEach(a -> parts.add(parameter(a, withAnnotations)));
        if (arguments.varArg() != null) {
            parts.add("*" + parameter(arguments.varArg(), withAnnotations));
        } else if (!arguments.kwOnly().isEmpty()) {
            parts.add("*");
        }
        arguments.kwOnly().forEach(a -> parts.add(parameter(a, withAnnotations)));
        if (arguments.kwArg() != null) {
            parts.add("**" + parameter(arguments.kwArg(), withAnnotations));
        }
        return String.join(", ", parts);
    }

    private static String parameter(Arg arg, boolean withAnnotations) {
        boolean annotated = withAnnotations && arg.annotation() != null;
        String text = annotated ? arg.name() + ": " + expression(arg.annotation()) : arg.name();
        if (arg.defaultValue() != null) {
            text += (annotated ? " = " : "=") + expression(arg.defaultValue());
        }
        return text;
    }

    private static String aliases(List<Alias> names) {
        return names.stream()
            .map(a -> a.asName() == null ? a.name() : a.name() + " as " + a.asName())
            .collect(Collectors.joining(", "));
    }

    private static String joined(List<Expr> elements) {
        return elements.stream().map(SourcePrinter::expression).collect(Collectors.joining(", "));
    }

    private static String literal(Object value) {
        if (value == null) {
            return "None";
        }
        if (value instanceof Boolean bool) {
            return bool ? "True" : "False";
        }
        if (value instanceof String text) {
            StringBuilder sb = new StringBuilder(text.length() + 2).append('\'');
            for (int i = 0; i < text.length(); i++) {
                char c = text.charAt(i);
                switch (c) {
                    case '\\' -> sb.append("\\\\");
                    case '\'' -> sb.append("\\'");
                    case '\n' -> sb.append("\\n");
                    case '\t' -> sb.append("\\t");
                    case '\r' -> sb.append("\\r");
                    default -> sb.append(c);
                }
            }
            return sb.append('\'').toString();
        }
        return value.toString();
    }
}
