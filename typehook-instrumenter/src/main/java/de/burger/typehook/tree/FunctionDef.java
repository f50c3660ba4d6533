package de.burger.typehook.tree;

import java.util.List;
import java.util.Objects;

/**
 * {@code def name(args) -> returns: body} or its {@code async def} form.
 * {@code returns} is {@code null} when no return annotation is declared.
 */
public record FunctionDef(
    String name,
    Arguments args,
    Expr returns,
    List<Stmt> body,
    List<Expr> decorators,
    boolean async,
    SourcePosition position
) implements Stmt {

    public FunctionDef {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(args, "args");
        body = List.copyOf(Objects.requireNonNull(body, "body"));
        decorators = List.copyOf(Objects.requireNonNull(decorators, "decorators"));
        Objects.requireNonNull(position, "position");
    }

    public FunctionDef withBody(List<Stmt> newBody) {
        return new FunctionDef(name, args, returns, newBody, decorators, async, position);
    }

    public FunctionDef withDecorators(List<Expr> newDecorators) {
        return new FunctionDef(name, args, returns, body, newDecorators, async, position);
    }
}
