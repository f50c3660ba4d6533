package de.burger.typehook.tree;

import java.util.List;
import java.util.Objects;

public record Try(
    List<Stmt> body,
    List<ExceptHandler> handlers,
    List<Stmt> orElse,
    List<Stmt> finalBody,
    SourcePosition position
) implements Stmt {

    public Try {
        body = List.copyOf(Objects.requireNonNull(body, "body"));
        handlers = List.copyOf(Objects.requireNonNull(handlers, "handlers"));
        orElse = List.copyOf(Objects.requireNonNull(orElse, "orElse"));
        finalBody = List.copyOf(Objects.requireNonNull(finalBody, "finalBody"));
        Objects.requireNonNull(position, "position");
    }

    public Try withBodies(List<Stmt> newBody, List<ExceptHandler> newHandlers, List<Stmt> newOrElse, List<Stmt> newFinalBody) {
        return new Try(newBody, newHandlers, newOrElse, newFinalBody, position);
    }
}
