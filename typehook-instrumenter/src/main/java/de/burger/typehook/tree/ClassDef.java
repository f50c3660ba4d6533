package de.burger.typehook.tree;

import java.util.List;
import java.util.Objects;

/** {@code class name(bases, keywords): body}, optionally decorated. */
public record ClassDef(
    String name,
    List<Expr> bases,
    List<Keyword> keywords,
    List<Stmt> body,
    List<Expr> decorators,
    SourcePosition position
) implements Stmt {

    public ClassDef {
        Objects.requireNonNull(name, "name");
        bases = List.copyOf(Objects.requireNonNull(bases, "bases"));
        keywords = List.copyOf(Objects.requireNonNull(keywords, "keywords"));
        body = List.copyOf(Objects.requireNonNull(body, "body"));
        decorators = List.copyOf(Objects.requireNonNull(decorators, "decorators"));
        Objects.requireNonNull(position, "position");
    }

    public ClassDef withBody(List<Stmt> newBody) {
        return new ClassDef(name, bases, keywords, newBody, decorators, position);
    }

    public ClassDef withDecorators(List<Expr> newDecorators) {
        return new ClassDef(name, bases, keywords, body, newDecorators, position);
    }
}
