package io.lighting.zweig.ast;

import java.util.List;
import java.util.Objects;

public record ExceptHandler(Expr type, String name, List<Stmt> body, Position position) implements Node, Located {
    public ExceptHandler {
        Objects.requireNonNull(body, "body");
        if (type == null && name != null) {
            throw new IllegalArgumentException("name requires an exception type");
        }
        body = List.copyOf(body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.EXCEPT_HANDLER;
    }
}
