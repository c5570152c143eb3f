package io.lighting.zweig.ast;

import java.util.Objects;

public record Arg(String arg, Expr annotation, Position position) implements Node, Located {
    public Arg {
        Objects.requireNonNull(arg, "arg");
        if (arg.isBlank()) {
            throw new IllegalArgumentException("arg must not be blank");
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ARG;
    }
}
