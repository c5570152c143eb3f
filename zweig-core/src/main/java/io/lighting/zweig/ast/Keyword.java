package io.lighting.zweig.ast;

import java.util.Objects;

public record Keyword(String arg, Expr value) implements Node {
    public Keyword {
        Objects.requireNonNull(arg, "arg");
        Objects.requireNonNull(value, "value");
        if (arg.isBlank()) {
            throw new IllegalArgumentException("arg must not be blank");
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.KEYWORD;
    }
}
