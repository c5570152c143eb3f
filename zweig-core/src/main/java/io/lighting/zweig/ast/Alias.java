package io.lighting.zweig.ast;

import java.util.Objects;

public record Alias(String name, String asname) implements Node {
    public Alias {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ALIAS;
    }
}
