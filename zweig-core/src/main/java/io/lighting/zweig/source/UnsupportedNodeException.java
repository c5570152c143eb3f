package io.lighting.zweig.source;

import io.lighting.zweig.ast.NodeKind;
import java.util.Objects;

/**
 * Thrown when rendering reaches a node kind that has no rendering rule. Any output written so
 * far is incomplete and must be discarded.
 */
public class UnsupportedNodeException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final NodeKind kind;

    public UnsupportedNodeException(NodeKind kind) {
        super("No rendering rule for node kind: " + Objects.requireNonNull(kind, "kind").displayName());
        this.kind = kind;
    }

    public NodeKind kind() {
        return kind;
    }
}
