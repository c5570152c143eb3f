package io.lighting.zweig.ast;

/**
 * Node that may know where it came from. The position is {@code null} for synthesized nodes.
 */
public interface Located {

    Position position();
}
