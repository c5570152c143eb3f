package io.lighting.zweig.source;

import io.lighting.zweig.ast.Node;
import java.util.Objects;

/**
 * Renders a tree back into canonical Python source.
 * <p>
 * Statements end with a newline; function and class definitions are followed by one blank line
 * unless they close their block. Parentheses appear only where the precedence tiers (see
 * {@link Precedence}) or token boundaries require them. Instances are immutable and can be shared
 * across threads; each call renders into its own {@link SourceWriter}.
 */
public final class Unparser {
    public static final String DEFAULT_INDENT = "    ";

    private static final Unparser DEFAULT = new Unparser(DEFAULT_INDENT);

    private final String indent;

    public Unparser(String indent) {
        Objects.requireNonNull(indent, "indent");
        if (indent.isEmpty() || !indent.isBlank()) {
            throw new IllegalArgumentException("indent must be non-empty whitespace: '" + indent + "'");
        }
        this.indent = indent;
    }

    public static String toSource(Node node) {
        return DEFAULT.render(node);
    }

    /**
     * @throws UnsupportedNodeException if the tree contains a kind without a rendering rule
     */
    public String render(Node node) {
        Objects.requireNonNull(node, "node");
        SourceWriter writer = new SourceWriter(indent);
        new UnparseVisitor(writer).visit(node);
        return writer.output();
    }

    public String indent() {
        return indent;
    }
}
