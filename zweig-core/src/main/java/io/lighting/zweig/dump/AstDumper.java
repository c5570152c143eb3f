package io.lighting.zweig.dump;

import io.lighting.zweig.ast.ExprContext;
import io.lighting.zweig.ast.Node;
import io.lighting.zweig.ast.NodeFields;
import io.lighting.zweig.ast.Operator;
import io.lighting.zweig.ast.Position;
import io.lighting.zweig.source.Literals;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Constructor-style debug rendering of a tree, e.g. {@code Name(id='spam', ctx=Load())}.
 * <p>
 * Non-empty lists put one element per line, indented one level deeper than the list owner and
 * followed by a comma; the closing bracket stays on that deeper indentation.
 */
public final class AstDumper {
    private static final String INDENT = "    ";

    private AstDumper() {
    }

    public static String dump(Object node) {
        return dump(node, DumpOptions.DEFAULT);
    }

    /**
     * @throws IllegalArgumentException if {@code node} is not a tree node
     */
    public static String dump(Object node, DumpOptions options) {
        Objects.requireNonNull(options, "options");
        if (!(node instanceof Node root)) {
            String type = node == null ? "NoneType" : node.getClass().getSimpleName();
            throw new IllegalArgumentException("expected AST, got '" + type + "'");
        }
        return format(root, 0, options);
    }

    private static String format(Object value, int level, DumpOptions options) {
        if (value instanceof Node node) {
            return formatNode(node, level, options);
        }
        if (value instanceof List<?> items) {
            return formatList(items, level, options);
        }
        return scalar(value);
    }

    private static String formatNode(Node node, int level, DumpOptions options) {
        List<String> fields = new ArrayList<>();
        for (NodeFields.NodeField field : NodeFields.of(node)) {
            fields.add(entry(field.name(), format(field.value(), level, options), options));
        }
        if (options.includePositions()) {
            Position position = NodeFields.positionOf(node);
            if (position != null) {
                fields.add(entry("lineno", Integer.toString(position.line()), options));
                fields.add(entry("col_offset", Integer.toString(position.column()), options));
            }
        }
        return node.kind().displayName() + "(" + String.join(", ", fields) + ")";
    }

    private static String entry(String name, String formatted, DumpOptions options) {
        return options.annotateFields() ? name + "=" + formatted : formatted;
    }

    private static String formatList(List<?> items, int level, DumpOptions options) {
        if (items.isEmpty()) {
            return "[]";
        }
        String indentation = INDENT.repeat(level + 1);
        List<String> lines = new ArrayList<>(items.size() + 2);
        lines.add("[");
        for (Object item : items) {
            lines.add(indentation + format(item, level + 1, options) + ",");
        }
        lines.add(indentation + "]");
        return String.join("\n", lines);
    }

    private static String scalar(Object value) {
        if (value == null) {
            return "None";
        }
        if (value instanceof Operator operator) {
            return operator.displayName() + "()";
        }
        if (value instanceof ExprContext ctx) {
            return ctx.displayName() + "()";
        }
        if (value instanceof Boolean bool) {
            return Literals.nameConstant(bool);
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d)) {
                return "nan";
            }
            if (Double.isInfinite(d)) {
                return d > 0 ? "inf" : "-inf";
            }
        }
        if (value instanceof Number number) {
            return Literals.number(number);
        }
        if (value instanceof String text) {
            return Literals.string(text);
        }
        if (value instanceof byte[] bytes) {
            return Literals.bytes(bytes);
        }
        throw new IllegalStateException("Unexpected field value type: " + value.getClass().getName());
    }
}
