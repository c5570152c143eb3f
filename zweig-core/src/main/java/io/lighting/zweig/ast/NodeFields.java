package io.lighting.zweig.ast;

import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Ordered view over the semantic fields of a node, in declaration order and under their Python
 * names ({@code decoratorList} is reported as {@code decorator_list}).
 * <p>
 * The position is not a semantic field; read it through {@link #positionOf(Node)}.
 */
public final class NodeFields {
    private static final String POSITION_COMPONENT = "position";
    private static final ConcurrentMap<Class<?>, List<Accessor>> CACHE = new ConcurrentHashMap<>();

    private NodeFields() {
    }

    public static List<NodeField> of(Node node) {
        Objects.requireNonNull(node, "node");
        List<Accessor> accessors = CACHE.computeIfAbsent(node.getClass(), NodeFields::buildAccessors);
        List<NodeField> fields = new ArrayList<>(accessors.size());
        for (Accessor accessor : accessors) {
            fields.add(new NodeField(accessor.name(), accessor.read(node)));
        }
        return fields;
    }

    public static Position positionOf(Node node) {
        Objects.requireNonNull(node, "node");
        if (node instanceof Located located) {
            return located.position();
        }
        return null;
    }

    /**
     * Direct children: node-valued fields and the node elements of list fields, in field order.
     */
    public static List<Node> children(Node node) {
        List<Node> children = new ArrayList<>();
        for (NodeField field : of(node)) {
            Object value = field.value();
            if (value instanceof Node child) {
                children.add(child);
            } else if (value instanceof List<?> items) {
                for (Object item : items) {
                    if (item instanceof Node child) {
                        children.add(child);
                    }
                }
            }
        }
        return children;
    }

    static String pythonName(String componentName) {
        StringBuilder out = new StringBuilder(componentName.length() + 4);
        for (int i = 0; i < componentName.length(); i++) {
            char ch = componentName.charAt(i);
            if (Character.isUpperCase(ch)) {
                out.append('_').append(Character.toLowerCase(ch));
            } else {
                out.append(ch);
            }
        }
        return out.toString();
    }

    private static List<Accessor> buildAccessors(Class<?> type) {
        RecordComponent[] components = type.getRecordComponents();
        if (components == null) {
            throw new IllegalArgumentException("Node type is not a record: " + type.getName());
        }
        List<Accessor> accessors = new ArrayList<>(components.length);
        for (RecordComponent component : components) {
            if (POSITION_COMPONENT.equals(component.getName())) {
                continue;
            }
            accessors.add(new Accessor(pythonName(component.getName()), component));
        }
        return List.copyOf(accessors);
    }

    public record NodeField(String name, Object value) {
        public NodeField {
            Objects.requireNonNull(name, "name");
        }
    }

    private record Accessor(String name, RecordComponent component) {
        Object read(Node node) {
            try {
                return component.getAccessor().invoke(node);
            } catch (ReflectiveOperationException ex) {
                throw new IllegalStateException(
                    "Failed to read field " + name + " of " + node.kind().displayName(), ex
                );
            }
        }
    }
}
