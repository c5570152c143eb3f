package io.lighting.zweig.ast;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy preorder enumeration: a node comes before its children, children in field order.
 */
public final class TreeWalker {
    private TreeWalker() {
    }

    public static Iterable<Node> preorder(Node root) {
        Objects.requireNonNull(root, "root");
        return () -> new PreorderIterator(root);
    }

    public static Stream<Node> stream(Node root) {
        Objects.requireNonNull(root, "root");
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(
                new PreorderIterator(root),
                Spliterator.ORDERED | Spliterator.NONNULL
            ),
            false
        );
    }

    private static final class PreorderIterator implements Iterator<Node> {
        private final Deque<Node> pending = new ArrayDeque<>();

        private PreorderIterator(Node root) {
            pending.push(root);
        }

        @Override
        public boolean hasNext() {
            return !pending.isEmpty();
        }

        @Override
        public Node next() {
            if (pending.isEmpty()) {
                throw new NoSuchElementException();
            }
            Node node = pending.pop();
            List<Node> children = NodeFields.children(node);
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
            return node;
        }
    }
}
