package io.lighting.zweig.ast;

import java.util.List;
import java.util.Objects;

/**
 * What goes between the brackets of a subscript.
 */
public sealed interface SliceNode extends Node permits SliceNode.Slice, SliceNode.ExtSlice, SliceNode.Index {

    /**
     * {@code lower:upper:step}, every bound optional.
     */
    record Slice(Expr lower, Expr upper, Expr step) implements SliceNode {
        @Override
        public NodeKind kind() {
            return NodeKind.SLICE;
        }
    }

    /**
     * Several dimensions separated by commas, at least one of them a {@link Slice}.
     */
    record ExtSlice(List<SliceNode> dims) implements SliceNode {
        public ExtSlice {
            Objects.requireNonNull(dims, "dims");
            if (dims.isEmpty()) {
                throw new IllegalArgumentException("dims must not be empty");
            }
            dims = List.copyOf(dims);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.EXT_SLICE;
        }
    }

    record Index(Expr value) implements SliceNode {
        public Index {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.INDEX;
        }
    }
}
