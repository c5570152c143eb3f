package io.lighting.zweig;

import io.lighting.zweig.ast.Node;
import io.lighting.zweig.ast.TreeWalker;
import io.lighting.zweig.dump.AstDumper;
import io.lighting.zweig.dump.DumpOptions;
import io.lighting.zweig.observe.RenderObserver;
import io.lighting.zweig.observe.RenderOperation;
import io.lighting.zweig.source.Unparser;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

public final class Zweig {
    private final Unparser unparser;
    private final List<RenderObserver> observers;

    private Zweig(Unparser unparser, List<RenderObserver> observers) {
        this.unparser = unparser;
        this.observers = observers;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String toSource(Node node) {
        Objects.requireNonNull(node, "node");
        return renderWithObservers(RenderOperation.UNPARSE, node, () -> unparser.render(node));
    }

    public String dump(Object node) {
        return dump(node, DumpOptions.DEFAULT);
    }

    public String dump(Object node, DumpOptions options) {
        Objects.requireNonNull(options, "options");
        return renderWithObservers(RenderOperation.DUMP, node, () -> AstDumper.dump(node, options));
    }

    public Iterable<Node> walk(Node node) {
        return TreeWalker.preorder(node);
    }

    public Unparser unparser() {
        return unparser;
    }

    public List<RenderObserver> observers() {
        return observers;
    }

    private String renderWithObservers(RenderOperation operation, Object source, Supplier<String> renderAction) {
        notifyBeforeRender(operation, source);
        long start = System.nanoTime();
        try {
            String output = renderAction.get();
            notifyAfterRender(operation, source, output, start);
            return output;
        } catch (RuntimeException ex) {
            notifyRenderError(operation, source, ex, start);
            throw ex;
        }
    }

    private void notifyBeforeRender(RenderOperation operation, Object source) {
        for (RenderObserver observer : observers) {
            observer.beforeRender(operation, source);
        }
    }

    private void notifyAfterRender(RenderOperation operation, Object source, String output, long start) {
        long elapsed = System.nanoTime() - start;
        for (RenderObserver observer : observers) {
            observer.afterRender(operation, source, output, elapsed);
        }
    }

    private void notifyRenderError(RenderOperation operation, Object source, Exception error, long start) {
        long elapsed = System.nanoTime() - start;
        for (RenderObserver observer : observers) {
            observer.onRenderError(operation, source, error, elapsed);
        }
    }

    public static final class Builder {
        private String indent = Unparser.DEFAULT_INDENT;
        private final List<RenderObserver> observers = new ArrayList<>();

        private Builder() {
        }

        // 缩进单位：必须为非空的空白字符串（空格或制表符），默认四个空格。
        public Builder indent(String indent) {
            this.indent = Objects.requireNonNull(indent, "indent");
            return this;
        }

        public Builder observer(RenderObserver observer) {
            observers.add(Objects.requireNonNull(observer, "observer"));
            return this;
        }

        public Builder observers(List<? extends RenderObserver> observers) {
            Objects.requireNonNull(observers, "observers");
            this.observers.clear();
            for (RenderObserver observer : observers) {
                observer(observer);
            }
            return this;
        }

        public Zweig build() {
            return new Zweig(new Unparser(indent), List.copyOf(observers));
        }
    }
}
