package io.lighting.zweig.source;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Text sink that tracks the indentation depth and whether the next write starts a line.
 * <p>
 * The indentation prefix is written lazily by the first {@link #write(String)} of a line, so a
 * blank line never carries trailing indentation. One writer belongs to one render call.
 */
public final class SourceWriter {
    private final StringBuilder output = new StringBuilder();
    private final String indentUnit;
    private int indentationLevel;
    private boolean atLineStart = true;

    public SourceWriter(String indentUnit) {
        this.indentUnit = Objects.requireNonNull(indentUnit, "indentUnit");
    }

    public void write(String text) {
        Objects.requireNonNull(text, "text");
        if (text.isEmpty()) {
            return;
        }
        if (atLineStart) {
            atLineStart = false;
            output.append(indentUnit.repeat(indentationLevel));
        }
        output.append(text);
    }

    public void writeNewline() {
        output.append('\n');
        atLineStart = true;
    }

    public void writeLine(String text) {
        write(text);
        writeNewline();
    }

    /**
     * Increments the depth until the returned guard is closed. Meant for try-with-resources so
     * the depth is restored on every exit path.
     */
    public Indentation indented() {
        indentationLevel++;
        return new Indentation();
    }

    public <T> void commaJoin(List<? extends T> items, Consumer<? super T> render) {
        Objects.requireNonNull(items, "items");
        Objects.requireNonNull(render, "render");
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) {
                write(", ");
            }
            render.accept(items.get(i));
        }
    }

    public int indentationLevel() {
        return indentationLevel;
    }

    public boolean atLineStart() {
        return atLineStart;
    }

    public String output() {
        return output.toString();
    }

    @Override
    public String toString() {
        return output();
    }

    public final class Indentation implements AutoCloseable {
        private boolean closed;

        private Indentation() {
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            indentationLevel--;
        }
    }
}
