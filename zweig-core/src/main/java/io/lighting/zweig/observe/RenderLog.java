package io.lighting.zweig.observe;

import io.lighting.zweig.ast.Node;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 渲染日志观察器。
 * <p>
 * 本类作为 {@link RenderObserver} 的实现，在语法树被还原为源码或被结构化输出时记录可读日志。
 * 主要场景：
 * <ul>
 *   <li>排查还原出的源码是否符合预期。</li>
 *   <li>观测单次渲染的耗时。</li>
 * </ul>
 * 通过 {@link Builder} 配置，构建后为不可变对象，线程安全。默认输出到 SLF4J。
 */
public final class RenderLog implements RenderObserver {
    private static final Logger LOGGER = LoggerFactory.getLogger(RenderLog.class);

    /**
     * 日志输出模式。
     */
    public enum Mode {
        /**
         * 仅输出根节点类型与输出行数，例如：Module -> 3 lines
         */
        SUMMARY,
        /**
         * 输出完整的渲染结果。
         */
        FULL
    }

    private final boolean enabled;
    private final boolean logOnRender;
    private final boolean logOnError;
    private final boolean includeElapsed;
    private final boolean includeOperation;
    private final Mode mode;
    private final String prefix;
    private final Consumer<String> sink;

    private RenderLog(Builder builder) {
        this.enabled = builder.enabled;
        this.logOnRender = builder.logOnRender;
        this.logOnError = builder.logOnError;
        this.includeElapsed = builder.includeElapsed;
        this.includeOperation = builder.includeOperation;
        this.mode = builder.mode;
        this.prefix = builder.prefix;
        this.sink = builder.sink;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 渲染完成后的回调。
     */
    @Override
    public void afterRender(RenderOperation operation, Object source, String output, long elapsedNanos) {
        if (!enabled || !logOnRender) {
            return;
        }
        String content = mode == Mode.FULL
            ? kindOf(source) + ":\n" + output
            : kindOf(source) + " -> " + lineCount(output) + " lines";
        sink.accept(head(operation) + content + elapsed(elapsedNanos));
    }

    /**
     * 渲染失败时的回调。异常本身由调用方继续抛出，这里只负责记录。
     */
    @Override
    public void onRenderError(RenderOperation operation, Object source, Exception error, long elapsedNanos) {
        if (!enabled || !logOnError) {
            return;
        }
        sink.accept(
            head(operation) + "failed on " + kindOf(source) + ": "
                + error.getClass().getSimpleName() + ": " + error.getMessage() + elapsed(elapsedNanos)
        );
    }

    private String head(RenderOperation operation) {
        if (!includeOperation) {
            return prefix + " ";
        }
        return prefix + " [" + operation.name() + "] ";
    }

    private String elapsed(long elapsedNanos) {
        return includeElapsed ? " (elapsed=" + elapsedNanos + "ns)" : "";
    }

    private static String kindOf(Object source) {
        if (source instanceof Node node) {
            return node.kind().displayName();
        }
        return source == null ? "null" : source.getClass().getSimpleName();
    }

    private static long lineCount(String output) {
        return output.lines().count();
    }

    public static final class Builder {
        private boolean enabled = true;
        private boolean logOnRender = true;
        private boolean logOnError = true;
        private boolean includeElapsed = false;
        private boolean includeOperation = true;
        private Mode mode = Mode.SUMMARY;
        private String prefix = "ZWEIG:";
        private Consumer<String> sink = LOGGER::info;

        /**
         * 全局开关：关闭后不输出任何日志。
         */
        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder logOnRender(boolean enabled) {
            this.logOnRender = enabled;
            return this;
        }

        public Builder logOnError(boolean enabled) {
            this.logOnError = enabled;
            return this;
        }

        /**
         * 是否输出耗时信息（纳秒）。
         */
        public Builder includeElapsed(boolean enabled) {
            this.includeElapsed = enabled;
            return this;
        }

        /**
         * 是否输出操作类型（UNPARSE/DUMP）。
         */
        public Builder includeOperation(boolean enabled) {
            this.includeOperation = enabled;
            return this;
        }

        public Builder mode(Mode mode) {
            this.mode = Objects.requireNonNull(mode, "mode");
            return this;
        }

        public Builder prefix(String prefix) {
            if (prefix == null || prefix.isBlank()) {
                throw new IllegalArgumentException("prefix must not be blank");
            }
            this.prefix = prefix;
            return this;
        }

        /**
         * 设置日志输出目标，默认写入 SLF4J 的 INFO 级别。
         */
        public Builder sink(Consumer<String> sink) {
            this.sink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        /**
         * 构建实例。至少需要开启渲染日志或失败日志其中之一。
         */
        public RenderLog build() {
            if (!logOnRender && !logOnError) {
                throw new IllegalStateException("At least one of logOnRender/logOnError must be enabled");
            }
            return new RenderLog(this);
        }
    }
}
