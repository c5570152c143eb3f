package io.lighting.zweig.starter;

import io.lighting.zweig.observe.RenderLog;
import io.lighting.zweig.source.Unparser;
import java.util.function.Consumer;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for Zweig.
 * <p>
 * Configure these properties under the "zweig" prefix in application.yml:
 * <pre>{@code
 * zweig:
 *   indent: "  "
 *   log:
 *     enabled: true
 *     mode: FULL
 *     include-elapsed: true
 * }</pre>
 */
@ConfigurationProperties(prefix = "zweig")
public class ZweigProperties {

    private String indent = Unparser.DEFAULT_INDENT;
    private RenderLogProperties log = new RenderLogProperties();

    public String getIndent() {
        return indent;
    }

    public void setIndent(String indent) {
        this.indent = indent;
    }

    public RenderLogProperties getLog() {
        return log;
    }

    public void setLog(RenderLogProperties log) {
        this.log = log;
    }

    public static class RenderLogProperties {
        private boolean enabled = true;
        private boolean logOnRender = true;
        private boolean logOnError = true;
        private boolean includeElapsed = false;
        private boolean includeOperation = true;
        private RenderLog.Mode mode = RenderLog.Mode.SUMMARY;
        private String prefix = "ZWEIG:";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isLogOnRender() {
            return logOnRender;
        }

        public void setLogOnRender(boolean logOnRender) {
            this.logOnRender = logOnRender;
        }

        public boolean isLogOnError() {
            return logOnError;
        }

        public void setLogOnError(boolean logOnError) {
            this.logOnError = logOnError;
        }

        public boolean isIncludeElapsed() {
            return includeElapsed;
        }

        public void setIncludeElapsed(boolean includeElapsed) {
            this.includeElapsed = includeElapsed;
        }

        public boolean isIncludeOperation() {
            return includeOperation;
        }

        public void setIncludeOperation(boolean includeOperation) {
            this.includeOperation = includeOperation;
        }

        public RenderLog.Mode getMode() {
            return mode;
        }

        public void setMode(RenderLog.Mode mode) {
            this.mode = mode;
        }

        public String getPrefix() {
            return prefix;
        }

        public void setPrefix(String prefix) {
            this.prefix = prefix;
        }

        /**
         * The configured log observer, or {@code null} when logging is disabled.
         */
        public RenderLog build(Consumer<String> logger) {
            if (!enabled) {
                return null;
            }
            return RenderLog.builder()
                .mode(mode)
                .logOnRender(logOnRender)
                .logOnError(logOnError)
                .includeElapsed(includeElapsed)
                .includeOperation(includeOperation)
                .prefix(prefix)
                .sink(logger)
                .build();
        }
    }
}
