package io.lighting.zweig.observe;

/**
 * Callbacks around each render performed by {@link io.lighting.zweig.Zweig}. All methods are
 * no-ops by default. {@code source} is the value passed in, which for a failing dump may be
 * something other than a node.
 */
public interface RenderObserver {
    default void beforeRender(RenderOperation operation, Object source) {
    }

    default void afterRender(RenderOperation operation, Object source, String output, long elapsedNanos) {
    }

    default void onRenderError(RenderOperation operation, Object source, Exception error, long elapsedNanos) {
    }
}
