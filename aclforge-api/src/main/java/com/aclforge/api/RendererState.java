package com.aclforge.api;

/**
 * Lifecycle of a {@link Renderer} instance.
 *
 * <pre>
 * CREATED --translate ok--&gt; TRANSLATED --render--&gt; RENDERED (render may repeat)
 * CREATED --translate fails--&gt; FAILED
 * </pre>
 */
public enum RendererState {
    CREATED,
    TRANSLATED,
    RENDERED,
    FAILED
}
