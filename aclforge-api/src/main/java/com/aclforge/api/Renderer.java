/*
 * Copyright (c) 2025 AclForge
 * Licensed under the Apache License, Version 2.0
 */
package com.aclforge.api;

import com.aclforge.api.exceptions.PolicyCompilationException;
import com.aclforge.api.model.Policy;

import java.util.List;

/**
 * Contract every target backend implements.
 *
 * <p>Rendering is two-phase. {@link #translate} consumes the policy IR and builds the
 * renderer's private model; {@link #render} turns that model into the final text.
 * An instance is single-use:
 * <ul>
 *   <li>{@code translate} may be called once. A fatal error leaves the renderer FAILED
 *   and no output can be obtained from it.</li>
 *   <li>{@code render} must follow a successful {@code translate}; it is a pure function
 *   of the model and returns identical text on every call.</li>
 * </ul>
 * Renderers never modify the policy. Separate instances may translate the same policy
 * concurrently.
 *
 * <h2>Usage</h2>
 * <pre>
 * Renderer renderer = Renderers.forPlatform("juniper", tracer);
 * renderer.translate(policy, ValidationConfig.defaults());
 * String config = renderer.render();
 * </pre>
 */
public interface Renderer {

    /**
     * Platform name matched against header targets and term platform lists.
     */
    String platform();

    /**
     * Builds the internal model for every filter targeting {@link #platform()}.
     *
     * @param policy the policy IR
     * @param config validation settings (today's date, expiry warn window)
     * @throws PolicyCompilationException on any fatal translation error
     * @throws IllegalStateException      if called more than once
     */
    void translate(Policy policy, ValidationConfig config);

    /**
     * Serializes the translated model.
     *
     * @return target configuration text
     * @throws IllegalStateException if {@link #translate} has not completed successfully
     */
    String render();

    RendererState state();

    /**
     * Terms omitted during translation, in the order they were encountered.
     */
    List<SkippedTerm> skippedTerms();
}
