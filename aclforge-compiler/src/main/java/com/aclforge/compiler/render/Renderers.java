/*
 * Copyright (c) 2025 AclForge
 * Licensed under the Apache License, Version 2.0
 */
package com.aclforge.compiler.render;

import com.aclforge.api.Renderer;
import com.aclforge.api.exceptions.UnsupportedFeatureException;
import com.aclforge.compiler.render.iptables.IptablesRenderer;
import com.aclforge.compiler.render.juniper.JuniperRenderer;
import com.aclforge.compiler.telemetry.TracingService;
import io.opentelemetry.api.trace.Tracer;

import java.util.List;

/**
 * Creates renderers by platform name. Every call returns a new, unshared instance.
 */
public final class Renderers {

    private Renderers() {
    }

    public static List<String> platforms() {
        return List.of(IptablesRenderer.PLATFORM, JuniperRenderer.PLATFORM);
    }

    public static Renderer forPlatform(String platform) {
        return forPlatform(platform, TracingService.getInstance().getTracer());
    }

    /**
     * @throws UnsupportedFeatureException if no renderer exists for the platform
     */
    public static Renderer forPlatform(String platform, Tracer tracer) {
        switch (platform) {
            case IptablesRenderer.PLATFORM:
                return new IptablesRenderer(tracer);
            case JuniperRenderer.PLATFORM:
                return new JuniperRenderer(tracer);
            default:
                throw new UnsupportedFeatureException("No renderer for platform " + platform
                        + "; available: " + platforms());
        }
    }
}
