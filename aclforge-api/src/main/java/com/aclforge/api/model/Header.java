/*
 * Copyright (c) 2025 AclForge
 * Licensed under the Apache License, Version 2.0
 */
package com.aclforge.api.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only facade over a filter header: the platforms the filter targets,
 * the per-platform options and free-text comments.
 *
 * <p>For each target the first option is the filter name on that platform, the
 * remaining entries are target specific (address family, default action, ...).
 */
public final class Header {

    /**
     * One {@code target::} line of a header.
     *
     * @param platform target platform name, e.g. "iptables"
     * @param options  filter name followed by target options
     */
    public record Target(String platform, List<String> options) {
        public Target {
            Objects.requireNonNull(platform, "platform");
            options = options == null ? List.of() : List.copyOf(options);
        }
    }

    private final List<Target> targets;
    private final List<String> comments;

    public Header(List<Target> targets, List<String> comments) {
        this.targets = targets == null ? List.of() : List.copyOf(targets);
        this.comments = comments == null ? List.of() : List.copyOf(comments);
    }

    public static Header of(String platform, String... options) {
        return new Header(List.of(new Target(platform, List.of(options))), List.of());
    }

    public Header withComments(String... lines) {
        return new Header(targets, List.of(lines));
    }

    public List<Target> targets() {
        return targets;
    }

    /**
     * Platforms this header applies to, in declaration order.
     */
    public Set<String> platforms() {
        Set<String> platforms = new LinkedHashSet<>();
        for (Target target : targets) {
            platforms.add(target.platform());
        }
        return platforms;
    }

    public Optional<Target> target(String platform) {
        return targets.stream().filter(t -> t.platform().equals(platform)).findFirst();
    }

    /**
     * All options of the platform's target line, filter name first.
     * Returns a fresh mutable list; empty if the platform is not targeted.
     */
    public List<String> filterOptions(String platform) {
        return target(platform).map(t -> new ArrayList<>(t.options())).orElseGet(ArrayList::new);
    }

    /**
     * Filter name on the given platform, or null if the header has no options for it.
     */
    public String filterName(String platform) {
        List<String> options = filterOptions(platform);
        return options.isEmpty() ? null : options.get(0);
    }

    public List<String> comments() {
        return comments;
    }
}
