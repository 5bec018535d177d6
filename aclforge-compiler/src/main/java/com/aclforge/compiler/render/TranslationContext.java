/*
 * Copyright (c) 2025 AclForge
 * Licensed under the Apache License, Version 2.0
 */
package com.aclforge.compiler.render;

import com.aclforge.api.SkipReason;
import com.aclforge.api.SkippedTerm;
import com.aclforge.api.ValidationConfig;
import com.aclforge.api.exceptions.DuplicateNameException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * State of one {@code translate} call: settings, emitted-name registry and skips.
 *
 * <p>A new context is created for every call and handed to every helper, so nothing
 * carries over between translations or between renderer instances.
 */
public final class TranslationContext {

    private final String platform;
    private final ValidationConfig config;
    private final List<SkippedTerm> skipped = new ArrayList<>();

    private String filterName;
    private Set<String> emittedNames = new HashSet<>();
    private int renderedTerms;

    public TranslationContext(String platform, ValidationConfig config) {
        this.platform = platform;
        this.config = config;
    }

    public String platform() {
        return platform;
    }

    public ValidationConfig config() {
        return config;
    }

    /**
     * Starts a new filter scope; emitted names are tracked per filter.
     */
    public void beginFilter(String name) {
        this.filterName = name;
        this.emittedNames = new HashSet<>();
    }

    public String filterName() {
        return filterName;
    }

    /**
     * Registers an identifier as emitted in the current filter.
     *
     * @throws DuplicateNameException if the identifier was already emitted, which can
     *                                happen when two distinct names shorten to the same one
     */
    public void claimName(String name) {
        if (!emittedNames.add(name)) {
            throw new DuplicateNameException(name);
        }
    }

    void recordSkip(String termName, SkipReason reason, String detail) {
        skipped.add(new SkippedTerm(filterName, termName, reason, detail));
    }

    public void termRendered() {
        renderedTerms++;
    }

    public int renderedTerms() {
        return renderedTerms;
    }

    public List<SkippedTerm> skippedTerms() {
        return List.copyOf(skipped);
    }
}
