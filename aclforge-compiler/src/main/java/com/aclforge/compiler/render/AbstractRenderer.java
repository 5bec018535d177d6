/*
 * Copyright (c) 2025 AclForge
 * Licensed under the Apache License, Version 2.0
 */
package com.aclforge.compiler.render;

import com.aclforge.api.Renderer;
import com.aclforge.api.RendererState;
import com.aclforge.api.SkipReason;
import com.aclforge.api.SkippedTerm;
import com.aclforge.api.ValidationConfig;
import com.aclforge.api.exceptions.UnsupportedFeatureException;
import com.aclforge.api.exceptions.ValidationException;
import com.aclforge.api.model.Filter;
import com.aclforge.api.model.IpVersion;
import com.aclforge.api.model.Policy;
import com.aclforge.api.model.PortRange;
import com.aclforge.api.model.Term;
import com.aclforge.api.model.TermField;
import com.aclforge.compiler.address.AddressAlgebra;
import com.aclforge.compiler.address.AddressFamily;
import com.aclforge.compiler.address.FlowResolution;
import com.aclforge.compiler.address.FlowTag;
import com.aclforge.compiler.validation.TermValidator;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Lifecycle and term admission shared by all targets.
 *
 * <p>Subclasses turn one filter into their model type {@code F} and serialize the
 * list of translated filters. This class enforces the CREATED, TRANSLATED, RENDERED
 * state machine, opens the tracing spans and applies the checks every target runs
 * before emitting a term: platform gating, expiration, keyword support and
 * address family resolution.
 *
 * <p>Every skipped term is logged once, as a WARNING, on this class's logger.
 *
 * @param <F> per-filter model built by {@link #translateFilter}
 */
public abstract class AbstractRenderer<F> implements Renderer {
    private static final Logger logger = Logger.getLogger(AbstractRenderer.class.getName());

    private static final Set<String> HIGH_PORT_PROTOCOLS = Set.of("tcp", "udp");
    private static final PortRange HIGH_PORTS = PortRange.of(1024, PortRange.MAX_PORT);

    protected final Tracer tracer;
    protected final TermValidator validator;

    private RendererState state = RendererState.CREATED;
    private List<F> filters = List.of();
    private List<SkippedTerm> skippedTerms = List.of();

    protected AbstractRenderer(Tracer tracer, TermValidator validator) {
        this.tracer = tracer;
        this.validator = validator;
    }

    /**
     * Optional keywords this target can express, in addition to {@link TermField#required()}.
     */
    protected abstract Set<TermField> optionalKeywords();

    /**
     * Translates one filter whose header targets this platform.
     */
    protected abstract F translateFilter(Filter filter, TranslationContext context);

    /**
     * Serializes translated filters; must depend only on its argument.
     */
    protected abstract String renderFilters(List<F> filters);

    @Override
    public final synchronized void translate(Policy policy, ValidationConfig config) {
        if (state != RendererState.CREATED) {
            throw new IllegalStateException("translate may be called once; renderer is " + state);
        }

        Span span = tracer.spanBuilder("translate-policy").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("platform", platform());
            TranslationContext context = new TranslationContext(platform(), config);
            List<F> translated = new ArrayList<>();

            for (Filter filter : policy.filters()) {
                if (!filter.header().platforms().contains(platform())) {
                    continue;
                }
                validator.checkDuplicateNames(filter.terms());
                context.beginFilter(filter.header().filterName(platform()));
                translated.add(translateFilter(filter, context));
            }

            this.filters = List.copyOf(translated);
            this.skippedTerms = context.skippedTerms();
            this.state = RendererState.TRANSLATED;

            span.setAttribute("filterCount", translated.size());
            span.setAttribute("renderedTerms", context.renderedTerms());
            span.setAttribute("skippedTerms", skippedTerms.size());
            logger.info(String.format("Translated %d filter(s) for %s: %d term(s) rendered, %d skipped",
                    translated.size(), platform(), context.renderedTerms(), skippedTerms.size()));
        } catch (RuntimeException e) {
            state = RendererState.FAILED;
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public final synchronized String render() {
        if (state != RendererState.TRANSLATED && state != RendererState.RENDERED) {
            throw new IllegalStateException("render requires a successful translate; renderer is " + state);
        }

        Span span = tracer.spanBuilder("render-policy").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("platform", platform());
            String output = renderFilters(filters);
            span.setAttribute("outputLength", output.length());
            state = RendererState.RENDERED;
            return output;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public final synchronized RendererState state() {
        return state;
    }

    @Override
    public final synchronized List<SkippedTerm> skippedTerms() {
        return skippedTerms;
    }

    /**
     * Runs the checks every term goes through before target-specific translation.
     *
     * @return false if the term was skipped
     * @throws ValidationException if the term sets a keyword the target cannot express,
     *                             or has no action
     */
    protected boolean admit(Term term, TranslationContext context) {
        if (!term.appliesTo(platform())) {
            skip(context, term, SkipReason.PLATFORM_MISMATCH,
                    "term is not enabled for " + platform());
            return false;
        }

        ValidationConfig config = context.config();
        switch (validator.checkExpiration(term, config.today(), config.warnWindow())) {
            case SKIP:
                skip(context, term, SkipReason.EXPIRED, "expired on " + term.expiration());
                return false;
            case WARN:
                logger.info(String.format("Term %s in filter %s expires on %s",
                        term.name(), context.filterName(), term.expiration()));
                break;
            default:
                break;
        }

        Set<TermField> supported = EnumSet.copyOf(TermField.required());
        supported.addAll(optionalKeywords());
        validator.checkSupportedKeywords(term, supported);

        if (term.action() == null && term.verbatimFor(platform()).isEmpty()) {
            throw new ValidationException("Term " + term.name() + " has no action");
        }
        return true;
    }

    /**
     * Decides which IP versions of the term the filter's family can carry.
     *
     * @return the versions to render; empty if the term was skipped
     */
    protected Set<IpVersion> resolveVersions(Term term, AddressFamily family, TranslationContext context) {
        String protocol = family.incompatibleProtocol(term.protocols());
        if (protocol != null) {
            skip(context, term, SkipReason.PROTOCOL_FAMILY_MISMATCH,
                    "protocol " + protocol + " cannot be used in a " + family.token() + " filter");
            return Set.of();
        }

        Set<FlowTag> flows = AddressAlgebra.classifyFlows(term.sourceAddresses(), term.destinationAddresses());
        FlowResolution resolution = family.resolve(flows);
        if (resolution.isSkip()) {
            skip(context, term, SkipReason.ADDRESS_FAMILY_MISMATCH, resolution.skipDetail());
            return Set.of();
        }
        if (resolution.versions().size() < family.versions().size()) {
            logger.fine(String.format("Term %s renders only %s in %s filter %s",
                    term.name(), resolution.versions(), family.token(), context.filterName()));
        }
        return resolution.versions();
    }

    /**
     * Restricts {@code established} to return traffic: a term with that option whose
     * protocols are tcp and/or udp and that has no destination port gets destination
     * ports 1024-65535. The input term is not modified.
     *
     * @throws UnsupportedFeatureException if {@code tcp-established} is used with any
     *                                     protocol set other than exactly tcp
     */
    protected static Term fixHighPorts(Term term) {
        List<String> protocols = term.protocols();
        if (term.options().contains("tcp-established")
                && !(protocols.size() == 1 && "tcp".equals(protocols.get(0)))) {
            throw new UnsupportedFeatureException(String.format(
                    "Term %s: option tcp-established can only be applied to protocol tcp, got %s",
                    term.name(), protocols));
        }
        if (term.options().contains("established")
                && !protocols.isEmpty()
                && HIGH_PORT_PROTOCOLS.containsAll(protocols)
                && term.destinationPorts().isEmpty()) {
            return term.toBuilder().destinationPorts(HIGH_PORTS).build();
        }
        return term;
    }

    /**
     * Records a skipped term and logs it.
     */
    protected void skip(TranslationContext context, Term term, SkipReason reason, String detail) {
        logger.warning(String.format("Term %s in filter %s is not rendered for %s: %s",
                term.name(), context.filterName(), platform(), detail));
        context.recordSkip(term.name(), reason, detail);
    }
}
