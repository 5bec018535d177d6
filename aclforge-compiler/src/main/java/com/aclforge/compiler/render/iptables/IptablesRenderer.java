/*
 * Copyright (c) 2025 AclForge
 * Licensed under the Apache License, Version 2.0
 */
package com.aclforge.compiler.render.iptables;

import com.aclforge.api.SkipReason;
import com.aclforge.api.exceptions.UnsupportedFeatureException;
import com.aclforge.api.model.Action;
import com.aclforge.api.model.Filter;
import com.aclforge.api.model.Header;
import com.aclforge.api.model.Term;
import com.aclforge.api.model.TermField;
import com.aclforge.compiler.port.PortProtocolNormalizer;
import com.aclforge.compiler.render.AbstractRenderer;
import com.aclforge.compiler.render.TextWrapper;
import com.aclforge.compiler.render.TranslationContext;
import com.aclforge.compiler.validation.TermValidator;
import io.opentelemetry.api.trace.Tracer;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Renders filters as {@code iptables-restore} rules.
 *
 * <p>Each term becomes its own chain, jumped to from the filter's chain. Address
 * excludes are expressed either as early RETURN rules or by subtracting them from
 * the includes, whichever yields fewer rules (see {@link ExclusionPlanner}).
 */
public class IptablesRenderer extends AbstractRenderer<IptablesFilter> {

    public static final String PLATFORM = "iptables";
    static final int MAX_TERM_NAME_LENGTH = 24;
    private static final int HEADER_COMMENT_WIDTH = 70;

    private static final Set<TermField> OPTIONAL_KEYWORDS = EnumSet.of(
            TermField.COUNTER,
            TermField.DESTINATION_PREFIX,
            TermField.FRAGMENT_OFFSET,
            TermField.LOGGING,
            TermField.PACKET_LENGTH,
            TermField.POLICER,
            TermField.QOS,
            TermField.SOURCE_INTERFACE,
            TermField.DESTINATION_INTERFACE,
            TermField.SOURCE_PREFIX);

    private static final Logger logger = Logger.getLogger(IptablesRenderer.class.getName());

    private final PortProtocolNormalizer normalizer = PortProtocolNormalizer.byName();

    public IptablesRenderer(Tracer tracer) {
        this(tracer, new TermValidator());
    }

    public IptablesRenderer(Tracer tracer, TermValidator validator) {
        super(tracer, validator);
    }

    @Override
    public String platform() {
        return PLATFORM;
    }

    @Override
    protected Set<TermField> optionalKeywords() {
        return OPTIONAL_KEYWORDS;
    }

    @Override
    protected IptablesFilter translateFilter(Filter filter, TranslationContext context) {
        Header header = filter.header();
        IptablesFilterOptions options = IptablesFilterOptions.parse(header.filterOptions(PLATFORM));

        List<List<String>> terms = new ArrayList<>();
        for (Term term : filter.terms()) {
            if (!admit(term, context)) {
                continue;
            }

            List<String> verbatim = term.verbatimFor(PLATFORM);
            if (!verbatim.isEmpty()) {
                terms.add(verbatim);
                context.termRendered();
                continue;
            }

            if (!term.sourcePrefixes().isEmpty() || !term.destinationPrefixes().isEmpty()) {
                if (term.action() != Action.ACCEPT && term.action() != Action.NEXT) {
                    throw new UnsupportedFeatureException(String.format(
                            "Term %s has action %s with source_prefix or destination_prefix, "
                                    + "which iptables cannot express", term.name(), term.action().token()));
                }
                skip(context, term, SkipReason.PREFIX_LIST_UNSUPPORTED, "prefix lists are not supported by iptables");
                continue;
            }

            if (term.statelessReply() && options.stateful()) {
                skip(context, term, SkipReason.STATELESS_REPLY,
                        "stateless reply terms are not needed with connection tracking");
                continue;
            }

            if (resolveVersions(term, options.family(), context).isEmpty()) {
                continue;
            }

            warnIgnoredKeywords(term, context);
            Term fixed = fixHighPorts(term);
            String chainName = options.chain().charAt(0) + "_"
                    + validator.fitIdentifier(term.name(), MAX_TERM_NAME_LENGTH, options.truncateNames());
            context.claimName(chainName);
            terms.add(new IptablesTerm(fixed, chainName, options, normalizer).lines());
            context.termRendered();
        }
        return new IptablesFilter(options, header.comments(), terms);
    }

    private static void warnIgnoredKeywords(Term term, TranslationContext context) {
        List<String> ignored = new ArrayList<>();
        if (term.counter() != null) {
            ignored.add("counter");
        }
        if (term.policer() != null) {
            ignored.add("policer");
        }
        if (term.qos() != null) {
            ignored.add("qos");
        }
        if (!ignored.isEmpty()) {
            logger.warning(String.format("Term %s in filter %s: %s not rendered for iptables",
                    term.name(), context.filterName(), String.join(", ", ignored)));
        }
    }

    @Override
    protected String renderFilters(List<IptablesFilter> filters) {
        List<String> lines = new ArrayList<>();
        for (IptablesFilter filter : filters) {
            IptablesFilterOptions options = filter.options();
            lines.add("# Iptables " + options.chain() + " Policy");
            List<String> comments = TextWrapper.wrap(filter.comments(), HEADER_COMMENT_WIDTH);
            if (!comments.isEmpty()) {
                for (String comment : comments) {
                    lines.add("# " + comment);
                }
                lines.add("#");
            }
            lines.add("# " + options.family().token());
            if (options.defaultAction() != null) {
                lines.add("-P " + options.chain() + " " + options.defaultAction());
            }
            for (List<String> term : filter.terms()) {
                lines.addAll(term);
            }
            lines.add("");
        }
        return String.join("\n", lines) + "\n";
    }
}
