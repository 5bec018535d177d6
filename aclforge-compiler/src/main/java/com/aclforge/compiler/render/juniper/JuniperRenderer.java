/*
 * Copyright (c) 2025 AclForge
 * Licensed under the Apache License, Version 2.0
 */
package com.aclforge.compiler.render.juniper;

import com.aclforge.api.SkipReason;
import com.aclforge.api.exceptions.UnsupportedFeatureException;
import com.aclforge.api.model.Filter;
import com.aclforge.api.model.Header;
import com.aclforge.api.model.Term;
import com.aclforge.api.model.TermField;
import com.aclforge.compiler.port.PortProtocolNormalizer;
import com.aclforge.compiler.render.AbstractRenderer;
import com.aclforge.compiler.render.TranslationContext;
import com.aclforge.compiler.validation.TermValidator;
import io.opentelemetry.api.trace.Tracer;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Renders filters as Junos {@code firewall} configuration.
 *
 * <p>Address excludes use the native {@code except} syntax after
 * {@link com.aclforge.compiler.address.AddressAlgebra#minimizePrefixes minimization}.
 * Filter options are {@code NAME [inet|inet6|bridge] [not-interface-specific]}.
 */
public class JuniperRenderer extends AbstractRenderer<JuniperFilter> {

    public static final String PLATFORM = "juniper";
    static final int MAX_TERM_NAME_LENGTH = 64;
    private static final String NOT_INTERFACE_SPECIFIC = "not-interface-specific";

    private static final Set<TermField> OPTIONAL_KEYWORDS = EnumSet.of(
            TermField.COUNTER,
            TermField.DESTINATION_PREFIX,
            TermField.FRAGMENT_OFFSET,
            TermField.LOGGING,
            TermField.LOSS_PRIORITY,
            TermField.PACKET_LENGTH,
            TermField.POLICER,
            TermField.PRECEDENCE,
            TermField.PROTOCOL_EXCEPT,
            TermField.QOS,
            TermField.ROUTING_INSTANCE,
            TermField.SOURCE_PREFIX);

    private final PortProtocolNormalizer normalizer = PortProtocolNormalizer.byName();

    public JuniperRenderer(Tracer tracer) {
        this(tracer, new TermValidator());
    }

    public JuniperRenderer(Tracer tracer, TermValidator validator) {
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
    protected JuniperFilter translateFilter(Filter filter, TranslationContext context) {
        Header header = filter.header();
        List<String> options = header.filterOptions(PLATFORM);
        if (options.isEmpty()) {
            throw new UnsupportedFeatureException("juniper target requires a filter name");
        }
        String filterName = options.get(0);
        List<String> rest = new ArrayList<>(options.subList(1, options.size()));
        boolean interfaceSpecific = !rest.remove(NOT_INTERFACE_SPECIFIC);

        JuniperFamily family = JuniperFamily.INET;
        if (!rest.isEmpty()) {
            family = JuniperFamily.fromToken(rest.get(0));
            if (family == null || rest.size() > 1) {
                throw new UnsupportedFeatureException(String.format(
                        "Unsupported juniper filter options %s; expected one of inet, inet6, bridge", rest));
            }
        }

        List<String> terms = new ArrayList<>();
        for (Term term : filter.terms()) {
            if (!admit(term, context)) {
                continue;
            }
            String name = validator.fitIdentifier(term.name(), MAX_TERM_NAME_LENGTH, false);
            context.claimName(name);

            if (term.verbatimFor(PLATFORM).isEmpty()) {
                if (resolveVersions(term, family.addressFamily(), context).isEmpty()) {
                    continue;
                }
                term = fixHighPorts(term);
            }

            JuniperTerm juniperTerm = new JuniperTerm(term, name, family, normalizer);
            if (juniperTerm.matchesNothing()) {
                skip(context, term, SkipReason.ADDRESSES_EXCLUDED,
                        "every address of one side is also excluded");
                continue;
            }
            terms.add(juniperTerm.build());
            context.termRendered();
        }
        return new JuniperFilter(filterName, family, interfaceSpecific, header.comments(), terms);
    }

    @Override
    protected String renderFilters(List<JuniperFilter> filters) {
        JuniperConfig config = new JuniperConfig();
        for (JuniperFilter filter : filters) {
            config.append("firewall {");
            config.append("family " + filter.family().token() + " {");
            config.append("replace:");
            config.appendCommentBlock(filter.comments());
            config.append("filter " + filter.name() + " {");
            if (filter.interfaceSpecific()) {
                config.append("interface-specific;");
            }
            for (String term : filter.terms()) {
                config.appendVerbatim(term);
            }
            config.append("}");
            config.append("}");
            config.append("}");
        }
        return config + "\n";
    }
}
