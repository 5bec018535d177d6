/*
 * Copyright (c) 2025 AclForge
 * Licensed under the Apache License, Version 2.0
 */
package com.aclforge.compiler.render.juniper;

import com.aclforge.api.exceptions.ValidationException;
import com.aclforge.api.model.Action;
import com.aclforge.api.model.Address;
import com.aclforge.api.model.IpVersion;
import com.aclforge.api.model.PortRange;
import com.aclforge.api.model.Term;
import com.aclforge.compiler.address.AddressAlgebra;
import com.aclforge.compiler.address.MinimizedPrefixes;
import com.aclforge.compiler.port.PortProtocolNormalizer;
import com.aclforge.compiler.render.TextWrapper;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Builds the {@code term NAME { from { ... } then { ... } }} block of one term.
 */
final class JuniperTerm {
    private static final Logger logger = Logger.getLogger(JuniperTerm.class.getName());

    static final int TERM_INDENT = 12;
    private static final int COMMENT_LINE_END = 77;
    private static final int MAX_ANNOTATION_LENGTH = 132;

    private final Term term;
    private final String name;
    private final JuniperFamily family;
    private final PortProtocolNormalizer normalizer;
    private final IpVersion version;
    private final MinimizedPrefixes sources;
    private final MinimizedPrefixes destinations;

    JuniperTerm(Term term, String name, JuniperFamily family, PortProtocolNormalizer normalizer) {
        this.term = term;
        this.name = name;
        this.family = family;
        this.normalizer = normalizer;
        this.version = family.addressFamily().primaryVersion();
        this.sources = minimize(term.sourceAddresses(), term.sourceAddressExcludes());
        this.destinations = minimize(term.destinationAddresses(), term.destinationAddressExcludes());
    }

    private MinimizedPrefixes minimize(List<Address> include, List<Address> exclude) {
        List<Address> includes = AddressAlgebra.ofVersions(include, Set.of(version));
        List<Address> excludes = AddressAlgebra.ofVersions(exclude, Set.of(version));
        if (includes.isEmpty() && !excludes.isEmpty()) {
            includes = List.of(version.anyAddress());
        }
        return AddressAlgebra.minimizePrefixes(includes, excludes);
    }

    /**
     * True when every include of a side was cancelled by an identical exclude.
     */
    boolean matchesNothing() {
        return cancelled(term.sourceAddresses(), sources) || cancelled(term.destinationAddresses(), destinations);
    }

    private boolean cancelled(List<Address> declared, MinimizedPrefixes minimized) {
        return !AddressAlgebra.ofVersions(declared, Set.of(version)).isEmpty() && minimized.includes().isEmpty();
    }

    /**
     * @throws ValidationException for precedence values outside 0-7
     */
    String build() {
        JuniperConfig config = new JuniperConfig(TERM_INDENT);

        List<String> comments = new ArrayList<>(term.comments());
        if (term.owner() != null) {
            comments.add("Owner: " + term.owner());
        }
        if (!comments.isEmpty()) {
            config.appendCommentBlock(comments);
        }

        List<String> verbatim = term.verbatimFor(JuniperRenderer.PLATFORM);
        if (!verbatim.isEmpty()) {
            verbatim.forEach(config::appendVerbatim);
            return config.toString();
        }

        List<String> optionMatches = new ArrayList<>();
        List<String> extraActions = new ArrayList<>();
        boolean tcpOnly = term.protocols().equals(List.of("tcp"));
        for (String option : term.options()) {
            if (option.startsWith("sample")) {
                extraActions.add("sample");
            } else if (option.startsWith("established") || option.startsWith("tcp-established")) {
                // non-tcp established terms are narrowed by destination high ports instead
                if (tcpOnly) {
                    addOnce(optionMatches, family.keyword(JuniperKeyword.TCP_ESTABLISHED) + ";");
                }
            } else if (option.startsWith("rst")) {
                addOnce(optionMatches, "tcp-flags \"rst\";");
            } else if (option.startsWith("initial") || option.startsWith("tcp-initial")) {
                if (term.protocols().contains("tcp")) {
                    addOnce(optionMatches, "tcp-initial;");
                }
            } else if (option.startsWith("first-fragment")) {
                addOnce(optionMatches, "first-fragment;");
            } else {
                addOnce(optionMatches, option + ";");
            }
        }

        IntList icmpTypes = PortProtocolNormalizer.normalizeIcmpTypes(term.icmpTypes(), term.protocols(), version);

        config.append("term " + name + " {");
        if (hasMatchCriteria(optionMatches, icmpTypes)) {
            config.append("from {");
            appendAddresses(config, family.keyword(JuniperKeyword.SOURCE_ADDRESS), sources);
            appendAddresses(config, family.keyword(JuniperKeyword.DESTINATION_ADDRESS), destinations);
            appendPrefixLists(config, "source-prefix-list", term.sourcePrefixes());
            appendPrefixLists(config, "destination-prefix-list", term.destinationPrefixes());

            if (!term.protocols().isEmpty()) {
                config.append(family.keyword(JuniperKeyword.PROTOCOL) + " " + group(protocolTokens(term.protocols())));
            }
            if (!term.protocolExcepts().isEmpty()) {
                config.append(family.keyword(JuniperKeyword.PROTOCOL_EXCEPT) + " "
                        + group(protocolTokens(term.protocolExcepts())));
            }
            if (!term.sourcePorts().isEmpty()) {
                config.append("source-port " + group(portTokens(term.sourcePorts())));
            }
            if (!term.destinationPorts().isEmpty()) {
                config.append("destination-port " + group(portTokens(term.destinationPorts())));
            }
            optionMatches.forEach(config::append);
            if (term.packetLength() != null) {
                config.append("packet-length " + term.packetLength() + ";");
            }
            if (term.fragmentOffset() != null) {
                config.append("fragment-offset " + term.fragmentOffset() + ";");
            }
            if (isTypeSpecific(icmpTypes)) {
                List<String> types = new ArrayList<>();
                for (int i = 0; i < icmpTypes.size(); i++) {
                    types.add(Integer.toString(icmpTypes.getInt(i)));
                }
                config.append("icmp-type " + group(types));
            }

            if (!term.precedence().isEmpty()) {
                Set<Integer> precedences = new TreeSet<>();
                for (int precedence : term.precedence()) {
                    if (precedence < 0 || precedence > 7) {
                        throw new ValidationException(String.format(
                                "Precedence value %d is out of bounds in term %s", precedence, term.name()));
                    }
                    precedences.add(precedence);
                }
                List<String> values = new ArrayList<>();
                precedences.forEach(p -> values.add(Integer.toString(p)));
                config.append("precedence " + group(values));
            }
            config.append("}");
        }

        config.append("then {");
        if (term.isLogging()) {
            config.append("local".equals(term.logging()) ? "log;" : "syslog;");
        }
        if (term.routingInstance() != null) {
            config.append("routing-instance " + term.routingInstance() + ";");
        }
        if (term.counter() != null) {
            config.append("count " + term.counter() + ";");
        }
        if (term.policer() != null) {
            config.append("policer " + term.policer() + ";");
        }
        if (term.qos() != null) {
            config.append("forwarding-class " + term.qos() + ";");
        }
        if (term.lossPriority() != null) {
            config.append("loss-priority " + term.lossPriority() + ";");
        }
        for (String action : extraActions) {
            config.append(action + ";");
        }
        if (term.routingInstance() == null) {
            config.append(action(term.action()) + ";");
        }
        config.append("}");
        config.append("}");
        return config.toString();
    }

    /**
     * Whether any match line is produced; options, packet-length, fragment-offset and
     * typed ICMP all count.
     */
    private boolean hasMatchCriteria(List<String> optionMatches, IntList icmpTypes) {
        return !sources.includes().isEmpty()
                || !destinations.includes().isEmpty()
                || !term.sourcePrefixes().isEmpty()
                || !term.destinationPrefixes().isEmpty()
                || !term.protocols().isEmpty()
                || !term.protocolExcepts().isEmpty()
                || !term.sourcePorts().isEmpty()
                || !term.destinationPorts().isEmpty()
                || !term.precedence().isEmpty()
                || !optionMatches.isEmpty()
                || term.packetLength() != null
                || term.fragmentOffset() != null
                || isTypeSpecific(icmpTypes);
    }

    private static boolean isTypeSpecific(IntList icmpTypes) {
        return icmpTypes.getInt(0) != PortProtocolNormalizer.ANY_ICMP_TYPE;
    }

    private void appendAddresses(JuniperConfig config, String keyword, MinimizedPrefixes prefixes) {
        if (prefixes.includes().isEmpty()) {
            return;
        }
        config.append(keyword + " {");
        for (Address address : prefixes.includes()) {
            String entry = address + ";";
            config.append(entry + annotation(address, config.indent() + entry.length()));
        }
        for (Address address : prefixes.excludes()) {
            String entry = address + " except;";
            config.append(entry + annotation(address, config.indent() + entry.length()));
        }
        config.append("}");
    }

    private static void appendPrefixLists(JuniperConfig config, String keyword, List<String> names) {
        if (names.isEmpty()) {
            return;
        }
        config.append(keyword + " {");
        for (String prefixList : names) {
            config.append(prefixList + ";");
        }
        config.append("}");
    }

    /**
     * Trailing {@code /* ... *}{@code /} comment carrying the address annotation, wrapped so
     * continuation lines line up under the opening marker.
     */
    static String annotation(Address address, int column) {
        String text = address.comment();
        if (text == null || text.isBlank()) {
            return "";
        }
        if (text.contains("/*") || text.contains("*/")) {
            logger.fine("Ignoring malformed address comment: " + text);
            return "";
        }
        if (text.length() > MAX_ANNOTATION_LENGTH) {
            text = text.substring(0, MAX_ANNOTATION_LENGTH);
        }
        int width = Math.max(20, COMMENT_LINE_END - column);

        StringBuilder out = new StringBuilder();
        String marker = " /*";
        for (String line : TextWrapper.wrap(text, width)) {
            if (out.length() > 0) {
                out.append('\n');
            }
            out.append(marker).append(' ').append(line);
            marker = " ".repeat(column + 1) + "**";
        }
        return out.append(" */").toString();
    }

    private List<String> protocolTokens(List<String> protocols) {
        List<String> tokens = new ArrayList<>();
        for (String protocol : protocols) {
            tokens.add(normalizer.protocolToken(protocol));
        }
        return tokens;
    }

    private static List<String> portTokens(List<PortRange> ports) {
        List<String> tokens = new ArrayList<>();
        for (PortRange range : PortProtocolNormalizer.mergePorts(ports)) {
            tokens.add(range.toString());
        }
        return tokens;
    }

    /**
     * {@code x;} for one element, {@code [ a b ];} for several.
     */
    static String group(List<String> elements) {
        if (elements.size() == 1) {
            return elements.get(0) + ";";
        }
        return "[ " + String.join(" ", elements) + " ];";
    }

    private static String action(Action action) {
        switch (action) {
            case ACCEPT:
                return "accept";
            case DENY:
                return "discard";
            case REJECT:
                return "reject";
            case NEXT:
                return "next term";
            case REJECT_WITH_TCP_RST:
                return "reject tcp-reset";
            default:
                throw new IllegalArgumentException("Unknown action " + action);
        }
    }

    private static void addOnce(List<String> lines, String line) {
        if (!lines.contains(line)) {
            lines.add(line);
        }
    }
}
