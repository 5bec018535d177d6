/*
 * Copyright (c) 2025 AclForge
 * Licensed under the Apache License, Version 2.0
 */
package com.aclforge.compiler.render.iptables;

import com.aclforge.api.exceptions.UnsupportedFeatureException;
import com.aclforge.api.model.Action;
import com.aclforge.api.model.Address;
import com.aclforge.api.model.IpVersion;
import com.aclforge.api.model.PortRange;
import com.aclforge.api.model.Term;
import com.aclforge.compiler.address.AddressAlgebra;
import com.aclforge.compiler.port.PortGroup;
import com.aclforge.compiler.port.PortProtocolNormalizer;
import com.aclforge.compiler.render.TextWrapper;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds the rule lines of one term: chain creation, jump, comments, bailout
 * RETURN rules and the match rules.
 */
final class IptablesTerm {

    static final int MULTIPORT_BUDGET = 14;

    private static final Map<String, String> TCP_FLAGS = new LinkedHashMap<>();
    private static final Map<String, String> OPTION_MATCHERS = Map.of(
            "first-fragment", "-m u32 --u32 4&0x3FFF=0x2000",
            "initial", "--syn",
            "tcp-initial", "--syn",
            "sample", "");

    static {
        TCP_FLAGS.put("syn", "SYN");
        TCP_FLAGS.put("ack", "ACK");
        TCP_FLAGS.put("fin", "FIN");
        TCP_FLAGS.put("rst", "RST");
        TCP_FLAGS.put("urg", "URG");
        TCP_FLAGS.put("psh", "PSH");
        TCP_FLAGS.put("all", "ALL");
        TCP_FLAGS.put("none", "NONE");
    }

    // (check flags, set flags) approximating "established" without conntrack
    private static final List<List<List<String>>> STATELESS_ESTABLISHED = List.of(
            List.of(List.of("ACK"), List.of("ACK")),
            List.of(List.of("SYN", "FIN", "ACK", "RST"), List.of("RST")));
    private static final List<List<List<String>>> NO_TRACKING = List.of(List.of(List.of(), List.of()));

    private final Term term;
    private final String chainName;
    private final IptablesFilterOptions filter;
    private final PortProtocolNormalizer normalizer;
    private final IpVersion version;

    IptablesTerm(Term term, String chainName, IptablesFilterOptions filter, PortProtocolNormalizer normalizer) {
        this.term = term;
        this.chainName = chainName;
        this.filter = filter;
        this.normalizer = normalizer;
        this.version = filter.family().primaryVersion();
    }

    List<String> lines() {
        List<String> lines = new ArrayList<>();
        lines.add("-N " + chainName);
        lines.add("-A " + filter.chain() + " -j " + chainName);

        int commentWidth = Math.max(40, 92 - chainName.length());
        for (String comment : TextWrapper.wrap(term.comments(), commentWidth)) {
            lines.add("-A " + chainName + " -m comment --comment \"" + comment.replace('"', '\'') + "\"");
        }

        List<String> protocols = term.protocols().isEmpty() ? List.of("all") : term.protocols();
        List<String> options = new ArrayList<>();
        List<String> tcpFlags = new ArrayList<>();
        List<List<List<String>>> tracking = NO_TRACKING;
        for (String option : term.options()) {
            if (option.equals("established") || option.equals("tcp-established")) {
                if (filter.stateful()) {
                    addOnce(options, "-m state --state ESTABLISHED,RELATED");
                } else if (protocols.equals(List.of("tcp"))) {
                    tracking = STATELESS_ESTABLISHED;
                }
                continue;
            }
            String matcher = OPTION_MATCHERS.get(option);
            if (matcher != null) {
                if (!matcher.isEmpty()) {
                    addOnce(options, matcher);
                }
                continue;
            }
            String flag = tcpFlag(option);
            if (flag == null) {
                throw new UnsupportedFeatureException(String.format(
                        "Term %s: option %s is not supported by iptables", term.name(), option));
            }
            tcpFlags.add(flag);
        }
        if (term.packetLength() != null) {
            options.add("-m length --length " + term.packetLength().replace('-', ':'));
        }
        if (term.fragmentOffset() != null) {
            options.add("-m u32 --u32 4&0x1FFF=" + term.fragmentOffset().replace('-', ':'));
        }

        ExclusionPlan plan = ExclusionPlanner.plan(version,
                AddressAlgebra.ofVersions(term.sourceAddresses(), Set.of(version)),
                AddressAlgebra.ofVersions(term.sourceAddressExcludes(), Set.of(version)),
                AddressAlgebra.ofVersions(term.destinationAddresses(), Set.of(version)),
                AddressAlgebra.ofVersions(term.destinationAddressExcludes(), Set.of(version)));
        for (Address excluded : plan.bailoutSources()) {
            lines.add("-A " + chainName + " -s " + excluded + " -j RETURN");
        }
        for (Address excluded : plan.bailoutDestinations()) {
            lines.add("-A " + chainName + " -d " + excluded + " -j RETURN");
        }

        IntList icmpTypes = PortProtocolNormalizer.normalizeIcmpTypes(term.icmpTypes(), protocols, version);
        List<String> sourcePorts = portStatements(term.sourcePorts(), "s");
        List<String> destinationPorts = portStatements(term.destinationPorts(), "d");
        String action = actionTarget();

        for (Address source : plan.sources()) {
            for (Address destination : plan.destinations()) {
                for (int i = 0; i < icmpTypes.size(); i++) {
                    int icmpType = icmpTypes.getInt(i);
                    for (String protocol : protocols) {
                        for (List<List<String>> tuple : tracking) {
                            appendRules(lines, protocol, source, sourcePorts, destination, destinationPorts,
                                    options, tcpFlags, icmpType, tuple, action);
                        }
                    }
                }
            }
        }
        return lines;
    }

    private void appendRules(List<String> lines, String protocol,
                             Address source, List<String> sourcePorts,
                             Address destination, List<String> destinationPorts,
                             List<String> termOptions, List<String> tcpFlags, int icmpType,
                             List<List<String>> tracking, String action) {
        List<String> options = new ArrayList<>(termOptions);
        if (filter.stateful() && term.action() == Action.ACCEPT
                && options.stream().noneMatch(o -> o.contains("state"))) {
            options.add("-m state --state NEW,ESTABLISHED,RELATED");
        }

        String flags = "";
        if (!tcpFlags.isEmpty() || !tracking.get(0).isEmpty()) {
            Set<String> check = new LinkedHashSet<>(tcpFlags);
            check.addAll(tracking.get(0));
            Set<String> set = new LinkedHashSet<>(tcpFlags);
            set.addAll(tracking.get(1));
            flags = "--tcp-flags " + String.join(",", check) + " " + String.join(",", set);
        }

        String icmp = "";
        if (icmpType != PortProtocolNormalizer.ANY_ICMP_TYPE) {
            icmp = ("icmpv6".equals(protocol) ? "--icmpv6-type " : "--icmp-type ") + icmpType;
        }

        String src = source.isAny() ? "" : "-s " + source;
        String dst = destination.isAny() ? "" : "-d " + destination;
        String sourceInterface = term.sourceInterface() == null ? "" : "-i " + term.sourceInterface();
        String destinationInterface = term.destinationInterface() == null ? "" : "-o " + term.destinationInterface();
        String proto = "-p " + normalizer.protocolToken(protocol);

        for (String sport : sourcePorts) {
            for (String dport : destinationPorts) {
                String first = sport;
                String second = dport;
                // a multiport match ahead of a single-port one would consume it
                if (first.contains("multiport") && !second.contains("multiport")) {
                    first = dport;
                    second = sport;
                }
                List<String> parts = new ArrayList<>();
                parts.add("-A " + chainName);
                for (String value : new String[]{proto, flags, first, second, icmp, src, dst,
                        String.join(" ", options), sourceInterface, destinationInterface}) {
                    if (!value.isEmpty()) {
                        parts.add(value);
                    }
                }
                String rule = String.join(" ", parts);
                if (term.isLogging()) {
                    lines.add(rule + " -j LOG --log-prefix " + term.name());
                }
                lines.add(rule + " " + action);
            }
        }
    }

    /**
     * Port clauses for one direction; a single empty clause when no ports are set.
     */
    static List<String> portStatements(List<PortRange> ports, String direction) {
        if (ports.isEmpty()) {
            return List.of("");
        }
        List<String> statements = new ArrayList<>();
        for (PortGroup group : PortProtocolNormalizer.consolidateForBudget(
                PortProtocolNormalizer.mergePorts(ports), MULTIPORT_BUDGET)) {
            String list = group.ranges().stream()
                    .map(r -> r.isSinglePort() ? Integer.toString(r.low()) : r.low() + ":" + r.high())
                    .collect(Collectors.joining(","));
            statements.add(group.isSingle()
                    ? "--" + direction + "port " + list
                    : "-m multiport --" + direction + "ports " + list);
        }
        return statements;
    }

    private static String tcpFlag(String option) {
        return TCP_FLAGS.get(option);
    }

    private String actionTarget() {
        switch (term.action()) {
            case ACCEPT:
                return "-j ACCEPT";
            case DENY:
                return "-j DROP";
            case REJECT:
                return version == IpVersion.V6
                        ? "-j REJECT --reject-with adm-prohibited"
                        : "-j REJECT --reject-with icmp-host-prohibited";
            case REJECT_WITH_TCP_RST:
                return "-j REJECT --reject-with tcp-reset";
            case NEXT:
                return "-j RETURN";
            default:
                throw new UnsupportedFeatureException("Action " + term.action() + " is not supported by iptables");
        }
    }

    private static void addOnce(List<String> options, String option) {
        if (!options.contains(option)) {
            options.add(option);
        }
    }
}
