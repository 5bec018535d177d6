/*
 * Copyright (c) 2025 AclForge
 * Licensed under the Apache License, Version 2.0
 */
package com.aclforge.api.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One match/action entry of a filter.
 *
 * <p>Terms are immutable. Renderers that need an adjusted term (for example with
 * high ports added for {@code established}) derive a copy through {@link #toBuilder()}.
 * Unset list keywords are empty, unset scalar keywords are null.
 */
public final class Term {

    private final String name;
    private final Action action;
    private final List<String> protocols;
    private final List<String> protocolExcepts;
    private final List<Address> sourceAddresses;
    private final List<Address> sourceAddressExcludes;
    private final List<Address> destinationAddresses;
    private final List<Address> destinationAddressExcludes;
    private final List<PortRange> sourcePorts;
    private final List<PortRange> destinationPorts;
    private final List<String> icmpTypes;
    private final List<String> options;
    private final String logging;
    private final List<String> comments;
    private final String owner;
    private final LocalDate expiration;
    private final Set<String> platforms;
    private final Set<String> platformExcludes;
    private final List<Verbatim> verbatim;
    private final boolean statelessReply;
    private final String counter;
    private final String policer;
    private final String qos;
    private final String lossPriority;
    private final String routingInstance;
    private final String packetLength;
    private final String fragmentOffset;
    private final String sourceInterface;
    private final String destinationInterface;
    private final List<String> sourcePrefixes;
    private final List<String> destinationPrefixes;
    private final List<Integer> precedence;

    private Term(Builder b) {
        this.name = Objects.requireNonNull(b.name, "term name");
        this.action = b.action;
        this.protocols = List.copyOf(b.protocols);
        this.protocolExcepts = List.copyOf(b.protocolExcepts);
        this.sourceAddresses = List.copyOf(b.sourceAddresses);
        this.sourceAddressExcludes = List.copyOf(b.sourceAddressExcludes);
        this.destinationAddresses = List.copyOf(b.destinationAddresses);
        this.destinationAddressExcludes = List.copyOf(b.destinationAddressExcludes);
        this.sourcePorts = List.copyOf(b.sourcePorts);
        this.destinationPorts = List.copyOf(b.destinationPorts);
        this.icmpTypes = List.copyOf(b.icmpTypes);
        this.options = List.copyOf(b.options);
        this.logging = b.logging;
        this.comments = List.copyOf(b.comments);
        this.owner = b.owner;
        this.expiration = b.expiration;
        this.platforms = Set.copyOf(b.platforms);
        this.platformExcludes = Set.copyOf(b.platformExcludes);
        this.verbatim = List.copyOf(b.verbatim);
        this.statelessReply = b.statelessReply;
        this.counter = b.counter;
        this.policer = b.policer;
        this.qos = b.qos;
        this.lossPriority = b.lossPriority;
        this.routingInstance = b.routingInstance;
        this.packetLength = b.packetLength;
        this.fragmentOffset = b.fragmentOffset;
        this.sourceInterface = b.sourceInterface;
        this.destinationInterface = b.destinationInterface;
        this.sourcePrefixes = List.copyOf(b.sourcePrefixes);
        this.destinationPrefixes = List.copyOf(b.destinationPrefixes);
        this.precedence = List.copyOf(b.precedence);
    }

    public static Builder builder(String name) {
        return new Builder().name(name);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public String name() { return name; }
    public Action action() { return action; }
    public List<String> protocols() { return protocols; }
    public List<String> protocolExcepts() { return protocolExcepts; }
    public List<Address> sourceAddresses() { return sourceAddresses; }
    public List<Address> sourceAddressExcludes() { return sourceAddressExcludes; }
    public List<Address> destinationAddresses() { return destinationAddresses; }
    public List<Address> destinationAddressExcludes() { return destinationAddressExcludes; }
    public List<PortRange> sourcePorts() { return sourcePorts; }
    public List<PortRange> destinationPorts() { return destinationPorts; }
    public List<String> icmpTypes() { return icmpTypes; }
    public List<String> options() { return options; }
    public String logging() { return logging; }
    public List<String> comments() { return comments; }
    public String owner() { return owner; }
    public LocalDate expiration() { return expiration; }
    public Set<String> platforms() { return platforms; }
    public Set<String> platformExcludes() { return platformExcludes; }
    public List<Verbatim> verbatim() { return verbatim; }
    public boolean statelessReply() { return statelessReply; }
    public String counter() { return counter; }
    public String policer() { return policer; }
    public String qos() { return qos; }
    public String lossPriority() { return lossPriority; }
    public String routingInstance() { return routingInstance; }
    public String packetLength() { return packetLength; }
    public String fragmentOffset() { return fragmentOffset; }
    public String sourceInterface() { return sourceInterface; }
    public String destinationInterface() { return destinationInterface; }
    public List<String> sourcePrefixes() { return sourcePrefixes; }
    public List<String> destinationPrefixes() { return destinationPrefixes; }
    public List<Integer> precedence() { return precedence; }

    /**
     * True when logging is requested; "false" and "disable" count as off.
     */
    public boolean isLogging() {
        return logging != null
                && !logging.isBlank()
                && !"false".equalsIgnoreCase(logging)
                && !"disable".equalsIgnoreCase(logging);
    }

    /**
     * Whether the term-level platform / platform_exclude lists allow rendering on the platform.
     */
    public boolean appliesTo(String platform) {
        if (!platforms.isEmpty() && !platforms.contains(platform)) {
            return false;
        }
        return !platformExcludes.contains(platform);
    }

    /**
     * Raw text lines attached for the given platform, in declaration order.
     */
    public List<String> verbatimFor(String platform) {
        List<String> lines = new ArrayList<>();
        for (Verbatim v : verbatim) {
            if (v.platform().equals(platform)) {
                lines.add(v.text());
            }
        }
        return lines;
    }

    @Override
    public String toString() {
        return "Term[" + name + "]";
    }

    public static final class Builder {
        private String name;
        private Action action;
        private final List<String> protocols = new ArrayList<>();
        private final List<String> protocolExcepts = new ArrayList<>();
        private final List<Address> sourceAddresses = new ArrayList<>();
        private final List<Address> sourceAddressExcludes = new ArrayList<>();
        private final List<Address> destinationAddresses = new ArrayList<>();
        private final List<Address> destinationAddressExcludes = new ArrayList<>();
        private final List<PortRange> sourcePorts = new ArrayList<>();
        private final List<PortRange> destinationPorts = new ArrayList<>();
        private final List<String> icmpTypes = new ArrayList<>();
        private final List<String> options = new ArrayList<>();
        private String logging;
        private final List<String> comments = new ArrayList<>();
        private String owner;
        private LocalDate expiration;
        private final Set<String> platforms = new LinkedHashSet<>();
        private final Set<String> platformExcludes = new LinkedHashSet<>();
        private final List<Verbatim> verbatim = new ArrayList<>();
        private boolean statelessReply;
        private String counter;
        private String policer;
        private String qos;
        private String lossPriority;
        private String routingInstance;
        private String packetLength;
        private String fragmentOffset;
        private String sourceInterface;
        private String destinationInterface;
        private final List<String> sourcePrefixes = new ArrayList<>();
        private final List<String> destinationPrefixes = new ArrayList<>();
        private final List<Integer> precedence = new ArrayList<>();

        private Builder() {
        }

        private Builder(Term t) {
            this.name = t.name;
            this.action = t.action;
            this.protocols.addAll(t.protocols);
            this.protocolExcepts.addAll(t.protocolExcepts);
            this.sourceAddresses.addAll(t.sourceAddresses);
            this.sourceAddressExcludes.addAll(t.sourceAddressExcludes);
            this.destinationAddresses.addAll(t.destinationAddresses);
            this.destinationAddressExcludes.addAll(t.destinationAddressExcludes);
            this.sourcePorts.addAll(t.sourcePorts);
            this.destinationPorts.addAll(t.destinationPorts);
            this.icmpTypes.addAll(t.icmpTypes);
            this.options.addAll(t.options);
            this.logging = t.logging;
            this.comments.addAll(t.comments);
            this.owner = t.owner;
            this.expiration = t.expiration;
            this.platforms.addAll(t.platforms);
            this.platformExcludes.addAll(t.platformExcludes);
            this.verbatim.addAll(t.verbatim);
            this.statelessReply = t.statelessReply;
            this.counter = t.counter;
            this.policer = t.policer;
            this.qos = t.qos;
            this.lossPriority = t.lossPriority;
            this.routingInstance = t.routingInstance;
            this.packetLength = t.packetLength;
            this.fragmentOffset = t.fragmentOffset;
            this.sourceInterface = t.sourceInterface;
            this.destinationInterface = t.destinationInterface;
            this.sourcePrefixes.addAll(t.sourcePrefixes);
            this.destinationPrefixes.addAll(t.destinationPrefixes);
            this.precedence.addAll(t.precedence);
        }

        public Builder name(String name) { this.name = name; return this; }
        public Builder action(Action action) { this.action = action; return this; }
        public Builder protocols(String... values) { return protocols(List.of(values)); }
        public Builder protocols(Collection<String> values) { replace(protocols, values); return this; }
        public Builder protocolExcepts(Collection<String> values) { replace(protocolExcepts, values); return this; }
        public Builder sourceAddresses(Address... values) { return sourceAddresses(List.of(values)); }
        public Builder sourceAddresses(Collection<Address> values) { replace(sourceAddresses, values); return this; }
        public Builder sourceAddressExcludes(Address... values) { return sourceAddressExcludes(List.of(values)); }
        public Builder sourceAddressExcludes(Collection<Address> values) { replace(sourceAddressExcludes, values); return this; }
        public Builder destinationAddresses(Address... values) { return destinationAddresses(List.of(values)); }
        public Builder destinationAddresses(Collection<Address> values) { replace(destinationAddresses, values); return this; }
        public Builder destinationAddressExcludes(Address... values) { return destinationAddressExcludes(List.of(values)); }
        public Builder destinationAddressExcludes(Collection<Address> values) { replace(destinationAddressExcludes, values); return this; }
        public Builder sourcePorts(PortRange... values) { return sourcePorts(List.of(values)); }
        public Builder sourcePorts(Collection<PortRange> values) { replace(sourcePorts, values); return this; }
        public Builder destinationPorts(PortRange... values) { return destinationPorts(List.of(values)); }
        public Builder destinationPorts(Collection<PortRange> values) { replace(destinationPorts, values); return this; }
        public Builder icmpTypes(String... values) { return icmpTypes(List.of(values)); }
        public Builder icmpTypes(Collection<String> values) { replace(icmpTypes, values); return this; }
        public Builder options(String... values) { return options(List.of(values)); }
        public Builder options(Collection<String> values) { replace(options, values); return this; }
        public Builder logging(String logging) { this.logging = logging; return this; }
        public Builder comments(String... values) { return comments(List.of(values)); }
        public Builder comments(Collection<String> values) { replace(comments, values); return this; }
        public Builder owner(String owner) { this.owner = owner; return this; }
        public Builder expiration(LocalDate expiration) { this.expiration = expiration; return this; }
        public Builder platforms(Collection<String> values) { platforms.clear(); if (values != null) platforms.addAll(values); return this; }
        public Builder platformExcludes(Collection<String> values) { platformExcludes.clear(); if (values != null) platformExcludes.addAll(values); return this; }
        public Builder verbatim(Collection<Verbatim> values) { replace(verbatim, values); return this; }
        public Builder statelessReply(boolean statelessReply) { this.statelessReply = statelessReply; return this; }
        public Builder counter(String counter) { this.counter = counter; return this; }
        public Builder policer(String policer) { this.policer = policer; return this; }
        public Builder qos(String qos) { this.qos = qos; return this; }
        public Builder lossPriority(String lossPriority) { this.lossPriority = lossPriority; return this; }
        public Builder routingInstance(String routingInstance) { this.routingInstance = routingInstance; return this; }
        public Builder packetLength(String packetLength) { this.packetLength = packetLength; return this; }
        public Builder fragmentOffset(String fragmentOffset) { this.fragmentOffset = fragmentOffset; return this; }
        public Builder sourceInterface(String sourceInterface) { this.sourceInterface = sourceInterface; return this; }
        public Builder destinationInterface(String destinationInterface) { this.destinationInterface = destinationInterface; return this; }
        public Builder sourcePrefixes(Collection<String> values) { replace(sourcePrefixes, values); return this; }
        public Builder destinationPrefixes(Collection<String> values) { replace(destinationPrefixes, values); return this; }
        public Builder precedence(Collection<Integer> values) { replace(precedence, values); return this; }

        private static <T> void replace(List<T> target, Collection<? extends T> values) {
            target.clear();
            if (values != null) {
                target.addAll(values);
            }
        }

        public Term build() {
            return new Term(this);
        }
    }
}
