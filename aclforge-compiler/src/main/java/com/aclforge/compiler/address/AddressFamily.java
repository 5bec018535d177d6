/*
 * Copyright (c) 2025 AclForge
 * Licensed under the Apache License, Version 2.0
 */
package com.aclforge.compiler.address;

import com.aclforge.api.model.IpVersion;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Address family a filter is declared for, and the per-family rules deciding
 * which terms can be rendered under it.
 */
public enum AddressFamily {
    INET("inet", EnumSet.of(IpVersion.V4), Set.of("icmpv6")),
    INET6("inet6", EnumSet.of(IpVersion.V6), Set.of("icmp")),
    MIXED("mixed", EnumSet.of(IpVersion.V4, IpVersion.V6), Set.of()),
    // layer-2 filters that match on IPv4 headers
    BRIDGE("bridge", EnumSet.of(IpVersion.V4), Set.of("icmpv6"));

    private final String token;
    private final Set<IpVersion> versions;
    private final Set<String> incompatibleProtocols;

    AddressFamily(String token, Set<IpVersion> versions, Set<String> incompatibleProtocols) {
        this.token = token;
        this.versions = versions;
        this.incompatibleProtocols = incompatibleProtocols;
    }

    public String token() {
        return token;
    }

    public Set<IpVersion> versions() {
        return EnumSet.copyOf(versions);
    }

    /**
     * The single IP version of a one-version family.
     *
     * @throws IllegalStateException for MIXED
     */
    public IpVersion primaryVersion() {
        if (versions.size() != 1) {
            throw new IllegalStateException(token + " spans more than one IP version");
        }
        return versions.iterator().next();
    }

    /**
     * First protocol of the list that cannot be carried by this family, or null.
     */
    public String incompatibleProtocol(List<String> protocols) {
        for (String protocol : protocols) {
            if (incompatibleProtocols.contains(protocol)) {
                return protocol;
            }
        }
        return null;
    }

    /**
     * Decides which IP versions of a term can be rendered under this family.
     *
     * @param flows flow tags from {@link AddressAlgebra#classifyFlows}
     * @return the versions to render, or a skip with an explanation
     */
    public FlowResolution resolve(Set<FlowTag> flows) {
        switch (this) {
            case INET:
            case BRIDGE:
                return flows.contains(FlowTag.IP4_IP4)
                        ? FlowResolution.render(EnumSet.of(IpVersion.V4))
                        : FlowResolution.skip("no IPv4 source/destination combination in flows " + flows);
            case INET6:
                return flows.contains(FlowTag.IP6_IP6)
                        ? FlowResolution.render(EnumSet.of(IpVersion.V6))
                        : FlowResolution.skip("no IPv6 source/destination combination in flows " + flows);
            default:
                boolean v4 = flows.contains(FlowTag.IP4_IP4);
                boolean v6 = flows.contains(FlowTag.IP6_IP6);
                if (v4 && v6) {
                    return FlowResolution.render(EnumSet.of(IpVersion.V4, IpVersion.V6));
                }
                if (v4) {
                    return FlowResolution.render(EnumSet.of(IpVersion.V4));
                }
                if (v6) {
                    return FlowResolution.render(EnumSet.of(IpVersion.V6));
                }
                return FlowResolution.skip("source and destination have different address families " + flows);
        }
    }

    public static AddressFamily fromToken(String token) {
        for (AddressFamily family : values()) {
            if (family.token.equals(token)) {
                return family;
            }
        }
        return null;
    }
}
