/*
 * Copyright (c) 2025 AclForge
 * Licensed under the Apache License, Version 2.0
 */
package com.aclforge.compiler.port;

import com.aclforge.api.model.IpVersion;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * ICMP and ICMPv6 message type numbers by name.
 */
public final class IcmpTypes {

    public static final int UNKNOWN = -1;

    private static final Object2IntMap<String> ICMP_V4 = new Object2IntOpenHashMap<>();
    private static final Object2IntMap<String> ICMP_V6 = new Object2IntOpenHashMap<>();

    static {
        ICMP_V4.defaultReturnValue(UNKNOWN);
        ICMP_V4.put("echo-reply", 0);
        ICMP_V4.put("unreachable", 3);
        ICMP_V4.put("source-quench", 4);
        ICMP_V4.put("redirect", 5);
        ICMP_V4.put("alternate-address", 6);
        ICMP_V4.put("echo-request", 8);
        ICMP_V4.put("router-advertisement", 9);
        ICMP_V4.put("router-solicitation", 10);
        ICMP_V4.put("time-exceeded", 11);
        ICMP_V4.put("parameter-problem", 12);
        ICMP_V4.put("timestamp-request", 13);
        ICMP_V4.put("timestamp-reply", 14);
        ICMP_V4.put("information-request", 15);
        ICMP_V4.put("information-reply", 16);
        ICMP_V4.put("mask-request", 17);
        ICMP_V4.put("mask-reply", 18);
        ICMP_V4.put("conversion-error", 31);
        ICMP_V4.put("mobile-redirect", 32);

        ICMP_V6.defaultReturnValue(UNKNOWN);
        ICMP_V6.put("destination-unreachable", 1);
        ICMP_V6.put("packet-too-big", 2);
        ICMP_V6.put("time-exceeded", 3);
        ICMP_V6.put("parameter-problem", 4);
        ICMP_V6.put("echo-request", 128);
        ICMP_V6.put("echo-reply", 129);
        ICMP_V6.put("multicast-listener-query", 130);
        ICMP_V6.put("multicast-listener-report", 131);
        ICMP_V6.put("multicast-listener-done", 132);
        ICMP_V6.put("router-solicit", 133);
        ICMP_V6.put("router-advertisement", 134);
        ICMP_V6.put("neighbor-solicit", 135);
        ICMP_V6.put("neighbor-advertisement", 136);
        ICMP_V6.put("redirect-message", 137);
        ICMP_V6.put("router-renumbering", 138);
        ICMP_V6.put("icmp-node-information-query", 139);
        ICMP_V6.put("icmp-node-information-response", 140);
        ICMP_V6.put("inverse-neighbor-discovery-solicitation", 141);
        ICMP_V6.put("inverse-neighbor-discovery-advertisement", 142);
        ICMP_V6.put("version-2-multicast-listener-report", 143);
        ICMP_V6.put("home-agent-address-discovery-request", 144);
        ICMP_V6.put("home-agent-address-discovery-reply", 145);
        ICMP_V6.put("mobile-prefix-solicitation", 146);
        ICMP_V6.put("mobile-prefix-advertisement", 147);
        ICMP_V6.put("certification-path-solicitation", 148);
        ICMP_V6.put("certification-path-advertisement", 149);
        ICMP_V6.put("multicast-router-advertisement", 151);
        ICMP_V6.put("multicast-router-solicitation", 152);
        ICMP_V6.put("multicast-router-termination", 153);
    }

    private IcmpTypes() {
    }

    /**
     * @return the type number for the version's table, or {@link #UNKNOWN}
     */
    public static int lookup(IpVersion version, String name) {
        return (version == IpVersion.V4 ? ICMP_V4 : ICMP_V6).getInt(name);
    }

    /**
     * ICMP protocol name for the version: {@code icmp} or {@code icmpv6}.
     */
    public static String protocolFor(IpVersion version) {
        return version == IpVersion.V4 ? "icmp" : "icmpv6";
    }
}
