/*
 * Copyright (c) 2025 AclForge
 * Licensed under the Apache License, Version 2.0
 */
package com.aclforge.compiler.port;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * IANA protocol numbers for the protocol names policies use.
 */
public final class ProtocolTable {

    public static final int UNKNOWN = -1;

    private static final Object2IntMap<String> NAME_TO_NUMBER = new Object2IntOpenHashMap<>();
    private static final Int2ObjectMap<String> NUMBER_TO_NAME = new Int2ObjectOpenHashMap<>();

    static {
        NAME_TO_NUMBER.defaultReturnValue(UNKNOWN);
        register("ip", 0);
        register("icmp", 1);
        register("igmp", 2);
        register("ggp", 3);
        register("ipencap", 4);
        register("tcp", 6);
        register("egp", 8);
        register("igp", 9);
        register("udp", 17);
        register("rdp", 27);
        register("ipv6", 41);
        register("ipv6-route", 43);
        register("ipv6-frag", 44);
        register("rsvp", 46);
        register("gre", 47);
        register("esp", 50);
        register("ah", 51);
        register("icmpv6", 58);
        register("ipv6-nonxt", 59);
        register("ipv6-opts", 60);
        register("ospf", 89);
        register("ipip", 94);
        register("pim", 103);
        register("vrrp", 112);
        register("l2tp", 115);
        register("sctp", 132);
        register("udplite", 136);
    }

    private ProtocolTable() {
    }

    private static void register(String name, int number) {
        NAME_TO_NUMBER.put(name, number);
        NUMBER_TO_NAME.put(number, name);
    }

    /**
     * @return the IANA number, or {@link #UNKNOWN}
     */
    public static int numberOf(String name) {
        return NAME_TO_NUMBER.getInt(name);
    }

    /**
     * @return the protocol name, or null when the number has no registered name
     */
    public static String nameOf(int number) {
        return NUMBER_TO_NAME.get(number);
    }
}
