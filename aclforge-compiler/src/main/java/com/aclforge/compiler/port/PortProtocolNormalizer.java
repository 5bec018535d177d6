/*
 * Copyright (c) 2025 AclForge
 * Licensed under the Apache License, Version 2.0
 */
package com.aclforge.compiler.port;

import com.aclforge.api.exceptions.UnsupportedFeatureException;
import com.aclforge.api.exceptions.ValidationException;
import com.aclforge.api.model.IpVersion;
import com.aclforge.api.model.PortRange;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Port range merging, clause budgeting, protocol tokens and ICMP type lookup.
 *
 * <p>Port sets are handled as {@link RoaringBitmap}s over 0..65535, which makes merging
 * and coverage comparison exact. The protocol representation and an optional allow-list
 * are per-target settings held by the instance; the remaining operations are static.
 */
public final class PortProtocolNormalizer {

    /**
     * Single element ICMP type list meaning "every type".
     */
    public static final int ANY_ICMP_TYPE = -1;

    public enum ProtocolStyle {
        NAME,
        NUMBER
    }

    private final ProtocolStyle style;
    private final Set<String> allowedProtocols;

    /**
     * @param style            how protocols are written on the target
     * @param allowedProtocols protocols the target accepts, or null for no restriction
     */
    public PortProtocolNormalizer(ProtocolStyle style, Collection<String> allowedProtocols) {
        this.style = style;
        this.allowedProtocols = allowedProtocols == null ? null : Set.copyOf(allowedProtocols);
    }

    public static PortProtocolNormalizer byName() {
        return new PortProtocolNormalizer(ProtocolStyle.NAME, null);
    }

    /**
     * Maps a protocol to the target's representation.
     *
     * <p>Numeric tokens are left as they are. Names without a number are passed through
     * unless an allow-list is configured.
     *
     * @throws UnsupportedFeatureException if the protocol is not on the allow-list
     */
    public String protocolToken(String protocol) {
        String name = protocol.trim().toLowerCase(Locale.ROOT);
        if (allowedProtocols != null && !allowedProtocols.contains(name)) {
            throw new UnsupportedFeatureException("Protocol " + protocol + " is not supported by this target");
        }
        if (isNumeric(name)) {
            return name;
        }
        if (style == ProtocolStyle.NUMBER) {
            int number = ProtocolTable.numberOf(name);
            return number == ProtocolTable.UNKNOWN ? name : Integer.toString(number);
        }
        return name;
    }

    private static boolean isNumeric(String token) {
        if (token.isEmpty()) {
            return false;
        }
        for (int i = 0; i < token.length(); i++) {
            if (!Character.isDigit(token.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Collapses overlapping and adjacent ranges. The result is sorted and matches exactly
     * the ports of the input.
     */
    public static List<PortRange> mergePorts(List<PortRange> ports) {
        return toRanges(coverage(ports));
    }

    /**
     * Every port matched by the ranges.
     */
    public static RoaringBitmap coverage(Collection<PortRange> ports) {
        RoaringBitmap bitmap = new RoaringBitmap();
        for (PortRange range : ports) {
            bitmap.add((long) range.low(), (long) range.high() + 1);
        }
        return bitmap;
    }

    /**
     * Every port matched by the groups.
     */
    public static RoaringBitmap groupCoverage(List<PortGroup> groups) {
        RoaringBitmap bitmap = new RoaringBitmap();
        for (PortGroup group : groups) {
            bitmap.or(coverage(group.ranges()));
        }
        return bitmap;
    }

    private static List<PortRange> toRanges(RoaringBitmap bitmap) {
        List<PortRange> ranges = new ArrayList<>();
        long start = bitmap.nextValue(0);
        while (start >= 0) {
            long end = bitmap.nextAbsentValue((int) start);
            ranges.add(PortRange.of((int) start, (int) end - 1));
            if (end > PortRange.MAX_PORT) {
                break;
            }
            start = bitmap.nextValue((int) end);
        }
        return ranges;
    }

    /**
     * Splits ranges into clauses whose cost stays within the budget. A single port costs
     * one unit and a range two. A clause is closed when the next entry would push it past
     * the budget; an entry larger than the budget still gets a clause of its own.
     */
    public static List<PortGroup> consolidateForBudget(List<PortRange> ports, int unitBudget) {
        if (unitBudget <= 0) {
            throw new IllegalArgumentException("Unit budget must be positive, got " + unitBudget);
        }
        List<PortGroup> groups = new ArrayList<>();
        List<PortRange> current = new ArrayList<>();
        int used = 0;
        for (PortRange range : ports) {
            int cost = unitCost(range);
            if (used + cost > unitBudget && !current.isEmpty()) {
                groups.add(new PortGroup(current));
                current = new ArrayList<>();
                used = 0;
            }
            current.add(range);
            used += cost;
        }
        if (!current.isEmpty()) {
            groups.add(new PortGroup(current));
        }
        return groups;
    }

    static int unitCost(PortRange range) {
        return range.isSinglePort() ? 1 : 2;
    }

    /**
     * Resolves ICMP type names for one IP version.
     *
     * @return type numbers in input order, or {@code [ANY_ICMP_TYPE]} when no names are
     *         given or the protocols do not include icmp/icmpv6
     * @throws ValidationException         for a name missing from the version's table
     * @throws UnsupportedFeatureException when icmp types are combined with other
     *                                     protocols, or the icmp protocol does not
     *                                     match the IP version
     */
    public static IntList normalizeIcmpTypes(List<String> names, List<String> protocols, IpVersion version) {
        boolean icmp = protocols.contains("icmp");
        boolean icmpv6 = protocols.contains("icmpv6");
        if (names.isEmpty() || (!icmp && !icmpv6)) {
            return IntLists.singleton(ANY_ICMP_TYPE);
        }
        if (protocols.size() != 1) {
            throw new UnsupportedFeatureException(
                    "ICMP types require the protocol to be exactly icmp or icmpv6, got " + protocols);
        }
        String expected = IcmpTypes.protocolFor(version);
        if (!protocols.get(0).equals(expected)) {
            throw new UnsupportedFeatureException(String.format(
                    "ICMP types with protocol %s cannot be used for IPv%d", protocols.get(0), version.number()));
        }

        IntList types = new IntArrayList(names.size());
        for (String name : names) {
            int type = IcmpTypes.lookup(version, name);
            if (type == IcmpTypes.UNKNOWN) {
                throw new ValidationException(String.format(
                        "ICMP type %s is not defined for %s", name, expected));
            }
            types.add(type);
        }
        return types;
    }
}
