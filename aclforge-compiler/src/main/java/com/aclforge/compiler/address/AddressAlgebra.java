/*
 * Copyright (c) 2025 AclForge
 * Licensed under the Apache License, Version 2.0
 */
package com.aclforge.compiler.address;

import com.aclforge.api.model.Address;
import com.aclforge.api.model.IpVersion;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * CIDR set operations used by every renderer.
 *
 * <p>All operations are pure; input lists are never modified and output order is
 * deterministic. Prefix equality is exact (same network and length) and containment
 * is CIDR containment within the same IP version.
 */
public final class AddressAlgebra {

    private AddressAlgebra() {
    }

    /**
     * Classifies the IP version flows of a term.
     *
     * <p>An empty side accepts any version. For each version:
     * <ul>
     *   <li>both sides accept it: {@code ipV-ipV}</li>
     *   <li>only the source accepts it: {@code ipV-src-only} and {@code ipV-only}</li>
     *   <li>only the destination accepts it: {@code ipV-dst-only} and {@code ipV-only}</li>
     *   <li>neither: no tag</li>
     * </ul>
     */
    public static Set<FlowTag> classifyFlows(List<Address> sources, List<Address> destinations) {
        boolean sourceAny = sources.isEmpty();
        boolean destinationAny = destinations.isEmpty();
        Set<FlowTag> flows = EnumSet.noneOf(FlowTag.class);

        for (IpVersion version : IpVersion.values()) {
            boolean source = sourceAny || hasVersion(sources, version);
            boolean destination = destinationAny || hasVersion(destinations, version);
            if (source && destination) {
                flows.add(FlowTag.both(version));
            } else if (source) {
                flows.add(FlowTag.sourceOnly(version));
                flows.add(FlowTag.only(version));
            } else if (destination) {
                flows.add(FlowTag.destinationOnly(version));
                flows.add(FlowTag.only(version));
            }
        }
        return flows;
    }

    private static boolean hasVersion(List<Address> addresses, IpVersion version) {
        for (Address address : addresses) {
            if (address.version() == version) {
                return true;
            }
        }
        return false;
    }

    /**
     * Removes every exclude prefix from the include prefixes.
     *
     * <p>Includes that are disjoint from all excludes are kept unchanged, includes
     * covered by an exclude are dropped, and partially covered includes are split
     * into the fewest prefixes covering what remains. Output keeps include order;
     * the pieces of one include are in address order. Tokens and comments of the
     * include carry over to its pieces.
     */
    public static List<Address> excludeAddrs(List<Address> include, List<Address> exclude) {
        Set<Address> result = new LinkedHashSet<>();
        for (Address included : include) {
            List<Address> remaining = List.of(included);
            for (Address excluded : exclude) {
                List<Address> next = new ArrayList<>();
                for (Address piece : remaining) {
                    next.addAll(subtract(piece, excluded));
                }
                remaining = next;
                if (remaining.isEmpty()) {
                    break;
                }
            }
            result.addAll(remaining);
        }
        return new ArrayList<>(result);
    }

    /**
     * Set difference of two prefixes as a minimal list of prefixes in address order.
     */
    static List<Address> subtract(Address from, Address excluded) {
        if (!from.overlaps(excluded)) {
            return List.of(from);
        }
        if (excluded.contains(from)) {
            return List.of();
        }

        // from strictly contains excluded: walk down towards it, keeping each sibling half
        List<Address> pieces = new ArrayList<>();
        Address current = from;
        while (current.prefixLength() < excluded.prefixLength()) {
            Address lower = lowerHalf(current);
            Address upper = upperHalf(current);
            if (lower.contains(excluded)) {
                pieces.add(upper);
                current = lower;
            } else {
                pieces.add(lower);
                current = upper;
            }
        }
        pieces.sort(null);
        return pieces;
    }

    static Address lowerHalf(Address address) {
        return address.withPrefix(address.network(), address.prefixLength() + 1);
    }

    static Address upperHalf(Address address) {
        int childLength = address.prefixLength() + 1;
        BigInteger bit = BigInteger.ONE.shiftLeft(address.version().bitWidth() - childLength);
        return address.withPrefix(address.network().or(bit), childLength);
    }

    /**
     * Minimizes include/exclude lists for targets that express exclusion natively
     * ("prefix except").
     *
     * <p>An include with an exact match among the excludes cancels out, as does any
     * include lying inside an exclude. An exclude not contained in any surviving include
     * is dropped as well, since the implicit default already excludes it. Both lists keep
     * their input order, and the result matches exactly {@code include \ exclude}.
     */
    public static MinimizedPrefixes minimizePrefixes(List<Address> include, List<Address> exclude) {
        List<Address> includes = new ArrayList<>();
        for (Address address : include) {
            if (!coveredBy(address, exclude)) {
                includes.add(address);
            }
        }

        List<Address> excludes = new ArrayList<>();
        for (Address excluded : exclude) {
            for (Address included : includes) {
                if (included.contains(excluded)) {
                    excludes.add(excluded);
                    break;
                }
            }
        }
        return new MinimizedPrefixes(includes, excludes);
    }

    private static boolean coveredBy(Address address, List<Address> prefixes) {
        for (Address prefix : prefixes) {
            if (prefix.contains(address)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Addresses of the given versions, order preserved.
     */
    public static List<Address> ofVersions(List<Address> addresses, Collection<IpVersion> versions) {
        List<Address> result = new ArrayList<>();
        for (Address address : addresses) {
            if (versions.contains(address.version())) {
                result.add(address);
            }
        }
        return result;
    }

    /**
     * Whether a numeric address lies in any of the prefixes.
     */
    public static boolean covers(List<Address> prefixes, IpVersion version, BigInteger ip) {
        for (Address prefix : prefixes) {
            if (prefix.contains(version, ip)) {
                return true;
            }
        }
        return false;
    }
}
