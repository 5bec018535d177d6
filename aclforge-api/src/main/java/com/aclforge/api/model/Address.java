/*
 * Copyright (c) 2025 AclForge
 * Licensed under the Apache License, Version 2.0
 */
package com.aclforge.api.model;

import java.math.BigInteger;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Comparator;
import java.util.Objects;

/**
 * A CIDR prefix with its IP version, the symbolic token it was expanded from
 * and an optional free-text annotation.
 *
 * <p>Host bits of {@code network} are cleared on construction. Two addresses are
 * equal when they denote the same prefix (version, network and length); the token
 * and comment do not take part in equality.
 *
 * @param version       IP version tag
 * @param network       network address as an unsigned number of the version's width
 * @param prefixLength  prefix length, within the version's bit width
 * @param token         symbolic name the prefix came from (may be null)
 * @param comment       free-text annotation (may be null)
 */
public record Address(
        IpVersion version,
        BigInteger network,
        int prefixLength,
        String token,
        String comment
) implements Comparable<Address> {

    private static final Comparator<Address> ORDER = Comparator
            .comparing(Address::version)
            .thenComparing(Address::network)
            .thenComparingInt(Address::prefixLength);

    public Address {
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(network, "network");
        if (prefixLength < 0 || prefixLength > version.bitWidth()) {
            throw new IllegalArgumentException(
                    "Prefix length " + prefixLength + " is out of range for IPv" + version.number());
        }
        if (network.signum() < 0 || network.compareTo(version.maxValue()) > 0) {
            throw new IllegalArgumentException("Network address out of range for IPv" + version.number());
        }
        network = network.and(version.mask(prefixLength));
    }

    /**
     * Parses {@code a.b.c.d/len} or an IPv6 literal with an optional prefix length.
     * A missing length means a host route.
     */
    public static Address parse(String cidr) {
        return parse(cidr, null, null);
    }

    public static Address parse(String cidr, String token, String comment) {
        Objects.requireNonNull(cidr, "cidr");
        String text = cidr.trim();
        int slash = text.indexOf('/');
        String host = slash >= 0 ? text.substring(0, slash) : text;

        IpVersion version;
        BigInteger value;
        if (host.indexOf(':') >= 0) {
            version = IpVersion.V6;
            value = parseIpv6(host, cidr);
        } else {
            version = IpVersion.V4;
            value = parseIpv4(host, cidr);
        }

        int length = version.bitWidth();
        if (slash >= 0) {
            try {
                length = Integer.parseInt(text.substring(slash + 1));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid prefix length in: " + cidr, e);
            }
        }
        return new Address(version, value, length, token, comment);
    }

    private static BigInteger parseIpv4(String host, String original) {
        String[] octets = host.split("\\.", -1);
        if (octets.length != 4) {
            throw new IllegalArgumentException("Invalid IPv4 address: " + original);
        }
        long value = 0;
        for (String octet : octets) {
            int parsed;
            try {
                parsed = Integer.parseInt(octet);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid IPv4 address: " + original, e);
            }
            if (parsed < 0 || parsed > 255) {
                throw new IllegalArgumentException("Invalid IPv4 address: " + original);
            }
            value = (value << 8) | parsed;
        }
        return BigInteger.valueOf(value);
    }

    private static BigInteger parseIpv6(String host, String original) {
        // a literal containing ':' never triggers a name lookup
        byte[] bytes;
        try {
            bytes = InetAddress.getByName(host).getAddress();
        } catch (UnknownHostException e) {
            throw new IllegalArgumentException("Invalid IPv6 address: " + original, e);
        }
        if (bytes.length == 4) {
            // ::ffff:a.b.c.d comes back as an Inet4Address
            byte[] mapped = new byte[16];
            mapped[10] = (byte) 0xff;
            mapped[11] = (byte) 0xff;
            System.arraycopy(bytes, 0, mapped, 12, 4);
            bytes = mapped;
        }
        return new BigInteger(1, bytes);
    }

    /**
     * Returns a copy carrying a different network and length but the same token and comment.
     */
    public Address withPrefix(BigInteger newNetwork, int newPrefixLength) {
        return new Address(version, newNetwork, newPrefixLength, token, comment);
    }

    public BigInteger firstAddress() {
        return network;
    }

    public BigInteger lastAddress() {
        return network.or(version.maxValue().xor(version.mask(prefixLength)));
    }

    /**
     * True when {@code other} lies entirely within this prefix (equal prefixes included).
     */
    public boolean contains(Address other) {
        return version == other.version
                && prefixLength <= other.prefixLength
                && other.network.and(version.mask(prefixLength)).equals(network);
    }

    public boolean contains(IpVersion ipVersion, BigInteger ip) {
        return version == ipVersion && ip.and(version.mask(prefixLength)).equals(network);
    }

    public boolean overlaps(Address other) {
        return contains(other) || other.contains(this);
    }

    /**
     * True when this prefix is the whole address space of its version.
     */
    public boolean isAny() {
        return prefixLength == 0;
    }

    public String networkText() {
        return version.format(network);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Address)) return false;
        Address other = (Address) o;
        return version == other.version
                && prefixLength == other.prefixLength
                && network.equals(other.network);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, network, prefixLength);
    }

    @Override
    public int compareTo(Address other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return networkText() + "/" + prefixLength;
    }
}
