/*
 * Copyright (c) 2025 AclForge
 * Licensed under the Apache License, Version 2.0
 */
package com.aclforge.api.model;

import java.math.BigInteger;

/**
 * IP protocol version of an {@link Address}.
 *
 * <p>Addresses carry their version explicitly; code that needs version specific
 * behaviour dispatches on this tag instead of on the address class.
 */
public enum IpVersion {
    V4(4, 32),
    V6(6, 128);

    private final int number;
    private final int bitWidth;
    private final BigInteger maxValue;

    IpVersion(int number, int bitWidth) {
        this.number = number;
        this.bitWidth = bitWidth;
        this.maxValue = BigInteger.ONE.shiftLeft(bitWidth).subtract(BigInteger.ONE);
    }

    public int number() {
        return number;
    }

    public int bitWidth() {
        return bitWidth;
    }

    /**
     * Highest numeric address of this version (all bits set).
     */
    public BigInteger maxValue() {
        return maxValue;
    }

    /**
     * The default route of this version, {@code 0.0.0.0/0} or {@code ::/0}.
     */
    public Address anyAddress() {
        return new Address(this, BigInteger.ZERO, 0, null, null);
    }

    /**
     * Network mask for the given prefix length, as a number of this version's width.
     */
    public BigInteger mask(int prefixLength) {
        if (prefixLength == 0) {
            return BigInteger.ZERO;
        }
        return maxValue.shiftRight(bitWidth - prefixLength).shiftLeft(bitWidth - prefixLength);
    }

    public static IpVersion fromNumber(int number) {
        for (IpVersion version : values()) {
            if (version.number == number) {
                return version;
            }
        }
        throw new IllegalArgumentException("IP version must be 4 or 6, got: " + number);
    }

    /**
     * Formats a numeric address of this version. IPv6 output follows RFC 5952
     * (lowercase, longest zero run compressed).
     */
    String format(BigInteger value) {
        if (this == V4) {
            long v = value.longValue();
            return ((v >> 24) & 0xff) + "." + ((v >> 16) & 0xff) + "." + ((v >> 8) & 0xff) + "." + (v & 0xff);
        }

        int[] groups = new int[8];
        for (int i = 0; i < 8; i++) {
            groups[i] = value.shiftRight((7 - i) * 16).intValue() & 0xffff;
        }

        int bestStart = -1;
        int bestLength = 0;
        for (int i = 0; i < 8; ) {
            if (groups[i] != 0) {
                i++;
                continue;
            }
            int start = i;
            while (i < 8 && groups[i] == 0) {
                i++;
            }
            if (i - start > bestLength) {
                bestStart = start;
                bestLength = i - start;
            }
        }
        if (bestLength < 2) {
            bestStart = -1;
        }

        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 8; i++) {
            if (i == bestStart) {
                sb.append("::");
                i += bestLength - 1;
                continue;
            }
            if (sb.length() > 0 && sb.charAt(sb.length() - 1) != ':') {
                sb.append(':');
            }
            sb.append(Integer.toHexString(groups[i]));
        }
        return sb.toString();
    }
}
