/*
 * Copyright (c) 2025 AclForge
 * Licensed under the Apache License, Version 2.0
 */
package com.aclforge.api.model;

/**
 * Inclusive transport port range.
 */
public record PortRange(int low, int high) implements Comparable<PortRange> {

    public static final int MAX_PORT = 65535;

    public PortRange {
        if (low < 0 || high > MAX_PORT) {
            throw new IllegalArgumentException("Port out of range 0-65535: " + low + "-" + high);
        }
        if (low > high) {
            throw new IllegalArgumentException("Inverted port range: " + low + "-" + high);
        }
    }

    public static PortRange of(int port) {
        return new PortRange(port, port);
    }

    public static PortRange of(int low, int high) {
        return new PortRange(low, high);
    }

    public boolean isSinglePort() {
        return low == high;
    }

    @Override
    public int compareTo(PortRange other) {
        int cmp = Integer.compare(low, other.low);
        return cmp != 0 ? cmp : Integer.compare(high, other.high);
    }

    @Override
    public String toString() {
        return isSinglePort() ? Integer.toString(low) : low + "-" + high;
    }
}
