/*
 * Copyright (c) 2025 AclForge
 * Licensed under the Apache License, Version 2.0
 */
package com.aclforge.compiler.address;

import com.aclforge.api.model.IpVersion;

/**
 * Which IP versions appear on the source and destination sides of a term.
 *
 * <p>An empty side is a wildcard and accepts every version. For each version the
 * classification yields either a both-sides flow ({@code ip4-ip4}), or a one-sided
 * flow reported twice: once with its direction ({@code ip4-src-only}) and once
 * without ({@code ip4-only}).
 */
public enum FlowTag {
    IP4_IP4(IpVersion.V4, "ip4-ip4"),
    IP4_SRC_ONLY(IpVersion.V4, "ip4-src-only"),
    IP4_DST_ONLY(IpVersion.V4, "ip4-dst-only"),
    IP4_ONLY(IpVersion.V4, "ip4-only"),
    IP6_IP6(IpVersion.V6, "ip6-ip6"),
    IP6_SRC_ONLY(IpVersion.V6, "ip6-src-only"),
    IP6_DST_ONLY(IpVersion.V6, "ip6-dst-only"),
    IP6_ONLY(IpVersion.V6, "ip6-only");

    private final IpVersion version;
    private final String label;

    FlowTag(IpVersion version, String label) {
        this.version = version;
        this.label = label;
    }

    public IpVersion version() {
        return version;
    }

    static FlowTag both(IpVersion version) {
        return version == IpVersion.V4 ? IP4_IP4 : IP6_IP6;
    }

    static FlowTag sourceOnly(IpVersion version) {
        return version == IpVersion.V4 ? IP4_SRC_ONLY : IP6_SRC_ONLY;
    }

    static FlowTag destinationOnly(IpVersion version) {
        return version == IpVersion.V4 ? IP4_DST_ONLY : IP6_DST_ONLY;
    }

    static FlowTag only(IpVersion version) {
        return version == IpVersion.V4 ? IP4_ONLY : IP6_ONLY;
    }

    @Override
    public String toString() {
        return label;
    }
}
