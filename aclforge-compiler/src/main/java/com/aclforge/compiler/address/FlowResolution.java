package com.aclforge.compiler.address;

import com.aclforge.api.model.IpVersion;

import java.util.Set;

/**
 * Outcome of applying a filter's address family to a term's flows: either the set of
 * IP versions to render, or a skip explanation (versions empty).
 */
public record FlowResolution(Set<IpVersion> versions, String skipDetail) {

    public FlowResolution {
        versions = Set.copyOf(versions);
    }

    static FlowResolution render(Set<IpVersion> versions) {
        return new FlowResolution(versions, null);
    }

    static FlowResolution skip(String detail) {
        return new FlowResolution(Set.of(), detail);
    }

    public boolean isSkip() {
        return skipDetail != null;
    }
}
