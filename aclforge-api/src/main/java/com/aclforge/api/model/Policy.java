package com.aclforge.api.model;

import java.util.List;

/**
 * Ordered sequence of filters produced by the policy parser.
 */
public record Policy(List<Filter> filters) {

    public Policy {
        filters = filters == null ? List.of() : List.copyOf(filters);
    }

    public static Policy of(Filter... filters) {
        return new Policy(List.of(filters));
    }
}
