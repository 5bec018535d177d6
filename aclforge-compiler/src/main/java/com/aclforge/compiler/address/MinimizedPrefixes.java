package com.aclforge.compiler.address;

import com.aclforge.api.model.Address;

import java.util.List;

/**
 * Include and exclude lists for targets with native "except" syntax.
 */
public record MinimizedPrefixes(List<Address> includes, List<Address> excludes) {

    public MinimizedPrefixes {
        includes = List.copyOf(includes);
        excludes = List.copyOf(excludes);
    }
}
