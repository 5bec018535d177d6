package com.aclforge.api.model;

import java.util.List;
import java.util.Objects;

/**
 * A header and its terms. Term order is significant and is preserved by every renderer.
 */
public record Filter(Header header, List<Term> terms) {

    public Filter {
        Objects.requireNonNull(header, "header");
        terms = terms == null ? List.of() : List.copyOf(terms);
    }
}
