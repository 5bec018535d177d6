package com.aclforge.compiler.render.juniper;

import java.util.List;

/**
 * Translated Juniper filter; each term is a block of text already indented for the
 * {@code filter} body.
 */
record JuniperFilter(String name, JuniperFamily family, boolean interfaceSpecific,
                     List<String> comments, List<String> terms) {

    JuniperFilter {
        comments = List.copyOf(comments);
        terms = List.copyOf(terms);
    }
}
