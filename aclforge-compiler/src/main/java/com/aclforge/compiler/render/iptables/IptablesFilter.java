package com.aclforge.compiler.render.iptables;

import java.util.List;

/**
 * Translated iptables filter: options, header comments and the rule lines of each
 * rendered term.
 */
record IptablesFilter(IptablesFilterOptions options, List<String> comments, List<List<String>> terms) {

    IptablesFilter {
        comments = List.copyOf(comments);
        terms = terms.stream().map(List::copyOf).toList();
    }
}
