/*
 * Copyright (c) 2025 AclForge
 * Licensed under the Apache License, Version 2.0
 */
package com.aclforge.compiler.render.iptables;

import com.aclforge.api.exceptions.UnsupportedFeatureException;
import com.aclforge.compiler.address.AddressFamily;

import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Parsed {@code target:: iptables CHAIN [options]} line.
 *
 * @param chain         built-in or custom chain the terms are attached to
 * @param family        inet or inet6
 * @param defaultAction ACCEPT or DROP, or null to leave the chain policy alone
 * @param stateful      whether connection tracking is used (cleared by {@code nostate})
 * @param truncateNames whether long term names may be abbreviated
 */
public record IptablesFilterOptions(
        String chain,
        AddressFamily family,
        String defaultAction,
        boolean stateful,
        boolean truncateNames
) {
    private static final Logger logger = Logger.getLogger(IptablesFilterOptions.class.getName());

    private static final Set<String> DEFAULT_ACTIONS = Set.of("ACCEPT", "DROP");
    private static final Set<String> FAMILIES = Set.of("inet", "inet6");
    private static final Set<String> FLAGS = Set.of("nostate", "truncatenames");
    private static final Set<String> BUILT_IN_CHAINS = Set.of("INPUT", "OUTPUT", "FORWARD");

    /**
     * @param options target options, chain name first
     * @throws UnsupportedFeatureException for an unknown option or more than one family
     */
    public static IptablesFilterOptions parse(List<String> options) {
        if (options.isEmpty()) {
            throw new UnsupportedFeatureException("iptables target requires a chain name");
        }
        String chain = options.get(0);
        if (!BUILT_IN_CHAINS.contains(chain)) {
            logger.warning("Filter generates the non-standard chain " + chain
                    + ", which does not see traffic unless linked from INPUT, OUTPUT or FORWARD");
        }

        AddressFamily family = null;
        String defaultAction = "FORWARD".equals(chain) ? "DROP" : null;
        boolean stateful = true;
        boolean truncateNames = false;

        for (String option : options.subList(1, options.size())) {
            if (DEFAULT_ACTIONS.contains(option)) {
                defaultAction = option;
            } else if (FAMILIES.contains(option)) {
                if (family != null) {
                    throw new UnsupportedFeatureException(
                            "Only one of inet, inet6 may be given in iptables filter options: " + options);
                }
                family = AddressFamily.fromToken(option);
            } else if (FLAGS.contains(option)) {
                if ("nostate".equals(option)) {
                    stateful = false;
                } else {
                    truncateNames = true;
                }
            } else {
                throw new UnsupportedFeatureException("Unsupported option in iptables target definition: " + option);
            }
        }
        return new IptablesFilterOptions(chain, family == null ? AddressFamily.INET : family,
                defaultAction, stateful, truncateNames);
    }
}
