/*
 * Copyright (c) 2025 AclForge
 * Licensed under the Apache License, Version 2.0
 */
package com.aclforge.compiler.render.iptables;

import com.aclforge.api.model.Address;
import com.aclforge.api.model.IpVersion;
import com.aclforge.compiler.address.AddressAlgebra;

import java.util.List;
import java.util.logging.Logger;

/**
 * Chooses how address excludes are expressed for a target without native "except".
 *
 * <p>Bailout emits {@code |excludeSrc| + |excludeDst|} RETURN rules plus
 * {@code |src| x |dst|} match rules. Full expansion subtracts the excludes and emits
 * {@code |srcResult| x |dstResult|} match rules. Empty sides count as one. The cheaper
 * strategy wins; a tie goes to full expansion. Only one strategy is ever applied.
 */
public final class ExclusionPlanner {
    private static final Logger logger = Logger.getLogger(ExclusionPlanner.class.getName());

    private ExclusionPlanner() {
    }

    /**
     * Plans one IP version of a term. All address lists must already be restricted
     * to {@code version}; an empty include list means any address.
     */
    public static ExclusionPlan plan(IpVersion version,
                                     List<Address> sources, List<Address> sourceExcludes,
                                     List<Address> destinations, List<Address> destinationExcludes) {
        List<Address> sourceIncludes = sources.isEmpty() ? List.of(version.anyAddress()) : sources;
        List<Address> destinationIncludes = destinations.isEmpty() ? List.of(version.anyAddress()) : destinations;

        if (sourceExcludes.isEmpty() && destinationExcludes.isEmpty()) {
            int cost = sourceIncludes.size() * destinationIncludes.size();
            return new ExclusionPlan(ExclusionPlan.Strategy.NONE, sourceIncludes, destinationIncludes,
                    List.of(), List.of(), cost, cost);
        }

        List<Address> sourceResult = sourceExcludes.isEmpty()
                ? sourceIncludes
                : AddressAlgebra.excludeAddrs(sourceIncludes, sourceExcludes);
        List<Address> destinationResult = destinationExcludes.isEmpty()
                ? destinationIncludes
                : AddressAlgebra.excludeAddrs(destinationIncludes, destinationExcludes);

        int bailoutCost = sourceExcludes.size() + destinationExcludes.size()
                + Math.max(1, sources.size()) * Math.max(1, destinations.size());
        int expansionCost = Math.max(1, sourceResult.size()) * Math.max(1, destinationResult.size());

        if (expansionCost <= bailoutCost) {
            logger.fine(String.format("Full expansion chosen: %d rules vs %d with bailout", expansionCost, bailoutCost));
            return new ExclusionPlan(ExclusionPlan.Strategy.FULL_EXPANSION, sourceResult, destinationResult,
                    List.of(), List.of(), bailoutCost, expansionCost);
        }
        logger.fine(String.format("Bailout chosen: %d rules vs %d with full expansion", bailoutCost, expansionCost));
        return new ExclusionPlan(ExclusionPlan.Strategy.BAILOUT, sourceIncludes, destinationIncludes,
                sourceExcludes, destinationExcludes, bailoutCost, expansionCost);
    }
}
