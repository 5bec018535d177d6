package com.aclforge.compiler.render.iptables;

import com.aclforge.api.model.Address;

import java.util.List;

/**
 * Addresses to emit for one term and IP version after exclusions are applied.
 *
 * @param strategy           how excludes are expressed
 * @param sources            source prefixes of the match rules
 * @param destinations       destination prefixes of the match rules
 * @param bailoutSources     source prefixes that get an early RETURN rule
 * @param bailoutDestinations destination prefixes that get an early RETURN rule
 * @param bailoutCost        estimated rule count with bailout rules
 * @param expansionCost      estimated rule count with full expansion
 */
public record ExclusionPlan(
        Strategy strategy,
        List<Address> sources,
        List<Address> destinations,
        List<Address> bailoutSources,
        List<Address> bailoutDestinations,
        int bailoutCost,
        int expansionCost
) {

    public enum Strategy {
        /** The term has no excludes. */
        NONE,
        /** One RETURN rule per exclude ahead of the unmodified match rules. */
        BAILOUT,
        /** Excludes subtracted from the includes before the cross product. */
        FULL_EXPANSION
    }

    public ExclusionPlan {
        sources = List.copyOf(sources);
        destinations = List.copyOf(destinations);
        bailoutSources = List.copyOf(bailoutSources);
        bailoutDestinations = List.copyOf(bailoutDestinations);
    }
}
