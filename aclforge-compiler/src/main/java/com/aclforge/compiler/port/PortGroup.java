package com.aclforge.compiler.port;

import com.aclforge.api.model.PortRange;

import java.util.List;

/**
 * Port ranges that one match clause enumerates.
 */
public record PortGroup(List<PortRange> ranges) {

    public PortGroup {
        ranges = List.copyOf(ranges);
        if (ranges.isEmpty()) {
            throw new IllegalArgumentException("A port group needs at least one range");
        }
    }

    /**
     * Clause cost: one unit per single port, two per range.
     */
    public int units() {
        int units = 0;
        for (PortRange range : ranges) {
            units += PortProtocolNormalizer.unitCost(range);
        }
        return units;
    }

    public boolean isSingle() {
        return ranges.size() == 1;
    }
}
