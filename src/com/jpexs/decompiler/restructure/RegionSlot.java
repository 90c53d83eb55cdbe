package com.jpexs.decompiler.restructure;

import com.jpexs.decompiler.restructure.region.Region;

/**
 * Holder of a region built by a scheduled task. Set once, read by the region it is part of.
 *
 * @author JPEXS
 */
final class RegionSlot {

    private Region region;

    Region get() {
        if (region == null) {
            throw new StructuringInvariantViolationException("Region was read before it was built");
        }
        return region;
    }

    void set(Region region) {
        if (this.region != null) {
            throw new StructuringInvariantViolationException("Region was built twice");
        }
        this.region = region;
    }
}
