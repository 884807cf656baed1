package com.largomodo.zipsplit.core;

/**
 * Optical media presets with their nominal capacities.
 * <p>
 * Capacities are the marketing sizes in MB (1 MB = 1024 * 1024 bytes here, matching
 * how every size flag is interpreted). ZIP overhead is not subtracted: the part
 * budget limits uncompressed input, and deflated output is normally smaller.
 */
public enum MediaPreset {
    CD(700),
    DVD(4700),
    BLURAY(25000);

    private final long capacityMb;

    MediaPreset(long capacityMb) {
        this.capacityMb = capacityMb;
    }

    public long getCapacityMb() {
        return capacityMb;
    }

    /**
     * Clamps a part size to this medium's capacity.
     *
     * @param partSizeMb current part size in MB
     * @return the smaller of partSizeMb and the capacity
     */
    public long clampPartSizeMb(long partSizeMb) {
        return Math.min(partSizeMb, capacityMb);
    }
}
