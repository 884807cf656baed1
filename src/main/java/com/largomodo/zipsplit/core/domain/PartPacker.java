package com.largomodo.zipsplit.core.domain;

import java.util.List;

/**
 * Strategy interface for grouping input files into archive parts.
 * <p>
 * Implementations decide how files are distributed across parts while respecting
 * the per-part budget on uncompressed input size.
 */
public interface PartPacker {
    /**
     * Groups files into ordered part layouts.
     * <p>
     * Each resulting layout holds files whose combined size fits the budget, except
     * for a layout holding a single file that is larger than the budget by itself.
     *
     * @param files            input files in enumeration order, must not be null
     * @param maxPartSizeBytes maximum uncompressed bytes per part, must be positive
     * @return list of part layouts, empty if files is empty
     * @throws IllegalArgumentException if files is null or the budget is not positive
     */
    List<PartLayout> pack(List<SourceFile> files, long maxPartSizeBytes);
}
