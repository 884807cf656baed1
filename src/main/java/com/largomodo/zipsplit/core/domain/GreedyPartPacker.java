package com.largomodo.zipsplit.core.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Single-pass greedy part packer.
 * <p>
 * Files are taken in enumeration order and appended to the current part until the
 * next file would push the running total over the budget, at which point a new part
 * is started. Files are never reordered, so every part covers a contiguous run of
 * the input list.
 * <p>
 * A file larger than the budget is never rejected: it starts a new part (or fills
 * an empty one) and the following file always starts another part, leaving it alone
 * in an over-budget singleton.
 */
public class GreedyPartPacker implements PartPacker {

    @Override
    public List<PartLayout> pack(List<SourceFile> files, long maxPartSizeBytes) {
        if (files == null) {
            throw new IllegalArgumentException("Files list cannot be null");
        }
        if (maxPartSizeBytes <= 0) {
            throw new IllegalArgumentException(
                    "Maximum part size must be positive, got: " + maxPartSizeBytes);
        }

        List<PartLayout> layouts = new ArrayList<>();
        List<SourceFile> currentContents = new ArrayList<>();
        long currentSize = 0;

        for (SourceFile file : files) {
            // Close the part only when it already holds something; an empty part
            // always accepts the next file even if it is oversized
            if (currentSize + file.sizeBytes() > maxPartSizeBytes && !currentContents.isEmpty()) {
                layouts.add(new PartLayout(layouts.size(), currentContents));
                currentContents = new ArrayList<>();
                currentSize = 0;
            }

            currentContents.add(file);
            currentSize += file.sizeBytes();
        }

        if (!currentContents.isEmpty()) {
            layouts.add(new PartLayout(layouts.size(), currentContents));
        }

        return layouts;
    }
}
