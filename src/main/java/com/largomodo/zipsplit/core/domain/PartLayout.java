package com.largomodo.zipsplit.core.domain;

import java.util.List;

/**
 * Immutable layout of a single archive part.
 * <p>
 * Produced by PartPacker as one group of the part plan and consumed by
 * ArchiveProcessor when the part is compressed and written.
 * </p>
 *
 * @param partIndex zero-based position of the part in the plan
 * @param contents  the input files of this part, in enumeration order (unmodifiable)
 */
public record PartLayout(int partIndex, List<SourceFile> contents) {
    /**
     * Compact constructor that ensures contents is an unmodifiable copy.
     */
    public PartLayout {
        if (partIndex < 0) {
            throw new IllegalArgumentException("partIndex must not be negative, got: " + partIndex);
        }
        contents = List.copyOf(contents);
    }

    /**
     * @return sum of the uncompressed sizes of all files in this part
     */
    public long totalBytes() {
        return contents.stream().mapToLong(SourceFile::sizeBytes).sum();
    }
}
