package com.largomodo.zipsplit.core;

/**
 * Sizing configuration for a whole run.
 *
 * @param maxPartSizeBytes     maximum uncompressed input bytes per part
 * @param memoryThresholdBytes available memory must exceed this for a part to be staged in memory
 */
public record PartBudget(long maxPartSizeBytes, long memoryThresholdBytes) {

    public static final long BYTES_PER_MB = 1024L * 1024L;
    public static final long DEFAULT_PART_SIZE_MB = 100;
    public static final long DEFAULT_THRESHOLD_MB = 100;

    public PartBudget {
        if (maxPartSizeBytes <= 0) {
            throw new IllegalArgumentException("maxPartSizeBytes must be positive, got: " + maxPartSizeBytes);
        }
        if (memoryThresholdBytes <= 0) {
            throw new IllegalArgumentException("memoryThresholdBytes must be positive, got: " + memoryThresholdBytes);
        }
    }

    /**
     * Creates a budget from MB values.
     *
     * @throws IllegalArgumentException if either value is not positive or overflows when converted
     */
    public static PartBudget ofMegabytes(long partSizeMb, long memoryThresholdMb) {
        return new PartBudget(toBytes(partSizeMb), toBytes(memoryThresholdMb));
    }

    static PartBudget defaults() {
        return ofMegabytes(DEFAULT_PART_SIZE_MB, DEFAULT_THRESHOLD_MB);
    }

    private static long toBytes(long megabytes) {
        if (megabytes <= 0) {
            throw new IllegalArgumentException("Size must be positive, got: " + megabytes + " MB");
        }
        try {
            return Math.multiplyExact(megabytes, BYTES_PER_MB);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Size too large: " + megabytes + " MB", e);
        }
    }
}
