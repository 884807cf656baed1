package com.largomodo.zipsplit.core.buffer;

import java.util.OptionalLong;

/**
 * Source of the current available-memory reading.
 * <p>
 * The reading is approximate and may be stale by the time it is used. An empty
 * result means the platform could not provide it.
 */
@FunctionalInterface
public interface MemoryProbe {

    /**
     * @return available physical memory in bytes, or empty if unknown
     */
    OptionalLong availableBytes();
}
