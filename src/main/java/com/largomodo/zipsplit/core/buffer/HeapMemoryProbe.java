package com.largomodo.zipsplit.core.buffer;

import java.util.OptionalLong;

/**
 * Reports how many more bytes the Java heap can grow to hold.
 * <p>
 * Memory buffers live on the heap, so free physical memory alone says nothing
 * about whether a part fits: the JVM's {@code -Xmx} limit applies first.
 */
public class HeapMemoryProbe implements MemoryProbe {

    private final Runtime runtime;

    public HeapMemoryProbe() {
        this(Runtime.getRuntime());
    }

    HeapMemoryProbe(Runtime runtime) {
        this.runtime = runtime;
    }

    @Override
    public OptionalLong availableBytes() {
        long used = runtime.totalMemory() - runtime.freeMemory();
        long headroom = runtime.maxMemory() - used;
        return headroom >= 0 ? OptionalLong.of(headroom) : OptionalLong.empty();
    }
}
