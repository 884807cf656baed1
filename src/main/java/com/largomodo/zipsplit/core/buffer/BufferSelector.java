package com.largomodo.zipsplit.core.buffer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.OptionalLong;

/**
 * Chooses between a memory-backed and a disk-backed buffer for one archive part.
 * <p>
 * Memory is chosen only when the system probe reports more available bytes than
 * the configured threshold. Any failure to obtain a usable reading falls back to
 * disk. The probes are queried on every call because available memory changes
 * between parts of a long run.
 * <p>
 * When the part's input size is known, the heap headroom is checked as well: a
 * memory buffer grows by doubling, so a part needs up to
 * {@value #HEAP_HEADROOM_FACTOR} times its size in free heap while it is built.
 */
public class BufferSelector {

    static final int HEAP_HEADROOM_FACTOR = 3;

    private static final Logger log = LoggerFactory.getLogger(BufferSelector.class);

    private final MemoryProbe memoryProbe;
    private final MemoryProbe heapProbe;
    private final Path tempDir;

    /**
     * @param memoryProbe source of available system memory readings
     * @param tempDir     directory for disk buffers, or null for the platform temp directory
     */
    public BufferSelector(MemoryProbe memoryProbe, Path tempDir) {
        this(memoryProbe, new HeapMemoryProbe(), tempDir);
    }

    BufferSelector(MemoryProbe memoryProbe, MemoryProbe heapProbe, Path tempDir) {
        if (memoryProbe == null || heapProbe == null) {
            throw new IllegalArgumentException("memoryProbe and heapProbe must not be null");
        }
        this.memoryProbe = memoryProbe;
        this.heapProbe = heapProbe;
        this.tempDir = tempDir;
    }

    /**
     * Creates the buffer for the next part.
     *
     * @param memoryThresholdBytes available memory must exceed this to use a memory buffer
     * @return a new, empty buffer owned by the caller
     * @throws IOException if a disk buffer is needed and its temp file cannot be created
     */
    public BufferSource select(long memoryThresholdBytes) throws IOException {
        OptionalLong available = read(memoryProbe, "available-memory");
        if (available.isPresent() && available.getAsLong() > memoryThresholdBytes) {
            log.debug("Using memory buffer: {} bytes available > {} bytes threshold",
                    available.getAsLong(), memoryThresholdBytes);
            return new MemoryBufferSource();
        }
        log.debug("Using disk buffer: available memory {} <= {} bytes threshold",
                available.isPresent() ? available.getAsLong() + " bytes" : "unknown", memoryThresholdBytes);
        return new DiskBufferSource(tempDir);
    }

    /**
     * Creates the buffer for a part whose uncompressed input totals {@code expectedBytes}.
     * <p>
     * Parts that could not fit in a single byte array, or in the remaining heap,
     * always go to disk whatever the system memory reading.
     */
    public BufferSource select(long memoryThresholdBytes, long expectedBytes) throws IOException {
        if (expectedBytes > MemoryBufferSource.MAX_CAPACITY) {
            log.debug("Using disk buffer: part input of {} bytes exceeds in-memory capacity", expectedBytes);
            return new DiskBufferSource(tempDir);
        }
        OptionalLong headroom = read(heapProbe, "heap headroom");
        if (headroom.isEmpty() || expectedBytes > headroom.getAsLong() / HEAP_HEADROOM_FACTOR) {
            log.debug("Using disk buffer: part input of {} bytes needs more than heap headroom {}",
                    expectedBytes, headroom.isPresent() ? headroom.getAsLong() + " bytes" : "unknown");
            return new DiskBufferSource(tempDir);
        }
        return select(memoryThresholdBytes);
    }

    private OptionalLong read(MemoryProbe probe, String signal) {
        try {
            OptionalLong reading = probe.availableBytes();
            if (reading == null || (reading.isPresent() && reading.getAsLong() < 0)) {
                log.debug("Unusable {} reading: {}", signal, reading);
                return OptionalLong.empty();
            }
            return reading;
        } catch (RuntimeException e) {
            // Best-effort signal: disk is the conservative choice
            log.debug("{} query failed, falling back to disk buffer", signal, e);
            return OptionalLong.empty();
        }
    }
}
