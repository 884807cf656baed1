package com.largomodo.zipsplit.core.buffer;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.util.OptionalLong;

/**
 * Reads free physical memory from the platform operating system MXBean.
 * <p>
 * Only the HotSpot extension {@code com.sun.management.OperatingSystemMXBean}
 * exposes physical memory; on other JVMs the reading is empty.
 */
public class SystemMemoryProbe implements MemoryProbe {

    private final OperatingSystemMXBean osBean;

    public SystemMemoryProbe() {
        this(ManagementFactory.getOperatingSystemMXBean());
    }

    SystemMemoryProbe(OperatingSystemMXBean osBean) {
        this.osBean = osBean;
    }

    @Override
    public OptionalLong availableBytes() {
        if (osBean instanceof com.sun.management.OperatingSystemMXBean sunBean) {
            long free = sunBean.getFreeMemorySize();
            return free >= 0 ? OptionalLong.of(free) : OptionalLong.empty();
        }
        return OptionalLong.empty();
    }
}
