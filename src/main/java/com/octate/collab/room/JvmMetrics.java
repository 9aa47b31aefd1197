package com.octate.collab.room;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.lang.management.OperatingSystemMXBean;

final class JvmMetrics {

    private JvmMetrics() {
    }

    static ServerStats.MemoryUsage memory() {
        MemoryMXBean bean = ManagementFactory.getMemoryMXBean();
        MemoryUsage heap = bean.getHeapMemoryUsage();
        return new ServerStats.MemoryUsage(heap.getUsed(), heap.getCommitted(), heap.getMax(),
            bean.getNonHeapMemoryUsage().getUsed());
    }

    static long heapUsed() {
        return ManagementFactory.getMemoryMXBean().getHeapMemoryUsage().getUsed();
    }

    static ServerStats.CpuUsage cpu() {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        long cpuTime = -1;
        if (os instanceof com.sun.management.OperatingSystemMXBean sun) {
            cpuTime = sun.getProcessCpuTime() / 1_000_000;
        }
        return new ServerStats.CpuUsage(os.getAvailableProcessors(), os.getSystemLoadAverage(), cpuTime);
    }
}
