package com.octate.collab.room;

public record ServerStats(
    long uptime,
    int activeRooms,
    int totalRooms,
    int totalConnections,
    MemoryUsage memoryUsage,
    CpuUsage cpuUsage,
    long timestamp
) {

    public record MemoryUsage(long heapUsed, long heapTotal, long heapMax, long nonHeapUsed) {

        public double heapPercent() {
            return heapTotal == 0 ? 0 : heapUsed * 100.0 / heapTotal;
        }
    }

    /** {@code processCpuTime} is in milliseconds, -1 when the platform does not report it. */
    public record CpuUsage(int availableProcessors, double systemLoadAverage, long processCpuTime) {}
}
