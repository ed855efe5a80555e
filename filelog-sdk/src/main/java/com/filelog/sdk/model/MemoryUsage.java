package com.filelog.sdk.model;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;

/**
 * JVM memory snapshot, in whole mebibytes.
 *
 * @param total     heap plus non-heap committed
 * @param heap      heap used
 * @param heapTotal heap committed
 * @param nonHeap   non-heap used
 */
public record MemoryUsage(long total, long heap, long heapTotal, long nonHeap) {

    public static MemoryUsage current() {
        MemoryMXBean memory = ManagementFactory.getMemoryMXBean();
        java.lang.management.MemoryUsage heapUsage = memory.getHeapMemoryUsage();
        java.lang.management.MemoryUsage nonHeapUsage = memory.getNonHeapMemoryUsage();
        return new MemoryUsage(
                mb(heapUsage.getCommitted() + nonHeapUsage.getCommitted()),
                mb(heapUsage.getUsed()),
                mb(heapUsage.getCommitted()),
                mb(nonHeapUsage.getUsed()));
    }

    private static long mb(long bytes) {
        return bytes >> 20;
    }
}
