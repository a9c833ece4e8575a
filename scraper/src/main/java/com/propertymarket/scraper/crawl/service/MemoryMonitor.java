package com.propertymarket.scraper.crawl.service;

import com.propertymarket.scraper.config.ScraperProperties;
import org.springframework.stereotype.Component;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Samples heap usage while a run is in progress. Observation only.
 */
@Component
public class MemoryMonitor {
    private final ScraperProperties properties;
    private final MemoryMXBean memoryBean = ManagementFactory.getMemoryMXBean();

    public MemoryMonitor(ScraperProperties properties) {
        this.properties = properties;
    }

    public Session start() {
        return new Session(properties.getMetrics().getMemorySampleIntervalMs());
    }

    long heapUsed() {
        return memoryBean.getHeapMemoryUsage().getUsed();
    }

    public record MemorySnapshot(long startBytes, long endBytes, long peakBytes, long elapsedMs) {
        public long deltaBytes() {
            return endBytes - startBytes;
        }
    }

    public final class Session {
        private final long startedNanos = System.nanoTime();
        private final long startBytes;
        private final AtomicLong peakBytes;
        private final ScheduledExecutorService sampler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "memory-monitor");
            thread.setDaemon(true);
            return thread;
        });
        private MemorySnapshot snapshot;

        private Session(int intervalMs) {
            this.startBytes = heapUsed();
            this.peakBytes = new AtomicLong(startBytes);
            sampler.scheduleAtFixedRate(this::sample, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        }

        private void sample() {
            long used = heapUsed();
            peakBytes.accumulateAndGet(used, Math::max);
        }

        public synchronized MemorySnapshot stop() {
            if (snapshot != null) {
                return snapshot;
            }
            sampler.shutdownNow();
            long endBytes = heapUsed();
            peakBytes.accumulateAndGet(endBytes, Math::max);
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
            snapshot = new MemorySnapshot(startBytes, endBytes, peakBytes.get(), elapsedMs);
            return snapshot;
        }
    }
}
