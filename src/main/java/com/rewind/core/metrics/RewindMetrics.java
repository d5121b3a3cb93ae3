package com.rewind.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for checkpoint operations.
 */
@Service
public class RewindMetrics {

    private final MeterRegistry registry;

    public RewindMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordCheckpointCreated(String trigger, long ms) {
        Timer.builder("rewind.checkpoint.create.duration")
                .tag("trigger", trigger)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordSnapshotSize(long bytes) {
        DistributionSummary.builder("rewind.checkpoint.snapshot.bytes")
                .baseUnit("bytes")
                .register(registry)
                .record(bytes);
    }

    /**
     * Counts blobs written versus blobs already present in the content pool.
     * The ratio shows how much deduplication saves.
     */
    public void recordBlobWrites(int written, int deduplicated) {
        Counter.builder("rewind.blobs.written").register(registry).increment(written);
        Counter.builder("rewind.blobs.deduplicated").register(registry).increment(deduplicated);
    }

    public void recordRestore(boolean success, long ms) {
        Timer.builder("rewind.checkpoint.restore.duration")
                .tag("success", String.valueOf(success))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordFork() {
        Counter.builder("rewind.checkpoint.forks")
                .register(registry)
                .increment();
    }

    public void recordCleanup(int checkpointsRemoved, int blobsRemoved) {
        Counter.builder("rewind.cleanup.checkpoints_removed").register(registry).increment(checkpointsRemoved);
        Counter.builder("rewind.cleanup.blobs_removed").register(registry).increment(blobsRemoved);
    }

    public void recordAutoCheckpointTrigger(String reason) {
        Counter.builder("rewind.auto_checkpoint.triggers")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordActiveManagers(int count) {
        DistributionSummary.builder("rewind.managers.active")
                .register(registry)
                .record(count);
    }
}
