package com.geico.poc.schemaengine.snapshot;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Detached queue for pre-change snapshot captures.
 *
 * Tasks run one at a time, in submission order, on a daemon thread. Their
 * failures go to a dedicated logger and never reach the submitting caller.
 */
@Component
public class PreChangeSnapshotQueue {

    private static final Logger log = LoggerFactory.getLogger("schema-engine.snapshots.async");

    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r);
        t.setName("pre-change-snapshot");
        t.setDaemon(true);
        return t;
    });

    private final AtomicLong submitted = new AtomicLong();
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    /**
     * Queue a capture. Returns immediately.
     */
    public void submit(String label, Runnable capture) {
        submitted.incrementAndGet();
        try {
            executor.execute(() -> {
                try {
                    capture.run();
                    completed.incrementAndGet();
                    log.debug("Pre-change snapshot captured: {}", label);
                } catch (Exception e) {
                    failed.incrementAndGet();
                    log.error("❌ Pre-change snapshot failed ({}): {}", label, e.getMessage(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            failed.incrementAndGet();
            log.error("❌ Pre-change snapshot rejected ({}): queue is shut down", label);
        }
    }

    /**
     * Wait until every task submitted so far has finished
     *
     * @return false if the timeout elapsed first
     */
    public boolean drain(Duration timeout) {
        try {
            // Single worker, FIFO: the marker runs after everything queued before it
            executor.submit(() -> { }).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            log.warn("⚠️  Pre-change snapshot queue not drained within {}ms", timeout.toMillis());
            return false;
        } catch (RejectedExecutionException | ExecutionException e) {
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public long getSubmittedCount() {
        return submitted.get();
    }

    public long getCompletedCount() {
        return completed.get();
    }

    public long getFailedCount() {
        return failed.get();
    }

    @PreDestroy
    public void shutdown() {
        drain(Duration.ofSeconds(30));
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("✅ Pre-change snapshot queue stopped ({} submitted, {} failed)", submitted.get(), failed.get());
    }
}
