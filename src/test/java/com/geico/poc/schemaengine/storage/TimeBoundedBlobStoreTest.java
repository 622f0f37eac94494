package com.geico.poc.schemaengine.storage;

import com.geico.poc.schemaengine.error.StorageDegradedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the timeout decorator around blob stores
 */
public class TimeBoundedBlobStoreTest {

    private final CountDownLatch release = new CountDownLatch(1);
    private TimeBoundedBlobStore store;

    @AfterEach
    public void tearDown() {
        release.countDown();
        if (store != null) {
            store.close();
        }
    }

    @Test
    public void testDelegatesWithinTimeout() {
        InMemoryBlobStore delegate = new InMemoryBlobStore();
        store = new TimeBoundedBlobStore(delegate, Duration.ofSeconds(5));

        store.put("snapshots/a/data.json", "{}");

        assertEquals(Optional.of("{}"), store.get("snapshots/a/data.json"));
        assertEquals(List.of("snapshots/a/data.json"), store.list("snapshots/"));
        assertTrue(store.delete("snapshots/a/data.json"));
        assertSame(delegate, store.getDelegate());
    }

    @Test
    public void testHangingStoreTimesOut() {
        store = new TimeBoundedBlobStore(new InMemoryBlobStore() {
            @Override
            public Optional<String> get(String key) {
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return Optional.empty();
            }
        }, Duration.ofMillis(100));

        long start = System.nanoTime();
        StorageDegradedException e = assertThrows(StorageDegradedException.class,
            () -> store.get("snapshots/a/data.json"));
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertTrue(e.getMessage().contains("timed out"), e.getMessage());
        assertTrue(elapsedMs < 5000, "took " + elapsedMs + "ms");
    }

    @Test
    public void testFailureBecomesDegraded() {
        store = new TimeBoundedBlobStore(new InMemoryBlobStore() {
            @Override
            public void put(String key, String content) {
                throw new BlobStorageException("disk full");
            }
        }, Duration.ofSeconds(5));

        StorageDegradedException e = assertThrows(StorageDegradedException.class,
            () -> store.put("k", "v"));
        assertInstanceOf(BlobStorageException.class, e.getCause());
    }

    @Test
    public void testClosedStoreBecomesDegraded() {
        store = new TimeBoundedBlobStore(new InMemoryBlobStore(), Duration.ofSeconds(5));
        store.close();

        StorageDegradedException e = assertThrows(StorageDegradedException.class,
            () -> store.put("snapshots/a/data.json", "{}"));
        assertTrue(e.getMessage().contains("closed"), e.getMessage());
        assertThrows(StorageDegradedException.class, () -> store.get("snapshots/a/data.json"));
    }
}
