package com.geico.poc.schemaengine.storage;

import com.geico.poc.schemaengine.error.StorageDegradedException;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Decorator that bounds every call to the wrapped store by a timeout.
 * Any failure or timeout is reported as {@link StorageDegradedException}.
 */
public class TimeBoundedBlobStore implements BlobStore, AutoCloseable {

    private static final AtomicInteger THREAD_SEQ = new AtomicInteger();

    private final BlobStore delegate;
    private final Duration timeout;
    private final ExecutorService executor;

    public TimeBoundedBlobStore(BlobStore delegate, Duration timeout) {
        this.delegate = delegate;
        this.timeout = timeout;
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setName("blob-io-" + THREAD_SEQ.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void put(String key, String content) {
        call("PUT", key, () -> {
            delegate.put(key, content);
            return null;
        });
    }

    @Override
    public Optional<String> get(String key) {
        return call("GET", key, () -> delegate.get(key));
    }

    @Override
    public boolean delete(String key) {
        return call("DELETE", key, () -> delegate.delete(key));
    }

    @Override
    public void deletePrefix(String prefix) {
        call("DELETE_PREFIX", prefix, () -> {
            delegate.deletePrefix(prefix);
            return null;
        });
    }

    @Override
    public List<String> list(String prefix) {
        return call("LIST", prefix, () -> delegate.list(prefix));
    }

    public BlobStore getDelegate() {
        return delegate;
    }

    private <T> T call(String op, String key, Callable<T> task) {
        Future<T> future;
        try {
            future = executor.submit(task);
        } catch (RejectedExecutionException e) {
            // Closed while a caller still held this instance
            throw new StorageDegradedException("Blob " + op + " rejected for key=" + key + ": store is closed", e);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new StorageDegradedException(
                "Blob " + op + " timed out after " + timeout.toMillis() + "ms for key=" + key, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new StorageDegradedException(
                "Blob " + op + " failed for key=" + key + ": " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new StorageDegradedException("Interrupted during blob " + op + " for key=" + key, e);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
