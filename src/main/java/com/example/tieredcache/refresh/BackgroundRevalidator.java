package com.example.tieredcache.refresh;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs detached stale revalidations on a bounded pool. A failing task is
 * logged and never reaches whoever submitted it.
 */
public class BackgroundRevalidator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BackgroundRevalidator.class);

    private final ExecutorService executor;

    public BackgroundRevalidator(int threads) {
        this(Executors.newFixedThreadPool(threads, new DaemonThreadFactory()));
    }

    public BackgroundRevalidator(ExecutorService executor) {
        this.executor = executor;
    }

    public interface Task {
        void run() throws Exception;
    }

    /**
     * @param description used only in log lines, e.g. {@code "revalidate posts:1"}
     * @return completes when the task finished, successfully or not; never exceptionally
     */
    public CompletableFuture<Void> submit(String description, Task task) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                try {
                    task.run();
                    log.debug("Background task done: {}", description);
                } catch (Exception e) {
                    log.warn("Background task failed: {}", description, e);
                } finally {
                    done.complete(null);
                }
            });
        } catch (RuntimeException e) {
            // rejected, usually because the pool is shutting down
            log.warn("Background task not scheduled: {}", description, e);
            done.complete(null);
        }
        return done;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class DaemonThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "cache-revalidate-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
