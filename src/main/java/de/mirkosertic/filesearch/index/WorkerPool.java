package de.mirkosertic.filesearch.index;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Fixed-size pool of named worker threads.
 */
public class WorkerPool implements Executor {

    private static final Logger logger = LoggerFactory.getLogger(WorkerPool.class);

    private final String name;
    private final ThreadPoolExecutor executor;

    public WorkerPool(final String name, final int threads) {
        this.name = name;
        final int size = Math.max(1, threads);
        final AtomicInteger threadCounter = new AtomicInteger(0);
        final ThreadFactory threadFactory = r -> {
            final Thread thread = new Thread(r, name + "-" + threadCounter.getAndIncrement());
            thread.setDaemon(false);
            return thread;
        };

        this.executor = new ThreadPoolExecutor(
                size,
                size,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(10000),
                threadFactory,
                new ThreadPoolExecutor.CallerRunsPolicy()
        );

        logger.info("WorkerPool '{}' initialized with {} threads", name, size);
    }

    /**
     * @throws RejectedExecutionException once the pool is shut down
     */
    @Override
    public void execute(final Runnable task) {
        if (executor.isShutdown()) {
            throw new RejectedExecutionException("WorkerPool '" + name + "' is shut down");
        }
        executor.execute(task);
    }

    public <T> CompletableFuture<T> supply(final Supplier<T> task) {
        return CompletableFuture.supplyAsync(task, this);
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    /**
     * Shutdown the pool, waiting briefly for running tasks.
     */
    public void shutdown() {
        logger.info("Shutting down WorkerPool '{}'", name);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("WorkerPool '{}' did not terminate in time, forcing shutdown", name);
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            logger.error("Interrupted while waiting for WorkerPool '{}' to terminate", name, e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
