package io.fleetmesh.background;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Fixed-size pool of daemon workers for fire-and-forget side work.
 *
 * <p>One instance per process is created by {@link #initialize(int)} and handed
 * to components through their constructors. A failing task is logged with its
 * description and completes its future exceptionally; the submitter never sees
 * the exception on its own thread. Tasks still queued at JVM exit are dropped.
 */
public final class BackgroundPool {
    private static final Logger log = LoggerFactory.getLogger(BackgroundPool.class);
    private static final Slot SHARED = new Slot("fleetmesh-bg-", hook -> Runtime.getRuntime().addShutdownHook(hook));

    private final ExecutorService executor;
    private final int workers;

    BackgroundPool(int workers, String threadPrefix) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1");
        }
        this.workers = workers;
        this.executor = Executors.newFixedThreadPool(workers, new WorkerThreadFactory(threadPrefix));
    }

    /**
     * Creates the process-wide pool on first call; later calls return the same
     * instance and ignore {@code workers}.
     */
    public static BackgroundPool initialize(int workers) {
        return SHARED.initialize(workers);
    }

    public static BackgroundPool shared() {
        return SHARED.get();
    }

    /**
     * A pool outside the process-wide slot, owned and shut down by the caller.
     */
    public static BackgroundPool isolated(int workers, String threadPrefix) {
        return new BackgroundPool(workers, threadPrefix);
    }

    public <T> CompletableFuture<T> submit(BackgroundTask<T> task, TaskContext context, String description) {
        CompletableFuture<T> result = new CompletableFuture<>();
        String label = description == null || description.isBlank() ? "background task" : description;
        try {
            executor.execute(() -> {
                try {
                    result.complete(task.run(context));
                } catch (Exception e) {
                    log.error("Background task '{}' failed (namespace={}, principal={})",
                            label, context.namespace(), context.principalId(), e);
                    result.completeExceptionally(e);
                } catch (Error e) {
                    log.error("Background task '{}' failed with error", label, e);
                    result.completeExceptionally(e);
                    throw e;
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Background task '{}' rejected, pool is shut down", label);
            result.completeExceptionally(e);
        }
        return result;
    }

    public CompletableFuture<Void> submit(Runnable task, String description) {
        return submit(ctx -> {
            task.run();
            return null;
        }, TaskContext.system(null, null), description);
    }

    public int workers() {
        return workers;
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    /**
     * Stops accepting work without waiting for running tasks.
     */
    public void shutdown() {
        if (!executor.isShutdown()) {
            executor.shutdown();
        }
    }

    /**
     * Stops accepting work, then waits up to {@code timeoutMs} for in-flight tasks.
     */
    public boolean shutdownAndAwait(long timeoutMs) throws InterruptedException {
        shutdown();
        return executor.awaitTermination(Math.max(0L, timeoutMs), TimeUnit.MILLISECONDS);
    }

    /**
     * Holder for a lazily created pool whose shutdown is tied to JVM exit.
     */
    static final class Slot {
        private final String threadPrefix;
        private final Consumer<Thread> hookRegistrar;
        private BackgroundPool pool;

        Slot(String threadPrefix, Consumer<Thread> hookRegistrar) {
            this.threadPrefix = threadPrefix;
            this.hookRegistrar = hookRegistrar;
        }

        synchronized BackgroundPool initialize(int workers) {
            if (pool == null) {
                BackgroundPool created = new BackgroundPool(workers, threadPrefix);
                hookRegistrar.accept(new Thread(created::shutdown, threadPrefix + "shutdown"));
                pool = created;
                log.info("Background pool started with {} workers", workers);
            }
            return pool;
        }

        synchronized BackgroundPool get() {
            if (pool == null) {
                throw new IllegalStateException("BackgroundPool.initialize(...) has not been called");
            }
            return pool;
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();
        private final String prefix;

        private WorkerThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
