package io.fleetmesh.background;

import io.fleetmesh.config.FleetMeshSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

final class BackgroundPoolTest {
    private BackgroundPool pool;

    @BeforeEach
    void setUp() {
        pool = BackgroundPool.isolated(2, "fleetmesh-pool-test-");
    }

    @AfterEach
    void tearDown() throws Exception {
        pool.shutdownAndAwait(5_000L);
    }

    @Test
    void taskReceivesSubmitterContext() throws Exception {
        TaskContext context = new TaskContext("tenant-a", "alice", FleetMeshSettings.defaults());
        AtomicReference<String> thread = new AtomicReference<>();

        Future<String> result = pool.submit(ctx -> {
            thread.set(Thread.currentThread().getName());
            return ctx.namespace() + "/" + ctx.principalId();
        }, context, "context echo");

        Assertions.assertEquals("tenant-a/alice", result.get(5, TimeUnit.SECONDS));
        Assertions.assertTrue(thread.get().startsWith("fleetmesh-pool-test-"));
    }

    @Test
    void failureStaysOnTheWorker() throws Exception {
        Future<Object> failed = pool.submit(ctx -> {
            throw new IllegalStateException("boom");
        }, TaskContext.system("default", null), "doomed task");

        ExecutionException e = Assertions.assertThrows(ExecutionException.class, () -> failed.get(5, TimeUnit.SECONDS));
        Assertions.assertInstanceOf(IllegalStateException.class, e.getCause());

        Assertions.assertEquals(7, pool.submit(ctx -> 7, TaskContext.system("default", null), "after failure").get(5, TimeUnit.SECONDS));
    }

    @Test
    void tasksRunConcurrentlyUpToWorkerCount() throws Exception {
        CountDownLatch both = new CountDownLatch(2);
        Future<Void> a = pool.submit(() -> awaitQuietly(both), "a");
        Future<Void> b = pool.submit(() -> awaitQuietly(both), "b");
        a.get(5, TimeUnit.SECONDS);
        b.get(5, TimeUnit.SECONDS);
        Assertions.assertEquals(2, pool.workers());
    }

    @Test
    void submitAfterShutdownCompletesExceptionally() {
        pool.shutdown();
        Assertions.assertTrue(pool.isShutdown());
        Future<Void> rejected = pool.submit(() -> {
        }, "late");
        ExecutionException e = Assertions.assertThrows(ExecutionException.class, () -> rejected.get(1, TimeUnit.SECONDS));
        Assertions.assertInstanceOf(RejectedExecutionException.class, e.getCause());
    }

    @Test
    void contextDefaultsAreFilledIn() {
        TaskContext context = new TaskContext(" ", null, null);
        Assertions.assertEquals("default", context.namespace());
        Assertions.assertEquals("system", context.principalId());
        Assertions.assertNotNull(context.settings());
        Assertions.assertThrows(IllegalArgumentException.class, () -> BackgroundPool.isolated(0, "x-"));
    }

    @Test
    void slotCreatesOnePoolAndOneShutdownHook() throws Exception {
        List<Thread> hooks = new ArrayList<>();
        BackgroundPool.Slot slot = new BackgroundPool.Slot("fleetmesh-slot-test-", hooks::add);
        Assertions.assertThrows(IllegalStateException.class, slot::get);

        BackgroundPool first = slot.initialize(2);
        BackgroundPool again = slot.initialize(5);
        Assertions.assertSame(first, again);
        Assertions.assertSame(first, slot.get());
        Assertions.assertEquals(2, first.workers());
        Assertions.assertEquals(1, hooks.size());
        Assertions.assertEquals("fleetmesh-slot-test-shutdown", hooks.get(0).getName());
        Assertions.assertEquals("ok", first.submit(ctx -> "ok", TaskContext.system(null, null), "before exit").get(5, TimeUnit.SECONDS));

        Thread hook = hooks.get(0);
        hook.start();
        hook.join(5_000L);
        Assertions.assertTrue(first.isShutdown());
        Assertions.assertSame(first, slot.initialize(3));
        Assertions.assertEquals(1, hooks.size());
    }

    @Test
    void processWidePoolIsInitializedOnce() {
        BackgroundPool shared = BackgroundPool.initialize(3);
        Assertions.assertSame(shared, BackgroundPool.initialize(4));
        Assertions.assertSame(shared, BackgroundPool.shared());
        Assertions.assertFalse(shared.isShutdown());
    }

    private static void awaitQuietly(CountDownLatch latch) {
        latch.countDown();
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("peer task never started");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
