package io.fleetmesh.scheduler;

import io.fleetmesh.background.BackgroundPool;
import io.fleetmesh.background.TaskContext;
import io.fleetmesh.dispatch.CommandDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic driver for the scheduler: each tick recovers stale claims, sweeps
 * due jobs and expires old commands. The tick runs on the background pool; a
 * tick that is still running makes the next one a no-op.
 */
public final class SweepTimer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SweepTimer.class);

    private final JobScheduler scheduler;
    private final CommandDispatcher dispatcher;
    private final BackgroundPool pool;
    private final TaskContext context;
    private final Clock clock;
    private final long intervalMs;
    private final Duration commandTtl;
    private final Duration staleAfter;
    private final AtomicBoolean inFlight = new AtomicBoolean(false);
    private final ScheduledExecutorService ticker;
    private ScheduledFuture<?> future;

    public SweepTimer(
            JobScheduler scheduler,
            CommandDispatcher dispatcher,
            BackgroundPool pool,
            TaskContext context,
            Clock clock
    ) {
        this.scheduler = scheduler;
        this.dispatcher = dispatcher;
        this.pool = pool;
        this.context = context;
        this.clock = clock;
        this.intervalMs = Math.max(50L, context.settings().sweepIntervalMs());
        this.commandTtl = Duration.ofMillis(context.settings().commandTtlMs());
        this.staleAfter = Duration.ofMillis(context.settings().staleRunningMs());
        this.ticker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "fleetmesh-sweeper");
            thread.setDaemon(true);
            return thread;
        });
    }

    public synchronized void start() {
        if (future != null) {
            return;
        }
        future = ticker.scheduleAtFixedRate(this::submitTick, 0L, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Sweep timer started (interval={}ms, commandTtl={}, staleAfter={})", intervalMs, commandTtl, staleAfter);
    }

    @Override
    public synchronized void close() {
        if (future != null) {
            future.cancel(false);
            future = null;
        }
        ticker.shutdownNow();
        log.info("Sweep timer stopped");
    }

    void submitTick() {
        if (!inFlight.compareAndSet(false, true)) {
            log.debug("Previous sweep still running, skipping tick");
            return;
        }
        try {
            pool.submit(ctx -> tick(), context, "scheduled sweep")
                    .whenComplete((outcome, error) -> inFlight.set(false));
        } catch (RuntimeException e) {
            inFlight.set(false);
            log.warn("Could not hand the sweep to the background pool: {}", e.toString());
        }
    }

    boolean tickInFlight() {
        return inFlight.get();
    }

    /**
     * One full maintenance pass at the current clock time.
     */
    public SweepOutcome tick() {
        Instant now = clock.instant();
        scheduler.recoverStaleRunning(now, staleAfter);
        SweepOutcome outcome = scheduler.sweep(now);
        dispatcher.expire(now.toEpochMilli(), commandTtl);
        return outcome;
    }
}
