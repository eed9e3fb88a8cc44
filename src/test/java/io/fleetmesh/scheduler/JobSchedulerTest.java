package io.fleetmesh.scheduler;

import io.fleetmesh.dispatch.CommandDispatcher;
import io.fleetmesh.error.IllegalTransitionException;
import io.fleetmesh.error.NotFoundException;
import io.fleetmesh.error.TerminalStateViolationException;
import io.fleetmesh.model.JobStatus;
import io.fleetmesh.model.Recurrence;
import io.fleetmesh.model.RemoteCommand;
import io.fleetmesh.model.ScheduledJob;
import io.fleetmesh.runtime.FleetMeshRuntime;
import io.fleetmesh.storage.CommandStore;
import io.fleetmesh.storage.Database;
import io.fleetmesh.storage.JobStore;
import io.fleetmesh.testing.Fixtures;
import io.fleetmesh.testing.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

final class JobSchedulerTest {
    private static final Instant T = Instant.parse("2026-06-01T09:00:00Z");

    private Path root;
    private MutableClock clock;
    private FleetMeshRuntime runtime;
    private JobScheduler scheduler;

    @BeforeEach
    void setUp() throws Exception {
        root = Fixtures.tempRoot("scheduler");
        clock = new MutableClock(T.minus(Duration.ofHours(1)));
        runtime = Fixtures.runtime(root, clock);
        scheduler = runtime.scheduler();
    }

    @AfterEach
    void tearDown() throws Exception {
        runtime.close();
        Fixtures.deleteRecursively(root);
    }

    @Test
    void onceJobFansOutAndCompletes() {
        ScheduledJob job = scheduler.create("patch", "apt-upgrade", T, Recurrence.ONCE, List.of("web-01", "web-02"), "{\"dry_run\":false}", "ops");
        Assertions.assertEquals(JobStatus.SCHEDULED, job.status());

        Assertions.assertEquals(0, scheduler.sweep(clock.instant()).due());

        clock.set(T);
        SweepOutcome outcome = scheduler.sweep(clock.instant());
        Assertions.assertEquals(1, outcome.claimed());
        Assertions.assertEquals(1, outcome.completed());
        Assertions.assertEquals(2, outcome.commandsEnqueued());

        ScheduledJob done = scheduler.find(job.jobId()).orElseThrow();
        Assertions.assertEquals(JobStatus.COMPLETED, done.status());
        List<RemoteCommand> commands = scheduler.commandsFor(job.jobId());
        Assertions.assertEquals(2, commands.size());
        Assertions.assertEquals("apt-upgrade", commands.get(0).actionType());
        Assertions.assertEquals("{\"dry_run\":false}", commands.get(0).payload());
    }

    @Test
    void dailyJobRearmsFromPriorRunAtNotFromNow() {
        ScheduledJob job = scheduler.create("backup", "snapshot", T, Recurrence.DAILY, List.of("db-01"), null, "ops");

        clock.set(T.plus(Duration.ofHours(3)));
        SweepOutcome first = scheduler.sweep(clock.instant());
        Assertions.assertEquals(1, first.rearmed());

        ScheduledJob rearmed = scheduler.find(job.jobId()).orElseThrow();
        Assertions.assertEquals(JobStatus.SCHEDULED, rearmed.status());
        Assertions.assertEquals(T.plus(Duration.ofHours(24)).toEpochMilli(), rearmed.runAtMs());
        Assertions.assertEquals(1, rearmed.occurrence());
        Assertions.assertEquals(0, scheduler.sweep(clock.instant()).due());

        clock.set(T.plus(Duration.ofHours(24)).plusSeconds(30));
        scheduler.sweep(clock.instant());
        ScheduledJob third = scheduler.find(job.jobId()).orElseThrow();
        Assertions.assertEquals(T.plus(Duration.ofHours(48)).toEpochMilli(), third.runAtMs());
        Assertions.assertEquals(2, scheduler.commandsFor(job.jobId()).size());
    }

    @Test
    void missedOccurrencesCatchUpOnePerSweep() {
        ScheduledJob job = scheduler.create("report", "collect", T, Recurrence.DAILY, List.of("db-01"), "{}", "ops");

        clock.set(T.plus(Duration.ofDays(3)).plusSeconds(1));
        scheduler.sweep(clock.instant());
        Assertions.assertEquals(T.plus(Duration.ofDays(1)).toEpochMilli(), scheduler.find(job.jobId()).orElseThrow().runAtMs());
        scheduler.sweep(clock.instant());
        Assertions.assertEquals(T.plus(Duration.ofDays(2)).toEpochMilli(), scheduler.find(job.jobId()).orElseThrow().runAtMs());
    }

    @Test
    void overlappingSweepsClaimEachJobOnce() throws Exception {
        List<String> jobIds = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            jobIds.add(scheduler.create("job-" + i, "ping", T, Recurrence.ONCE, List.of("a", "b"), "{}", "ops").jobId());
        }
        clock.set(T.plusSeconds(1));

        int sweepers = 4;
        ExecutorService pool = Executors.newFixedThreadPool(sweepers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<SweepOutcome>> futures = new ArrayList<>();
            for (int i = 0; i < sweepers; i++) {
                Database db = new Database(runtime.config());
                JobScheduler other = new JobScheduler(
                        new JobStore(db), new CommandDispatcher(new CommandStore(db), clock), null, clock, 100);
                futures.add(pool.submit(() -> {
                    start.await();
                    return other.sweep(clock.instant());
                }));
            }
            start.countDown();
            int claimed = 0;
            for (Future<SweepOutcome> future : futures) {
                claimed += future.get(60, TimeUnit.SECONDS).claimed();
            }
            Assertions.assertEquals(5, claimed);
        } finally {
            pool.shutdownNow();
        }
        for (String jobId : jobIds) {
            Assertions.assertEquals(JobStatus.COMPLETED, scheduler.find(jobId).orElseThrow().status());
            Assertions.assertEquals(2, scheduler.commandsFor(jobId).size());
        }
    }

    @Test
    void cancelOnlyFromScheduled() {
        ScheduledJob pending = scheduler.create("later", "ping", T.plus(Duration.ofDays(1)), Recurrence.WEEKLY, List.of("a"), "{}", "ops");
        ScheduledJob cancelled = scheduler.cancel(pending.jobId(), "ops");
        Assertions.assertEquals(JobStatus.CANCELLED, cancelled.status());

        TerminalStateViolationException twice = Assertions.assertThrows(
                TerminalStateViolationException.class, () -> scheduler.cancel(pending.jobId(), "ops"));
        Assertions.assertEquals("CANCELLED", twice.currentState());

        clock.set(T.plus(Duration.ofDays(2)));
        Assertions.assertEquals(0, scheduler.sweep(clock.instant()).due());

        ScheduledJob once = scheduler.create("now", "ping", T, Recurrence.ONCE, List.of("a"), "{}", "ops");
        scheduler.sweep(clock.instant());
        TerminalStateViolationException completed = Assertions.assertThrows(
                TerminalStateViolationException.class, () -> scheduler.cancel(once.jobId(), "ops"));
        Assertions.assertEquals("COMPLETED", completed.currentState());

        Assertions.assertThrows(NotFoundException.class, () -> scheduler.cancel("job_missing", "ops"));
    }

    @Test
    void runningJobCannotBeCancelled() {
        ScheduledJob job = scheduler.create("busy", "ping", T, Recurrence.ONCE, List.of("a"), "{}", "ops");
        clock.set(T);
        JobStore jobs = new JobStore(runtime.database());
        Assertions.assertTrue(jobs.tryClaim(job.jobId(), job.claimEpoch(), clock.millis()).granted());

        IllegalTransitionException e = Assertions.assertThrows(
                IllegalTransitionException.class, () -> scheduler.cancel(job.jobId(), "ops"));
        Assertions.assertFalse(e instanceof TerminalStateViolationException);
        Assertions.assertEquals("RUNNING", e.currentState());
    }

    @Test
    void scheduledJobCanBeEditedInPlace() {
        ScheduledJob job = scheduler.create("patch", "apt-upgrade", T, Recurrence.ONCE, List.of("web-01"), "{}", "ops");

        ScheduledJob edited = scheduler.edit(job.jobId(),
                new JobEdit(" patch-all ", null, Recurrence.WEEKLY, List.of("web-02", "web-01", "web-02"), "{\"reboot\":true}"),
                "ops");
        Assertions.assertEquals("patch-all", edited.name());
        Assertions.assertEquals(T.toEpochMilli(), edited.runAtMs());
        Assertions.assertEquals(Recurrence.WEEKLY, edited.recurrence());
        Assertions.assertEquals(2, edited.targetHosts().size());
        Assertions.assertEquals("{\"reboot\":true}", edited.payload());
        Assertions.assertEquals("apt-upgrade", edited.actionType());
        Assertions.assertEquals(JobStatus.SCHEDULED, edited.status());

        Assertions.assertThrows(IllegalArgumentException.class,
                () -> scheduler.edit(job.jobId(), new JobEdit(null, null, null, null, null), "ops"));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> scheduler.edit(job.jobId(), new JobEdit(" ", null, null, null, null), "ops"));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> scheduler.edit(job.jobId(), new JobEdit(null, null, null, null, "[1]"), "ops"));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> scheduler.edit(job.jobId(), new JobEdit(null, null, null, List.of(), null), "ops"));
        Assertions.assertThrows(NotFoundException.class,
                () -> scheduler.edit("job_missing", JobEdit.moveTo(T), "ops"));
    }

    @Test
    void rescheduleMovesTheNextRun() {
        ScheduledJob job = scheduler.create("backup", "snapshot", T, Recurrence.DAILY, List.of("db-01"), "{}", "ops");
        Instant later = T.plus(Duration.ofHours(6));

        Assertions.assertEquals(later.toEpochMilli(), scheduler.reschedule(job.jobId(), later, "ops").runAtMs());
        clock.set(T.plusSeconds(1));
        Assertions.assertEquals(0, scheduler.sweep(clock.instant()).due());
        clock.set(later);
        Assertions.assertEquals(1, scheduler.sweep(clock.instant()).claimed());
        Assertions.assertThrows(IllegalArgumentException.class, () -> scheduler.reschedule(job.jobId(), null, "ops"));
    }

    @Test
    void onlyScheduledJobsAreEditable() {
        ScheduledJob once = scheduler.create("now", "ping", T, Recurrence.ONCE, List.of("a"), "{}", "ops");
        ScheduledJob busy = scheduler.create("busy", "ping", T, Recurrence.ONCE, List.of("a"), "{}", "ops");
        ScheduledJob dropped = scheduler.create("dropped", "ping", T.plus(Duration.ofDays(1)), Recurrence.ONCE, List.of("a"), "{}", "ops");
        scheduler.cancel(dropped.jobId(), "ops");
        clock.set(T);
        JobStore jobs = new JobStore(runtime.database());
        Assertions.assertTrue(jobs.tryClaim(busy.jobId(), busy.claimEpoch(), clock.millis()).granted());
        scheduler.sweep(clock.instant());
        Assertions.assertEquals(JobStatus.COMPLETED, scheduler.find(once.jobId()).orElseThrow().status());

        TerminalStateViolationException completed = Assertions.assertThrows(TerminalStateViolationException.class,
                () -> scheduler.reschedule(once.jobId(), T.plus(Duration.ofDays(1)), "ops"));
        Assertions.assertEquals("COMPLETED", completed.currentState());
        Assertions.assertThrows(TerminalStateViolationException.class,
                () -> scheduler.edit(dropped.jobId(), new JobEdit("x", null, null, null, null), "ops"));
        IllegalTransitionException running = Assertions.assertThrows(IllegalTransitionException.class,
                () -> scheduler.edit(busy.jobId(), new JobEdit("x", null, null, null, null), "ops"));
        Assertions.assertFalse(running instanceof TerminalStateViolationException);
        Assertions.assertEquals("RUNNING", running.currentState());
    }

    @Test
    void deletedJobLeavesItsCommandsBehind() {
        ScheduledJob job = scheduler.create("patch", "apt-upgrade", T, Recurrence.ONCE, List.of("web-01", "web-02"), "{}", "ops");
        clock.set(T);
        scheduler.sweep(clock.instant());

        ScheduledJob deleted = scheduler.delete(job.jobId(), "ops");
        Assertions.assertEquals(JobStatus.COMPLETED, deleted.status());
        Assertions.assertTrue(scheduler.find(job.jobId()).isEmpty());
        Assertions.assertEquals(2, scheduler.commandsFor(job.jobId()).size());
        Assertions.assertEquals(2, runtime.dispatcher().bySourceJob(job.jobId()).size());
        Assertions.assertEquals(1, runtime.dispatcher().claimPendingForHost("web-01", 0).size());
        Assertions.assertThrows(NotFoundException.class, () -> scheduler.delete(job.jobId(), "ops"));
    }

    @Test
    void runningJobCannotBeDeleted() {
        ScheduledJob job = scheduler.create("busy", "ping", T, Recurrence.ONCE, List.of("a"), "{}", "ops");
        ScheduledJob idle = scheduler.create("idle", "ping", T.plus(Duration.ofDays(1)), Recurrence.ONCE, List.of("a"), "{}", "ops");
        clock.set(T);
        JobStore jobs = new JobStore(runtime.database());
        Assertions.assertTrue(jobs.tryClaim(job.jobId(), job.claimEpoch(), clock.millis()).granted());

        IllegalTransitionException e = Assertions.assertThrows(
                IllegalTransitionException.class, () -> scheduler.delete(job.jobId(), "ops"));
        Assertions.assertEquals("RUNNING", e.currentState());
        Assertions.assertTrue(scheduler.find(job.jobId()).isPresent());

        Assertions.assertEquals(JobStatus.SCHEDULED, scheduler.delete(idle.jobId(), "ops").status());
        Assertions.assertThrows(NotFoundException.class, () -> scheduler.commandsFor(idle.jobId()));
    }

    @Test
    void enqueueFailureMarksJobFailed() throws Exception {
        ScheduledJob job = scheduler.create("doomed", "ping", T, Recurrence.DAILY, List.of("a", "b"), "{}", "ops");
        try (Connection c = runtime.database().openConnection(); Statement st = c.createStatement()) {
            st.execute("DROP TABLE remote_commands");
        }
        clock.set(T);

        SweepOutcome outcome = scheduler.sweep(clock.instant());
        Assertions.assertEquals(1, outcome.failed());
        Assertions.assertEquals(0, outcome.rearmed());

        ScheduledJob failed = scheduler.find(job.jobId()).orElseThrow();
        Assertions.assertEquals(JobStatus.FAILED, failed.status());
        Assertions.assertNotNull(failed.lastError());
    }

    @Test
    void staleClaimIsRedrivenWithoutDuplicateCommands() {
        ScheduledJob job = scheduler.create("crashy", "ping", T, Recurrence.ONCE, List.of("a", "b"), "{}", "ops");
        clock.set(T);
        JobStore jobs = new JobStore(runtime.database());
        JobStore.ClaimGrant grant = jobs.tryClaim(job.jobId(), job.claimEpoch(), clock.millis());
        Assertions.assertTrue(grant.granted());
        RemoteCommand partial = runtime.dispatcher().enqueueForJob(grant.job(), grant.job().occurrence(), "a");

        clock.advance(Duration.ofMinutes(5));
        Assertions.assertEquals(0, scheduler.recoverStaleRunning(clock.instant(), Duration.ofMinutes(10)));
        clock.advance(Duration.ofMinutes(6));
        Assertions.assertEquals(1, scheduler.recoverStaleRunning(clock.instant(), Duration.ofMinutes(10)));

        SweepOutcome outcome = scheduler.sweep(clock.instant());
        Assertions.assertEquals(1, outcome.completed());

        List<RemoteCommand> commands = scheduler.commandsFor(job.jobId());
        Assertions.assertEquals(2, commands.size());
        Assertions.assertTrue(commands.stream().anyMatch(c -> c.commandId().equals(partial.commandId())));

        Assertions.assertFalse(jobs.tryComplete(job.jobId(), grant.job().claimEpoch(), clock.millis()));
    }

    @Test
    void createValidatesInput() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> scheduler.create("x", "ping", T, Recurrence.ONCE, List.of(), "{}", "ops"));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> scheduler.create("x", "ping", T, Recurrence.ONCE, List.of("a"), "[1,2]", "ops"));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> scheduler.create(" ", "ping", T, Recurrence.ONCE, List.of("a"), "{}", "ops"));
        Assertions.assertThrows(NotFoundException.class, () -> scheduler.commandsFor("job_missing"));
    }
}
